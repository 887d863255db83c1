package com.pairarb.domain.enums;

/**
 * Which matching algorithm the spread matcher runs.
 *
 * <p>AUTO_DETECT probes both instruments for order book depth on every call. The other
 * values force a variant regardless of what data is available; a forced variant whose
 * required depth is missing produces a non-executable result.
 */
public enum MatchingStrategy {
    AUTO_DETECT,
    DUAL_DEPTH,
    SINGLE_DEPTH,
    BEST_PRICES
}
