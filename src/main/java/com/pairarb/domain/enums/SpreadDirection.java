package com.pairarb.domain.enums;

/**
 * Which leg of a pair is bought.
 * LONG_SPREAD buys instrument 1 and sells instrument 2; SHORT_SPREAD does the reverse.
 */
public enum SpreadDirection {
    LONG_SPREAD,
    SHORT_SPREAD;

    /** Returns the mirrored direction, used when the two instruments are swapped. */
    public SpreadDirection opposite() {
        return this == LONG_SPREAD ? SHORT_SPREAD : LONG_SPREAD;
    }

    /** True when instrument 1 is the bought leg. */
    public boolean buysFirstLeg() {
        return this == LONG_SPREAD;
    }
}
