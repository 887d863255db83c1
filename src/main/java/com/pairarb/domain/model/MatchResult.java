package com.pairarb.domain.model;

import com.pairarb.domain.enums.MatchingStrategy;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one spread-matching call.
 *
 * <p>When {@link #isExecutable()} is true, {@link #getLeg1()} and {@link #getLeg2()} are in
 * the caller's (instrument 1, instrument 2) order, carry opposite signs, and their notional
 * values agree to within one lot's worth of value. The only executable result with zero
 * quantities is the answer to a zero target notional.
 *
 * <p>A non-executable result carries a {@link #getRejectReason()} and no legs. Callers
 * treat it as "nothing to do this tick", never as an error.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class MatchResult {

    private final Leg leg1;
    private final Leg leg2;

    /** Per-level match details, kept for diagnostics. */
    @Builder.Default
    private final List<MatchLevel> matchedLevels = List.of();

    private final BigDecimal totalBuyNotional;
    private final BigDecimal totalSellNotional;
    private final BigDecimal avgBuyPrice;
    private final BigDecimal avgSellPrice;

    /** Quantity-weighted average spread over the matched levels, in percent. */
    private final BigDecimal avgSpreadPct;

    private final boolean reachedTarget;

    /** Target notional left unmatched. Never negative. */
    @Builder.Default
    private final BigDecimal remainingNotional = BigDecimal.ZERO;

    private final boolean executable;

    private final String rejectReason;

    private final MatchingStrategy usedStrategy;

    public static MatchResult notExecutable(MatchingStrategy strategy, String reason) {
        return MatchResult.builder()
                .executable(false)
                .usedStrategy(strategy)
                .rejectReason(reason)
                .build();
    }

    public List<Leg> legs() {
        return executable ? List.of(leg1, leg2) : List.of();
    }

    /**
     * Returns this result with the legs and level diagnostics swapped. Aggregates are
     * side-based (buy/sell) and need no change.
     */
    public MatchResult swapped() {
        if (!executable) {
            return this;
        }
        return toBuilder()
                .leg1(leg2)
                .leg2(leg1)
                .matchedLevels(matchedLevels.stream().map(MatchLevel::swapped).toList())
                .build();
    }
}
