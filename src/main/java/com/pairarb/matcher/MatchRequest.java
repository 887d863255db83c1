package com.pairarb.matcher;

import com.pairarb.domain.enums.SpreadDirection;
import com.pairarb.domain.model.Instrument;
import java.math.BigDecimal;

/**
 * Input to one spread-matching call.
 *
 * @param instrument1    first leg; results always list it first
 * @param instrument2    second leg
 * @param targetNotional notional to match, measured on the bought leg (the depth leg for single-depth matching)
 * @param direction      LONG_SPREAD buys instrument 1 and sells instrument 2
 * @param minSpreadPct   minimum acceptable spread in percent; null accepts any spread
 * @param fees           absolute fees to fold into the reported averages; never used for sizing
 */
public record MatchRequest(
        Instrument instrument1,
        Instrument instrument2,
        BigDecimal targetNotional,
        SpreadDirection direction,
        BigDecimal minSpreadPct,
        BigDecimal fees) {

    public MatchRequest {
        fees = fees == null ? BigDecimal.ZERO : fees;
    }

    public static MatchRequest of(
            Instrument instrument1,
            Instrument instrument2,
            BigDecimal targetNotional,
            SpreadDirection direction,
            BigDecimal minSpreadPct) {
        return new MatchRequest(instrument1, instrument2, targetNotional, direction, minSpreadPct, BigDecimal.ZERO);
    }

    /** Same request with the instruments exchanged and the direction mirrored. */
    public MatchRequest swapped() {
        return new MatchRequest(instrument2, instrument1, targetNotional, direction.opposite(), minSpreadPct, fees);
    }

    public boolean buysFirstLeg() {
        return direction.buysFirstLeg();
    }
}
