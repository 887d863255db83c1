package com.pairarb.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Diagnostics for one matched price pair. Quantities are unsigned; prices are per instrument position. */
@Value
@Builder
public class MatchLevel {

    BigDecimal price1;
    BigDecimal price2;
    BigDecimal quantity1;
    BigDecimal quantity2;

    /** Notional of the bought side at this level. */
    BigDecimal notional;

    BigDecimal spreadPct;

    /** Returns the same level with instrument 1 and instrument 2 swapped. */
    public MatchLevel swapped() {
        return MatchLevel.builder()
                .price1(price2)
                .price2(price1)
                .quantity1(quantity2)
                .quantity2(quantity1)
                .notional(notional)
                .spreadPct(spreadPct)
                .build();
    }
}
