package com.pairarb.domain.model;

import java.math.BigDecimal;

/** A pair of signed per-leg quantities in (instrument 1, instrument 2) order. */
public record LegQuantities(BigDecimal leg1, BigDecimal leg2) {

    public static final LegQuantities ZERO = new LegQuantities(BigDecimal.ZERO, BigDecimal.ZERO);

    public LegQuantities plus(LegQuantities other) {
        return new LegQuantities(leg1.add(other.leg1), leg2.add(other.leg2));
    }

    public LegQuantities minus(LegQuantities other) {
        return new LegQuantities(leg1.subtract(other.leg1), leg2.subtract(other.leg2));
    }

    /** Strict zero check on both legs, no tolerance. */
    public boolean isZero() {
        return leg1.signum() == 0 && leg2.signum() == 0;
    }
}
