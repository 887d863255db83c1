package com.pairarb.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Lot-size arithmetic shared by the matcher and the execution state machine.
 *
 * <p>Quantities are always truncated toward zero to a whole multiple of the lot size,
 * never rounded up. A non-positive lot size means the instrument has no increment
 * restriction and the quantity is returned unchanged.
 */
public final class Lots {

    private Lots() {}

    /** Truncates {@code quantity} toward zero to a multiple of {@code lotSize}. Sign is preserved. */
    public static BigDecimal roundDown(BigDecimal quantity, BigDecimal lotSize) {
        if (quantity == null) {
            return BigDecimal.ZERO;
        }
        if (lotSize == null || lotSize.signum() <= 0) {
            return quantity;
        }
        BigDecimal lots = quantity.divide(lotSize, 0, RoundingMode.DOWN);
        return lots.multiply(lotSize);
    }

    /** True when the absolute quantity is at least one lot. */
    public static boolean isTradable(BigDecimal quantity, BigDecimal lotSize) {
        return roundDown(quantity.abs(), lotSize).signum() > 0;
    }

    /** Market value of one lot at the given price. */
    public static BigDecimal lotValue(BigDecimal lotSize, BigDecimal price) {
        if (lotSize == null || price == null) {
            return BigDecimal.ZERO;
        }
        return lotSize.multiply(price).abs();
    }
}
