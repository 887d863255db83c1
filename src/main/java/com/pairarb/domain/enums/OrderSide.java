package com.pairarb.domain.enums;

import java.math.BigDecimal;

/** Buy or sell side of a leg order, derived from the sign of its quantity. */
public enum OrderSide {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    public static OrderSide of(BigDecimal signedQuantity) {
        return signedQuantity.signum() >= 0 ? BUY : SELL;
    }
}
