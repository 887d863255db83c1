package com.pairarb.domain.model;

import com.pairarb.domain.enums.OrderSide;
import java.math.BigDecimal;

/**
 * One side of a matched pair: an instrument and a signed quantity
 * (positive = buy, negative = sell).
 */
public record Leg(Instrument instrument, BigDecimal quantity) {

    public OrderSide side() {
        return OrderSide.of(quantity);
    }

    public boolean isZero() {
        return quantity.signum() == 0;
    }
}
