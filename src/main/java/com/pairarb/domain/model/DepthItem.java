package com.pairarb.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * A single level in an order book (bid or ask).
 * Used by {@link OrderBookDepth}'s bid and ask lists.
 */
@Data
@Builder
public class DepthItem {

    private BigDecimal price;

    /** Total quantity available at this price level. */
    private BigDecimal size;

    public static DepthItem of(String price, String size) {
        return DepthItem.builder()
                .price(new BigDecimal(price))
                .size(new BigDecimal(size))
                .build();
    }
}
