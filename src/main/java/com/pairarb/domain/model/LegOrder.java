package com.pairarb.domain.model;

import com.pairarb.domain.enums.OrderSide;
import com.pairarb.domain.enums.OrderStatus;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle for one leg order submitted to the broker.
 *
 * <p>The handle is attached to its order group by the first order event that mentions
 * its order ID and is refreshed in place by every later event for the same ID.
 * Quantities are signed: positive for buys, negative for sells.
 */
@Data
@Builder
public class LegOrder {

    private static final Logger log = LoggerFactory.getLogger(LegOrder.class);

    /** Broker-assigned order ID. */
    private String orderId;

    private Instrument instrument;

    /** Requested signed quantity. */
    private BigDecimal quantity;

    @Builder.Default
    private OrderStatus status = OrderStatus.NEW;

    /** Cumulative signed filled quantity. */
    @Builder.Default
    private BigDecimal filledQuantity = BigDecimal.ZERO;

    /** Volume-weighted average fill price across all partial fills that carried a price. */
    private BigDecimal averageFillPrice;

    /** Unsigned quantity behind {@link #averageFillPrice}. */
    @Builder.Default
    private BigDecimal pricedQuantity = BigDecimal.ZERO;

    /** Cumulative fee paid on this order, in account currency. */
    @Builder.Default
    private BigDecimal fee = BigDecimal.ZERO;

    private String rejectionReason;

    private Instant updatedAt;

    /**
     * Applies one broker update. {@code fillQuantity} is the signed quantity of this fill
     * only (zero for pure status changes). A fill always counts toward the filled quantity;
     * only fills that carry a price re-weight the average price, and an unpriced fill is
     * logged.
     *
     * @return false if the handle is already terminal and the update was ignored
     */
    public boolean applyUpdate(
            OrderStatus newStatus, BigDecimal fillQuantity, BigDecimal fillPrice, BigDecimal fillFee, Instant at) {
        if (status.isTerminal()) {
            return false;
        }
        if (fillQuantity != null && fillQuantity.signum() != 0) {
            if (fillPrice != null) {
                BigDecimal total = pricedQuantity.add(fillQuantity.abs());
                BigDecimal previousNotional =
                        averageFillPrice != null ? averageFillPrice.multiply(pricedQuantity) : BigDecimal.ZERO;
                averageFillPrice = previousNotional
                        .add(fillPrice.multiply(fillQuantity.abs()))
                        .divide(total, MathContext.DECIMAL64);
                pricedQuantity = total;
            } else {
                log.warn(
                        "Order {} fill of {} arrived without a price, average price left at {}",
                        orderId,
                        fillQuantity,
                        averageFillPrice);
            }
            filledQuantity = filledQuantity.add(fillQuantity);
        }
        if (fillFee != null) {
            fee = fee.add(fillFee);
        }
        status = newStatus;
        updatedAt = at;
        return true;
    }

    public OrderSide getSide() {
        return OrderSide.of(quantity != null ? quantity : filledQuantity);
    }
}
