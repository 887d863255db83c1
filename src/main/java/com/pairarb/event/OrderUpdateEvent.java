package com.pairarb.event;

import com.pairarb.domain.enums.OrderStatus;
import com.pairarb.domain.model.Instrument;
import java.math.BigDecimal;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published by an {@link com.pairarb.broker.OrderGateway} implementation whenever a
 * submitted order changes state.
 *
 * <p>Fill fields describe this event only: {@code fillQuantity} is the signed quantity
 * filled since the previous event for the same order, {@code fee} the fee charged on that
 * fill. Pure status changes (acknowledgment, cancel, rejection) carry a zero fill.
 *
 * <p>The {@code tag} is the one passed at submission and is the only way the execution
 * core resolves which target the order belongs to.
 */
public class OrderUpdateEvent extends ApplicationEvent {

    private final String orderId;
    private final Instrument instrument;
    private final OrderStatus status;
    private final BigDecimal quantity;
    private final BigDecimal fillQuantity;
    private final BigDecimal fillPrice;
    private final BigDecimal fee;
    private final String tag;
    private final String reason;
    private final Instant eventTime;

    public OrderUpdateEvent(
            Object source,
            String orderId,
            Instrument instrument,
            OrderStatus status,
            BigDecimal quantity,
            BigDecimal fillQuantity,
            BigDecimal fillPrice,
            BigDecimal fee,
            String tag,
            String reason,
            Instant eventTime) {
        super(source);
        this.orderId = orderId;
        this.instrument = instrument;
        this.status = status;
        this.quantity = quantity;
        this.fillQuantity = fillQuantity != null ? fillQuantity : BigDecimal.ZERO;
        this.fillPrice = fillPrice;
        this.fee = fee != null ? fee : BigDecimal.ZERO;
        this.tag = tag;
        this.reason = reason;
        this.eventTime = eventTime;
    }

    /** Order accepted by the venue, nothing filled yet. */
    public static OrderUpdateEvent acknowledged(
            Object source, String orderId, Instrument instrument, BigDecimal quantity, String tag, Instant at) {
        return new OrderUpdateEvent(
                source, orderId, instrument, OrderStatus.SUBMITTED, quantity, null, null, null, tag, null, at);
    }

    /**
     * A fill of {@code fillQuantity}. The status is FILLED when the order's cumulative
     * fill reaches its requested quantity, PARTIALLY_FILLED otherwise.
     */
    public static OrderUpdateEvent fill(
            Object source,
            String orderId,
            Instrument instrument,
            BigDecimal quantity,
            BigDecimal fillQuantity,
            BigDecimal fillPrice,
            BigDecimal fee,
            boolean complete,
            String tag,
            Instant at) {
        OrderStatus status = complete ? OrderStatus.FILLED : OrderStatus.PARTIALLY_FILLED;
        return new OrderUpdateEvent(
                source, orderId, instrument, status, quantity, fillQuantity, fillPrice, fee, tag, null, at);
    }

    /** Order ended without (further) fills: CANCELED by the venue or INVALID on rejection. */
    public static OrderUpdateEvent failed(
            Object source,
            String orderId,
            Instrument instrument,
            OrderStatus status,
            BigDecimal quantity,
            String tag,
            String reason,
            Instant at) {
        return new OrderUpdateEvent(source, orderId, instrument, status, quantity, null, null, null, tag, reason, at);
    }

    public String getOrderId() {
        return orderId;
    }

    public Instrument getInstrument() {
        return instrument;
    }

    public OrderStatus getStatus() {
        return status;
    }

    /** Requested signed quantity of the order. */
    public BigDecimal getQuantity() {
        return quantity;
    }

    public BigDecimal getFillQuantity() {
        return fillQuantity;
    }

    /** Price of this fill; null when nothing was filled. */
    public BigDecimal getFillPrice() {
        return fillPrice;
    }

    public BigDecimal getFee() {
        return fee;
    }

    public String getTag() {
        return tag;
    }

    /** Rejection or cancel reason, when the venue gave one. */
    public String getReason() {
        return reason;
    }

    public Instant getEventTime() {
        return eventTime;
    }

    public boolean isFill() {
        return status == OrderStatus.FILLED || status == OrderStatus.PARTIALLY_FILLED;
    }

    @Override
    public String toString() {
        return "OrderUpdateEvent{orderId=" + orderId + ", instrument=" + instrument + ", status=" + status
                + ", fillQuantity=" + fillQuantity + ", fillPrice=" + fillPrice + ", tag=" + tag + "}";
    }
}
