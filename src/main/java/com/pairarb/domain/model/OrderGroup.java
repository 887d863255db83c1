package com.pairarb.domain.model;

import com.pairarb.domain.Spreads;
import com.pairarb.domain.enums.OrderGroupStatus;
import com.pairarb.domain.enums.OrderGroupType;
import com.pairarb.domain.enums.OrderStatus;
import com.pairarb.exception.LegMismatchException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.Getter;

/**
 * One batch of concurrently submitted leg orders, i.e. one execution attempt.
 *
 * <p>The group is appended to its target as a placeholder before any order is sent, with
 * {@code expectedLegCount} saying how many handles will eventually arrive. Handles are
 * attached later by order events, which avoids racing the first event against the
 * submission call. {@link #isComplete()} distinguishes "still waiting for an
 * acknowledgment" from "every expected order has arrived".
 *
 * <p>{@link #getStatus()} is computed on every read from the leg order statuses and is
 * never stored:
 * <ul>
 *   <li>any CANCELED or INVALID order: FAILED</li>
 *   <li>complete and every order FILLED: FILLED</li>
 *   <li>some order filled or partially filled: PARTIALLY_FILLED</li>
 *   <li>otherwise: SUBMITTED</li>
 * </ul>
 */
@Getter
public class OrderGroup {

    private final int sequence;
    private final OrderGroupType type;
    private final Instrument instrument1;
    private final Instrument instrument2;
    private final BigDecimal expectedSpreadPct;
    private final Instant createdAt;

    private int expectedLegCount;

    private final List<LegOrder> legOrders = new ArrayList<>();

    public OrderGroup(
            int sequence,
            OrderGroupType type,
            Instrument instrument1,
            Instrument instrument2,
            int expectedLegCount,
            BigDecimal expectedSpreadPct,
            Instant createdAt) {
        this.sequence = sequence;
        this.type = type;
        this.instrument1 = instrument1;
        this.instrument2 = instrument2;
        this.expectedLegCount = expectedLegCount;
        this.expectedSpreadPct = expectedSpreadPct;
        this.createdAt = createdAt;
    }

    public List<LegOrder> getLegOrders() {
        return Collections.unmodifiableList(legOrders);
    }

    /**
     * Raises the number of expected handles by one. Must be called before the matching
     * order is submitted, so a callback that arrives during submission already sees the
     * higher count.
     */
    public void incrementExpectedLegCount() {
        expectedLegCount++;
    }

    public boolean isComplete() {
        return legOrders.size() == expectedLegCount;
    }

    public boolean contains(String orderId) {
        return findOrder(orderId).isPresent();
    }

    public Optional<LegOrder> findOrder(String orderId) {
        return legOrders.stream()
                .filter(o -> o.getOrderId().equals(orderId))
                .findFirst();
    }

    /**
     * Attaches a new handle. Returns false without change when the group already holds
     * every expected handle.
     *
     * @throws LegMismatchException if the handle's instrument is not one of this group's legs
     */
    public boolean attach(LegOrder legOrder) {
        if (!isLegInstrument(legOrder.getInstrument())) {
            throw new LegMismatchException(legOrder.getOrderId(), legOrder.getInstrument(), instrument1, instrument2);
        }
        if (contains(legOrder.getOrderId()) || isComplete()) {
            return false;
        }
        legOrders.add(legOrder);
        return true;
    }

    public boolean isLegInstrument(Instrument instrument) {
        return instrument1.equals(instrument) || instrument2.equals(instrument);
    }

    /** Signed filled quantity summed over the orders for {@code instrument}. */
    public BigDecimal filledQuantity(Instrument instrument) {
        return legOrders.stream()
                .filter(o -> o.getInstrument().equals(instrument))
                .map(LegOrder::getFilledQuantity)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public LegQuantities filledQuantities() {
        return new LegQuantities(filledQuantity(instrument1), filledQuantity(instrument2));
    }

    public BigDecimal totalFee() {
        return legOrders.stream().map(LegOrder::getFee).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public OrderGroupStatus getStatus() {
        if (isFailed()) {
            return OrderGroupStatus.FAILED;
        }
        if (isFilled()) {
            return OrderGroupStatus.FILLED;
        }
        if (isPartiallyFilled()) {
            return OrderGroupStatus.PARTIALLY_FILLED;
        }
        return OrderGroupStatus.SUBMITTED;
    }

    public boolean isFailed() {
        return legOrders.stream().anyMatch(o -> o.getStatus().isFailure());
    }

    public boolean isFilled() {
        return isComplete()
                && !legOrders.isEmpty()
                && legOrders.stream().allMatch(o -> o.getStatus() == OrderStatus.FILLED);
    }

    public boolean isPartiallyFilled() {
        return !isFailed()
                && !isFilled()
                && legOrders.stream()
                        .anyMatch(o -> o.getStatus() == OrderStatus.FILLED
                                || o.getStatus() == OrderStatus.PARTIALLY_FILLED);
    }

    /**
     * True once every expected handle has arrived and each order is terminal, so no further
     * fill can land on this attempt. A FAILED group stays unresolved while its other legs
     * are still working at the venue or have not been acknowledged yet.
     */
    public boolean isResolved() {
        return isComplete() && legOrders.stream().allMatch(o -> o.getStatus().isTerminal());
    }

    /**
     * Lowers the expected handle count for a leg that was never sent, after an earlier leg
     * of the same group was refused at submission.
     */
    public void withdrawExpectedLeg() {
        if (expectedLegCount <= legOrders.size()) {
            throw new IllegalStateException("Group " + sequence + " already holds every expected order");
        }
        expectedLegCount--;
    }

    /** True when every expected handle has arrived and each order is FILLED. */
    public boolean allOrdersFilled() {
        return isComplete() && legOrders.stream().allMatch(o -> o.getStatus() == OrderStatus.FILLED);
    }

    /**
     * Spread actually realized by a filled pair group: {@code (1 - buyPrice / sellPrice) * 100}
     * over the average fill prices of the bought and sold legs. Empty until the group is
     * FILLED, and always empty for sweep groups, which have no counter leg.
     */
    public Optional<BigDecimal> realizedSpreadPct() {
        if (type != OrderGroupType.PAIR || !isFilled()) {
            return Optional.empty();
        }
        BigDecimal buyPrice = averageFillPrice(true);
        BigDecimal sellPrice = averageFillPrice(false);
        if (buyPrice == null || sellPrice == null || sellPrice.signum() <= 0) {
            return Optional.empty();
        }
        return Optional.of(Spreads.spreadPct(buyPrice, sellPrice));
    }

    private BigDecimal averageFillPrice(boolean buys) {
        BigDecimal quantity = BigDecimal.ZERO;
        BigDecimal notional = BigDecimal.ZERO;
        for (LegOrder order : legOrders) {
            BigDecimal filled = order.getFilledQuantity();
            if (order.getAverageFillPrice() == null || filled.signum() == 0 || (filled.signum() > 0) != buys) {
                continue;
            }
            quantity = quantity.add(filled.abs());
            notional = notional.add(filled.abs().multiply(order.getAverageFillPrice()));
        }
        return quantity.signum() == 0 ? null : notional.divide(quantity, Spreads.MC);
    }
}
