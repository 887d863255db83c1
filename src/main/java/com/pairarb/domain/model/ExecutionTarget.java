package com.pairarb.domain.model;

import com.pairarb.domain.Lots;
import com.pairarb.domain.enums.ExecutionStatus;
import com.pairarb.domain.enums.OrderGroupStatus;
import com.pairarb.domain.enums.OrderGroupType;
import com.pairarb.domain.enums.SpreadDirection;
import com.pairarb.exception.ExecutionStateException;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The hedge goal for one trading opportunity: a signed target quantity per leg, the
 * spread the opportunity was detected at, and the ordered list of order groups (attempts
 * and sweeps) sent so far to reach it.
 *
 * <p>Status flow: NEW -> SUBMITTED -> PARTIALLY_FILLED -> FILLED, with CANCELED, INVALID
 * and FAILED reachable from any non-terminal state. A terminal status is set exactly once;
 * every later mutation is rejected with {@link ExecutionStateException}.
 *
 * <p>Only the execution manager mutates a target, always under the registry lock.
 * Collaborators outside the core only ever see {@link ExecutionTargetSnapshot}s.
 */
@Getter
public class ExecutionTarget {

    private static final Logger log = LoggerFactory.getLogger(ExecutionTarget.class);

    private final ExecutionTargetId id;

    /** Stable identity of the opportunity (pair + level), used to reject duplicate targets. */
    private final String opportunityKey;

    private final Instrument instrument1;
    private final Instrument instrument2;

    /** Signed target quantity per leg, lot aligned. */
    private final BigDecimal targetQuantity1;

    private final BigDecimal targetQuantity2;

    private final BigDecimal lotSize1;
    private final BigDecimal lotSize2;

    private final SpreadDirection direction;

    /** Spread at creation time; also the minimum spread every matched slice must meet. */
    private final BigDecimal expectedSpreadPct;

    private final Duration timeout;
    private final Instant createdAt;

    /** Set on the first tick that passes validation. The timeout clock runs from here. */
    private Instant anchorTime;

    private ExecutionStatus status = ExecutionStatus.NEW;

    private Instant statusChangedAt;

    private final List<OrderGroup> orderGroups = new ArrayList<>();

    @Builder
    public ExecutionTarget(
            ExecutionTargetId id,
            String opportunityKey,
            Instrument instrument1,
            Instrument instrument2,
            BigDecimal targetQuantity1,
            BigDecimal targetQuantity2,
            BigDecimal lotSize1,
            BigDecimal lotSize2,
            SpreadDirection direction,
            BigDecimal expectedSpreadPct,
            Duration timeout,
            Instant createdAt) {
        this.id = id;
        this.opportunityKey = opportunityKey;
        this.instrument1 = instrument1;
        this.instrument2 = instrument2;
        this.lotSize1 = lotSize1;
        this.lotSize2 = lotSize2;
        this.targetQuantity1 = Lots.roundDown(targetQuantity1, lotSize1);
        this.targetQuantity2 = Lots.roundDown(targetQuantity2, lotSize2);
        this.direction = direction;
        this.expectedSpreadPct = expectedSpreadPct;
        this.timeout = timeout;
        this.createdAt = createdAt;
        this.statusChangedAt = createdAt;
    }

    public List<OrderGroup> getOrderGroups() {
        return Collections.unmodifiableList(orderGroups);
    }

    public LegQuantities targetQuantities() {
        return new LegQuantities(targetQuantity1, targetQuantity2);
    }

    /** Filled quantity per leg, summed across every order group. */
    public LegQuantities quantityFilled() {
        return orderGroups.stream()
                .map(OrderGroup::filledQuantities)
                .reduce(LegQuantities.ZERO, LegQuantities::plus);
    }

    /** Target minus filled, per leg. */
    public LegQuantities quantityRemaining() {
        return targetQuantities().minus(quantityFilled());
    }

    /** True iff both legs' remaining quantity is exactly zero. No tolerance is applied. */
    public boolean isQuantityFilled() {
        return quantityRemaining().isZero();
    }

    /**
     * True when the target is stuck with a remainder it cannot hedge as a pair: every order
     * sent so far is FILLED (nothing in flight), some quantity is still open, and the
     * smaller leg remainder is worth less than the larger of the two legs' one-lot values.
     *
     * @param price1 current reference price of instrument 1
     * @param price2 current reference price of instrument 2
     */
    public boolean shouldFillRemainingOrders(BigDecimal price1, BigDecimal price2) {
        if (orderGroups.isEmpty() || !orderGroups.stream().allMatch(OrderGroup::allOrdersFilled)) {
            return false;
        }
        LegQuantities remaining = quantityRemaining();
        if (remaining.isZero()) {
            return false;
        }
        BigDecimal value1 = remaining.leg1().abs().multiply(price1);
        BigDecimal value2 = remaining.leg2().abs().multiply(price2);
        BigDecimal oneLotValue = Lots.lotValue(lotSize1, price1).max(Lots.lotValue(lotSize2, price2));
        return value1.min(value2).compareTo(oneLotValue) < 0;
    }

    /**
     * Lot-aligned, non-zero per-leg remainders that a sweep would send, as signed legs in
     * (instrument 1, instrument 2) order.
     */
    public List<Leg> sweepLegs() {
        LegQuantities remaining = quantityRemaining();
        List<Leg> legs = new ArrayList<>(2);
        BigDecimal sweep1 = Lots.roundDown(remaining.leg1(), lotSize1);
        BigDecimal sweep2 = Lots.roundDown(remaining.leg2(), lotSize2);
        if (sweep1.signum() != 0) {
            legs.add(new Leg(instrument1, sweep1));
        }
        if (sweep2.signum() != 0) {
            legs.add(new Leg(instrument2, sweep2));
        }
        return legs;
    }

    /**
     * Quantity-based completion, decided only once no order is still working. If quantities
     * say filled but some order group does not report FILLED, the quantity answer still wins
     * and the disagreement is logged.
     */
    public boolean isCompletelyFilled() {
        if (!isQuantityFilled() || hasUnresolvedGroup()) {
            return false;
        }
        if (hasUnfilledGroups()) {
            log.warn(
                    "Target {} quantities are filled but group statuses disagree: {}",
                    id,
                    orderGroups.stream().map(OrderGroup::getStatus).toList());
        }
        return true;
    }

    /** True when at least one order group does not report FILLED. */
    public boolean hasUnfilledGroups() {
        return orderGroups.stream().anyMatch(g -> g.getStatus() != OrderGroupStatus.FILLED);
    }

    /** True when the timeout clock has started and strictly more than {@code timeout} has elapsed. */
    public boolean isExpired(Instant now) {
        return anchorTime != null && Duration.between(anchorTime, now).compareTo(timeout) > 0;
    }

    /**
     * True when there is at least one order group, every group reports FAILED, and none of
     * them still has an order working.
     */
    public boolean isCompletelyFailed() {
        return !orderGroups.isEmpty() && !hasUnresolvedGroup() && orderGroups.stream().allMatch(OrderGroup::isFailed);
    }

    /** The most recently appended group, if any. */
    public Optional<OrderGroup> activeGroup() {
        return orderGroups.isEmpty() ? Optional.empty() : Optional.of(orderGroups.get(orderGroups.size() - 1));
    }

    /** True when any group still has orders in flight or unacknowledged handles. */
    public boolean hasUnresolvedGroup() {
        return orderGroups.stream().anyMatch(g -> !g.isResolved());
    }

    /** Oldest group still waiting for handles; a newly seen order ID belongs there. */
    public Optional<OrderGroup> groupAwaitingHandles() {
        return orderGroups.stream().filter(g -> !g.isComplete()).findFirst();
    }

    /** Finds the group that already holds {@code orderId}, searching newest first. */
    public Optional<OrderGroup> groupContaining(String orderId) {
        for (int i = orderGroups.size() - 1; i >= 0; i--) {
            if (orderGroups.get(i).contains(orderId)) {
                return Optional.of(orderGroups.get(i));
            }
        }
        return Optional.empty();
    }

    public void anchor(Instant now) {
        if (anchorTime == null) {
            anchorTime = now;
        }
    }

    /**
     * Appends a placeholder group for one matched pair slice, expecting two handles.
     *
     * @throws ExecutionStateException if the target is terminal or any group is unresolved
     */
    public OrderGroup openPairGroup(BigDecimal matchedSpreadPct, Instant now) {
        requireMutable();
        if (hasUnresolvedGroup()) {
            throw new ExecutionStateException(id, "Cannot open a new order group while an earlier one still has orders working");
        }
        return append(OrderGroupType.PAIR, 2, matchedSpreadPct, now);
    }

    /**
     * Appends an empty sweep group. The caller raises its expected leg count once per
     * single-leg order, before submitting that order.
     */
    public OrderGroup openSweepGroup(Instant now) {
        requireMutable();
        return append(OrderGroupType.SWEEP, 0, expectedSpreadPct, now);
    }

    private OrderGroup append(OrderGroupType type, int expectedLegs, BigDecimal spreadPct, Instant now) {
        OrderGroup group =
                new OrderGroup(orderGroups.size() + 1, type, instrument1, instrument2, expectedLegs, spreadPct, now);
        orderGroups.add(group);
        return group;
    }

    /** True once a sweep group has been sent. The core sweeps at most once per target. */
    public boolean hasSwept() {
        return orderGroups.stream().anyMatch(g -> g.getType() == OrderGroupType.SWEEP);
    }

    /** Fees summed over every leg order of every group. */
    public BigDecimal totalFee() {
        return orderGroups.stream().map(OrderGroup::totalFee).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Moves the target to {@code newStatus}.
     *
     * @throws ExecutionStateException if the target already holds a terminal status
     */
    public void markStatus(ExecutionStatus newStatus, Instant now) {
        requireMutable();
        if (newStatus == ExecutionStatus.NEW) {
            throw new ExecutionStateException(id, "Cannot move a target back to NEW");
        }
        status = newStatus;
        statusChangedAt = now;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    private void requireMutable() {
        if (status.isTerminal()) {
            throw new ExecutionStateException(id, "Target is already terminal with status " + status);
        }
    }

    /** Immutable copy of the current state, safe to hand to collaborators outside the core. */
    public ExecutionTargetSnapshot snapshot() {
        return ExecutionTargetSnapshot.of(this);
    }
}
