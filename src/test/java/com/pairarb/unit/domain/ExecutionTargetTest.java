package com.pairarb.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pairarb.domain.enums.ExecutionStatus;
import com.pairarb.domain.enums.OrderGroupType;
import com.pairarb.domain.enums.OrderStatus;
import com.pairarb.domain.enums.SpreadDirection;
import com.pairarb.domain.model.ExecutionTarget;
import com.pairarb.domain.model.ExecutionTargetId;
import com.pairarb.domain.model.ExecutionTargetSnapshot;
import com.pairarb.domain.model.Instrument;
import com.pairarb.domain.model.Leg;
import com.pairarb.domain.model.LegOrder;
import com.pairarb.domain.model.OrderGroup;
import com.pairarb.exception.ExecutionStateException;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ExecutionTarget covering quantity accounting, the timeout boundary,
 * the sweep trigger and the terminal-status guard.
 */
class ExecutionTargetTest {

    private static final Instrument X = Instrument.crypto("XSTK", "GATE");
    private static final Instrument Y = Instrument.equity("XSTK", "NASDAQ");
    private static final Instant T0 = Instant.parse("2026-03-02T15:00:00Z");
    private static final BigDecimal P100 = new BigDecimal("100");
    private static final BigDecimal P102 = new BigDecimal("102");

    private ExecutionTarget target;

    @BeforeEach
    void setUp() {
        target = newTarget("10", "-10");
    }

    private static ExecutionTarget newTarget(String quantity1, String quantity2) {
        return ExecutionTarget.builder()
                .id(new ExecutionTargetId(7))
                .opportunityKey("XSTK:GATE/NASDAQ")
                .instrument1(X)
                .instrument2(Y)
                .targetQuantity1(new BigDecimal(quantity1))
                .targetQuantity2(new BigDecimal(quantity2))
                .lotSize1(BigDecimal.ONE)
                .lotSize2(BigDecimal.ONE)
                .direction(SpreadDirection.LONG_SPREAD)
                .expectedSpreadPct(new BigDecimal("1.0"))
                .timeout(Duration.ofMinutes(5))
                .createdAt(T0)
                .build();
    }

    /** Opens a pair group and fills each leg by the given (possibly partial) quantities. */
    private OrderGroup filledPair(String fill1, String fill2) {
        OrderGroup group = target.openPairGroup(new BigDecimal("1.9"), T0);
        int n = target.getOrderGroups().size();
        LegOrder leg1 = LegOrder.builder().orderId("A-" + n).instrument(X).quantity(new BigDecimal(fill1)).build();
        LegOrder leg2 = LegOrder.builder().orderId("B-" + n).instrument(Y).quantity(new BigDecimal(fill2)).build();
        group.attach(leg1);
        group.attach(leg2);
        leg1.applyUpdate(OrderStatus.FILLED, new BigDecimal(fill1), P100, new BigDecimal("0.1"), T0);
        leg2.applyUpdate(OrderStatus.FILLED, new BigDecimal(fill2), P102, new BigDecimal("0.1"), T0);
        return group;
    }

    @Nested
    @DisplayName("Quantity Accounting")
    class Quantities {

        @Test
        @DisplayName("Target quantities are truncated to whole lots at construction")
        void lotAlignedAtConstruction() {
            ExecutionTarget odd = newTarget("10.7", "-9.9");

            assertThat(odd.getTargetQuantity1()).isEqualByComparingTo("10");
            assertThat(odd.getTargetQuantity2()).isEqualByComparingTo("-9");
        }

        @Test
        @DisplayName("Remaining is target minus fills summed over groups")
        void remainingAcrossGroups() {
            filledPair("4", "-4");
            filledPair("5", "-5");

            assertThat(target.quantityFilled().leg1()).isEqualByComparingTo("9");
            assertThat(target.quantityRemaining().leg1()).isEqualByComparingTo("1");
            assertThat(target.quantityRemaining().leg2()).isEqualByComparingTo("-1");
            assertThat(target.isQuantityFilled()).isFalse();
            assertThat(target.totalFee()).isEqualByComparingTo("0.4");
        }

        @Test
        @DisplayName("Exact fills complete the target by quantity")
        void completelyFilled() {
            filledPair("10", "-10");

            assertThat(target.isQuantityFilled()).isTrue();
            assertThat(target.isCompletelyFilled()).isTrue();
            assertThat(target.hasUnfilledGroups()).isFalse();
        }

        @Test
        @DisplayName("Exact quantities do not complete the target while an order is still working")
        void notCompleteWhileWorking() {
            OrderGroup group = target.openPairGroup(new BigDecimal("1.9"), T0);
            LegOrder leg1 = LegOrder.builder().orderId("A").instrument(X).quantity(BigDecimal.TEN).build();
            LegOrder leg2 = LegOrder.builder().orderId("B").instrument(Y).quantity(new BigDecimal("-10")).build();
            group.attach(leg1);
            group.attach(leg2);
            leg1.applyUpdate(OrderStatus.FILLED, BigDecimal.TEN, P100, BigDecimal.ZERO, T0);
            leg2.applyUpdate(OrderStatus.PARTIALLY_FILLED, new BigDecimal("-10"), P102, BigDecimal.ZERO, T0);

            assertThat(target.isQuantityFilled()).isTrue();
            assertThat(target.isCompletelyFilled()).isFalse();
        }
    }

    @Nested
    @DisplayName("Timeout")
    class Timeout {

        @Test
        @DisplayName("Not expired before the clock is anchored")
        void unanchoredNeverExpires() {
            assertThat(target.isExpired(T0.plus(Duration.ofDays(1)))).isFalse();
        }

        @Test
        @DisplayName("Expires strictly after anchor plus timeout")
        void boundary() {
            target.anchor(T0);

            Instant deadline = T0.plus(Duration.ofMinutes(5));
            assertThat(target.isExpired(deadline.minusMillis(1))).isFalse();
            assertThat(target.isExpired(deadline)).isFalse();
            assertThat(target.isExpired(deadline.plusMillis(1))).isTrue();
        }

        @Test
        @DisplayName("Anchoring again does not move the clock")
        void anchorOnce() {
            target.anchor(T0);
            target.anchor(T0.plus(Duration.ofMinutes(4)));

            assertThat(target.getAnchorTime()).isEqualTo(T0);
        }
    }

    @Nested
    @DisplayName("Sweep Trigger")
    class SweepTrigger {

        @Test
        @DisplayName("No groups yet: no sweep")
        void noGroups() {
            assertThat(target.shouldFillRemainingOrders(P100, P102)).isFalse();
        }

        @Test
        @DisplayName("One leg complete and the other short by less than a lot's value: sweep")
        void oneSidedRemainder() {
            filledPair("10", "-9");

            assertThat(target.shouldFillRemainingOrders(P100, P102)).isTrue();
            List<Leg> legs = target.sweepLegs();
            assertThat(legs).hasSize(1);
            assertThat(legs.get(0).instrument()).isEqualTo(Y);
            assertThat(legs.get(0).quantity()).isEqualByComparingTo("-1");
        }

        @Test
        @DisplayName("Both legs with at least a lot's value remaining: keep pair matching")
        void largeRemainder() {
            filledPair("5", "-5");

            assertThat(target.shouldFillRemainingOrders(P100, P102)).isFalse();
        }

        @Test
        @DisplayName("An order still in flight blocks the sweep")
        void inFlight() {
            OrderGroup group = target.openPairGroup(new BigDecimal("1.9"), T0);
            LegOrder leg1 = LegOrder.builder().orderId("A").instrument(X).quantity(BigDecimal.TEN).build();
            LegOrder leg2 = LegOrder.builder().orderId("B").instrument(Y).quantity(new BigDecimal("-9")).build();
            group.attach(leg1);
            group.attach(leg2);
            leg1.applyUpdate(OrderStatus.FILLED, BigDecimal.TEN, P100, BigDecimal.ZERO, T0);
            leg2.applyUpdate(OrderStatus.SUBMITTED, null, null, null, T0);

            assertThat(target.shouldFillRemainingOrders(P100, P102)).isFalse();
            assertThat(target.hasUnresolvedGroup()).isTrue();
        }

        @Test
        @DisplayName("Fully filled target does not sweep")
        void nothingRemaining() {
            filledPair("10", "-10");

            assertThat(target.shouldFillRemainingOrders(P100, P102)).isFalse();
        }

        @Test
        @DisplayName("Sweep group is recorded once opened")
        void sweepRecorded() {
            filledPair("10", "-9");

            OrderGroup sweep = target.openSweepGroup(T0);

            assertThat(sweep.getType()).isEqualTo(OrderGroupType.SWEEP);
            assertThat(sweep.getExpectedLegCount()).isZero();
            assertThat(target.hasSwept()).isTrue();
        }
    }

    @Nested
    @DisplayName("Status Guard")
    class StatusGuard {

        @Test
        @DisplayName("Terminal status is set once and rejects later changes")
        void terminalIsFinal() {
            target.markStatus(ExecutionStatus.FILLED, T0);

            assertThatThrownBy(() -> target.markStatus(ExecutionStatus.CANCELED, T0))
                    .isInstanceOf(ExecutionStateException.class);
            assertThatThrownBy(() -> target.openPairGroup(BigDecimal.ONE, T0))
                    .isInstanceOf(ExecutionStateException.class);
            assertThat(target.getStatus()).isEqualTo(ExecutionStatus.FILLED);
        }

        @Test
        @DisplayName("A target cannot go back to NEW")
        void noReturnToNew() {
            target.markStatus(ExecutionStatus.SUBMITTED, T0);

            assertThatThrownBy(() -> target.markStatus(ExecutionStatus.NEW, T0))
                    .isInstanceOf(ExecutionStateException.class);
        }

        @Test
        @DisplayName("A new pair group waits for the previous one to resolve")
        void oneGroupInFlight() {
            target.openPairGroup(BigDecimal.ONE, T0);

            assertThatThrownBy(() -> target.openPairGroup(BigDecimal.ONE, T0))
                    .isInstanceOf(ExecutionStateException.class);
        }

        @Test
        @DisplayName("Completely failed only when every group failed")
        void completelyFailed() {
            assertThat(target.isCompletelyFailed()).isFalse();

            OrderGroup group = target.openPairGroup(BigDecimal.ONE, T0);
            LegOrder leg = LegOrder.builder().orderId("A").instrument(X).quantity(BigDecimal.TEN).build();
            group.attach(leg);
            leg.applyUpdate(OrderStatus.CANCELED, null, null, null, T0);

            // the counter leg has not been acknowledged yet
            assertThat(target.isCompletelyFailed()).isFalse();

            LegOrder counter = LegOrder.builder().orderId("B").instrument(Y).quantity(new BigDecimal("-9")).build();
            group.attach(counter);
            counter.applyUpdate(OrderStatus.CANCELED, null, null, null, T0);

            assertThat(target.isCompletelyFailed()).isTrue();
        }

        @Test
        @DisplayName("A failed group with a leg still working keeps new groups out until that leg ends")
        void failedGroupWithWorkingLeg() {
            OrderGroup first = filledPair("4", "-4");
            OrderGroup second = target.openPairGroup(BigDecimal.ONE, T0);
            LegOrder canceled = LegOrder.builder().orderId("C").instrument(X).quantity(new BigDecimal("6")).build();
            LegOrder working = LegOrder.builder().orderId("D").instrument(Y).quantity(new BigDecimal("-6")).build();
            second.attach(canceled);
            second.attach(working);
            canceled.applyUpdate(OrderStatus.CANCELED, null, null, null, T0);
            working.applyUpdate(OrderStatus.SUBMITTED, null, null, null, T0);

            assertThat(target.hasUnresolvedGroup()).isTrue();
            assertThat(target.groupAwaitingHandles()).isEmpty();
            assertThatThrownBy(() -> target.openPairGroup(BigDecimal.ONE, T0))
                    .isInstanceOf(ExecutionStateException.class);

            working.applyUpdate(OrderStatus.FILLED, new BigDecimal("-6"), P102, BigDecimal.ZERO, T0);

            assertThat(target.hasUnresolvedGroup()).isFalse();
            assertThat(target.quantityFilled().leg2()).isEqualByComparingTo("-10");
            OrderGroup third = target.openPairGroup(BigDecimal.ONE, T0);
            assertThat(target.activeGroup()).contains(third);
            assertThat(target.groupAwaitingHandles()).contains(third);
            assertThat(first.isResolved()).isTrue();
        }
    }

    @Test
    @DisplayName("Snapshot copies state and group details")
    void snapshot() {
        filledPair("10", "-9");
        target.markStatus(ExecutionStatus.PARTIALLY_FILLED, T0);

        ExecutionTargetSnapshot snapshot = target.snapshot();

        assertThat(snapshot.id()).isEqualTo(new ExecutionTargetId(7));
        assertThat(snapshot.status()).isEqualTo(ExecutionStatus.PARTIALLY_FILLED);
        assertThat(snapshot.filledQuantity().leg2()).isEqualByComparingTo("-9");
        assertThat(snapshot.orderGroups()).hasSize(1);
        assertThat(snapshot.orderGroups().get(0).orders()).hasSize(2);
        assertThat(snapshot.isTerminal()).isFalse();
    }
}
