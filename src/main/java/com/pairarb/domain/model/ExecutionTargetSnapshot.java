package com.pairarb.domain.model;

import com.pairarb.domain.enums.ExecutionStatus;
import com.pairarb.domain.enums.OrderGroupStatus;
import com.pairarb.domain.enums.OrderGroupType;
import com.pairarb.domain.enums.OrderStatus;
import com.pairarb.domain.enums.SpreadDirection;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time copy of an {@link ExecutionTarget}, handed to notification listeners
 * and to the history recorder. Holds no references to live core objects.
 */
public record ExecutionTargetSnapshot(
        ExecutionTargetId id,
        String opportunityKey,
        Instrument instrument1,
        Instrument instrument2,
        SpreadDirection direction,
        ExecutionStatus status,
        BigDecimal expectedSpreadPct,
        LegQuantities targetQuantity,
        LegQuantities filledQuantity,
        BigDecimal totalFee,
        Instant createdAt,
        Instant anchorTime,
        Instant statusChangedAt,
        List<OrderGroupSnapshot> orderGroups) {

    static ExecutionTargetSnapshot of(ExecutionTarget target) {
        return new ExecutionTargetSnapshot(
                target.getId(),
                target.getOpportunityKey(),
                target.getInstrument1(),
                target.getInstrument2(),
                target.getDirection(),
                target.getStatus(),
                target.getExpectedSpreadPct(),
                target.targetQuantities(),
                target.quantityFilled(),
                target.totalFee(),
                target.getCreatedAt(),
                target.getAnchorTime(),
                target.getStatusChangedAt(),
                target.getOrderGroups().stream().map(OrderGroupSnapshot::of).toList());
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Copy of one order group. */
    public record OrderGroupSnapshot(
            int sequence,
            OrderGroupType type,
            OrderGroupStatus status,
            int expectedLegCount,
            BigDecimal expectedSpreadPct,
            BigDecimal realizedSpreadPct,
            Instant createdAt,
            List<LegOrderSnapshot> orders) {

        static OrderGroupSnapshot of(OrderGroup group) {
            return new OrderGroupSnapshot(
                    group.getSequence(),
                    group.getType(),
                    group.getStatus(),
                    group.getExpectedLegCount(),
                    group.getExpectedSpreadPct(),
                    group.realizedSpreadPct().orElse(null),
                    group.getCreatedAt(),
                    group.getLegOrders().stream().map(LegOrderSnapshot::of).toList());
        }
    }

    /** Copy of one leg order handle. */
    public record LegOrderSnapshot(
            String orderId,
            Instrument instrument,
            BigDecimal quantity,
            OrderStatus status,
            BigDecimal filledQuantity,
            BigDecimal averageFillPrice,
            BigDecimal fee) {

        static LegOrderSnapshot of(LegOrder order) {
            return new LegOrderSnapshot(
                    order.getOrderId(),
                    order.getInstrument(),
                    order.getQuantity(),
                    order.getStatus(),
                    order.getFilledQuantity(),
                    order.getAverageFillPrice(),
                    order.getFee());
        }
    }
}
