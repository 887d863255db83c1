package com.pairarb.oms;

import com.pairarb.broker.OrderGateway;
import com.pairarb.calendar.MarketSessionGate;
import com.pairarb.config.ExecutionProperties;
import com.pairarb.domain.Lots;
import com.pairarb.domain.enums.ExecutionStatus;
import com.pairarb.domain.enums.OrderGroupType;
import com.pairarb.domain.enums.OrderStatus;
import com.pairarb.domain.model.ExecutionTarget;
import com.pairarb.domain.model.ExecutionTargetId;
import com.pairarb.domain.model.ExecutionTargetSnapshot;
import com.pairarb.domain.model.Instrument;
import com.pairarb.domain.model.Leg;
import com.pairarb.domain.model.LegOrder;
import com.pairarb.domain.model.LegQuantities;
import com.pairarb.domain.model.MatchResult;
import com.pairarb.domain.model.OrderGroup;
import com.pairarb.event.ExecutionEventPublisher;
import com.pairarb.event.MarketTickEvent;
import com.pairarb.event.OrderUpdateEvent;
import com.pairarb.exception.BrokerException;
import com.pairarb.exception.BusinessException;
import com.pairarb.exception.ErrorCode;
import com.pairarb.exception.InvalidOrderTagException;
import com.pairarb.exception.LegMismatchException;
import com.pairarb.marketdata.MarketDataProvider;
import com.pairarb.matcher.MatchRequest;
import com.pairarb.matcher.SpreadMatcher;
import com.pairarb.observability.ExecutionMetricsService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Drives execution targets from creation to a terminal status.
 *
 * <p>Two entry points mutate targets:
 * <ul>
 *   <li>{@link #execute(ExecutionTargetId, Instant)}, once per relevant market tick, which
 *       validates the market, sweeps stuck remainders, retires filled or expired targets,
 *       and otherwise matches and submits the next pair slice</li>
 *   <li>{@link #onOrderEvent(OrderUpdateEvent)}, once per broker order event, which attaches
 *       the order handle to its group and moves the target's status</li>
 * </ul>
 *
 * <p>Both run under the registry lock, so the manager behaves as a single logical writer.
 * Nothing here blocks or retries: a tick with nothing to do returns and the next tick
 * tries again with fresh market data. The only remediation is one sweep per target;
 * anything it cannot resolve ends as CANCELED (timeout) or FAILED.
 */
@Service
public class ExecutionManager {

    private static final Logger log = LoggerFactory.getLogger(ExecutionManager.class);

    private final ExecutionTargetRegistry executionTargetRegistry;
    private final SpreadMatcher spreadMatcher;
    private final MarketDataProvider marketDataProvider;
    private final MarketSessionGate marketSessionGate;
    private final OrderGateway orderGateway;
    private final OrderTagCodec orderTagCodec;
    private final ExecutionEventPublisher executionEventPublisher;
    private final ExecutionMetricsService executionMetricsService;
    private final ExecutionProperties executionProperties;
    private final Clock clock;

    public ExecutionManager(
            ExecutionTargetRegistry executionTargetRegistry,
            SpreadMatcher spreadMatcher,
            MarketDataProvider marketDataProvider,
            MarketSessionGate marketSessionGate,
            OrderGateway orderGateway,
            OrderTagCodec orderTagCodec,
            ExecutionEventPublisher executionEventPublisher,
            ExecutionMetricsService executionMetricsService,
            ExecutionProperties executionProperties,
            Clock clock) {
        this.executionTargetRegistry = executionTargetRegistry;
        this.spreadMatcher = spreadMatcher;
        this.marketDataProvider = marketDataProvider;
        this.marketSessionGate = marketSessionGate;
        this.orderGateway = orderGateway;
        this.orderTagCodec = orderTagCodec;
        this.executionEventPublisher = executionEventPublisher;
        this.executionMetricsService = executionMetricsService;
        this.executionProperties = executionProperties;
        this.clock = clock;
    }

    // ---- Target lifecycle ----

    /**
     * Creates and registers a target. Quantities are rounded down to whole lots.
     *
     * @throws BusinessException if the request is malformed or the opportunity already has an active target
     */
    public ExecutionTargetSnapshot createTarget(ExecutionTargetRequest request) {
        validate(request);
        return executionTargetRegistry.withLock(() -> {
            ExecutionTarget target = ExecutionTarget.builder()
                    .id(executionTargetRegistry.mintId())
                    .opportunityKey(request.opportunityKey())
                    .instrument1(request.instrument1())
                    .instrument2(request.instrument2())
                    .targetQuantity1(request.targetQuantity1())
                    .targetQuantity2(request.targetQuantity2())
                    .lotSize1(marketDataProvider.lotSize(request.instrument1()))
                    .lotSize2(marketDataProvider.lotSize(request.instrument2()))
                    .direction(request.direction())
                    .expectedSpreadPct(request.expectedSpreadPct())
                    .timeout(request.timeout() != null ? request.timeout() : executionProperties.getDefaultTimeout())
                    .createdAt(clock.instant())
                    .build();

            if (target.getTargetQuantity1().signum() == 0 || target.getTargetQuantity2().signum() == 0) {
                throw new BusinessException(
                        "Target quantity below one lot: " + request.targetQuantity1() + "/" + request.targetQuantity2());
            }

            executionTargetRegistry.register(target);
            log.info(
                    "Created target {}: opportunity={}, {}={}, {}={}, direction={}, expectedSpread={}%, timeout={}",
                    target.getId(),
                    target.getOpportunityKey(),
                    target.getInstrument1(),
                    target.getTargetQuantity1(),
                    target.getInstrument2(),
                    target.getTargetQuantity2(),
                    target.getDirection(),
                    target.getExpectedSpreadPct(),
                    target.getTimeout());
            executionEventPublisher.publishCreated(this, target);
            return target.snapshot();
        });
    }

    /**
     * Cancels an active target at the target level. Orders already at the venue are not
     * touched; their later events are dropped as belonging to a retired target.
     *
     * @throws BusinessException with {@link ErrorCode#NOT_FOUND} if the target is not active
     */
    public ExecutionTargetSnapshot cancel(ExecutionTargetId id) {
        return executionTargetRegistry.withLock(() -> {
            ExecutionTarget target = executionTargetRegistry
                    .find(id)
                    .orElseThrow(() -> new BusinessException(ErrorCode.NOT_FOUND, "No active target " + id));
            finish(target, ExecutionStatus.CANCELED, clock.instant(), "Canceled on request");
            return target.snapshot();
        });
    }

    public boolean hasActiveExecution(String opportunityKey) {
        return executionTargetRegistry.findByOpportunityKey(opportunityKey).isPresent();
    }

    public List<ExecutionTargetSnapshot> getActiveTargets() {
        return executionTargetRegistry.withLock(() -> executionTargetRegistry.activeTargets().stream()
                .map(ExecutionTarget::snapshot)
                .toList());
    }

    public Optional<ExecutionTargetSnapshot> getTarget(ExecutionTargetId id) {
        return executionTargetRegistry.withLock(() -> executionTargetRegistry.find(id).map(ExecutionTarget::snapshot));
    }

    // ---- Per-tick execution ----

    public ExecutionStep execute(ExecutionTargetId id) {
        return execute(id, clock.instant());
    }

    /**
     * Testable version: runs one execution tick for a target at {@code now}.
     */
    public ExecutionStep execute(ExecutionTargetId id, Instant now) {
        return executionTargetRegistry.withLock(() -> executionTargetRegistry
                .find(id)
                .map(target -> execute(target, now))
                .orElse(ExecutionStep.NOT_ACTIVE));
    }

    public Map<ExecutionTargetId, ExecutionStep> executeAll() {
        return executeAll(clock.instant());
    }

    /**
     * Testable version: runs one tick for every active target. A failure on one target is
     * logged and does not stop the others.
     */
    public Map<ExecutionTargetId, ExecutionStep> executeAll(Instant now) {
        return executionTargetRegistry.withLock(() -> {
            Map<ExecutionTargetId, ExecutionStep> steps = new LinkedHashMap<>();
            for (ExecutionTarget target : executionTargetRegistry.activeTargets()) {
                steps.put(target.getId(), executeSafely(target, now));
            }
            return steps;
        });
    }

    /**
     * Runs the targets trading the ticked instrument.
     * Runs at @Order(5), after the market data cache has been updated.
     */
    @EventListener
    @Order(5)
    public void onMarketTick(MarketTickEvent event) {
        if (!executionProperties.isTickDriven()) {
            return;
        }
        Instant now = clock.instant();
        executionTargetRegistry.runLocked(() -> {
            for (ExecutionTarget target : executionTargetRegistry.activeTargets()) {
                if (target.getInstrument1().equals(event.getInstrument())
                        || target.getInstrument2().equals(event.getInstrument())) {
                    executeSafely(target, now);
                }
            }
        });
    }

    private ExecutionStep executeSafely(ExecutionTarget target, Instant now) {
        if (target.isTerminal()) {
            return ExecutionStep.NOT_ACTIVE;
        }
        try {
            return execute(target, now);
        } catch (RuntimeException e) {
            log.error("Execution tick failed for target {}", target.getId(), e);
            return ExecutionStep.NOT_ACTIVE;
        }
    }

    ExecutionStep execute(ExecutionTarget target, Instant now) {
        if (target.isTerminal()) {
            return ExecutionStep.NOT_ACTIVE;
        }
        Instrument instrument1 = target.getInstrument1();
        Instrument instrument2 = target.getInstrument2();

        // Step 1: both markets open, both prices valid
        if (!marketSessionGate.isMarketOpen(instrument1, now) || !marketSessionGate.isMarketOpen(instrument2, now)) {
            log.debug("Target {} skipped: market closed for {} or {}", target.getId(), instrument1, instrument2);
            return ExecutionStep.MARKET_CLOSED;
        }
        if (!marketDataProvider.hasValidPrice(instrument1) || !marketDataProvider.hasValidPrice(instrument2)) {
            log.debug("Target {} skipped: no valid price for {} or {}", target.getId(), instrument1, instrument2);
            return ExecutionStep.INVALID_PRICE;
        }
        BigDecimal price1 = marketDataProvider.referencePrice(instrument1);
        BigDecimal price2 = marketDataProvider.referencePrice(instrument2);

        // Step 2: the timeout clock starts on the first valid tick
        target.anchor(now);

        // Step 3: a stuck one-sided remainder takes precedence over everything else
        if (!target.hasSwept() && target.shouldFillRemainingOrders(price1, price2) && sweep(target, now)) {
            return ExecutionStep.SWEPT;
        }

        // Step 4: filled by quantity
        if (target.isCompletelyFilled()) {
            if (target.hasUnfilledGroups()) {
                executionMetricsService.recordCompletionInconsistency();
            }
            finish(target, ExecutionStatus.FILLED, now, null);
            return ExecutionStep.FILLED;
        }

        // Step 5: timeout
        if (target.isExpired(now)) {
            finish(target, ExecutionStatus.CANCELED, now, "Timed out after " + target.getTimeout());
            return ExecutionStep.CANCELED;
        }

        if (target.hasUnresolvedGroup()) {
            return ExecutionStep.AWAITING_FILLS;
        }

        // Step 6: match the remaining quantity
        LegQuantities remaining = target.quantityRemaining();
        BigDecimal remainingNotional = remaining.leg1().signum() != 0
                ? remaining.leg1().abs().multiply(price1)
                : remaining.leg2().abs().multiply(price2);
        MatchResult match = spreadMatcher.matchPair(new MatchRequest(
                instrument1,
                instrument2,
                remainingNotional,
                target.getDirection(),
                target.getExpectedSpreadPct(),
                BigDecimal.ZERO));
        if (!match.isExecutable()) {
            executionMetricsService.recordMatchRejected();
            log.debug("Target {}: nothing executable this tick ({})", target.getId(), match.getRejectReason());
            return ExecutionStep.NO_MATCH;
        }

        BigDecimal quantity1 = capToRemaining(match.getLeg1().quantity(), remaining.leg1(), target.getLotSize1());
        BigDecimal quantity2 = capToRemaining(match.getLeg2().quantity(), remaining.leg2(), target.getLotSize2());
        if (quantity1.signum() == 0 || quantity2.signum() == 0) {
            executionMetricsService.recordMatchRejected();
            log.debug(
                    "Target {}: matched slice {}/{} does not fit remaining {}/{}",
                    target.getId(),
                    match.getLeg1().quantity(),
                    match.getLeg2().quantity(),
                    remaining.leg1(),
                    remaining.leg2());
            return ExecutionStep.NO_MATCH;
        }

        // Step 7: placeholder group first, then the two legs
        OrderGroup group = target.openPairGroup(match.getAvgSpreadPct(), now);
        if (target.getStatus() == ExecutionStatus.NEW) {
            target.markStatus(ExecutionStatus.SUBMITTED, now);
            executionEventPublisher.publishTransition(this, target, null);
        }
        log.info(
                "Target {} group {}: submitting {} {} / {} {} at spread {}% ({})",
                target.getId(),
                group.getSequence(),
                instrument1,
                quantity1,
                instrument2,
                quantity2,
                match.getAvgSpreadPct(),
                match.getUsedStrategy());

        String tag = orderTagCodec.encode(target.getId());
        List<Leg> legs = List.of(new Leg(instrument1, quantity1), new Leg(instrument2, quantity2));
        for (int i = 0; i < legs.size(); i++) {
            // an order event delivered during submission may already have retired the target
            if (target.isTerminal()) {
                log.warn(
                        "Target {} became {} mid-submission, not sending {}",
                        target.getId(),
                        target.getStatus(),
                        legs.get(i));
                break;
            }
            if (!submit(target, group, legs.get(i), tag, now)) {
                withdrawUnsentLegs(target, group, legs.subList(i + 1, legs.size()), now);
                break;
            }
        }
        return ExecutionStep.SUBMITTED;
    }

    /**
     * Sends one single-leg market order per leg with a lot-aligned remainder, all in one
     * new SWEEP group. Returns false if there was nothing lot-aligned to send.
     */
    private boolean sweep(ExecutionTarget target, Instant now) {
        List<Leg> legs = target.sweepLegs();
        if (legs.isEmpty()) {
            log.warn(
                    "Target {} has an un-hedgeable remainder {} below one lot on both legs, nothing to sweep",
                    target.getId(),
                    target.quantityRemaining());
            return false;
        }

        OrderGroup group = target.openSweepGroup(now);
        executionMetricsService.recordSweep();
        log.info("Target {} sweep group {}: {}", target.getId(), group.getSequence(), legs);
        executionEventPublisher.publishSweep(this, target, "Sweeping " + legs);

        String tag = orderTagCodec.encode(target.getId());
        for (Leg leg : legs) {
            if (target.isTerminal()) {
                break;
            }
            group.incrementExpectedLegCount();
            submit(target, group, leg, tag, now);
        }
        return true;
    }

    /** Sends one leg. Returns false if the gateway refused it, after recording an INVALID handle. */
    private boolean submit(ExecutionTarget target, OrderGroup group, Leg leg, String tag, Instant now) {
        try {
            String orderId = orderGateway.submitMarketOrder(leg.instrument(), leg.quantity(), tag);
            executionMetricsService.recordOrderSubmitted();
            log.debug("Target {} group {}: order {} sent for {}", target.getId(), group.getSequence(), orderId, leg);
            return true;
        } catch (BrokerException e) {
            log.error("Target {} group {}: submission of {} refused", target.getId(), group.getSequence(), leg, e);
            String syntheticId = "REJ-" + tag + "-" + group.getSequence() + "-" + leg.instrument().symbol();
            applyOrderUpdate(
                    target,
                    OrderUpdateEvent.failed(
                            this, syntheticId, leg.instrument(), OrderStatus.INVALID, leg.quantity(), tag,
                            e.getMessage(), now),
                    now);
            return false;
        }
    }

    /**
     * A refused leg stops the rest of the pair. The group stops waiting for the legs that
     * were never sent, which may leave it resolved and the target ready for a decision.
     */
    private void withdrawUnsentLegs(ExecutionTarget target, OrderGroup group, List<Leg> unsent, Instant now) {
        if (unsent.isEmpty() || target.isTerminal()) {
            return;
        }
        unsent.forEach(leg -> group.withdrawExpectedLeg());
        log.warn("Target {} group {}: not sending {} after a refused leg", target.getId(), group.getSequence(), unsent);
        settle(target, group, false, now);
    }

    // ---- Order events ----

    /**
     * Applies a broker order event to the target named by its tag.
     * Runs at @Order(1), before any listener that reads target state.
     *
     * <p>Events that cannot be attributed (bad tag, unknown or retired target, instrument
     * not a leg of the target) are logged at ERROR, counted, and dropped.
     */
    @EventListener
    @Order(1)
    public void onOrderEvent(OrderUpdateEvent event) {
        executionTargetRegistry.runLocked(() -> {
            ExecutionTargetId id;
            try {
                id = orderTagCodec.decode(event.getTag());
            } catch (InvalidOrderTagException e) {
                log.error("Dropping order event with unroutable tag: {}", event, e);
                executionMetricsService.recordDroppedEvent("invalid_tag");
                return;
            }

            Optional<ExecutionTarget> target = executionTargetRegistry.find(id);
            if (target.isEmpty()) {
                boolean retired = executionTargetRegistry.wasRetired(id);
                log.error("Dropping order event for {} target {}: {}", retired ? "retired" : "unknown", id, event);
                executionMetricsService.recordDroppedEvent(retired ? "retired_target" : "unknown_target");
                return;
            }

            try {
                applyOrderUpdate(target.get(), event, eventTime(event));
            } catch (LegMismatchException e) {
                log.error("Dropping order event for target {}: {}", id, e.getMessage(), e);
                executionMetricsService.recordDroppedEvent("leg_mismatch");
            }
        });
    }

    private void applyOrderUpdate(ExecutionTarget target, OrderUpdateEvent event, Instant now) {
        if (target.isTerminal()) {
            log.error("Dropping order event for terminal target {}: {}", target.getId(), event);
            executionMetricsService.recordDroppedEvent("retired_target");
            return;
        }

        // Step 1: find the handle's group, or attach the handle to the group still waiting for it
        Optional<OrderGroup> owning = target.groupContaining(event.getOrderId());
        OrderGroup group = owning.or(target::groupAwaitingHandles).orElse(null);
        if (group == null) {
            log.error("Dropping order event for target {}, no order group expects it: {}", target.getId(), event);
            executionMetricsService.recordDroppedEvent("no_order_group");
            return;
        }

        LegOrder handle = group.findOrder(event.getOrderId()).orElse(null);
        if (handle == null) {
            handle = LegOrder.builder()
                    .orderId(event.getOrderId())
                    .instrument(event.getInstrument())
                    .quantity(event.getQuantity())
                    .updatedAt(now)
                    .build();
            if (!group.attach(handle)) {
                log.warn(
                        "Target {} group {} already holds {} orders, ignoring {}",
                        target.getId(),
                        group.getSequence(),
                        group.getExpectedLegCount(),
                        event.getOrderId());
                executionMetricsService.recordDroppedEvent("group_complete");
                return;
            }
        } else if (!handle.getInstrument().equals(event.getInstrument())) {
            throw new LegMismatchException(
                    event.getOrderId(), event.getInstrument(), target.getInstrument1(), target.getInstrument2());
        }

        // Step 2: fills and fees
        OrderStatus previous = handle.getStatus();
        if (!handle.applyUpdate(
                event.getStatus(), event.getFillQuantity(), event.getFillPrice(), event.getFee(), now)) {
            log.warn("Order {} is already {}, ignoring {}", handle.getOrderId(), previous, event.getStatus());
            return;
        }

        // Step 3: target status
        if (event.getStatus().isFailure()) {
            executionMetricsService.recordOrderFailed();
            log.warn(
                    "Target {} group {}: order {} for {} ended {} ({})",
                    target.getId(),
                    group.getSequence(),
                    handle.getOrderId(),
                    handle.getInstrument(),
                    handle.getStatus(),
                    event.getReason());
        } else if (!event.isFill()) {
            log.debug("Order {} for target {} acknowledged: {}", handle.getOrderId(), target.getId(), event.getStatus());
        }
        settle(target, group, event.isFill(), now);
    }

    /**
     * Moves the target after an update to {@code group}. While any order of any group is
     * still working, the only change is PARTIALLY_FILLED on a fill; FILLED and FAILED are
     * decided once every order sent so far is terminal.
     */
    private void settle(ExecutionTarget target, OrderGroup group, boolean filled, Instant now) {
        if (target.hasUnresolvedGroup()) {
            if (group.isFailed()) {
                log.warn(
                        "Target {} group {} failed with orders still working, waiting for them to finish",
                        target.getId(),
                        group.getSequence());
            }
            if (filled) {
                markPartiallyFilled(target, now);
            }
            return;
        }

        if (target.isCompletelyFilled()) {
            if (target.hasUnfilledGroups()) {
                executionMetricsService.recordCompletionInconsistency();
            }
            finish(target, ExecutionStatus.FILLED, now, null);
        } else if (target.isCompletelyFailed()) {
            finish(target, ExecutionStatus.FAILED, now, "Every order group failed");
        } else if (group.isFailed() && group.getType() == OrderGroupType.SWEEP) {
            // the one remediation attempt is gone; whatever is filled stays unhedged
            log.error(
                    "Target {} sweep failed, exposure left unhedged: filled={}, target={}",
                    target.getId(),
                    target.quantityFilled(),
                    target.targetQuantities());
            finish(target, ExecutionStatus.FAILED, now, "Sweep order failed with orphaned exposure");
        } else {
            if (group.isFailed()) {
                log.warn(
                        "Target {} keeps running after a failed leg: filled={}, remaining={}",
                        target.getId(),
                        target.quantityFilled(),
                        target.quantityRemaining());
            }
            if (filled) {
                markPartiallyFilled(target, now);
            }
        }
    }

    private void markPartiallyFilled(ExecutionTarget target, Instant now) {
        target.markStatus(ExecutionStatus.PARTIALLY_FILLED, now);
        executionEventPublisher.publishTransition(this, target, null);
    }

    private void finish(ExecutionTarget target, ExecutionStatus status, Instant now, String reason) {
        target.markStatus(status, now);
        executionTargetRegistry.retire(target.getId());
        log.info(
                "Target {} {}: filled={}, target={}, fees={}, groups={}{}",
                target.getId(),
                status,
                target.quantityFilled(),
                target.targetQuantities(),
                target.totalFee(),
                target.getOrderGroups().size(),
                reason != null ? ", reason=" + reason : "");
        executionEventPublisher.publishTransition(this, target, reason);
    }

    // ---- Helpers ----

    /**
     * Limits a matched leg to what the target still needs on that leg, in whole lots.
     * Zero when the leg is already complete or the match points the other way.
     */
    static BigDecimal capToRemaining(BigDecimal matched, BigDecimal remaining, BigDecimal lotSize) {
        if (matched.signum() == 0 || matched.signum() != remaining.signum()) {
            return BigDecimal.ZERO;
        }
        BigDecimal cap = Lots.roundDown(remaining.abs(), lotSize);
        BigDecimal capped = matched.abs().min(cap);
        return matched.signum() > 0 ? capped : capped.negate();
    }

    private Instant eventTime(OrderUpdateEvent event) {
        return event.getEventTime() != null ? event.getEventTime() : clock.instant();
    }

    private void validate(ExecutionTargetRequest request) {
        if (request.opportunityKey() == null || request.opportunityKey().isBlank()) {
            throw new BusinessException("Opportunity key is required");
        }
        if (request.instrument1() == null || request.instrument2() == null) {
            throw new BusinessException("Both instruments are required");
        }
        if (request.instrument1().equals(request.instrument2())) {
            throw new BusinessException("A pair needs two different instruments, got " + request.instrument1());
        }
        if (request.direction() == null) {
            throw new BusinessException("Spread direction is required");
        }
        if (request.targetQuantity1() == null || request.targetQuantity2() == null) {
            throw new BusinessException("Both target quantities are required");
        }
        int expectedSign1 = request.direction().buysFirstLeg() ? 1 : -1;
        if (request.targetQuantity1().signum() != expectedSign1
                || request.targetQuantity2().signum() != -expectedSign1) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Target quantities " + request.targetQuantity1() + "/" + request.targetQuantity2()
                            + " do not match direction " + request.direction(),
                    Map.of("direction", request.direction().name()));
        }
        if (request.timeout() != null && (request.timeout().isNegative() || request.timeout().equals(Duration.ZERO))) {
            throw new BusinessException("Timeout must be positive, got " + request.timeout());
        }
    }
}
