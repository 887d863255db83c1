package com.pairarb.observability;

import com.pairarb.domain.enums.ExecutionStatus;
import com.pairarb.event.ExecutionTargetEvent;
import com.pairarb.oms.ExecutionTargetRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the execution core.
 *
 * <ul>
 *   <li><b>execution.orders.submitted</b> (counter): leg orders handed to the gateway</li>
 *   <li><b>execution.orders.failed</b> (counter): leg orders that ended CANCELED or INVALID</li>
 *   <li><b>execution.sweeps</b> (counter): sweep groups sent</li>
 *   <li><b>execution.matches.rejected</b> (counter): ticks where the matcher found nothing to trade</li>
 *   <li><b>execution.completion.inconsistent</b> (counter): targets completed by quantity while
 *       some order group did not report FILLED</li>
 *   <li><b>execution.events.dropped</b> (counter, tag {@code reason}): order events that could
 *       not be attributed to an active target</li>
 *   <li><b>execution.targets.completed</b> (counter, tag {@code status}): targets retired, by status</li>
 *   <li><b>execution.targets.active</b> (gauge): targets currently in the registry</li>
 * </ul>
 */
@Service
public class ExecutionMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter ordersSubmittedCounter;
    private final Counter ordersFailedCounter;
    private final Counter sweepsCounter;
    private final Counter matchRejectedCounter;
    private final Counter completionInconsistentCounter;

    public ExecutionMetricsService(MeterRegistry meterRegistry, ExecutionTargetRegistry executionTargetRegistry) {
        this.meterRegistry = meterRegistry;

        this.ordersSubmittedCounter = Counter.builder("execution.orders.submitted")
                .description("Leg orders handed to the order gateway")
                .register(meterRegistry);

        this.ordersFailedCounter = Counter.builder("execution.orders.failed")
                .description("Leg orders that ended canceled or invalid")
                .register(meterRegistry);

        this.sweepsCounter = Counter.builder("execution.sweeps")
                .description("Single-leg sweep groups sent for un-hedgeable remainders")
                .register(meterRegistry);

        this.matchRejectedCounter = Counter.builder("execution.matches.rejected")
                .description("Ticks on which the spread matcher returned nothing executable")
                .register(meterRegistry);

        this.completionInconsistentCounter = Counter.builder("execution.completion.inconsistent")
                .description("Targets filled by quantity while an order group did not report FILLED")
                .register(meterRegistry);

        meterRegistry.gauge("execution.targets.active", executionTargetRegistry, ExecutionTargetRegistry::size);
    }

    public void recordOrderSubmitted() {
        ordersSubmittedCounter.increment();
    }

    public void recordOrderFailed() {
        ordersFailedCounter.increment();
    }

    public void recordSweep() {
        sweepsCounter.increment();
    }

    public void recordMatchRejected() {
        matchRejectedCounter.increment();
    }

    public void recordCompletionInconsistency() {
        completionInconsistentCounter.increment();
    }

    public void recordDroppedEvent(String reason) {
        meterRegistry.counter("execution.events.dropped", "reason", reason).increment();
    }

    /**
     * Counts retired targets by terminal status.
     * Runs at @Order(20), after the core listeners.
     */
    @EventListener
    @Order(20)
    public void onExecutionTargetEvent(ExecutionTargetEvent event) {
        ExecutionStatus status = event.getSnapshot().status();
        if (event.getEventType().isTerminal()) {
            meterRegistry
                    .counter("execution.targets.completed", "status", status.name().toLowerCase(Locale.ROOT))
                    .increment();
        }
    }
}
