package com.pairarb.event;

import com.pairarb.domain.model.ExecutionTarget;
import com.pairarb.domain.model.Instrument;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed methods
 * for the execution core's events.
 *
 * <p>Execution target notifications are delivered synchronously. A listener that throws
 * must not affect target state, so those failures are logged here and swallowed.
 */
@Component
public class ExecutionEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEventPublisher.class);

    private final ApplicationEventPublisher applicationEventPublisher;

    public ExecutionEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Execution targets ----

    public void publishCreated(Object source, ExecutionTarget target) {
        publishTargetEvent(source, target, ExecutionEventType.CREATED, null);
    }

    /** Announces the target's current status. */
    public void publishTransition(Object source, ExecutionTarget target, String message) {
        publishTargetEvent(source, target, ExecutionEventType.of(target.getStatus()), message);
    }

    public void publishSweep(Object source, ExecutionTarget target, String message) {
        publishTargetEvent(source, target, ExecutionEventType.SWEEP_SUBMITTED, message);
    }

    private void publishTargetEvent(Object source, ExecutionTarget target, ExecutionEventType type, String message) {
        try {
            applicationEventPublisher.publishEvent(new ExecutionTargetEvent(source, target.snapshot(), type, message));
        } catch (RuntimeException e) {
            log.error("Execution listener failed for target={}, event={}", target.getId(), type, e);
        }
    }

    // ---- Broker and market data ----

    public void publishOrderUpdate(OrderUpdateEvent event) {
        applicationEventPublisher.publishEvent(event);
    }

    public void publishTick(Object source, Instrument instrument, Instant receivedAt) {
        applicationEventPublisher.publishEvent(new MarketTickEvent(source, instrument, receivedAt));
    }
}
