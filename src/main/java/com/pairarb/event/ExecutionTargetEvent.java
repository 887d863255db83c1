package com.pairarb.event;

import com.pairarb.domain.model.ExecutionTargetSnapshot;
import org.springframework.context.ApplicationEvent;

/**
 * Published on every status transition of an execution target, and when a sweep is sent.
 *
 * <p>Carries an immutable snapshot taken at publication time. Listeners run synchronously
 * on the execution thread and must return quickly; anything they throw is logged and
 * discarded by {@link ExecutionEventPublisher}.
 */
public class ExecutionTargetEvent extends ApplicationEvent {

    private final ExecutionTargetSnapshot snapshot;
    private final ExecutionEventType eventType;
    private final String message;

    public ExecutionTargetEvent(
            Object source, ExecutionTargetSnapshot snapshot, ExecutionEventType eventType, String message) {
        super(source);
        this.snapshot = snapshot;
        this.eventType = eventType;
        this.message = message;
    }

    public ExecutionTargetSnapshot getSnapshot() {
        return snapshot;
    }

    public ExecutionEventType getEventType() {
        return eventType;
    }

    /** Human-readable detail, e.g. the failure cause. May be null. */
    public String getMessage() {
        return message;
    }
}
