package com.pairarb.event;

import com.pairarb.domain.enums.ExecutionStatus;

public enum ExecutionEventType {
    CREATED,
    SUBMITTED,
    PARTIALLY_FILLED,
    SWEEP_SUBMITTED,
    FILLED,
    CANCELED,
    INVALID,
    FAILED;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELED || this == INVALID || this == FAILED;
    }

    /** The event type announcing a move to {@code status}. */
    public static ExecutionEventType of(ExecutionStatus status) {
        return switch (status) {
            case NEW -> CREATED;
            case SUBMITTED -> SUBMITTED;
            case PARTIALLY_FILLED -> PARTIALLY_FILLED;
            case FILLED -> FILLED;
            case CANCELED -> CANCELED;
            case INVALID -> INVALID;
            case FAILED -> FAILED;
        };
    }
}
