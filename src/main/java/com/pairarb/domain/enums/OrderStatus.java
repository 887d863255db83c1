package com.pairarb.domain.enums;

/**
 * Lifecycle status of a single leg order as reported by the broker.
 * NEW is our placeholder state for a handle whose acknowledgment has not arrived yet.
 */
public enum OrderStatus {
    NEW,
    SUBMITTED,
    PARTIALLY_FILLED,
    FILLED,
    CANCELED,
    INVALID;

    /** CANCELED and INVALID both count as a failed order for group status. */
    public boolean isFailure() {
        return this == CANCELED || this == INVALID;
    }

    public boolean isTerminal() {
        return this == FILLED || isFailure();
    }
}
