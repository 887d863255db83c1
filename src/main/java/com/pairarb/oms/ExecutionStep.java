package com.pairarb.oms;

/** What one execution tick did for a target. */
public enum ExecutionStep {
    /** Target is not active (unknown or already retired). */
    NOT_ACTIVE,
    MARKET_CLOSED,
    INVALID_PRICE,
    SWEPT,
    FILLED,
    CANCELED,
    /** The active order group still has orders in flight. */
    AWAITING_FILLS,
    NO_MATCH,
    SUBMITTED
}
