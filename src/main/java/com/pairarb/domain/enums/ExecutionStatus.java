package com.pairarb.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of an execution target.
 *
 * <p>NEW is the initial state. FILLED, CANCELED, INVALID and FAILED are terminal and
 * are reached at most once per target.
 */
public enum ExecutionStatus {
    NEW,
    SUBMITTED,
    PARTIALLY_FILLED,
    FILLED,
    CANCELED,
    INVALID,
    FAILED;

    private static final Set<ExecutionStatus> TERMINAL = EnumSet.of(FILLED, CANCELED, INVALID, FAILED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
