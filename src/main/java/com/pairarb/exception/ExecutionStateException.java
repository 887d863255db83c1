package com.pairarb.exception;

import com.pairarb.domain.model.ExecutionTargetId;
import java.util.Map;

/**
 * Thrown when an execution target is asked to change in a way its state machine forbids,
 * e.g. mutating a target that already holds a terminal status.
 */
public class ExecutionStateException extends BaseException {

    public ExecutionStateException(ExecutionTargetId targetId, String message) {
        super(ErrorCode.ILLEGAL_STATE, message, Map.of("targetId", String.valueOf(targetId)));
    }
}
