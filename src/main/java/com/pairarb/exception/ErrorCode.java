package com.pairarb.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", false),
    DUPLICATE_TARGET("DUPLICATE_TARGET", false),
    NOT_FOUND("NOT_FOUND", false),
    ILLEGAL_STATE("ILLEGAL_STATE", false),
    INVALID_ORDER_TAG("INVALID_ORDER_TAG", false),
    LEG_MISMATCH("LEG_MISMATCH", false),
    BROKER_ERROR("BROKER_ERROR", true);

    private final String code;

    /** Whether the caller may retry the same operation on a later tick. */
    private final boolean retryable;
}
