package com.pairarb.domain.enums;

/** Derived status of an order group. Never stored, always computed from its leg orders. */
public enum OrderGroupStatus {
    SUBMITTED,
    PARTIALLY_FILLED,
    FILLED,
    FAILED
}
