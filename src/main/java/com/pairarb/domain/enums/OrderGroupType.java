package com.pairarb.domain.enums;

/** PAIR groups carry both legs of a matched slice; SWEEP groups carry single-leg remediation orders. */
public enum OrderGroupType {
    PAIR,
    SWEEP
}
