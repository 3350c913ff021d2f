package com.swingtrader.common.unit;

/**
 * Classifies why a unit did not succeed.
 */
public enum ErrorKind {
    /** Input rejected before domain work began. */
    VALIDATION,
    /** Domain work raised an error. */
    UNIT_EXECUTION,
    /** Domain work exceeded the per-unit time limit. */
    TIMEOUT,
    /** An upstream unit did not produce the required output. */
    UPSTREAM
}
