package com.swingtrader.orchestrator.result;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum OverallStatus {
    /** Every unit succeeded. */
    SUCCESS,
    /** Some units succeeded, others failed or were skipped. */
    PARTIAL,
    /** No unit succeeded, or the graph was rejected. */
    FAILURE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
