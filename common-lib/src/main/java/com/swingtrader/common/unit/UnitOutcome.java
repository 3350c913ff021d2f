package com.swingtrader.common.unit;

import java.util.Map;

/**
 * Tagged result of one unit execution. Exactly one of {@code output} or
 * {@code errorKind} is populated, depending on {@code status}.
 */
public record UnitOutcome(
    UnitStatus status,
    Map<String, Object> output,
    ErrorKind errorKind,
    String message,
    boolean cacheHit
) {
    public static UnitOutcome succeeded(Map<String, Object> output) {
        return new UnitOutcome(UnitStatus.SUCCEEDED, output, null, null, false);
    }

    public static UnitOutcome fromCache(Map<String, Object> output) {
        return new UnitOutcome(UnitStatus.SUCCEEDED, output, null, null, true);
    }

    public static UnitOutcome failed(ErrorKind kind, String message) {
        return new UnitOutcome(UnitStatus.FAILED, null, kind, message, false);
    }

    public static UnitOutcome skipped(String message) {
        return new UnitOutcome(UnitStatus.SKIPPED, null, ErrorKind.UPSTREAM, message, false);
    }

    public boolean isSuccess() {
        return status == UnitStatus.SUCCEEDED;
    }
}
