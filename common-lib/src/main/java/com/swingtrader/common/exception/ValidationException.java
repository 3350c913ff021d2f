package com.swingtrader.common.exception;

import java.util.List;

/**
 * Raised when a unit's raw input does not satisfy its declared schema.
 * Carries every violation found, not only the first.
 */
public class ValidationException extends AgentException {
    private final List<String> violations;

    public ValidationException(String unitName, List<String> violations) {
        super(unitName, "invalid input: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
