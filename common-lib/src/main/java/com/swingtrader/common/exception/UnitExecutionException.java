package com.swingtrader.common.exception;

/**
 * Raised from a unit's domain work when it cannot produce an output,
 * e.g. an upstream data provider returned nothing usable.
 */
public class UnitExecutionException extends AgentException {

    public UnitExecutionException(String unitName, String message) {
        super(unitName, message);
    }

    public UnitExecutionException(String unitName, String message, Throwable cause) {
        super(unitName, message, cause);
    }
}
