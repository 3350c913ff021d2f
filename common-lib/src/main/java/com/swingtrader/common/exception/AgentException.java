package com.swingtrader.common.exception;

/**
 * Root of every failure raised by an agent unit. The message is prefixed with the
 * unit name so log lines and recorded errors identify their origin without extra context.
 */
public class AgentException extends RuntimeException {
    private final String unitName;

    public AgentException(String unitName, String message) {
        super("[" + unitName + "] " + message);
        this.unitName = unitName;
    }

    public AgentException(String unitName, String message, Throwable cause) {
        super("[" + unitName + "] " + message, cause);
        this.unitName = unitName;
    }

    public String getUnitName() {
        return unitName;
    }
}
