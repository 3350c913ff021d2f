package com.swingtrader.orchestrator.engine;

import com.swingtrader.common.exception.AgentException;

/**
 * A unit's input could not be built from its producers' outputs. The unit is skipped.
 */
public class RoutingException extends AgentException {

    public RoutingException(String unitId, String message) {
        super(unitId, message);
    }
}
