package com.swingtrader.common.unit;

import java.util.Map;

/**
 * A node of the workflow graph: receives a key/value input, does its domain work,
 * returns a tagged {@link UnitOutcome}. Implementations must never throw from
 * {@link #execute}; every failure is reported through the outcome.
 */
public interface AgentUnit {

    String unitName();

    UnitOutcome execute(Map<String, Object> input);

    /**
     * Whether the engine may replay a stored output for the same input instead of executing.
     * Units with side effects, such as placing orders, return {@code false}.
     */
    default boolean cacheable() {
        return true;
    }
}
