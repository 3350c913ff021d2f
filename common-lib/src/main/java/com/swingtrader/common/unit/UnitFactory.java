package com.swingtrader.common.unit;

import java.util.Map;

/**
 * Creates a unit instance for a graph node from its per-node configuration.
 */
@FunctionalInterface
public interface UnitFactory {

    AgentUnit create(String unitId, Map<String, Object> config);
}
