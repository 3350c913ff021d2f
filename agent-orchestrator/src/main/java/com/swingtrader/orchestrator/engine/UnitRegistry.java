package com.swingtrader.orchestrator.engine;

import com.swingtrader.common.unit.AgentUnit;
import com.swingtrader.common.unit.UnitFactory;
import com.swingtrader.orchestrator.graph.UnitNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unit types known to the engine, each with the factory that builds it. Filled once at
 * startup, read-only afterwards.
 */
public class UnitRegistry {

    private final Map<String, UnitFactory> factories = new LinkedHashMap<>();

    public UnitRegistry register(String type, UnitFactory factory) {
        if (factories.putIfAbsent(type, factory) != null) {
            throw new IllegalStateException("Unit type already registered: " + type);
        }
        return this;
    }

    public boolean contains(String type) {
        return factories.containsKey(type);
    }

    public AgentUnit create(UnitNode node) {
        UnitFactory factory = factories.get(node.type());
        if (factory == null) {
            throw new IllegalArgumentException("Unknown unit type: " + node.type());
        }
        return factory.create(node.id(), node.config());
    }

    public List<String> types() {
        return new ArrayList<>(factories.keySet());
    }
}
