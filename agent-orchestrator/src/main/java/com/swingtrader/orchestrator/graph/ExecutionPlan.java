package com.swingtrader.orchestrator.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolved run order. Each wave only depends on earlier waves; ids inside a wave keep
 * declaration order.
 */
public record ExecutionPlan(List<List<String>> waves) {

    public ExecutionPlan {
        List<List<String>> copy = new ArrayList<>();
        waves.forEach(w -> copy.add(List.copyOf(w)));
        waves = List.copyOf(copy);
    }

    /** Flat topological order: wave 0 first. */
    public List<String> order() {
        List<String> order = new ArrayList<>();
        waves.forEach(order::addAll);
        return order;
    }

    public int indexOf(String unitId) {
        return order().indexOf(unitId);
    }
}
