package com.swingtrader.orchestrator.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Turns a graph description into waves by layered breadth-first traversal (Kahn's algorithm
 * one layer at a time). Ties inside a wave follow declaration order, so the same graph always
 * yields the same plan.
 */
public class GraphResolver {

    private static final Logger log = LoggerFactory.getLogger(GraphResolver.class);

    private final Predicate<String> knownType;

    /**
     * @param knownType accepts unit type identifiers that can be instantiated
     */
    public GraphResolver(Predicate<String> knownType) {
        this.knownType = knownType;
    }

    public ExecutionPlan resolve(GraphDefinition graph) {
        Map<String, UnitNode> nodes = new LinkedHashMap<>();
        for (UnitNode node : graph.nodes()) {
            if (nodes.putIfAbsent(node.id(), node) != null) {
                throw new GraphException(GraphException.Kind.DUPLICATE_NODE,
                    "node id '" + node.id() + "' is declared more than once", List.of(node.id()));
            }
            if (!knownType.test(node.type())) {
                throw new GraphException(GraphException.Kind.UNKNOWN_UNIT_TYPE,
                    "node '" + node.id() + "' has unknown type '" + node.type() + "'", List.of(node.id()));
            }
            node.inputMapping().forEach((field, reference) -> {
                if (reference == null || UnitNode.producerOf(reference).isBlank()) {
                    throw new GraphException(GraphException.Kind.UNKNOWN_PRODUCER,
                        "node '" + node.id() + "' maps input '" + field + "' from no producer", List.of(node.id()));
                }
            });
        }

        Map<String, Integer> unresolved = new HashMap<>();
        Map<String, List<String>> consumers = new HashMap<>();
        for (UnitNode node : nodes.values()) {
            List<String> producers = node.producers();
            for (String producer : producers) {
                if (!nodes.containsKey(producer)) {
                    throw new GraphException(GraphException.Kind.UNKNOWN_PRODUCER,
                        "node '" + node.id() + "' maps input from unknown node '" + producer + "'",
                        List.of(node.id(), producer));
                }
                consumers.computeIfAbsent(producer, k -> new ArrayList<>()).add(node.id());
            }
            unresolved.put(node.id(), producers.size());
        }

        List<List<String>> waves = new ArrayList<>();
        Set<String> placed = new HashSet<>();
        List<String> current = nodes.keySet().stream().filter(id -> unresolved.get(id) == 0).toList();
        while (!current.isEmpty()) {
            waves.add(current);
            placed.addAll(current);
            Set<String> released = new HashSet<>();
            for (String id : current) {
                for (String consumer : consumers.getOrDefault(id, List.of())) {
                    if (unresolved.merge(consumer, -1, Integer::sum) == 0) {
                        released.add(consumer);
                    }
                }
            }
            current = nodes.keySet().stream().filter(released::contains).toList();
        }

        if (placed.size() < nodes.size()) {
            List<String> cycle = findCycle(nodes, placed);
            throw new GraphException(GraphException.Kind.CYCLE,
                "dependency cycle " + String.join(" -> ", cycle), cycle);
        }

        ExecutionPlan plan = new ExecutionPlan(waves);
        log.info("Graph resolved. name={} nodes={} waves={}", graph.name(), nodes.size(), plan.waves());
        return plan;
    }

    /**
     * Walks producer edges from the first unplaced node until a node repeats. Every unplaced
     * node has at least one unplaced producer, so the walk always closes a cycle.
     */
    private static List<String> findCycle(Map<String, UnitNode> nodes, Set<String> placed) {
        String start = nodes.keySet().stream().filter(id -> !placed.contains(id)).findFirst().orElseThrow();
        List<String> walk = new ArrayList<>();
        Map<String, Integer> position = new HashMap<>();
        String at = start;
        while (!position.containsKey(at)) {
            position.put(at, walk.size());
            walk.add(at);
            at = nodes.get(at).producers().stream()
                .filter(p -> !placed.contains(p))
                .findFirst()
                .orElseThrow();
        }
        // walk follows consumer -> producer; report in dependency direction
        List<String> cycle = new ArrayList<>(walk.subList(position.get(at), walk.size()));
        Collections.reverse(cycle);
        cycle.add(cycle.get(0));
        return cycle;
    }
}
