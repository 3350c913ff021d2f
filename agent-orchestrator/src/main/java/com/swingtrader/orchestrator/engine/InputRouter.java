package com.swingtrader.orchestrator.engine;

import com.swingtrader.orchestrator.graph.UnitNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds a unit's input from the outputs of the units it maps from.
 *
 * <p>{@code "producer"} passes the whole output; {@code "producer.field"} extracts one field,
 * and longer dotted paths descend into nested objects. Only successful outputs are ever
 * present in {@code outputs}, so a failed or skipped producer surfaces as a
 * {@link RoutingException}.
 */
public final class InputRouter {

    private InputRouter() {}

    public static Map<String, Object> route(UnitNode node, Map<String, Map<String, Object>> outputs,
                                            Map<String, Object> initialInput) {
        if (node.isRoot()) {
            return initialInput == null ? new LinkedHashMap<>() : new LinkedHashMap<>(initialInput);
        }
        Map<String, Object> input = new LinkedHashMap<>();
        for (Map.Entry<String, String> mapping : node.inputMapping().entrySet()) {
            input.put(mapping.getKey(), resolve(node.id(), mapping.getValue(), outputs));
        }
        return input;
    }

    private static Object resolve(String unitId, String reference, Map<String, Map<String, Object>> outputs) {
        String producer = UnitNode.producerOf(reference);
        Map<String, Object> output = outputs.get(producer);
        if (output == null) {
            throw new RoutingException(unitId, "producer '" + producer + "' has no successful output");
        }
        if (producer.equals(reference)) {
            return output;
        }
        Object current = output;
        for (String segment : reference.substring(producer.length() + 1).split("\\.")) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
                throw new RoutingException(unitId, "output of '" + producer + "' has no field '"
                    + reference.substring(producer.length() + 1) + "'");
            }
            current = map.get(segment);
        }
        return current;
    }
}
