package com.swingtrader.orchestrator.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One node of a workflow graph.
 *
 * <p>{@code inputMapping} maps an input field of this unit to {@code "producerId.outputField"},
 * or to {@code "producerId"} to pass the producer's whole output. A node without mappings is a
 * root and receives the run's initial input unchanged.
 */
public record UnitNode(
    @JsonProperty("id") String id,
    @JsonProperty("type") String type,
    @JsonProperty("config") Map<String, Object> config,
    @JsonProperty("input_mapping") Map<String, String> inputMapping
) {
    public UnitNode {
        config       = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
        inputMapping = inputMapping == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputMapping));
    }

    @JsonIgnore
    public boolean isRoot() {
        return inputMapping.isEmpty();
    }

    /** Producer ids referenced by the mapping, in mapping order, without duplicates. */
    @JsonIgnore
    public List<String> producers() {
        Set<String> producers = new LinkedHashSet<>();
        inputMapping.values().forEach(ref -> producers.add(producerOf(ref)));
        return new ArrayList<>(producers);
    }

    public static String producerOf(String reference) {
        int dot = reference.indexOf('.');
        return dot < 0 ? reference : reference.substring(0, dot);
    }
}
