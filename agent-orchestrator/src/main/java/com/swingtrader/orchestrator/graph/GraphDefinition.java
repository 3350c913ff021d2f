package com.swingtrader.orchestrator.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record GraphDefinition(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("nodes") List<UnitNode> nodes
) {
    public GraphDefinition {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }
}
