package com.swingtrader.analysis.tool;

import java.util.List;

/**
 * A registered tool: its name, parameter schema and strategy. A descriptor with
 * {@code available=false} is declared for discovery but is skipped by source selection.
 */
public record ToolDescriptor(
    String name,
    String description,
    SourceTier tier,
    List<ToolParameter> parameters,
    boolean available,
    DataFetchStrategy strategy
) {
    public ToolDescriptor {
        parameters = List.copyOf(parameters);
    }

    public ToolMetadata metadata() {
        return new ToolMetadata(name, description, tier, parameters, available);
    }
}
