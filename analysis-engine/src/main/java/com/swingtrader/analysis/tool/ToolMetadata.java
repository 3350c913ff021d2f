package com.swingtrader.analysis.tool;

import java.util.List;

/** Strategy-free view of a {@link ToolDescriptor}, safe to expose. */
public record ToolMetadata(
    String name,
    String description,
    SourceTier tier,
    List<ToolParameter> parameters,
    boolean available
) {}
