package com.swingtrader.analysis.tool;

public record ToolParameter(
    String name,
    ParameterType type,
    boolean required,
    Object defaultValue,
    String description
) {
    public static ToolParameter required(String name, ParameterType type, String description) {
        return new ToolParameter(name, type, true, null, description);
    }

    public static ToolParameter optional(String name, ParameterType type, Object defaultValue, String description) {
        return new ToolParameter(name, type, false, defaultValue, description);
    }
}
