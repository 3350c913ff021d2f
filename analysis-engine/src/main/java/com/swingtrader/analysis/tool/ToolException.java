package com.swingtrader.analysis.tool;

public class ToolException extends RuntimeException {

    public enum Kind {
        UNKNOWN_TOOL,
        INVALID_ARGS,
        EXECUTION_FAILED,
        DUPLICATE_TOOL,
        UNAVAILABLE
    }

    private final Kind kind;
    private final String toolName;

    public ToolException(Kind kind, String toolName, String message) {
        super(kind + " [" + toolName + "] " + message);
        this.kind     = kind;
        this.toolName = toolName;
    }

    public ToolException(Kind kind, String toolName, String message, Throwable cause) {
        super(kind + " [" + toolName + "] " + message, cause);
        this.kind     = kind;
        this.toolName = toolName;
    }

    public Kind getKind() {
        return kind;
    }

    public String getToolName() {
        return toolName;
    }
}
