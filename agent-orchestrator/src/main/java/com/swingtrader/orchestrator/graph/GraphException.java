package com.swingtrader.orchestrator.graph;

import java.util.List;

/**
 * Invalid graph description. Raised before any unit runs.
 */
public class GraphException extends RuntimeException {

    public enum Kind {
        CYCLE,
        UNKNOWN_PRODUCER,
        DUPLICATE_NODE,
        UNKNOWN_UNIT_TYPE
    }

    private final Kind kind;
    private final List<String> path;

    public GraphException(Kind kind, String message, List<String> path) {
        super(kind + ": " + message);
        this.kind = kind;
        this.path = List.copyOf(path);
    }

    public Kind getKind() {
        return kind;
    }

    /** Node ids involved: the cycle for {@link Kind#CYCLE}, else the offending node(s). */
    public List<String> getPath() {
        return path;
    }
}
