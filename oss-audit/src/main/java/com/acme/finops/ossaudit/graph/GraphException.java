package com.acme.finops.ossaudit.graph;

/**
 * Structural problem with the build graph: unknown node, dangling edge,
 * unreadable snapshot. Always fatal for the run.
 */
public final class GraphException extends RuntimeException {
    public GraphException(String message) {
        super(message);
    }

    public GraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
