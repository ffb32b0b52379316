package com.textgraph.canvas.exception;

import lombok.Getter;

/**
 * Raised when a graph breaks the closure invariant: an edge points at a node id
 * that is not part of the graph, or connects a node to itself.
 */
@Getter
public class GraphIntegrityException extends RuntimeException {

    private final String sourceId;
    private final String targetId;

    public GraphIntegrityException(String sourceId, String targetId) {
        super("Dangling edge " + sourceId + " -> " + targetId + ": endpoint missing from node set");
        this.sourceId = sourceId;
        this.targetId = targetId;
    }

    public GraphIntegrityException(String message) {
        super(message);
        this.sourceId = null;
        this.targetId = null;
    }

    private GraphIntegrityException(String message, String sourceId, String targetId) {
        super(message);
        this.sourceId = sourceId;
        this.targetId = targetId;
    }

    public static GraphIntegrityException selfLoop(String nodeId) {
        return new GraphIntegrityException("Self-loop on '" + nodeId + "'", nodeId, nodeId);
    }
}
