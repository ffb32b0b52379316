package com.textgraph.canvas.model.graph;

import lombok.Builder;
import lombok.Value;

/**
 * A word or concept in the knowledge graph.
 */
@Value
@Builder
public class Node {

    /**
     * Fixed weight given to nodes introduced by semantic expansion.
     */
    public static final double SEMANTIC_WEIGHT = 1.0;

    /** Normalized word, unique within a graph. */
    String id;

    String label;

    /** Occurrence count for original nodes, {@link #SEMANTIC_WEIGHT} for semantic ones. */
    double weight;

    NodeOrigin origin;

    public static Node original(String id, int frequency) {
        return Node.builder()
                .id(id)
                .label(id)
                .weight(frequency)
                .origin(NodeOrigin.ORIGINAL)
                .build();
    }

    public static Node semantic(String id) {
        return Node.builder()
                .id(id)
                .label(id)
                .weight(SEMANTIC_WEIGHT)
                .origin(NodeOrigin.SEMANTIC)
                .build();
    }
}
