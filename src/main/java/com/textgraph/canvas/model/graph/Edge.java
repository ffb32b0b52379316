package com.textgraph.canvas.model.graph;

import lombok.Builder;
import lombok.Value;

/**
 * Weighted, typed relationship between two nodes of a {@link Graph}.
 */
@Value
@Builder(toBuilder = true)
public class Edge {

    String sourceId;

    String targetId;

    /** Never negative. */
    double weight;

    RelationType relationType;

    public boolean connects(String nodeId) {
        return sourceId.equals(nodeId) || targetId.equals(nodeId);
    }
}
