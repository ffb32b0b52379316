package com.textgraph.canvas.semantic;

import com.textgraph.canvas.model.graph.Edge;
import com.textgraph.canvas.model.graph.Graph;
import com.textgraph.canvas.model.graph.Node;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Output of one semantic expansion batch.
 */
@Value
@Builder
public class ExtractionResult {

    /** Semantic nodes that were not in the input, in creation order. */
    @Singular
    List<Node> newNodes;

    /** Typed edges from an input word to a (possibly new) node. */
    @Singular
    List<Edge> newEdges;

    /** Which source answered for each expanded word. */
    @Singular("answeredBy")
    Map<String, String> sourceByWord;

    /** Words for which every source failed or returned nothing. */
    @Singular
    List<String> skippedWords;

    public static ExtractionResult empty() {
        return ExtractionResult.builder().build();
    }

    /**
     * Adds the new nodes, then the new edges, to {@code graph}. The graph must already hold
     * the nodes the expansion was computed from.
     *
     * @throws com.textgraph.canvas.exception.GraphIntegrityException if an edge source is missing
     */
    public Graph mergeInto(Graph graph) {
        newNodes.forEach(graph::addNode);
        newEdges.forEach(graph::addEdge);
        return graph;
    }
}
