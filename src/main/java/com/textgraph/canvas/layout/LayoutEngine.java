package com.textgraph.canvas.layout;

import com.textgraph.canvas.model.graph.Edge;
import com.textgraph.canvas.model.graph.Graph;
import com.textgraph.canvas.model.graph.Node;

import java.util.Collection;

/**
 * Computes 2D positions for the nodes of a graph.
 */
public interface LayoutEngine {

    /**
     * @param seed fixes the initial placement; {@code null} picks a random one
     * @throws com.textgraph.canvas.exception.GraphIntegrityException if an edge references an unknown node
     */
    LayoutResult layout(Collection<Node> nodes, Collection<Edge> edges,
                        int width, int height, int iterations, Long seed);

    /**
     * Lays out a whole graph with the configured canvas and iteration budget.
     */
    LayoutResult layout(Graph graph, Long seed);
}
