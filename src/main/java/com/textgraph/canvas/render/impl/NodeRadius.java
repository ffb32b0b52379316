package com.textgraph.canvas.render.impl;

import com.textgraph.canvas.configuration.RenderProperties;
import com.textgraph.canvas.model.graph.Graph;
import com.textgraph.canvas.model.graph.Node;

/**
 * Circle radius proportional to the square root of node weight, so area tracks frequency.
 */
final class NodeRadius {

    private final double minRadius;
    private final double maxRadius;
    private final double sqrtMaxWeight;

    NodeRadius(RenderProperties properties, Graph graph) {
        this.minRadius = properties.getMinRadius();
        this.maxRadius = Math.max(properties.getMinRadius(), properties.getMaxRadius());
        this.sqrtMaxWeight = Math.sqrt(graph.getNodes().stream().mapToDouble(Node::getWeight).max().orElse(0.0));
    }

    double of(Node node) {
        if (sqrtMaxWeight <= 0) {
            return minRadius;
        }
        return minRadius + (maxRadius - minRadius) * Math.sqrt(Math.max(0.0, node.getWeight())) / sqrtMaxWeight;
    }
}
