package com.textgraph.canvas.render.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.textgraph.canvas.model.graph.Edge;
import com.textgraph.canvas.model.graph.Graph;
import com.textgraph.canvas.model.graph.LayoutPosition;
import com.textgraph.canvas.model.graph.Node;
import com.textgraph.canvas.model.render.CanvasSize;
import com.textgraph.canvas.model.render.RenderFormat;
import com.textgraph.canvas.render.GraphRenderer;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * {@code {"nodes":[...],"edges":[...]}} in graph order. Carries no timestamps or other
 * run-dependent data, so the same input always yields the same bytes.
 */
@Component
public class JsonGraphRenderer implements GraphRenderer {

    private final ObjectMapper objectMapper;

    public JsonGraphRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public RenderFormat getFormat() {
        return RenderFormat.JSON;
    }

    @Override
    public String render(Graph graph, Map<String, LayoutPosition> positions, CanvasSize canvas) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(graph, positions));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize graph to JSON", e);
        }
    }

    /**
     * Compact form, used when the graph is embedded into another document.
     */
    String renderCompact(Graph graph, Map<String, LayoutPosition> positions) {
        try {
            return objectMapper.writeValueAsString(toTree(graph, positions));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize graph to JSON", e);
        }
    }

    private ObjectNode toTree(Graph graph, Map<String, LayoutPosition> positions) {
        ObjectNode root = objectMapper.createObjectNode();

        ArrayNode nodes = root.putArray("nodes");
        for (Node node : graph.getNodes()) {
            LayoutPosition position = positions.get(node.getId());
            nodes.addObject()
                    .put("id", node.getId())
                    .put("label", node.getLabel())
                    .put("x", position.getX())
                    .put("y", position.getY())
                    .put("weight", node.getWeight())
                    .put("origin", node.getOrigin().getWireName());
        }

        ArrayNode edges = root.putArray("edges");
        for (Edge edge : graph.getEdges()) {
            edges.addObject()
                    .put("source", edge.getSourceId())
                    .put("target", edge.getTargetId())
                    .put("weight", edge.getWeight())
                    .put("relation_type", edge.getRelationType().getWireName());
        }
        return root;
    }
}
