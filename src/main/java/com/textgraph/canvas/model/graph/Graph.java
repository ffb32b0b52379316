package com.textgraph.canvas.model.graph;

import com.google.common.base.Preconditions;
import com.textgraph.canvas.exception.GraphIntegrityException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Node set plus edge list, created fresh for every pipeline run.
 *
 * <p>Nodes keep insertion order so that layout and rendering are reproducible.
 * Every edge added through {@link #addEdge(Edge)} must reference nodes already in
 * the graph; {@link #validate()} re-checks graphs assembled from outside.
 */
public class Graph {

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final List<Edge> edges = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    public static Graph of(Collection<Node> nodes, Collection<Edge> edges) {
        Graph graph = new Graph();
        nodes.forEach(graph::addNode);
        edges.forEach(graph::addEdge);
        return graph;
    }

    /**
     * Adds a node unless one with the same id already exists.
     *
     * @return true if the node was added
     */
    public boolean addNode(Node node) {
        Preconditions.checkNotNull(node, "node cannot be null");
        Preconditions.checkArgument(node.getId() != null && !node.getId().isEmpty(), "node id cannot be empty");
        return nodes.putIfAbsent(node.getId(), node) == null;
    }

    /**
     * @throws GraphIntegrityException if either endpoint is missing
     */
    public void addEdge(Edge edge) {
        Preconditions.checkNotNull(edge, "edge cannot be null");
        Preconditions.checkArgument(edge.getWeight() >= 0, "edge weight must be >= 0");
        if (!nodes.containsKey(edge.getSourceId()) || !nodes.containsKey(edge.getTargetId())) {
            throw new GraphIntegrityException(edge.getSourceId(), edge.getTargetId());
        }
        if (edge.getSourceId().equals(edge.getTargetId())) {
            throw GraphIntegrityException.selfLoop(edge.getSourceId());
        }
        edges.add(edge);
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    public Optional<Node> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public List<Node> getNodes() {
        return List.copyOf(nodes.values());
    }

    public List<Edge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void putMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    /**
     * Checks the closure invariant over arbitrary node and edge collections.
     *
     * @throws GraphIntegrityException on the first dangling edge, self-loop or duplicate node id
     */
    public static void validate(Collection<Node> nodes, Collection<Edge> edges) {
        Map<String, Node> byId = new LinkedHashMap<>();
        for (Node node : nodes) {
            if (byId.putIfAbsent(node.getId(), node) != null) {
                throw new GraphIntegrityException("Duplicate node id '" + node.getId() + "'");
            }
        }
        for (Edge edge : edges) {
            if (!byId.containsKey(edge.getSourceId()) || !byId.containsKey(edge.getTargetId())) {
                throw new GraphIntegrityException(edge.getSourceId(), edge.getTargetId());
            }
            if (edge.getSourceId().equals(edge.getTargetId())) {
                throw GraphIntegrityException.selfLoop(edge.getSourceId());
            }
        }
    }

    public void validate() {
        validate(nodes.values(), edges);
    }

    @Override
    public String toString() {
        return "Graph{nodes=" + nodes.size() + ", edges=" + edges.size() + "}";
    }
}
