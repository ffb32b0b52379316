package com.textgraph.canvas.layout;

import com.textgraph.canvas.model.graph.LayoutPosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Positions produced by a {@link LayoutEngine}, one per node, in node input order.
 */
public final class LayoutResult {

    private static final LayoutResult EMPTY = new LayoutResult(Map.of(), 0, 0);

    private final Map<String, LayoutPosition> positions;
    private final int iterations;
    private final int degenerateResolutions;

    private LayoutResult(Map<String, LayoutPosition> positions, int iterations, int degenerateResolutions) {
        this.positions = positions;
        this.iterations = iterations;
        this.degenerateResolutions = degenerateResolutions;
    }

    public static LayoutResult empty() {
        return EMPTY;
    }

    public static LayoutResult of(List<LayoutPosition> positions, int iterations, int degenerateResolutions) {
        Map<String, LayoutPosition> byId = new LinkedHashMap<>();
        positions.forEach(p -> byId.put(p.getNodeId(), p));
        return new LayoutResult(Collections.unmodifiableMap(byId), iterations, degenerateResolutions);
    }

    public Optional<LayoutPosition> getPosition(String nodeId) {
        return Optional.ofNullable(positions.get(nodeId));
    }

    public List<LayoutPosition> getPositions() {
        return new ArrayList<>(positions.values());
    }

    public Map<String, LayoutPosition> asMap() {
        return positions;
    }

    public int size() {
        return positions.size();
    }

    public boolean isEmpty() {
        return positions.isEmpty();
    }

    public int getIterations() {
        return iterations;
    }

    /**
     * How many times two nodes were closer than epsilon and had to be pushed apart
     * along a synthetic direction.
     */
    public int getDegenerateResolutions() {
        return degenerateResolutions;
    }
}
