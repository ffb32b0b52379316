package com.textgraph.canvas.layout.impl;

import com.google.common.base.Preconditions;
import com.textgraph.canvas.configuration.AppProperties;
import com.textgraph.canvas.configuration.LayoutProperties;
import com.textgraph.canvas.layout.LayoutEngine;
import com.textgraph.canvas.layout.LayoutResult;
import com.textgraph.canvas.model.graph.Edge;
import com.textgraph.canvas.model.graph.Graph;
import com.textgraph.canvas.model.graph.LayoutPosition;
import com.textgraph.canvas.model.graph.Node;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Fruchterman-Reingold force-directed layout.
 *
 * <p>Every pair of nodes repels with {@code k²/d}, every edge pulls its endpoints with
 * {@code d - k}, where {@code k = sqrt(area / n)} is the ideal edge length. The step each node
 * may take is capped by a temperature that falls linearly from {@code width / 10} to zero, and
 * positions are clamped to the canvas minus a margin. The loop always runs exactly
 * {@code iterations} times.
 *
 * <p>With a seed the result is fully reproducible: initial positions are drawn from
 * {@code new Random(seed)} in node input order and no other randomness is used.
 */
@Slf4j
@Component
public class FruchtermanReingoldLayoutEngine implements LayoutEngine {

    /** Golden angle, spreads successive jitter directions evenly around the circle. */
    private static final double JITTER_ANGLE_STEP = Math.PI * (3 - Math.sqrt(5));

    private final LayoutProperties properties;

    @Autowired
    public FruchtermanReingoldLayoutEngine(AppProperties appProperties) {
        this(appProperties.getLayout());
    }

    public FruchtermanReingoldLayoutEngine(LayoutProperties properties) {
        this.properties = properties;
    }

    @Override
    public LayoutResult layout(Graph graph, Long seed) {
        Preconditions.checkNotNull(graph, "Graph cannot be null");
        return layout(graph.getNodes(), graph.getEdges(),
                properties.getWidth(), properties.getHeight(), properties.getIterations(), seed);
    }

    @Override
    public LayoutResult layout(Collection<Node> nodes, Collection<Edge> edges,
                               int width, int height, int iterations, Long seed) {
        Preconditions.checkNotNull(nodes, "Nodes cannot be null");
        Preconditions.checkNotNull(edges, "Edges cannot be null");
        Preconditions.checkArgument(width > 0 && height > 0, "Canvas must be positive, got %sx%s", width, height);
        Preconditions.checkArgument(iterations >= 0, "Iterations must be >= 0, got %s", iterations);

        Graph.validate(nodes, edges);
        if (nodes.isEmpty()) {
            return LayoutResult.empty();
        }

        List<Node> ordered = new ArrayList<>(nodes);
        int n = ordered.size();
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < n; i++) {
            index.put(ordered.get(i).getId(), i);
        }

        double margin = Math.min(properties.getMargin(), Math.min(width, height) / 2.0);
        double minX = margin;
        double maxX = width - margin;
        double minY = margin;
        double maxY = height - margin;
        double epsilon = properties.getEpsilon();

        Random random = seed == null ? new Random() : new Random(seed);
        double[] x = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = minX + random.nextDouble() * (maxX - minX);
            y[i] = minY + random.nextDouble() * (maxY - minY);
        }

        int[][] springs = edges.stream()
                .filter(e -> !e.getSourceId().equals(e.getTargetId()))
                .map(e -> new int[]{index.get(e.getSourceId()), index.get(e.getTargetId())})
                .toArray(int[][]::new);

        double k = Math.sqrt((double) width * height / n);
        double initialTemperature = width / 10.0;
        double[] dispX = new double[n];
        double[] dispY = new double[n];
        int degenerate = 0;

        for (int iter = 0; iter < iterations; iter++) {
            double temperature = initialTemperature * (1.0 - (double) iter / iterations);
            Arrays.fill(dispX, 0.0);
            Arrays.fill(dispY, 0.0);

            for (int i = 0; i < n; i++) {
                for (int j = i + 1; j < n; j++) {
                    double dx = x[i] - x[j];
                    double dy = y[i] - y[j];
                    double dist = Math.sqrt(dx * dx + dy * dy);
                    if (dist < epsilon) {
                        degenerate++;
                        if (dist == 0.0) {
                            double angle = (i * (long) n + j) * JITTER_ANGLE_STEP;
                            dx = Math.cos(angle) * epsilon;
                            dy = Math.sin(angle) * epsilon;
                        } else {
                            dx = dx / dist * epsilon;
                            dy = dy / dist * epsilon;
                        }
                        dist = epsilon;
                    }
                    double force = k * k / dist;
                    double fx = dx / dist * force;
                    double fy = dy / dist * force;
                    dispX[i] += fx;
                    dispY[i] += fy;
                    dispX[j] -= fx;
                    dispY[j] -= fy;
                }
            }

            for (int[] spring : springs) {
                int s = spring[0];
                int t = spring[1];
                double dx = x[t] - x[s];
                double dy = y[t] - y[s];
                double dist = Math.sqrt(dx * dx + dy * dy);
                if (dist < epsilon) {
                    // Direction is undefined; repulsion already separates the pair
                    continue;
                }
                double force = dist - k;
                double fx = dx / dist * force;
                double fy = dy / dist * force;
                dispX[s] += fx;
                dispY[s] += fy;
                dispX[t] -= fx;
                dispY[t] -= fy;
            }

            for (int i = 0; i < n; i++) {
                double length = Math.sqrt(dispX[i] * dispX[i] + dispY[i] * dispY[i]);
                if (length > 0) {
                    double step = Math.min(length, temperature);
                    x[i] += dispX[i] / length * step;
                    y[i] += dispY[i] / length * step;
                }
                x[i] = clamp(x[i], minX, maxX);
                y[i] = clamp(y[i], minY, maxY);
            }
        }

        if (degenerate > 0) {
            log.warn("⚠️ LayoutDegenerate: {} near-coincident node pairs resolved with epsilon {}", degenerate, epsilon);
        }

        List<LayoutPosition> positions = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            positions.add(new LayoutPosition(ordered.get(i).getId(), x[i], y[i]));
        }
        log.info("📐 Layout: {} nodes, {} edges, {} iterations on {}x{} (seed={})",
                n, springs.length, iterations, width, height, seed);
        return LayoutResult.of(positions, iterations, degenerate);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
