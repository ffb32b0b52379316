package com.textgraph.canvas.render;

import com.textgraph.canvas.model.graph.Graph;
import com.textgraph.canvas.model.graph.LayoutPosition;
import com.textgraph.canvas.model.render.CanvasSize;
import com.textgraph.canvas.model.render.RenderFormat;

import java.util.Map;

/**
 * Serializes a laid-out graph into one output format.
 *
 * <p>Implementations may assume the graph is closed and every node has a position;
 * {@link MultiFormatRenderer} checks both before delegating.
 */
public interface GraphRenderer {

    RenderFormat getFormat();

    String render(Graph graph, Map<String, LayoutPosition> positions, CanvasSize canvas);
}
