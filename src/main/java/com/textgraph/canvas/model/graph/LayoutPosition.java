package com.textgraph.canvas.model.graph;

import lombok.Value;

/**
 * 2D coordinate assigned to one node by the layout engine.
 */
@Value
public class LayoutPosition {
    String nodeId;
    double x;
    double y;
}
