package com.textgraph.canvas.render.impl;

import com.google.common.escape.Escaper;
import com.google.common.xml.XmlEscapers;
import com.textgraph.canvas.configuration.AppProperties;
import com.textgraph.canvas.configuration.RenderProperties;
import com.textgraph.canvas.model.graph.Edge;
import com.textgraph.canvas.model.graph.Graph;
import com.textgraph.canvas.model.graph.LayoutPosition;
import com.textgraph.canvas.model.graph.Node;
import com.textgraph.canvas.model.graph.NodeOrigin;
import com.textgraph.canvas.model.render.CanvasSize;
import com.textgraph.canvas.model.render.RenderFormat;
import com.textgraph.canvas.render.GraphRenderer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Standalone SVG document: a {@code <line>} per edge, a {@code <circle>} and a {@code <text>}
 * label per node. Nothing else in the document uses those two element names.
 */
@Component
public class SvgGraphRenderer implements GraphRenderer {

    private static final Escaper TEXT = XmlEscapers.xmlContentEscaper();
    private static final Escaper ATTRIBUTE = XmlEscapers.xmlAttributeEscaper();

    private final RenderProperties properties;

    @Autowired
    public SvgGraphRenderer(AppProperties appProperties) {
        this(appProperties.getRender());
    }

    public SvgGraphRenderer(RenderProperties properties) {
        this.properties = properties;
    }

    @Override
    public RenderFormat getFormat() {
        return RenderFormat.SVG;
    }

    @Override
    public String render(Graph graph, Map<String, LayoutPosition> positions, CanvasSize canvas) {
        NodeRadius radius = new NodeRadius(properties, graph);
        StringBuilder svg = new StringBuilder();

        svg.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        svg.append(format("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"%d\" height=\"%d\" viewBox=\"0 0 %d %d\">\n",
                canvas.getWidth(), canvas.getHeight(), canvas.getWidth(), canvas.getHeight()));
        svg.append("  <title>").append(TEXT.escape(properties.getTitle())).append("</title>\n");
        svg.append("  <defs>\n");
        svg.append("    <style>\n");
        svg.append("      .edge { stroke: #999; stroke-opacity: 0.6; }\n");
        svg.append("      .edge.co_occurrence { stroke: #4A90E2; }\n");
        svg.append("      .edge.is_a { stroke: #7B4AE2; stroke-dasharray: 4,3; }\n");
        svg.append("      .node.original { fill: #4A90E2; }\n");
        svg.append("      .node.semantic { fill: #E27A4A; }\n");
        svg.append("      .node { stroke: white; stroke-width: 1.5; }\n");
        svg.append("      .label { font-family: sans-serif; font-size: 10px; fill: #333; }\n");
        svg.append("    </style>\n");
        svg.append("  </defs>\n");
        svg.append(format("  <rect width=\"%d\" height=\"%d\" fill=\"#fafafa\"/>\n", canvas.getWidth(), canvas.getHeight()));

        svg.append("  <g id=\"edges\">\n");
        for (Edge edge : graph.getEdges()) {
            LayoutPosition source = positions.get(edge.getSourceId());
            LayoutPosition target = positions.get(edge.getTargetId());
            svg.append(format("    <line class=\"edge %s\" x1=\"%.2f\" y1=\"%.2f\" x2=\"%.2f\" y2=\"%.2f\" stroke-width=\"%.2f\"/>\n",
                    edge.getRelationType().getWireName(),
                    source.getX(), source.getY(), target.getX(), target.getY(),
                    Math.max(0.5, Math.sqrt(edge.getWeight()))));
        }
        svg.append("  </g>\n");

        svg.append("  <g id=\"nodes\">\n");
        for (Node node : graph.getNodes()) {
            LayoutPosition p = positions.get(node.getId());
            svg.append(format("    <circle class=\"node %s\" data-id=\"%s\" cx=\"%.2f\" cy=\"%.2f\" r=\"%.2f\"/>\n",
                    node.getOrigin() == NodeOrigin.ORIGINAL ? "original" : "semantic",
                    ATTRIBUTE.escape(node.getId()), p.getX(), p.getY(), radius.of(node)));
        }
        svg.append("  </g>\n");

        svg.append("  <g id=\"labels\">\n");
        for (Node node : graph.getNodes()) {
            LayoutPosition p = positions.get(node.getId());
            svg.append(format("    <text class=\"label\" x=\"%.2f\" y=\"%.2f\" text-anchor=\"middle\">", p.getX(), p.getY() - radius.of(node) - 3))
                    .append(TEXT.escape(node.getLabel()))
                    .append("</text>\n");
        }
        svg.append("  </g>\n");
        svg.append("</svg>\n");
        return svg.toString();
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
