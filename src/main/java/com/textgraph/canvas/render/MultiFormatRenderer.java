package com.textgraph.canvas.render;

import com.google.common.base.Preconditions;
import com.textgraph.canvas.configuration.AppProperties;
import com.textgraph.canvas.configuration.LayoutProperties;
import com.textgraph.canvas.exception.GraphIntegrityException;
import com.textgraph.canvas.exception.UnsupportedFormatException;
import com.textgraph.canvas.layout.LayoutResult;
import com.textgraph.canvas.model.graph.Graph;
import com.textgraph.canvas.model.graph.LayoutPosition;
import com.textgraph.canvas.model.graph.Node;
import com.textgraph.canvas.model.render.CanvasSize;
import com.textgraph.canvas.model.render.RenderArtifact;
import com.textgraph.canvas.model.render.RenderFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for rendering: resolves the format name, checks the graph and positions,
 * and hands off to the matching {@link GraphRenderer}.
 *
 * <p>Output is built completely in memory before the artifact is created, so a failing
 * render never yields a partial artifact.
 */
@Slf4j
@Service
public class MultiFormatRenderer {

    private final Map<RenderFormat, GraphRenderer> renderers = new EnumMap<>(RenderFormat.class);
    private final CanvasSize defaultCanvas;

    @Autowired
    public MultiFormatRenderer(List<GraphRenderer> renderers, AppProperties appProperties) {
        this(renderers, appProperties.getLayout());
    }

    MultiFormatRenderer(List<GraphRenderer> renderers, LayoutProperties layout) {
        renderers.forEach(renderer -> this.renderers.put(renderer.getFormat(), renderer));
        this.defaultCanvas = CanvasSize.of(layout.getWidth(), layout.getHeight());
    }

    public RenderArtifact render(Graph graph, LayoutResult layout, String format) {
        Preconditions.checkNotNull(layout, "Layout cannot be null");
        return render(graph, layout.asMap(), format, defaultCanvas);
    }

    public RenderArtifact render(Graph graph, Map<String, LayoutPosition> positions, String format) {
        return render(graph, positions, format, defaultCanvas);
    }

    /**
     * @throws UnsupportedFormatException if {@code format} is not html, svg, json or ascii
     * @throws GraphIntegrityException    if the graph is not closed or a node has no position
     */
    public RenderArtifact render(Graph graph, Map<String, LayoutPosition> positions, String format, CanvasSize canvas) {
        RenderFormat renderFormat = RenderFormat.fromName(format);
        Preconditions.checkNotNull(graph, "Graph cannot be null");
        Preconditions.checkNotNull(positions, "Positions cannot be null");
        Preconditions.checkNotNull(canvas, "Canvas cannot be null");

        GraphRenderer renderer = renderers.get(renderFormat);
        if (renderer == null) {
            throw new UnsupportedFormatException(format, renderers.keySet().toString());
        }

        graph.validate();
        for (Node node : graph.getNodes()) {
            if (!positions.containsKey(node.getId())) {
                throw new GraphIntegrityException("Node '" + node.getId() + "' has no layout position");
            }
        }

        String content = renderer.render(graph, positions, canvas);
        RenderArtifact artifact = RenderArtifact.of(renderFormat, content);
        log.info("🖼️ Rendered {} nodes, {} edges as {} ({} bytes)",
                graph.nodeCount(), graph.edgeCount(), renderFormat.getName(), artifact.size());
        return artifact;
    }

    public CanvasSize getDefaultCanvas() {
        return defaultCanvas;
    }
}
