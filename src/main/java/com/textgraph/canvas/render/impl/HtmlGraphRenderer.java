package com.textgraph.canvas.render.impl;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.textgraph.canvas.configuration.AppProperties;
import com.textgraph.canvas.configuration.RenderProperties;
import com.textgraph.canvas.model.graph.Graph;
import com.textgraph.canvas.model.graph.LayoutPosition;
import com.textgraph.canvas.model.render.CanvasSize;
import com.textgraph.canvas.model.render.RenderFormat;
import com.textgraph.canvas.render.GraphRenderer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

/**
 * Self-contained HTML page drawing the graph on a {@code <canvas>}.
 *
 * <p>The page comes from {@code templates/graph.html.mustache}. The graph is embedded as the
 * JSON rendering inside a {@code application/json} script block. The page script supports drag
 * to pan, wheel to zoom and click to highlight a node with its neighbors. No external resources
 * are loaded.
 */
@Component
public class HtmlGraphRenderer implements GraphRenderer {

    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory("templates");
    private final Mustache page = mustacheFactory.compile("graph.html.mustache");

    private final RenderProperties properties;
    private final JsonGraphRenderer jsonRenderer;

    @Autowired
    public HtmlGraphRenderer(AppProperties appProperties, JsonGraphRenderer jsonRenderer) {
        this(appProperties.getRender(), jsonRenderer);
    }

    public HtmlGraphRenderer(RenderProperties properties, JsonGraphRenderer jsonRenderer) {
        this.properties = properties;
        this.jsonRenderer = jsonRenderer;
    }

    @Override
    public RenderFormat getFormat() {
        return RenderFormat.HTML;
    }

    @Override
    public String render(Graph graph, Map<String, LayoutPosition> positions, CanvasSize canvas) {
        // "</" would close the data script block early
        String data = jsonRenderer.renderCompact(graph, positions).replace("</", "<\\/");

        Map<String, Object> scope = new HashMap<>();
        scope.put("title", properties.getTitle());
        scope.put("width", canvas.getWidth());
        scope.put("height", canvas.getHeight());
        scope.put("minRadius", properties.getMinRadius());
        scope.put("maxRadius", properties.getMaxRadius());
        scope.put("data", data);

        StringWriter writer = new StringWriter();
        page.execute(writer, scope);
        return writer.toString();
    }
}
