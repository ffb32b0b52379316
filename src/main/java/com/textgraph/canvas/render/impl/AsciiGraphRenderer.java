package com.textgraph.canvas.render.impl;

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

import java.util.Arrays;
import java.util.Map;

/**
 * Rough character-grid preview. Positions are scaled down to the grid, edges are drawn
 * first with {@code - | \ /} and nodes on top ({@code O} original, {@code o} semantic).
 * Node names are listed below the grid since there is no room for labels.
 */
@Component
public class AsciiGraphRenderer implements GraphRenderer {

    private final RenderProperties properties;

    @Autowired
    public AsciiGraphRenderer(AppProperties appProperties) {
        this(appProperties.getRender());
    }

    public AsciiGraphRenderer(RenderProperties properties) {
        this.properties = properties;
    }

    @Override
    public RenderFormat getFormat() {
        return RenderFormat.ASCII;
    }

    @Override
    public String render(Graph graph, Map<String, LayoutPosition> positions, CanvasSize canvas) {
        int columns = properties.getAsciiColumns();
        int rows = properties.getAsciiRows();
        char[][] grid = new char[rows][columns];
        for (char[] row : grid) {
            Arrays.fill(row, ' ');
        }

        for (Edge edge : graph.getEdges()) {
            int[] from = toCell(positions.get(edge.getSourceId()), canvas, columns, rows);
            int[] to = toCell(positions.get(edge.getTargetId()), canvas, columns, rows);
            drawLine(grid, from, to);
        }

        for (Node node : graph.getNodes()) {
            int[] cell = toCell(positions.get(node.getId()), canvas, columns, rows);
            grid[cell[1]][cell[0]] = node.getOrigin() == NodeOrigin.ORIGINAL ? 'O' : 'o';
        }

        StringBuilder out = new StringBuilder();
        String border = "+" + "-".repeat(columns) + "+\n";
        out.append(border);
        for (char[] row : grid) {
            out.append('|').append(row).append("|\n");
        }
        out.append(border);
        out.append("O original  o semantic  - | \\ / edges\n");
        out.append(graph.nodeCount()).append(" nodes, ").append(graph.edgeCount()).append(" edges\n");
        for (Node node : graph.getNodes()) {
            int[] cell = toCell(positions.get(node.getId()), canvas, columns, rows);
            out.append(node.getOrigin() == NodeOrigin.ORIGINAL ? "O " : "o ")
                    .append(node.getLabel())
                    .append(" (").append(cell[0]).append(',').append(cell[1]).append(")\n");
        }
        return out.toString();
    }

    private static int[] toCell(LayoutPosition position, CanvasSize canvas, int columns, int rows) {
        int col = (int) Math.round(position.getX() / canvas.getWidth() * (columns - 1));
        int row = (int) Math.round(position.getY() / canvas.getHeight() * (rows - 1));
        return new int[]{clamp(col, columns - 1), clamp(row, rows - 1)};
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(max, value));
    }

    /**
     * Bresenham between two cells, endpoints excluded (nodes are drawn over them anyway).
     */
    private static void drawLine(char[][] grid, int[] from, int[] to) {
        int dx = to[0] - from[0];
        int dy = to[1] - from[1];
        char glyph = glyphFor(dx, dy);

        int x = from[0];
        int y = from[1];
        int stepX = Integer.signum(dx);
        int stepY = Integer.signum(dy);
        int absX = Math.abs(dx);
        int absY = Math.abs(dy);
        int error = absX - absY;
        while (x != to[0] || y != to[1]) {
            int doubled = 2 * error;
            if (doubled > -absY) {
                error -= absY;
                x += stepX;
            }
            if (doubled < absX) {
                error += absX;
                y += stepY;
            }
            if ((x != to[0] || y != to[1]) && grid[y][x] == ' ') {
                grid[y][x] = glyph;
            }
        }
    }

    private static char glyphFor(int dx, int dy) {
        int absX = Math.abs(dx);
        int absY = Math.abs(dy);
        if (absY * 2 <= absX) {
            return '-';
        }
        if (absX * 2 <= absY) {
            return '|';
        }
        // Rows grow downwards
        return (dx > 0) == (dy > 0) ? '\\' : '/';
    }
}
