package com.textgraph.canvas.pipeline;

import com.textgraph.canvas.layout.LayoutResult;
import com.textgraph.canvas.model.graph.Graph;
import com.textgraph.canvas.model.render.RenderArtifact;
import com.textgraph.canvas.model.render.RenderFormat;
import com.textgraph.canvas.parser.ParseWarning;
import com.textgraph.canvas.semantic.ExtractionResult;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Value
@Builder
public class PipelineResult {

    /** Parsed graph with semantic nodes and edges merged in. */
    Graph graph;

    @Singular
    List<ParseWarning> warnings;

    ExtractionResult extraction;

    LayoutResult layout;

    @Singular
    Map<RenderFormat, RenderArtifact> artifacts;

    long elapsedMs;

    public Optional<RenderArtifact> getArtifact(String format) {
        return Optional.ofNullable(artifacts.get(RenderFormat.fromName(format)));
    }
}
