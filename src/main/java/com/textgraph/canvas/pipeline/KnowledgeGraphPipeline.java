package com.textgraph.canvas.pipeline;

import com.google.common.base.Preconditions;
import com.textgraph.canvas.configuration.AppProperties;
import com.textgraph.canvas.layout.LayoutEngine;
import com.textgraph.canvas.layout.LayoutResult;
import com.textgraph.canvas.model.graph.Graph;
import com.textgraph.canvas.model.render.CanvasSize;
import com.textgraph.canvas.model.render.RenderArtifact;
import com.textgraph.canvas.model.render.RenderFormat;
import com.textgraph.canvas.parser.ContentParser;
import com.textgraph.canvas.parser.ParseResult;
import com.textgraph.canvas.parser.SourceType;
import com.textgraph.canvas.render.MultiFormatRenderer;
import com.textgraph.canvas.semantic.ExtractionResult;
import com.textgraph.canvas.semantic.FuzzySemanticExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs text through parse, semantic expansion, layout and rendering.
 *
 * <p>Stateless apart from the semantic cache held by the extractor, so one instance can serve
 * concurrent callers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KnowledgeGraphPipeline {

    private final ContentParser contentParser;
    private final FuzzySemanticExtractor semanticExtractor;
    private final LayoutEngine layoutEngine;
    private final MultiFormatRenderer renderer;
    private final AppProperties appProperties;

    public PipelineResult run(String text, String sourceTag, PipelineOptions options) {
        Preconditions.checkNotNull(options, "Options cannot be null");
        long start = System.currentTimeMillis();
        Map<RenderFormat, String> formats = resolveFormats(options);
        return finish(contentParser.parse(text, sourceTag), options, formats, start);
    }

    public PipelineResult run(String text, SourceType sourceType, PipelineOptions options) {
        Preconditions.checkNotNull(options, "Options cannot be null");
        long start = System.currentTimeMillis();
        Map<RenderFormat, String> formats = resolveFormats(options);
        return finish(contentParser.parse(text, sourceType), options, formats, start);
    }

    // Called before parsing so a bad format name fails before any work is done
    private static Map<RenderFormat, String> resolveFormats(PipelineOptions options) {
        Map<RenderFormat, String> formats = new LinkedHashMap<>();
        options.getFormats().forEach(name -> formats.put(RenderFormat.fromName(name), name));
        return formats;
    }

    private PipelineResult finish(ParseResult parsed, PipelineOptions options, Map<RenderFormat, String> formats,
                                  long start) {
        Graph graph = parsed.getGraph();

        ExtractionResult extraction = ExtractionResult.empty();
        if (options.isSemanticExpansion()) {
            int maxWords = options.getMaxWords() != null
                    ? options.getMaxWords()
                    : appProperties.getSemantic().getMaxWords();
            extraction = semanticExtractor.extractGraphSemantics(graph.getNodes(), maxWords);
            extraction.mergeInto(graph);
        }

        CanvasSize canvas = options.getCanvas() != null ? options.getCanvas() : renderer.getDefaultCanvas();
        int iterations = options.getIterations() != null
                ? options.getIterations()
                : appProperties.getLayout().getIterations();
        LayoutResult layout = layoutEngine.layout(graph.getNodes(), graph.getEdges(),
                canvas.getWidth(), canvas.getHeight(), iterations, options.getSeed());

        PipelineResult.PipelineResultBuilder result = PipelineResult.builder()
                .graph(graph)
                .warnings(parsed.getWarnings())
                .extraction(extraction)
                .layout(layout);
        formats.forEach((format, name) -> {
            RenderArtifact artifact = renderer.render(graph, layout.asMap(), name, canvas);
            result.artifact(format, artifact);
        });

        long elapsed = System.currentTimeMillis() - start;
        log.info("✅ Pipeline finished in {}ms: {} nodes, {} edges, {} artifacts",
                elapsed, graph.nodeCount(), graph.edgeCount(), formats.size());
        return result.elapsedMs(elapsed).build();
    }
}
