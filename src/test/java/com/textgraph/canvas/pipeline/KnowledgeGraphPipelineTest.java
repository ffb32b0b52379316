package com.textgraph.canvas.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import com.textgraph.canvas.configuration.AppProperties;
import com.textgraph.canvas.exception.UnsupportedFormatException;
import com.textgraph.canvas.layout.impl.FruchtermanReingoldLayoutEngine;
import com.textgraph.canvas.model.graph.NodeOrigin;
import com.textgraph.canvas.model.render.RenderFormat;
import com.textgraph.canvas.parser.ContentParser;
import com.textgraph.canvas.parser.SourceType;
import com.textgraph.canvas.render.MultiFormatRenderer;
import com.textgraph.canvas.render.impl.AsciiGraphRenderer;
import com.textgraph.canvas.render.impl.HtmlGraphRenderer;
import com.textgraph.canvas.render.impl.JsonGraphRenderer;
import com.textgraph.canvas.render.impl.SvgGraphRenderer;
import com.textgraph.canvas.semantic.FuzzySemanticExtractor;
import com.textgraph.canvas.semantic.cache.CaffeineSemanticExpansionCache;
import com.textgraph.canvas.semantic.impl.StaticFallbackSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

@DisplayName("Knowledge Graph Pipeline Tests")
class KnowledgeGraphPipelineTest {

    private static final String TEXT = "Ideas is about cringe proof. It's a game about news.";

    private KnowledgeGraphPipeline pipeline;

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        JsonGraphRenderer json = new JsonGraphRenderer(new ObjectMapper());
        MultiFormatRenderer renderer = new MultiFormatRenderer(List.of(
                json,
                new SvgGraphRenderer(properties),
                new HtmlGraphRenderer(properties, json),
                new AsciiGraphRenderer(properties)), properties);
        FuzzySemanticExtractor extractor = new FuzzySemanticExtractor(
                List.of(new StaticFallbackSource(true)),
                new CaffeineSemanticExpansionCache(Duration.ofHours(1), Ticker.systemTicker()));

        pipeline = new KnowledgeGraphPipeline(
                new ContentParser(properties),
                extractor,
                new FruchtermanReingoldLayoutEngine(properties),
                renderer,
                properties);
    }

    @Test
    @DisplayName("Should run all stages and render every requested format")
    void testRun_AllStages() {
        // Given
        PipelineOptions options = PipelineOptions.builder()
                .seed(42L)
                .format("json")
                .format("svg")
                .format("html")
                .format("ascii")
                .build();

        // When
        PipelineResult result = pipeline.run(TEXT, SourceType.VOICE_TRANSCRIPT, options);

        // Then
        assertTrue(result.getGraph().containsNode("game"));
        assertTrue(result.getGraph().containsNode("activity"));
        assertEquals(NodeOrigin.SEMANTIC, result.getGraph().getNode("activity").orElseThrow().getOrigin());
        assertEquals("static_fallback", result.getExtraction().getSourceByWord().get("game"));
        assertEquals(result.getGraph().nodeCount(), result.getLayout().size());
        assertEquals(4, result.getArtifacts().size());
        assertTrue(result.getArtifact("svg").isPresent());
        assertEquals(RenderFormat.HTML, result.getArtifact("HTML").orElseThrow().getFormat());
        assertDoesNotThrow(() -> result.getGraph().validate());
    }

    @Test
    @DisplayName("Should produce identical JSON for identical input and seed")
    void testRun_Deterministic() {
        PipelineOptions options = PipelineOptions.builder().seed(7L).format("json").build();

        byte[] first = pipeline.run(TEXT, SourceType.VOICE_TRANSCRIPT, options).getArtifact("json").orElseThrow().getContent();
        byte[] second = pipeline.run(TEXT, SourceType.VOICE_TRANSCRIPT, options).getArtifact("json").orElseThrow().getContent();

        assertArrayEquals(first, second);
    }

    @Test
    @DisplayName("Should skip expansion when disabled")
    void testRun_NoExpansion() {
        PipelineOptions options = PipelineOptions.builder().semanticExpansion(false).seed(1L).build();

        PipelineResult result = pipeline.run(TEXT, SourceType.VOICE_TRANSCRIPT, options);

        assertEquals(5, result.getGraph().nodeCount());
        assertTrue(result.getExtraction().getNewNodes().isEmpty());
        assertTrue(result.getArtifacts().isEmpty());
    }

    @Test
    @DisplayName("Should carry parse warnings through for an unknown source tag")
    void testRun_DegradedParse() {
        PipelineResult result = pipeline.run(TEXT, "telegram", PipelineOptions.defaults());

        assertEquals(1, result.getWarnings().size());
        assertTrue(result.getArtifact("json").isPresent());
    }

    @Test
    @DisplayName("Should fail fast on an unknown format")
    void testRun_UnknownFormat() {
        PipelineOptions options = PipelineOptions.builder().format("pdf").build();

        assertThrows(UnsupportedFormatException.class,
                () -> pipeline.run(TEXT, SourceType.VOICE_TRANSCRIPT, options));
    }

    @Test
    @DisplayName("Should reject an unknown format before parsing")
    void testRun_UnknownFormatBeforeParse() {
        // Given
        ContentParser parser = mock(ContentParser.class);
        FuzzySemanticExtractor extractor = mock(FuzzySemanticExtractor.class);
        AppProperties properties = new AppProperties();
        KnowledgeGraphPipeline guarded = new KnowledgeGraphPipeline(parser, extractor,
                new FruchtermanReingoldLayoutEngine(properties),
                new MultiFormatRenderer(List.of(new JsonGraphRenderer(new ObjectMapper())), properties),
                properties);
        PipelineOptions options = PipelineOptions.builder().format("json").format("pdf").build();

        // When
        assertThrows(UnsupportedFormatException.class, () -> guarded.run(TEXT, "post", options));

        // Then
        verifyNoInteractions(parser, extractor);
    }
}
