package com.textgraph.canvas.parser;

import com.textgraph.canvas.configuration.ParserProperties;
import com.textgraph.canvas.model.graph.Edge;
import com.textgraph.canvas.model.graph.Graph;
import com.textgraph.canvas.model.graph.Node;
import com.textgraph.canvas.model.graph.NodeOrigin;
import com.textgraph.canvas.model.graph.RelationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Content Parser Tests")
class ContentParserTest {

    private ContentParser parser;

    @BeforeEach
    void setUp() {
        parser = new ContentParser(new ParserProperties());
    }

    @Test
    @DisplayName("Should keep content words and link neighbours inside the window")
    void testParse_StopWordsRemovedAndCoOccurrenceBuilt() {
        // Given
        String text = "Ideas is about cringe proof. It's a game about news.";

        // When
        ParseResult result = parser.parse(text, SourceType.VOICE_TRANSCRIPT);
        Graph graph = result.getGraph();

        // Then
        assertFalse(result.isDegraded());
        assertEquals(Set.of("ideas", "cringe", "proof", "game", "news"), nodeIds(graph));

        Edge ideasCringe = findEdge(graph, "ideas", "cringe").orElseThrow();
        assertEquals(RelationType.CO_OCCURRENCE, ideasCringe.getRelationType());
        assertTrue(ideasCringe.getWeight() >= 1);
    }

    @Test
    @DisplayName("Should only pair tokens closer than the window size")
    void testParse_WindowLimitsPairs() {
        // Given: filtered stream is alpha beta gamma delta
        String text = "alpha beta gamma delta";

        // When
        Graph graph = parser.parse(text, SourceType.POST).getGraph();

        // Then: window 3 pairs each token with the next two only
        assertTrue(findEdge(graph, "alpha", "beta").isPresent());
        assertTrue(findEdge(graph, "alpha", "gamma").isPresent());
        assertFalse(findEdge(graph, "alpha", "delta").isPresent());
        assertEquals(5, graph.edgeCount());
    }

    @Test
    @DisplayName("Should store pairs with the smaller id as source")
    void testParse_PairsAreOrdered() {
        Graph graph = parser.parse("zebra apple", SourceType.POST).getGraph();

        Edge edge = graph.getEdges().get(0);
        assertEquals("apple", edge.getSourceId());
        assertEquals("zebra", edge.getTargetId());
    }

    @Test
    @DisplayName("Should count node frequency and repeated pairs without self-loops")
    void testParse_FrequencyAndWeights() {
        // Given
        String text = "graph graph layout graph layout";

        // When
        Graph graph = parser.parse(text, SourceType.VOICE_TRANSCRIPT).getGraph();

        // Then
        assertEquals(3.0, graph.getNode("graph").orElseThrow().getWeight());
        assertEquals(2.0, graph.getNode("layout").orElseThrow().getWeight());
        assertTrue(graph.getEdges().stream().noneMatch(e -> e.getSourceId().equals(e.getTargetId())));
        assertEquals(1, graph.edgeCount());
        assertEquals(4.0, graph.getEdges().get(0).getWeight());
        assertTrue(graph.getNodes().stream().allMatch(n -> n.getOrigin() == NodeOrigin.ORIGINAL));
    }

    @Test
    @DisplayName("Should drop short and numeric tokens")
    void testParse_ShortAndNumericTokensDropped() {
        Graph graph = parser.parse("go 2024 ok server 42 cluster", SourceType.VOICE_TRANSCRIPT).getGraph();

        assertEquals(Set.of("server", "cluster"), nodeIds(graph));
    }

    @Test
    @DisplayName("Should drop spoken fillers from transcripts")
    void testParse_VoiceFillersRemoved() {
        Graph graph = parser.parse("umm the podcast uh hmm episode", SourceType.VOICE_TRANSCRIPT).getGraph();

        assertEquals(Set.of("podcast", "episode"), nodeIds(graph));
    }

    @Test
    @DisplayName("Should split identifiers and drop language keywords in code")
    void testParse_CodeIdentifiersSplit() {
        // Given
        String code = "public void parseHttpResponse(String user_name) { return renderCanvas(); }";

        // When
        Graph graph = parser.parse(code, SourceType.CODE).getGraph();

        // Then
        assertEquals(Set.of("parse", "http", "response", "user", "name", "render", "canvas"), nodeIds(graph));
    }

    @Test
    @DisplayName("Should strip markdown markup, fenced code and link targets")
    void testParse_MarkdownCleaned() {
        // Given
        String markdown = """
                # Release notes
                - **Faster** [layout](https://example.org/layout)
                ```
                hiddenCode block
                ```
                """;

        // When
        Graph graph = parser.parse(markdown, SourceType.MARKDOWN).getGraph();

        // Then
        assertEquals(Set.of("release", "notes", "faster", "layout"), nodeIds(graph));
    }

    @Test
    @DisplayName("Should drop URLs and mentions from posts but keep hashtag words")
    void testParse_PostCleaned() {
        Graph graph = parser.parse("Loving the #sunset with @someone https://t.co/abc123", SourceType.POST).getGraph();

        assertEquals(Set.of("loving", "sunset"), nodeIds(graph));
    }

    @Test
    @DisplayName("Should degrade to a frequency-only graph for an unknown source tag")
    void testParse_UnknownTagDegrades() {
        // When
        ParseResult result = parser.parse("alpha beta alpha", "fax_machine");

        // Then
        assertTrue(result.isDegraded());
        assertEquals(1, result.getWarnings().size());
        assertEquals(ParseWarning.Kind.PARSE_DEGRADED, result.getWarnings().get(0).getKind());
        assertEquals(0, result.getGraph().edgeCount());
        assertEquals(2.0, result.getGraph().getNode("alpha").orElseThrow().getWeight());
    }

    @Test
    @DisplayName("Should accept a known tag given as a string")
    void testParse_KnownTag() {
        ParseResult result = parser.parse("alpha beta", "voice_transcript");

        assertFalse(result.isDegraded());
        assertEquals(1, result.getGraph().edgeCount());
    }

    @Test
    @DisplayName("Should degrade on malformed bytes instead of failing")
    void testParseBytes_MalformedInputDegrades() {
        // Given: 0xC3 0x28 is an invalid UTF-8 sequence
        byte[] bytes = {'s', 'e', 'r', 'v', 'e', 'r', ' ', (byte) 0xC3, (byte) 0x28, ' ',
                'c', 'l', 'u', 's', 't', 'e', 'r'};

        // When
        ParseResult result = parser.parseBytes(bytes, StandardCharsets.UTF_8, SourceType.POST);

        // Then
        assertTrue(result.isDegraded());
        assertEquals(0, result.getGraph().edgeCount());
        assertTrue(result.getGraph().containsNode("server"));
        assertTrue(result.getGraph().containsNode("cluster"));
    }

    @Test
    @DisplayName("Should parse valid bytes normally")
    void testParseBytes_ValidInput() {
        ParseResult result = parser.parseBytes("server cluster".getBytes(StandardCharsets.UTF_8),
                StandardCharsets.UTF_8, SourceType.POST);

        assertFalse(result.isDegraded());
        assertEquals(1, result.getGraph().edgeCount());
    }

    @Test
    @DisplayName("Should return an empty graph for empty text")
    void testParse_EmptyText() {
        ParseResult result = parser.parse("", SourceType.POST);

        assertEquals(0, result.getGraph().nodeCount());
        assertEquals(0, result.getGraph().edgeCount());
        assertFalse(result.isDegraded());
    }

    @Test
    @DisplayName("Should honour configured window size and extra stop-words")
    void testParse_CustomProperties() {
        // Given
        ParserProperties properties = new ParserProperties();
        properties.setWindowSize(2);
        properties.setExtraStopWords(List.of("Beta"));
        ContentParser custom = new ContentParser(properties);

        // When
        Graph graph = custom.parse("alpha beta gamma delta", SourceType.POST).getGraph();

        // Then: only direct neighbours of the filtered stream alpha gamma delta
        assertEquals(Set.of("alpha", "gamma", "delta"), nodeIds(graph));
        assertEquals(2, graph.edgeCount());
        assertEquals(2, graph.getMetadata().get("window_size"));
    }

    @Test
    @DisplayName("Should record parse metadata on the graph")
    void testParse_Metadata() {
        Graph graph = parser.parse("alpha beta alpha", SourceType.MARKDOWN).getGraph();

        assertEquals("markdown", graph.getMetadata().get("content_type"));
        assertEquals(3, graph.getMetadata().get("word_count"));
        assertEquals(2, graph.getMetadata().get("unique_words"));
        assertNotNull(graph.getMetadata().get("parsed_at"));
    }

    private static Set<String> nodeIds(Graph graph) {
        return graph.getNodes().stream().map(Node::getId).collect(Collectors.toSet());
    }

    private static Optional<Edge> findEdge(Graph graph, String a, String b) {
        return graph.getEdges().stream()
                .filter(e -> (e.getSourceId().equals(a) && e.getTargetId().equals(b))
                        || (e.getSourceId().equals(b) && e.getTargetId().equals(a)))
                .findFirst();
    }
}
