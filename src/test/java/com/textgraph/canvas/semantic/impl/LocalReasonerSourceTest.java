package com.textgraph.canvas.semantic.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.textgraph.canvas.client.OllamaClient;
import com.textgraph.canvas.configuration.SemanticProperties;
import com.textgraph.canvas.exception.SourceUnavailableException;
import com.textgraph.canvas.model.semantic.RelationshipSet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Local Reasoner Source Tests")
class LocalReasonerSourceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<String> lastRequest = new AtomicReference<>();

    private HttpServer server;
    private volatile int status;
    private volatile String body;
    private volatile long delayMillis;

    @BeforeEach
    void setUp() throws IOException {
        status = 200;
        delayMillis = 0;
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.setExecutor(Executors.newCachedThreadPool());
        server.createContext("/api/generate", this::handle);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    @DisplayName("Should parse a JSON object wrapped in prose")
    void testQuery_JsonInsideText() throws Exception {
        // Given
        respondWithText("Sure! {\"is_a\": [\"bird\", \"Animal\"], \"has_attribute\": [\"small\"], "
                + "\"used_for\": [], \"related_to\": [\"cage\"]} Hope that helps.");

        // When
        RelationshipSet result = source(Duration.ofSeconds(5)).query("parakeet");

        // Then
        assertEquals(Set.of("bird", "animal"), result.getIsA());
        assertEquals(Set.of("small"), result.getHasAttribute());
        assertTrue(result.getUsedFor().isEmpty());
        assertEquals(Set.of("cage"), result.getRelatedTo());
    }

    @Test
    @DisplayName("Should send a non-streaming JSON-mode generate request")
    void testQuery_RequestShape() throws Exception {
        // Given
        respondWithText("{\"is_a\": [\"activity\"]}");

        // When
        source(Duration.ofSeconds(5)).query("game");

        // Then
        JsonNode request = objectMapper.readTree(lastRequest.get());
        assertEquals("llama2", request.path("model").asText());
        assertFalse(request.path("stream").asBoolean(true));
        assertEquals("json", request.path("format").asText());
        assertEquals(0.3, request.path("options").path("temperature").asDouble());
        assertEquals(200, request.path("options").path("num_predict").asInt());
        assertTrue(request.path("prompt").asText().contains("Now extract for: game"));
    }

    @Test
    @DisplayName("Should report empty arrays as an empty set, not a failure")
    void testQuery_EmptyArrays() throws Exception {
        respondWithText("{\"is_a\": [], \"has_attribute\": [], \"used_for\": [], \"related_to\": []}");

        RelationshipSet result = source(Duration.ofSeconds(5)).query("xyzzy");

        assertTrue(result.isEmpty());
    }

    @Test
    @DisplayName("Should be unavailable on a non-2xx status")
    void testQuery_ServerError() {
        status = 500;
        body = "{\"error\":\"model not found\"}";

        SourceUnavailableException e = assertThrows(SourceUnavailableException.class,
                () -> source(Duration.ofSeconds(5)).query("game"));
        assertEquals(LocalReasonerSource.NAME, e.getSourceName());
    }

    @Test
    @DisplayName("Should be unavailable when the response holds no JSON")
    void testQuery_MalformedResponse() throws Exception {
        respondWithText("I am not sure what you mean.");

        assertThrows(SourceUnavailableException.class, () -> source(Duration.ofSeconds(5)).query("game"));
    }

    @Test
    @DisplayName("Should be unavailable when the JSON is broken")
    void testQuery_BrokenJson() throws Exception {
        respondWithText("{\"is_a\": [\"bird\",]]}");

        assertThrows(SourceUnavailableException.class, () -> source(Duration.ofSeconds(5)).query("game"));
    }

    @Test
    @DisplayName("Should be unavailable when the service exceeds the timeout")
    void testQuery_Timeout() throws Exception {
        // Given
        respondWithText("{\"is_a\": [\"activity\"]}");
        delayMillis = 2_000;

        // When
        long start = System.currentTimeMillis();
        assertThrows(SourceUnavailableException.class, () -> source(Duration.ofMillis(300)).query("game"));

        // Then
        assertTrue(System.currentTimeMillis() - start < 1_900, "call should give up before the server answers");
    }

    @Test
    @DisplayName("Should accept an already structured response object")
    void testParseBody_StructuredResponse() throws Exception {
        LocalReasonerSource source = new LocalReasonerSource(null, objectMapper, true);
        JsonNode body = objectMapper.readTree("{\"response\": {\"is_a\": [\"activity\"], \"related_to\": \"sport\"}}");

        RelationshipSet result = source.parseBody("game", body);

        assertEquals(Set.of("activity"), result.getIsA());
        assertEquals(Set.of("sport"), result.getRelatedTo());
    }

    @Test
    @DisplayName("Should accept buckets at the top level of the body")
    void testParseBody_TopLevelBuckets() throws Exception {
        LocalReasonerSource source = new LocalReasonerSource(null, objectMapper, true);
        JsonNode body = objectMapper.readTree("{\"used_for\": [\"fun\"]}");

        assertEquals(Set.of("fun"), source.parseBody("game", body).getUsedFor());
    }

    @Test
    @DisplayName("Should find the first balanced object, ignoring braces inside strings")
    void testFirstJsonObject() {
        String text = "prefix {\"a\": \"}{\", \"b\": {\"c\": 1}} trailing {\"d\": 2}";

        assertEquals("{\"a\": \"}{\", \"b\": {\"c\": 1}}", LocalReasonerSource.firstJsonObject(text));
        assertNull(LocalReasonerSource.firstJsonObject("no object {"));
    }

    @Test
    @DisplayName("Should render the prompt template with the word in both places")
    void testRenderPrompt() {
        LocalReasonerSource reasoner = new LocalReasonerSource(null, objectMapper, true);

        String prompt = reasoner.renderPrompt("parakeet");

        assertTrue(prompt.startsWith("Extract semantic relationships for the word: parakeet\n"));
        assertTrue(prompt.endsWith("Now extract for: parakeet"));
        assertTrue(prompt.contains("\"has_attribute\": [\"property1\", \"property2\"]"));
        assertFalse(prompt.contains("{{"));
    }

    private LocalReasonerSource source(Duration timeout) {
        SemanticProperties.LocalReasoner config = new SemanticProperties.LocalReasoner();
        config.setBaseUrl("http://127.0.0.1:" + server.getAddress().getPort());
        config.setTimeout(timeout);
        return new LocalReasonerSource(new OllamaClient(config), objectMapper, true);
    }

    private void respondWithText(String generated) throws Exception {
        body = objectMapper.writeValueAsString(Map.of("model", "llama2", "response", generated, "done", true));
    }

    private void handle(HttpExchange exchange) throws IOException {
        lastRequest.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        if (delayMillis > 0) {
            try {
                Thread.sleep(delayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        } catch (IOException e) {
            // client gave up (timeout test)
        } finally {
            exchange.close();
        }
    }
}
