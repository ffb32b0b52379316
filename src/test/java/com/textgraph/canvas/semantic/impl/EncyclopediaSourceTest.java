package com.textgraph.canvas.semantic.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.textgraph.canvas.client.EncyclopediaClient;
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
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Encyclopedia Source Tests")
class EncyclopediaSourceTest {

    private static final String PARAKEET_EXTRACT = "A parakeet is a small to medium-sized parrot, with long tail "
            + "feathers. The parakeet has bright plumage and is used for companionship in many homes.";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<String> lastPath = new AtomicReference<>();

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
        server.createContext("/page/summary/", this::handle);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    @DisplayName("Should turn summary sentences into relationships")
    void testQuery_PatternsApplied() throws Exception {
        // Given
        respondWithExtract(PARAKEET_EXTRACT);

        // When
        RelationshipSet result = source(Duration.ofSeconds(5)).query("parakeet");

        // Then
        assertTrue(result.getIsA().contains("small to medium-sized"), "is_a keeps the first three words");
        assertTrue(result.getHasAttribute().contains("long tail"));
        assertTrue(result.getHasAttribute().contains("bright plumage"));
        assertTrue(result.getUsedFor().contains("companionship in many homes"));
        assertEquals("/page/summary/parakeet", lastPath.get());
    }

    @Test
    @DisplayName("Should match 'refers to' definitions")
    void testExtractRelationships_RefersTo() {
        EncyclopediaSource source = new EncyclopediaSource(null, true);

        RelationshipSet result = source.extractRelationships("Java",
                "Java refers to a general-purpose programming language. It is used to build servers.");

        assertTrue(result.getIsA().contains("general-purpose programming language"));
        assertTrue(result.getUsedFor().contains("build servers"));
    }

    @Test
    @DisplayName("Should be unavailable when no pattern matches")
    void testQuery_NoMatches() throws Exception {
        respondWithExtract("Completely unrelated prose without any of the expected phrasing.");

        assertThrows(SourceUnavailableException.class, () -> source(Duration.ofSeconds(5)).query("thing"));
    }

    @Test
    @DisplayName("Should be unavailable when the extract is empty")
    void testQuery_EmptyExtract() throws Exception {
        respondWithExtract("");

        assertThrows(SourceUnavailableException.class, () -> source(Duration.ofSeconds(5)).query("thing"));
    }

    @Test
    @DisplayName("Should be unavailable on a 404")
    void testQuery_NotFound() {
        status = 404;
        body = "{\"type\":\"not_found\"}";

        SourceUnavailableException e = assertThrows(SourceUnavailableException.class,
                () -> source(Duration.ofSeconds(5)).query("qwertyuiop"));
        assertEquals(EncyclopediaSource.NAME, e.getSourceName());
    }

    @Test
    @DisplayName("Should be unavailable when the endpoint is too slow")
    void testQuery_Timeout() throws Exception {
        respondWithExtract(PARAKEET_EXTRACT);
        delayMillis = 2_000;

        assertThrows(SourceUnavailableException.class, () -> source(Duration.ofMillis(300)).query("parakeet"));
    }

    @Test
    @DisplayName("Should URL-encode multi-word titles")
    void testQuery_EncodesTitle() throws Exception {
        respondWithExtract("A board game is a tabletop game.");

        source(Duration.ofSeconds(5)).query("board game");

        assertEquals("/page/summary/board game", lastPath.get());
    }

    private EncyclopediaSource source(Duration timeout) {
        SemanticProperties.Encyclopedia config = new SemanticProperties.Encyclopedia();
        config.setBaseUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/");
        config.setTimeout(timeout);
        return new EncyclopediaSource(new EncyclopediaClient(config, objectMapper), true);
    }

    private void respondWithExtract(String extract) throws Exception {
        body = objectMapper.writeValueAsString(Map.of("title", "x", "extract", extract));
    }

    private void handle(HttpExchange exchange) throws IOException {
        lastPath.set(exchange.getRequestURI().getPath());
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
