package com.textgraph.canvas.semantic.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.textgraph.canvas.client.OllamaClient;
import com.textgraph.canvas.configuration.AppProperties;
import com.textgraph.canvas.exception.SourceUnavailableException;
import com.textgraph.canvas.model.graph.RelationType;
import com.textgraph.canvas.model.semantic.RelationshipSet;
import com.textgraph.canvas.semantic.SemanticSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.StringWriter;
import java.util.Map;

/**
 * Asks a local LLM to describe a word and parses the JSON object it answers with.
 *
 * <p>Ollama puts the generated text into the {@code response} field. In JSON mode that text
 * is itself a JSON object, but models regularly wrap it in prose, so the first balanced
 * {@code {...}} block is extracted. A response that is already an object is accepted as is.
 */
@Slf4j
@Component
public class LocalReasonerSource implements SemanticSource {

    public static final String NAME = "local_reasoner";

    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory("templates");
    private final Mustache prompt = mustacheFactory.compile("semantic-relationships.prompt.mustache");

    private final OllamaClient ollamaClient;
    private final ObjectMapper objectMapper;
    private final boolean enabled;

    @Autowired
    public LocalReasonerSource(OllamaClient ollamaClient, ObjectMapper objectMapper, AppProperties appProperties) {
        this(ollamaClient, objectMapper, appProperties.getSemantic().getLocalReasoner().isEnabled());
    }

    LocalReasonerSource(OllamaClient ollamaClient, ObjectMapper objectMapper, boolean enabled) {
        this.ollamaClient = ollamaClient;
        this.objectMapper = objectMapper;
        this.enabled = enabled;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 1;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public RelationshipSet query(String word) {
        JsonNode body;
        try {
            body = ollamaClient.generate(renderPrompt(word));
        } catch (RuntimeException e) {
            throw new SourceUnavailableException(NAME, "call failed for '" + word + "': " + e.getMessage(), e);
        }
        return parseBody(word, body);
    }

    String renderPrompt(String word) {
        StringWriter writer = new StringWriter();
        prompt.execute(writer, Map.of("word", word));
        return writer.toString();
    }

    RelationshipSet parseBody(String word, JsonNode body) {
        JsonNode response = body.path("response");
        JsonNode relationships;
        if (response.isObject()) {
            relationships = response;
        } else if (response.isTextual()) {
            relationships = parseEmbeddedObject(word, response.asText());
        } else if (hasAnyBucket(body)) {
            relationships = body;
        } else {
            throw new SourceUnavailableException(NAME, "response for '" + word + "' has no usable content");
        }

        if (!relationships.isObject()) {
            throw new SourceUnavailableException(NAME, "response for '" + word + "' is not a JSON object");
        }

        RelationshipSet.Builder builder = RelationshipSet.builder();
        for (RelationType type : RelationType.semanticTypes()) {
            JsonNode values = relationships.path(type.getWireName());
            if (values.isArray()) {
                values.forEach(value -> {
                    if (value.isTextual()) {
                        builder.add(type, value.asText());
                    }
                });
            } else if (values.isTextual()) {
                builder.add(type, values.asText());
            }
        }
        RelationshipSet result = builder.build();
        log.debug("LocalReasoner '{}' → {} relationships", word, result.size());
        return result;
    }

    private JsonNode parseEmbeddedObject(String word, String text) {
        String json = firstJsonObject(text);
        if (json == null) {
            throw new SourceUnavailableException(NAME, "no JSON object in response for '" + word + "'");
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SourceUnavailableException(NAME, "malformed JSON in response for '" + word + "'", e);
        }
    }

    /**
     * First balanced brace block, ignoring braces inside string literals.
     */
    static String firstJsonObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            return null;
        }
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return text.substring(start, i + 1);
                }
            }
        }
        return null;
    }

    private static boolean hasAnyBucket(JsonNode node) {
        return RelationType.semanticTypes().stream().anyMatch(type -> node.has(type.getWireName()));
    }
}
