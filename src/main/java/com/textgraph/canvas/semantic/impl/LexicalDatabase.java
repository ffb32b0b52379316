package com.textgraph.canvas.semantic.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lexical dataset loaded once from a JSON resource.
 *
 * <p>Expected shape:
 * <pre>
 * {
 *   "words": {
 *     "game": [
 *       { "hypernyms": ["activity"], "synonyms": [...], "meronyms": [...],
 *         "holonyms": [...], "uses": [...] },
 *       ...further senses...
 *     ]
 *   }
 * }
 * </pre>
 * Only the first sense of each word is kept. A load failure is remembered rather than
 * thrown so the application still starts; lookups then report the database as unavailable.
 */
@Slf4j
public class LexicalDatabase {

    @Value
    @Builder
    public static class Sense {
        @Singular("hypernym")
        List<String> hypernyms;
        @Singular("synonym")
        List<String> synonyms;
        @Singular("meronym")
        List<String> meronyms;
        @Singular("holonym")
        List<String> holonyms;
        @Singular("use")
        List<String> uses;
    }

    private final String location;
    private final Map<String, Sense> firstSenses;
    private final String loadFailure;

    private LexicalDatabase(String location, Map<String, Sense> firstSenses, String loadFailure) {
        this.location = location;
        this.firstSenses = firstSenses;
        this.loadFailure = loadFailure;
    }

    public static LexicalDatabase load(ResourceLoader resourceLoader, String location, ObjectMapper objectMapper) {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            JsonNode words = root.path("words");
            if (!words.isObject()) {
                return failed(location, "missing 'words' object");
            }
            Map<String, Sense> senses = new HashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = words.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode first = field.getValue().isArray() ? field.getValue().path(0) : field.getValue();
                if (first.isObject()) {
                    senses.put(field.getKey().toLowerCase(Locale.ROOT), toSense(first));
                }
            }
            log.info("📚 Lexical database loaded from {}: {} words", location, senses.size());
            return new LexicalDatabase(location, Collections.unmodifiableMap(senses), null);
        } catch (IOException e) {
            return failed(location, e.getMessage());
        }
    }

    private static LexicalDatabase failed(String location, String reason) {
        log.warn("⚠️ Lexical database at {} could not be loaded: {}", location, reason);
        return new LexicalDatabase(location, Map.of(), reason);
    }

    private static Sense toSense(JsonNode node) {
        return Sense.builder()
                .hypernyms(texts(node.path("hypernyms")))
                .synonyms(texts(node.path("synonyms")))
                .meronyms(texts(node.path("meronyms")))
                .holonyms(texts(node.path("holonyms")))
                .uses(texts(node.path("uses")))
                .build();
    }

    private static List<String> texts(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array.isArray()) {
            array.forEach(value -> values.add(value.asText().replace('_', ' ')));
        }
        return values;
    }

    public boolean isLoaded() {
        return loadFailure == null;
    }

    public Optional<String> getLoadFailure() {
        return Optional.ofNullable(loadFailure);
    }

    public String getLocation() {
        return location;
    }

    public int size() {
        return firstSenses.size();
    }

    public Optional<Sense> firstSense(String word) {
        return Optional.ofNullable(firstSenses.get(word.toLowerCase(Locale.ROOT)));
    }
}
