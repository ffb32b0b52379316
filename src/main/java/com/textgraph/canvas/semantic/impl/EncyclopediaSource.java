package com.textgraph.canvas.semantic.impl;

import com.textgraph.canvas.client.EncyclopediaClient;
import com.textgraph.canvas.configuration.AppProperties;
import com.textgraph.canvas.exception.SourceUnavailableException;
import com.textgraph.canvas.model.graph.RelationType;
import com.textgraph.canvas.model.semantic.RelationshipSet;
import com.textgraph.canvas.semantic.SemanticSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Derives relationships from the first paragraph of an encyclopedia article using
 * a handful of sentence patterns ("X is a Y", "has Z", "used for W", ...).
 *
 * <p>An article without any matching sentence is treated as unavailable rather than
 * empty, so the next source gets a chance.
 */
@Slf4j
@Component
public class EncyclopediaSource implements SemanticSource {

    public static final String NAME = "encyclopedia";

    private static final int MAX_CATEGORY_WORDS = 3;

    private static final Pattern GENERIC_IS_A = Pattern.compile("\\bis an? ([^,.]+)", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> HAS_PATTERNS = List.of(
            Pattern.compile("\\bhas ([a-z]+ [a-z]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bwith ([a-z]+ [a-z]+)", Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> USED_PATTERNS = List.of(
            Pattern.compile("\\bused for ([^,.]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bused to ([^,.]+)", Pattern.CASE_INSENSITIVE));

    private final EncyclopediaClient client;
    private final boolean enabled;

    @Autowired
    public EncyclopediaSource(EncyclopediaClient client, AppProperties appProperties) {
        this(client, appProperties.getSemantic().getEncyclopedia().isEnabled());
    }

    EncyclopediaSource(EncyclopediaClient client, boolean enabled) {
        this.client = client;
        this.enabled = enabled;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 3;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public RelationshipSet query(String word) {
        String extract;
        try {
            extract = client.fetchSummaryExtract(word);
        } catch (IOException e) {
            throw new SourceUnavailableException(NAME, "summary for '" + word + "' failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException(NAME, "interrupted while fetching '" + word + "'", e);
        }

        if (extract == null || extract.isBlank()) {
            throw new SourceUnavailableException(NAME, "no summary text for '" + word + "'");
        }

        RelationshipSet relationships = extractRelationships(word, extract);
        if (relationships.isEmpty()) {
            throw new SourceUnavailableException(NAME, "no recognizable relationships in summary for '" + word + "'");
        }
        return relationships;
    }

    RelationshipSet extractRelationships(String word, String extract) {
        RelationshipSet.Builder builder = RelationshipSet.builder();

        String quoted = Pattern.quote(word);
        List<Pattern> isAPatterns = List.of(
                Pattern.compile(quoted + " is an? ([^,.]+)", Pattern.CASE_INSENSITIVE),
                Pattern.compile(quoted + " refers to an? ([^,.]+)", Pattern.CASE_INSENSITIVE),
                GENERIC_IS_A);
        for (Pattern pattern : isAPatterns) {
            forEachMatch(pattern, extract, match -> builder.add(RelationType.IS_A, firstWords(match)));
        }
        for (Pattern pattern : HAS_PATTERNS) {
            forEachMatch(pattern, extract, match -> builder.add(RelationType.HAS_ATTRIBUTE, match));
        }
        for (Pattern pattern : USED_PATTERNS) {
            forEachMatch(pattern, extract, match -> builder.add(RelationType.USED_FOR, match));
        }

        RelationshipSet result = builder.build();
        log.debug("Encyclopedia '{}' → {} relationships", word, result.size());
        return result;
    }

    private static void forEachMatch(Pattern pattern, String text, Consumer<String> consumer) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            consumer.accept(matcher.group(1).trim());
        }
    }

    private static String firstWords(String phrase) {
        return Arrays.stream(phrase.trim().split("\\s+"))
                .limit(MAX_CATEGORY_WORDS)
                .collect(Collectors.joining(" "));
    }
}
