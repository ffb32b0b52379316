package com.textgraph.canvas.semantic.impl;

import com.textgraph.canvas.configuration.AppProperties;
import com.textgraph.canvas.model.semantic.RelationshipSet;
import com.textgraph.canvas.semantic.SemanticSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Last resort: a small built-in dictionary of common words. Never fails.
 */
@Component
public class StaticFallbackSource implements SemanticSource {

    public static final String NAME = "static_fallback";

    private static final Map<String, RelationshipSet> DICTIONARY = Map.ofEntries(
            Map.entry("game", RelationshipSet.builder()
                    .isA("activity", "entertainment")
                    .hasAttribute("rules", "players", "goal")
                    .usedFor("fun", "competition")
                    .relatedTo("play", "sport", "puzzle")
                    .build()),
            Map.entry("news", RelationshipSet.builder()
                    .isA("information", "media")
                    .hasAttribute("headline", "source")
                    .usedFor("informing")
                    .relatedTo("journalism", "report", "article")
                    .build()),
            Map.entry("idea", RelationshipSet.builder()
                    .isA("thought", "concept")
                    .relatedTo("plan", "creativity", "insight")
                    .build()),
            Map.entry("ideas", RelationshipSet.builder()
                    .isA("thought", "concept")
                    .relatedTo("plan", "creativity", "insight")
                    .build()),
            Map.entry("proof", RelationshipSet.builder()
                    .isA("evidence", "argument")
                    .usedFor("verification")
                    .relatedTo("truth", "test")
                    .build()),
            Map.entry("parakeet", RelationshipSet.builder()
                    .isA("bird", "animal", "pet")
                    .hasAttribute("small", "colorful", "intelligent", "green", "yellow")
                    .usedFor("companionship", "entertainment")
                    .relatedTo("budgie", "cage", "seed", "australia", "budgerigar")
                    .build()),
            Map.entry("bird", RelationshipSet.builder()
                    .isA("animal", "vertebrate")
                    .hasAttribute("feather", "wings", "beak")
                    .relatedTo("fly", "nest", "egg")
                    .build()),
            Map.entry("pet", RelationshipSet.builder()
                    .isA("animal", "companion")
                    .relatedTo("dog", "cat", "bird", "care")
                    .build()),
            Map.entry("intelligent", RelationshipSet.builder()
                    .isA("quality", "trait")
                    .relatedTo("smart", "clever", "bright", "brain", "learning", "problem-solving")
                    .build()),
            Map.entry("green", RelationshipSet.builder()
                    .isA("color")
                    .relatedTo("nature", "plant", "grass")
                    .build()),
            Map.entry("australia", RelationshipSet.builder()
                    .isA("country", "continent")
                    .relatedTo("sydney", "kangaroo", "outback")
                    .build()),
            Map.entry("tampa", RelationshipSet.builder()
                    .isA("city", "location")
                    .relatedTo("florida", "clearwater", "st-petersburg", "bay")
                    .build()),
            Map.entry("plumber", RelationshipSet.builder()
                    .isA("professional", "tradesperson")
                    .usedFor("fixing-leaks", "installation")
                    .relatedTo("pipe", "water", "repair", "service")
                    .build()),
            Map.entry("electrician", RelationshipSet.builder()
                    .isA("professional", "tradesperson")
                    .usedFor("electrical-work", "installation")
                    .relatedTo("electrical", "wiring", "repair", "service")
                    .build()),
            Map.entry("computer", RelationshipSet.builder()
                    .isA("machine", "device")
                    .hasAttribute("processor", "memory")
                    .usedFor("computation")
                    .relatedTo("software", "program")
                    .build()),
            Map.entry("music", RelationshipSet.builder()
                    .isA("art", "sound")
                    .hasAttribute("rhythm", "melody")
                    .usedFor("entertainment")
                    .relatedTo("song", "instrument")
                    .build()),
            Map.entry("voice", RelationshipSet.builder()
                    .isA("sound")
                    .usedFor("speech", "communication")
                    .relatedTo("speaker", "recording")
                    .build())
    );

    private final boolean enabled;

    @Autowired
    public StaticFallbackSource(AppProperties appProperties) {
        this(appProperties.getSemantic().getStaticFallback().isEnabled());
    }

    public StaticFallbackSource(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 4;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public RelationshipSet query(String word) {
        return DICTIONARY.getOrDefault(word, RelationshipSet.empty());
    }
}
