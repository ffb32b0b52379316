package com.textgraph.canvas.semantic.impl;

import com.textgraph.canvas.configuration.AppProperties;
import com.textgraph.canvas.exception.SourceUnavailableException;
import com.textgraph.canvas.model.CallContext;
import com.textgraph.canvas.model.ServiceType;
import com.textgraph.canvas.model.graph.RelationType;
import com.textgraph.canvas.model.semantic.RelationshipSet;
import com.textgraph.canvas.semantic.SemanticSource;
import com.textgraph.canvas.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Deterministic lookup in the local {@link LexicalDatabase}.
 * Hypernyms become is_a, meronyms has_attribute, uses used_for, synonyms and holonyms related_to.
 */
@Slf4j
@Component
public class LexicalDbSource implements SemanticSource {

    public static final String NAME = "lexical_db";

    private final LexicalDatabase database;
    private final boolean enabled;

    @Autowired
    public LexicalDbSource(LexicalDatabase database, AppProperties appProperties) {
        this(database, appProperties.getSemantic().getLexicalDb().isEnabled());
    }

    LexicalDbSource(LexicalDatabase database, boolean enabled) {
        this.database = database;
        this.enabled = enabled;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 2;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public RelationshipSet query(String word) {
        if (!database.isLoaded()) {
            throw new SourceUnavailableException(NAME,
                    "dataset " + database.getLocation() + " not loaded: " + database.getLoadFailure().orElse("unknown"));
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.LEXICON, "lookup", log);
        ctx.logRequest(word);
        RelationshipSet result = database.firstSense(word)
                .map(sense -> RelationshipSet.builder()
                        .addAll(RelationType.IS_A, sense.getHypernyms())
                        .addAll(RelationType.HAS_ATTRIBUTE, sense.getMeronyms())
                        .addAll(RelationType.USED_FOR, sense.getUses())
                        .addAll(RelationType.RELATED_TO, sense.getSynonyms())
                        .addAll(RelationType.RELATED_TO, sense.getHolonyms())
                        .build())
                .orElse(RelationshipSet.empty());
        ctx.logResponse(result.size() + " relationships");
        return result;
    }
}
