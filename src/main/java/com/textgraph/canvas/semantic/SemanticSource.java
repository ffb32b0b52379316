package com.textgraph.canvas.semantic;

import com.textgraph.canvas.exception.SourceUnavailableException;
import com.textgraph.canvas.model.semantic.RelationshipSet;

/**
 * A backend that can describe a single word through typed relationships.
 *
 * <p>Sources are tried in ascending {@link #getPriority()} order by the
 * {@link FuzzySemanticExtractor}; the first one that answers with a non-empty set wins.
 */
public interface SemanticSource {

    /**
     * Stable name, also used as the second half of the cache key.
     */
    String getName();

    /**
     * Lower value is asked first.
     */
    int getPriority();

    boolean isEnabled();

    /**
     * Looks up relationships for an already-normalized word.
     *
     * @return relationships, possibly empty when the source simply knows nothing about the word
     * @throws SourceUnavailableException when the source could not answer at all
     */
    RelationshipSet query(String word);
}
