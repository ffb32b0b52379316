package com.textgraph.canvas.semantic.cache;

import com.textgraph.canvas.model.semantic.RelationshipSet;

import java.util.function.Supplier;

/**
 * Cache of semantic source answers keyed by {@code (word, sourceName)}.
 *
 * <p>Shared by every pipeline run in the process, so implementations must be thread-safe.
 */
public interface SemanticExpansionCache {

    /**
     * Returns the cached set for the key when present and not expired, otherwise runs
     * {@code fetcher} and caches its result.
     *
     * <p>Concurrent callers missing on the same key share a single fetcher invocation and
     * all observe its result, or the exception it threw. Failures are not cached.
     *
     * @param word       normalized word
     * @param sourceName name of the source that {@code fetcher} queries
     * @param fetcher    loads the value on a miss; may throw
     */
    RelationshipSet getOrFetch(String word, String sourceName, Supplier<RelationshipSet> fetcher);

    /**
     * Drops a single entry, if present.
     */
    void invalidate(String word, String sourceName);

    void invalidateAll();

    /**
     * Number of stored entries, including ones that have expired but were not read since.
     */
    int size();

    CacheStats getStats();
}
