package com.textgraph.canvas.semantic.cache;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time counters of a {@link SemanticExpansionCache}.
 */
@Value
@Builder
public class CacheStats {

    /** Reads that found an entry, including ones that then waited on an in-flight fetch. */
    long hits;
    long misses;

    /** Fetcher invocations actually made. */
    long fetches;

    /** Callers that waited on another caller's in-flight fetch instead of fetching. */
    long coalesced;

    /** Entries removed by the TTL. Caffeine counts them when it cleans up, not at read time. */
    long expirations;

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
