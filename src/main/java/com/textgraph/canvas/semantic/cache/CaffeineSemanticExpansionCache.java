package com.textgraph.canvas.semantic.cache;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.google.common.base.Preconditions;
import com.textgraph.canvas.model.semantic.RelationshipSet;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * {@link SemanticExpansionCache} backed by a Caffeine {@link AsyncCache}.
 *
 * <p>The first caller to miss on a key installs an incomplete future and runs the fetcher on its
 * own thread. Callers arriving while it runs find that future and wait on it, so they see the
 * same value or the same exception. A failed fetch is removed from the cache before it is
 * rethrown. Expiry is Caffeine's {@code expireAfterWrite}, measured by the supplied
 * {@link Ticker}.
 */
@Slf4j
public class CaffeineSemanticExpansionCache implements SemanticExpansionCache {

    private record CacheKey(String word, String sourceName) {
    }

    private final AsyncCache<CacheKey, RelationshipSet> cache;

    private final LongAdder fetches = new LongAdder();
    private final LongAdder coalesced = new LongAdder();

    public CaffeineSemanticExpansionCache(Duration ttl, Ticker ticker) {
        Preconditions.checkNotNull(ttl, "TTL cannot be null");
        Preconditions.checkArgument(!ttl.isNegative() && !ttl.isZero(), "TTL must be positive: %s", ttl);
        Preconditions.checkNotNull(ticker, "Ticker cannot be null");

        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .recordStats()
                .buildAsync();
    }

    @Override
    public RelationshipSet getOrFetch(String word, String sourceName, Supplier<RelationshipSet> fetcher) {
        Preconditions.checkNotNull(word, "Word cannot be null");
        Preconditions.checkNotNull(sourceName, "Source name cannot be null");
        Preconditions.checkNotNull(fetcher, "Fetcher cannot be null");

        CacheKey key = new CacheKey(word, sourceName);
        CompletableFuture<RelationshipSet> existing = cache.getIfPresent(key);
        if (existing != null) {
            if (!existing.isDone()) {
                coalesced.increment();
                log.debug("Waiting on in-flight fetch for {}", key);
            }
            return await(existing);
        }

        CompletableFuture<RelationshipSet> ours = new CompletableFuture<>();
        existing = cache.asMap().putIfAbsent(key, ours);
        if (existing != null) {
            coalesced.increment();
            log.debug("Waiting on in-flight fetch for {}", key);
            return await(existing);
        }

        fetches.increment();
        try {
            RelationshipSet value = fetcher.get();
            Preconditions.checkState(value != null, "Fetcher for %s returned null", key);
            // Restarts the write clock, which Caffeine holds open while the future is incomplete
            cache.synchronous().put(key, value);
            ours.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            cache.asMap().remove(key, ours);
            ours.completeExceptionally(e);
            throw e;
        }
    }

    private static RelationshipSet await(CompletableFuture<RelationshipSet> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    @Override
    public void invalidate(String word, String sourceName) {
        cache.synchronous().invalidate(new CacheKey(word, sourceName));
    }

    @Override
    public void invalidateAll() {
        cache.synchronous().invalidateAll();
    }

    @Override
    public int size() {
        return Math.toIntExact(cache.synchronous().estimatedSize());
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.synchronous().stats();
        return CacheStats.builder()
                .hits(stats.hitCount())
                .misses(stats.missCount())
                .fetches(fetches.sum())
                .coalesced(coalesced.sum())
                .expirations(stats.evictionCount())
                .build();
    }
}
