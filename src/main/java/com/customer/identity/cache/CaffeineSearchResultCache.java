package com.customer.identity.cache;

import com.customer.identity.merge.MergeListener;
import com.customer.identity.resolver.ResolutionListener;
import com.customer.identity.resolver.ResolutionResult;
import com.customer.identity.search.SearchResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Caffeine-backed search result cache. A merge, a new customer or a changed identity can alter any
 * ranking, so every merge and every writing resolution clears the whole cache.
 */
public class CaffeineSearchResultCache implements SearchResultCache, MergeListener, ResolutionListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineSearchResultCache.class);

    private final Cache<CacheKey, SearchResult> cache;

    public CaffeineSearchResultCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("search.cache_initialized maxSize={} ttlSeconds={}", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<SearchResult> get(String normalizedQuery, int limit) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(normalizedQuery, limit)));
    }

    @Override
    public void put(String normalizedQuery, int limit, SearchResult result) {
        cache.put(new CacheKey(normalizedQuery, limit), result);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("search.cache_invalidated");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    @Override
    public void onMerge(long primaryId, List<Long> mergedIds) {
        invalidateAll();
    }

    @Override
    public void onResolved(ResolutionResult result) {
        invalidateAll();
    }

    record CacheKey(String normalizedQuery, int limit) {}
}
