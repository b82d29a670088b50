package com.customer.identity.cache;

import com.customer.identity.search.SearchResult;

import java.util.Optional;

/**
 * Cache that never stores anything.
 */
public class NoOpSearchResultCache implements SearchResultCache {

    @Override
    public Optional<SearchResult> get(String normalizedQuery, int limit) {
        return Optional.empty();
    }

    @Override
    public void put(String normalizedQuery, int limit, SearchResult result) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
