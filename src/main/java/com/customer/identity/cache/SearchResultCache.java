package com.customer.identity.cache;

import com.customer.identity.search.SearchResult;

import java.util.Optional;

/**
 * Cache of ranked search results, keyed by normalized query text and limit.
 */
public interface SearchResultCache {

    Optional<SearchResult> get(String normalizedQuery, int limit);

    void put(String normalizedQuery, int limit, SearchResult result);

    void invalidateAll();

    CacheStats getStats();
}
