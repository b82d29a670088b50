package com.customer.identity.search;

import java.util.List;

/**
 * Result of a customer search.
 *
 * @param query        the query as typed
 * @param detectedType how the query was interpreted
 * @param mode         {@link SearchMode#FALLBACK} when ranked retrieval failed and substring
 *                     search answered instead
 * @param hits         results, best first
 */
public record SearchResult(String query, QueryType detectedType, SearchMode mode, List<SearchHit> hits) {

    public SearchResult {
        hits = hits != null ? List.copyOf(hits) : List.of();
    }

    public static SearchResult empty(String query) {
        return new SearchResult(query, QueryType.NAME, SearchMode.RANKED, List.of());
    }

    public boolean isFallback() {
        return mode == SearchMode.FALLBACK;
    }

    public List<Long> customerIds() {
        return hits.stream().map(SearchHit::customerId).toList();
    }
}
