package com.customer.identity.search;

import java.util.List;

/**
 * Read access used by customer search.
 */
public interface CustomerSearchRepository {

    /**
     * Candidate retrieval: customers whose known emails or phones contain the query exactly,
     * whose name or company is trigram-similar to it, or whose search text matches it.
     * No scoring happens here; at most {@link CandidateQuery#candidateLimit()} rows are returned.
     */
    List<SearchCandidate> findCandidates(CandidateQuery query);

    /**
     * Substring search over the base customer table. Results are ordered by match strength
     * (exact email, first name, last name, other), then VIP, last update and id, all descending
     * except the match strength.
     */
    List<SearchCandidate> substringSearch(QueryType type, String term, int limit);
}
