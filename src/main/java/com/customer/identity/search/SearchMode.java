package com.customer.identity.search;

/**
 * Which search path produced a result.
 */
public enum SearchMode {
    /**
     * Candidate retrieval plus tiered scoring.
     */
    RANKED,

    /**
     * Substring match over the customer table, used when ranked search is unavailable.
     */
    FALLBACK
}
