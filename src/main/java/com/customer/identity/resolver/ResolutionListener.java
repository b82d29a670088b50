package com.customer.identity.resolver;

/**
 * Listener for resolutions that wrote to the customer store, e.g. to invalidate cached search results.
 */
public interface ResolutionListener {

    /**
     * Called after a {@code CREATED}, {@code UPDATED} or {@code LINKED} resolution has committed.
     * Ambiguous results write nothing and are not reported.
     */
    void onResolved(ResolutionResult result);
}
