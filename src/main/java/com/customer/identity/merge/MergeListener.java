package com.customer.identity.merge;

import java.util.List;

/**
 * Listener for customer merges, e.g. to invalidate cached search results.
 */
public interface MergeListener {

    /**
     * Called after a merge has committed.
     *
     * @param primaryId the surviving customer
     * @param mergedIds the customers that were merged into it and deleted
     */
    void onMerge(long primaryId, List<Long> mergedIds);
}
