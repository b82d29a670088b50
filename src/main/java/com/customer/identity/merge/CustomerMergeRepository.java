package com.customer.identity.merge;

import com.customer.identity.core.model.MergeCandidate;

import java.util.List;

/**
 * Persistence operations behind the merge workflow.
 */
public interface CustomerMergeRepository {

    /**
     * Other customers sharing an email or phone with any of the customer's own contact points
     * (primary fields and identities).
     */
    List<MergeCandidate> findMergeCandidates(long customerId);

    /**
     * Moves every reference from {@code losingIds} to {@code primaryId} and deletes the losing
     * customers, atomically. Either everything moves or nothing changes.
     *
     * @throws IllegalStateException if a customer disappeared before the merge could lock it
     */
    MergeCounts merge(long primaryId, List<Long> losingIds, List<ReferencingTable> tables);

    List<DuplicateContactGroup> findDuplicateContactGroups(int limit);
}
