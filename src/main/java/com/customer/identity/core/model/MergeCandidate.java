package com.customer.identity.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Another customer that shares at least one email or phone with the customer under review.
 * Always recomputed from current data, never persisted.
 *
 * @param customer  the other customer
 * @param matchedOn the signals that are shared
 */
public record MergeCandidate(Customer customer, Set<MatchSignal> matchedOn) {

    public MergeCandidate {
        matchedOn = matchedOn == null || matchedOn.isEmpty()
                ? Set.of() : Set.copyOf(EnumSet.copyOf(matchedOn));
    }

    public long customerId() {
        return customer.getId();
    }
}
