package com.customer.identity.merge;

import com.customer.identity.core.model.MatchSignal;

import java.util.List;

/**
 * Customers that share a primary email or phone. Produced for operator reconciliation of
 * duplicates created by concurrent first sightings of the same person.
 */
public record DuplicateContactGroup(MatchSignal signal, String value, List<Long> customerIds) {

    public DuplicateContactGroup {
        customerIds = List.copyOf(customerIds);
    }
}
