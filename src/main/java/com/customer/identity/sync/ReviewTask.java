package com.customer.identity.sync;

import com.customer.identity.core.model.MatchMethod;
import com.customer.identity.core.model.Provider;

import java.time.Instant;
import java.util.List;

/**
 * Request for a human to decide which customer, if any, owns a record.
 *
 * @param sourceType           cursor key of the job that saw the record
 * @param recordKey            the record's key in its source
 * @param provider             the record's provider
 * @param matchedBy            the signal shared by the candidates
 * @param candidateCustomerIds customers that could own the record
 * @param createdAt            when the ambiguity was detected
 */
public record ReviewTask(
        String sourceType,
        String recordKey,
        Provider provider,
        MatchMethod matchedBy,
        List<Long> candidateCustomerIds,
        Instant createdAt
) {
    public ReviewTask {
        candidateCustomerIds = List.copyOf(candidateCustomerIds);
    }
}
