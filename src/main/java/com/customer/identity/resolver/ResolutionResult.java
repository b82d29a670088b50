package com.customer.identity.resolver;

import com.customer.identity.core.model.MatchMethod;
import com.customer.identity.core.model.ResolutionAction;

import java.util.List;

/**
 * Decision taken for one inbound record.
 *
 * @param action               what the resolver did
 * @param customerId           the owning customer; {@code null} only when ambiguous
 * @param matchedBy            the signal that found the customer, {@link MatchMethod#NONE} on create
 * @param ambiguousCustomerIds the competing customers when ambiguous, otherwise empty
 */
public record ResolutionResult(
        ResolutionAction action,
        Long customerId,
        MatchMethod matchedBy,
        List<Long> ambiguousCustomerIds
) {
    public ResolutionResult {
        ambiguousCustomerIds = ambiguousCustomerIds != null ? List.copyOf(ambiguousCustomerIds) : List.of();
    }

    public static ResolutionResult created(long customerId) {
        return new ResolutionResult(ResolutionAction.CREATED, customerId, MatchMethod.NONE, List.of());
    }

    public static ResolutionResult updated(long customerId, MatchMethod matchedBy) {
        return new ResolutionResult(ResolutionAction.UPDATED, customerId, matchedBy, List.of());
    }

    public static ResolutionResult linked(long customerId, MatchMethod matchedBy) {
        return new ResolutionResult(ResolutionAction.LINKED, customerId, matchedBy, List.of());
    }

    public static ResolutionResult ambiguous(List<Long> candidateIds, MatchMethod matchedBy) {
        return new ResolutionResult(ResolutionAction.AMBIGUOUS, null, matchedBy, candidateIds);
    }

    public boolean isAmbiguous() {
        return action == ResolutionAction.AMBIGUOUS;
    }
}
