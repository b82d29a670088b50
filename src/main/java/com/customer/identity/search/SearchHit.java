package com.customer.identity.search;

import com.customer.identity.core.model.Customer;
import com.customer.identity.core.model.Provider;

import java.util.Set;

/**
 * One ranked search result.
 *
 * @param customer        the matching customer
 * @param score           tiered score; {@code 0} for substring fallback results, which are not scored
 * @param linkedProviders providers with an identity for this customer
 */
public record SearchHit(Customer customer, double score, Set<Provider> linkedProviders) {

    public SearchHit {
        linkedProviders = linkedProviders != null ? Set.copyOf(linkedProviders) : Set.of();
    }

    public long customerId() {
        return customer.getId();
    }
}
