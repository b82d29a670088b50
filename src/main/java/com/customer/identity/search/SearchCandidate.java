package com.customer.identity.search;

import com.customer.identity.core.model.Customer;
import com.customer.identity.core.model.Provider;

import java.util.List;
import java.util.Set;

/**
 * A customer returned by candidate retrieval, with everything the scorer needs.
 *
 * @param customer       the customer row
 * @param emails         every known email (primary and identities), lower-cased
 * @param phoneKeys      last ten digits of every known phone
 * @param providers      providers with an identity for this customer
 * @param textRank       full-text relevance reported by the store, 0 when not computed
 */
public record SearchCandidate(
        Customer customer,
        List<String> emails,
        List<String> phoneKeys,
        Set<Provider> providers,
        double textRank
) {

    public SearchCandidate {
        emails = emails != null ? List.copyOf(emails) : List.of();
        phoneKeys = phoneKeys != null ? List.copyOf(phoneKeys) : List.of();
        providers = providers != null ? Set.copyOf(providers) : Set.of();
    }
}
