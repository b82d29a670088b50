package com.customer.identity.store;

import com.customer.identity.core.model.Customer;
import com.customer.identity.core.model.CustomerIdentity;

/**
 * Result of an atomic customer-plus-identity insert.
 *
 * @param customer the created customer, or the customer that already owned the identity key
 * @param identity the created or pre-existing identity; {@code null} when no identity was requested
 * @param created  {@code false} when a concurrent writer had already claimed the identity key,
 *                 in which case nothing was inserted
 */
public record CreateOutcome(Customer customer, CustomerIdentity identity, boolean created) {
}
