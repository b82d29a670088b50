package com.customer.identity.store;

import com.customer.identity.core.model.Customer;
import com.customer.identity.core.model.CustomerIdentity;
import com.customer.identity.core.model.Provider;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence for customers and their identities.
 * All email and phone arguments are expected in normalized form.
 */
public interface CustomerRepository {

    Optional<Customer> findById(long customerId);

    /**
     * Returns the ids among {@code customerIds} that exist.
     */
    Set<Long> findExistingIds(Collection<Long> customerIds);

    Optional<CustomerIdentity> findIdentity(Provider provider, String externalId);

    List<CustomerIdentity> findIdentities(long customerId);

    /**
     * Customers whose primary email, or any identity email, equals {@code email}.
     */
    Set<Long> findCustomerIdsByEmail(String email);

    /**
     * Customers whose primary phone, or any identity phone, equals {@code phone}.
     */
    Set<Long> findCustomerIdsByPhone(String phone);

    /**
     * Customers owning an identity of {@code provider} that carries the address fingerprint,
     * either as its synthetic external id or in its metadata.
     */
    Set<Long> findCustomerIdsByAddressHash(Provider provider, String addressHash);

    /**
     * Inserts a customer and, when given, its first identity in one transaction. If the identity's
     * {@code (provider, externalId)} is claimed concurrently, the insert is rolled back and the
     * existing owner is returned with {@code created == false}.
     *
     * @param identity identity to attach; its {@code customerId} is ignored. May be {@code null}.
     */
    default CreateOutcome createWithIdentity(Customer customer, CustomerIdentity identity) {
        return createWithIdentity(customer, identity, List.of());
    }

    /**
     * Like {@link #createWithIdentity(Customer, CustomerIdentity)}, also attaching
     * {@code additionalIdentities} in the same transaction once the first identity is stored.
     * An additional identity whose key is already taken is skipped.
     */
    CreateOutcome createWithIdentity(Customer customer, CustomerIdentity identity,
                                     List<CustomerIdentity> additionalIdentities);

    /**
     * Attaches an identity to the customer named by {@code identity.getCustomerId()}.
     * A keyed identity whose key is already taken is returned unchanged; a key-less identity that
     * repeats an existing (customer, provider, email, phone) row refreshes that row instead.
     */
    IdentityWrite linkIdentity(CustomerIdentity identity);

    /**
     * Refreshes the identity keyed by {@code (provider, externalId)}: supplied email and phone
     * replace stored values, metadata entries are merged.
     */
    CustomerIdentity refreshIdentity(Provider provider, String externalId,
                                     String email, String phone, Map<String, Object> metadata);

    Customer updateProfile(long customerId, ProfileUpdate update, ProfileUpdate.Mode mode);
}
