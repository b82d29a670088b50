package com.customer.identity.store;

import com.customer.identity.core.model.CustomerIdentity;

/**
 * Result of linking an identity to a customer.
 *
 * @param identity the stored identity row
 * @param inserted {@code true} for a new row, {@code false} when an existing row was reused
 */
public record IdentityWrite(CustomerIdentity identity, boolean inserted) {
}
