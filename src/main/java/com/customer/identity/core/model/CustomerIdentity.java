package com.customer.identity.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One provider-specific signal observed for a customer.
 * {@code (provider, externalId)} is unique whenever {@code externalId} is present.
 */
public final class CustomerIdentity {

    /**
     * Prefix of the synthetic external id used for address-only identities.
     */
    public static final String ADDRESS_HASH_PREFIX = "address_hash:";

    private final Long id;
    private final long customerId;
    private final Provider provider;
    private final String externalId;
    private final String email;
    private final String phone;
    private final Map<String, Object> metadata;
    private final Instant createdAt;
    private final Instant updatedAt;

    private CustomerIdentity(Builder builder) {
        this.id = builder.id;
        this.customerId = builder.customerId;
        this.provider = builder.provider;
        this.externalId = builder.externalId;
        this.email = builder.email;
        this.phone = builder.phone;
        this.metadata = builder.metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata)) : Map.of();
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public Long getId() {
        return id;
    }

    public long getCustomerId() {
        return customerId;
    }

    public Provider getProvider() {
        return provider;
    }

    public String getExternalId() {
        return externalId;
    }

    public String getEmail() {
        return email;
    }

    public String getPhone() {
        return phone;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Returns the address fingerprint carried by this identity, either as its synthetic
     * external id or as the {@code addressHash} metadata entry.
     */
    public String getAddressHash() {
        if (externalId != null && externalId.startsWith(ADDRESS_HASH_PREFIX)) {
            return externalId.substring(ADDRESS_HASH_PREFIX.length());
        }
        Object hash = metadata.get("addressHash");
        return hash != null ? hash.toString() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CustomerIdentity that = (CustomerIdentity) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CustomerIdentity{" +
                "id=" + id +
                ", customerId=" + customerId +
                ", provider=" + provider +
                ", externalId='" + externalId + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(CustomerIdentity identity) {
        return new Builder()
                .id(identity.id)
                .customerId(identity.customerId)
                .provider(identity.provider)
                .externalId(identity.externalId)
                .email(identity.email)
                .phone(identity.phone)
                .metadata(identity.metadata)
                .createdAt(identity.createdAt)
                .updatedAt(identity.updatedAt);
    }

    public static class Builder {
        private Long id;
        private long customerId;
        private Provider provider;
        private String externalId;
        private String email;
        private String phone;
        private Map<String, Object> metadata;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder customerId(long customerId) {
            this.customerId = customerId;
            return this;
        }

        public Builder provider(Provider provider) {
            this.provider = provider;
            return this;
        }

        public Builder externalId(String externalId) {
            this.externalId = externalId;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public CustomerIdentity build() {
            Objects.requireNonNull(provider, "provider is required");
            return new CustomerIdentity(this);
        }
    }
}
