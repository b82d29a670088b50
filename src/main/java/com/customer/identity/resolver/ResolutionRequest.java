package com.customer.identity.resolver;

import com.customer.identity.address.AddressInput;
import com.customer.identity.core.model.Provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Identifying fields of one inbound provider record. Every field except the provider is
 * optional; values are normalized by the resolver, not here.
 */
public final class ResolutionRequest {
    private final Provider provider;
    private final String externalId;
    private final String email;
    private final String phone;
    private final String firstName;
    private final String lastName;
    private final String company;
    private final Map<String, Object> metadata;
    private final AddressInput address;

    private ResolutionRequest(Builder builder) {
        this.provider = builder.provider;
        this.externalId = builder.externalId;
        this.email = builder.email;
        this.phone = builder.phone;
        this.firstName = builder.firstName;
        this.lastName = builder.lastName;
        this.company = builder.company;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.address = builder.address;
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

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public String getCompany() {
        return company;
    }

    /**
     * Provenance stored on the identity row, e.g. the source record id.
     */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public AddressInput getAddress() {
        return address;
    }

    /**
     * Whether the record carries an external id, an email, a phone or an address.
     * Records without any of them can still be resolved, but only ever create new customers.
     */
    public boolean hasIdentifyingSignal() {
        return !isBlank(externalId) || !isBlank(email) || !isBlank(phone) || address != null;
    }

    @Override
    public String toString() {
        return "ResolutionRequest{" +
                "provider=" + provider +
                ", externalId='" + externalId + '\'' +
                ", hasEmail=" + !isBlank(email) +
                ", hasPhone=" + !isBlank(phone) +
                ", hasAddress=" + (address != null) +
                '}';
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static Builder builder(Provider provider) {
        return new Builder().provider(provider);
    }

    public static class Builder {
        private Provider provider;
        private String externalId;
        private String email;
        private String phone;
        private String firstName;
        private String lastName;
        private String company;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private AddressInput address;

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

        public Builder firstName(String firstName) {
            this.firstName = firstName;
            return this;
        }

        public Builder lastName(String lastName) {
            this.lastName = lastName;
            return this;
        }

        public Builder company(String company) {
            this.company = company;
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder address(AddressInput address) {
            this.address = address;
            return this;
        }

        public ResolutionRequest build() {
            Objects.requireNonNull(provider, "provider is required");
            return new ResolutionRequest(this);
        }
    }
}
