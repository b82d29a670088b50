package com.customer.identity.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Unified customer record. Owns any number of {@link CustomerIdentity} rows, one per
 * provider-specific signal. Instances are immutable; use {@link #builder(Customer)} to derive
 * a modified copy.
 */
public final class Customer {
    private final Long id;
    private final String primaryEmail;
    private final String primaryPhone;
    private final String firstName;
    private final String lastName;
    private final String company;
    private final boolean vip;
    private final String creditRiskLevel;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Customer(Builder builder) {
        this.id = builder.id;
        this.primaryEmail = builder.primaryEmail;
        this.primaryPhone = builder.primaryPhone;
        this.firstName = builder.firstName;
        this.lastName = builder.lastName;
        this.company = builder.company;
        this.vip = builder.vip;
        this.creditRiskLevel = builder.creditRiskLevel;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public Long getId() {
        return id;
    }

    public String getPrimaryEmail() {
        return primaryEmail;
    }

    public String getPrimaryPhone() {
        return primaryPhone;
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

    public boolean isVip() {
        return vip;
    }

    public String getCreditRiskLevel() {
        return creditRiskLevel;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * First and last name joined by a single space, or an empty string when both are absent.
     */
    public String getFullName() {
        String first = firstName != null ? firstName.trim() : "";
        String last = lastName != null ? lastName.trim() : "";
        return (first + " " + last).trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Customer customer = (Customer) o;
        return Objects.equals(id, customer.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Customer{" +
                "id=" + id +
                ", primaryEmail='" + primaryEmail + '\'' +
                ", primaryPhone='" + primaryPhone + '\'' +
                ", name='" + getFullName() + '\'' +
                ", company='" + company + '\'' +
                ", vip=" + vip +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Customer customer) {
        return new Builder()
                .id(customer.id)
                .primaryEmail(customer.primaryEmail)
                .primaryPhone(customer.primaryPhone)
                .firstName(customer.firstName)
                .lastName(customer.lastName)
                .company(customer.company)
                .vip(customer.vip)
                .creditRiskLevel(customer.creditRiskLevel)
                .createdAt(customer.createdAt)
                .updatedAt(customer.updatedAt);
    }

    public static class Builder {
        private Long id;
        private String primaryEmail;
        private String primaryPhone;
        private String firstName;
        private String lastName;
        private String company;
        private boolean vip;
        private String creditRiskLevel;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder primaryEmail(String primaryEmail) {
            this.primaryEmail = primaryEmail;
            return this;
        }

        public Builder primaryPhone(String primaryPhone) {
            this.primaryPhone = primaryPhone;
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

        public Builder vip(boolean vip) {
            this.vip = vip;
            return this;
        }

        public Builder creditRiskLevel(String creditRiskLevel) {
            this.creditRiskLevel = creditRiskLevel;
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

        public Customer build() {
            return new Customer(this);
        }
    }
}
