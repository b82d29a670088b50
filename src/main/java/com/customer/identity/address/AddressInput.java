package com.customer.identity.address;

/**
 * A loosely structured postal address as received from a provider.
 * Any component may be {@code null}.
 */
public record AddressInput(
        String name,
        String line1,
        String line2,
        String city,
        String region,
        String postalCode,
        String country
) {

    /**
     * Returns the raw value of one component.
     */
    public String get(AddressField field) {
        return switch (field) {
            case NAME -> name;
            case LINE1 -> line1;
            case LINE2 -> line2;
            case CITY -> city;
            case REGION -> region;
            case POSTAL_CODE -> postalCode;
            case COUNTRY -> country;
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String line1;
        private String line2;
        private String city;
        private String region;
        private String postalCode;
        private String country;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder line1(String line1) {
            this.line1 = line1;
            return this;
        }

        public Builder line2(String line2) {
            this.line2 = line2;
            return this;
        }

        public Builder city(String city) {
            this.city = city;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder postalCode(String postalCode) {
            this.postalCode = postalCode;
            return this;
        }

        public Builder country(String country) {
            this.country = country;
            return this;
        }

        public AddressInput build() {
            return new AddressInput(name, line1, line2, city, region, postalCode, country);
        }
    }
}
