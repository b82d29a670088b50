package com.customer.identity.core.model;

import java.util.Locale;

/**
 * Source systems that contribute customer identities.
 * Each provider has a stable storage code used in the {@code customer_identities.provider} column.
 */
public enum Provider {
    STOREFRONT("storefront"),
    MARKETPLACE("marketplace"),
    ACCOUNTING("accounting"),
    FULFILLMENT("fulfillment"),
    MANUAL("manual"),
    SELF_REPORTED("self_reported");

    private final String code;

    Provider(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Looks up a provider by its storage code (case-insensitive).
     *
     * @throws IllegalArgumentException if the code is unknown
     */
    public static Provider fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Provider code must not be null");
        }
        String lower = code.trim().toLowerCase(Locale.ROOT);
        for (Provider provider : values()) {
            if (provider.code.equals(lower)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown provider: " + code);
    }
}
