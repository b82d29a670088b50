package com.customer.identity.store;

/**
 * Customer fields carried by an inbound record. {@code null} means "not supplied".
 */
public record ProfileUpdate(
        String email,
        String phone,
        String firstName,
        String lastName,
        String company
) {

    /**
     * How supplied values combine with the stored ones.
     */
    public enum Mode {
        /**
         * Supplied name and company replace stored values; email and phone only fill gaps.
         */
        REFRESH,

        /**
         * Every supplied value only fills a stored {@code null}.
         */
        FILL_MISSING
    }
}
