package com.customer.identity.address;

/**
 * Address components, in the order they contribute to a fingerprint.
 */
public enum AddressField {
    NAME,
    LINE1,
    LINE2,
    CITY,
    REGION,
    POSTAL_CODE,
    COUNTRY
}
