package com.customer.identity.core.model;

/**
 * Signal that decided a resolution.
 */
public enum MatchMethod {
    EXTERNAL_ID,
    ADDRESS_HASH,
    EMAIL,
    PHONE,
    NONE
}
