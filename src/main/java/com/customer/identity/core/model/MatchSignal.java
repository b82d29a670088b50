package com.customer.identity.core.model;

/**
 * Contact signal shared between two customers.
 */
public enum MatchSignal {
    EMAIL,
    PHONE
}
