package com.customer.identity.core.model;

/**
 * Outcome of resolving one inbound record against the unified customer set.
 */
public enum ResolutionAction {
    /**
     * No existing customer matched; a customer and identity were created.
     */
    CREATED,

    /**
     * The record's identity key was already known; the owning customer was refreshed.
     */
    UPDATED,

    /**
     * Exactly one existing customer matched by contact signal; a new identity now points at it.
     */
    LINKED,

    /**
     * Several distinct customers matched. Nothing was written; the record needs human review.
     */
    AMBIGUOUS
}
