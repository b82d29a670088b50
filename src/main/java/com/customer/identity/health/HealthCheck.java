package com.customer.identity.health;

/**
 * A check of one dependency of the identity engine, such as the database or the sync cursors.
 */
public interface HealthCheck {

    /**
     * Key of this check in the aggregate status details.
     */
    String getName();

    /**
     * Probes the dependency. Implementations report failures as {@link HealthStatus.Status#DOWN}
     * rather than throwing.
     */
    HealthStatus check();
}
