package com.worker.lookup.health;

/**
 * A single health probe of the lookup subsystem (error rate, cache, ...).
 */
public interface HealthCheck {

    /**
     * Returns the name the check is reported under.
     */
    String getName();

    /**
     * Runs the check.
     */
    HealthStatus check();
}
