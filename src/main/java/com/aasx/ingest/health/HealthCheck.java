package com.aasx.ingest.health;

/**
 * A probe of one component.
 */
public interface HealthCheck {

    /**
     * Gets the name the status is reported under.
     *
     * @return check name
     */
    String getName();

    /**
     * Performs the check. Implementations report failures in the returned status
     * instead of throwing.
     *
     * @return current status with details
     */
    HealthStatus check();
}
