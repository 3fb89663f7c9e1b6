package com.speaker.standardization.health;

/**
 * Interface for individual health checks.
 * Implementations check one dependency of the pipeline and return a {@link HealthStatus}.
 */
public interface HealthCheck {

    /**
     * Returns the name of this health check.
     */
    String getName();

    /**
     * Performs the health check and returns the current status.
     */
    HealthStatus check();
}
