package com.fleetdeck.core.health;

/**
 * An extra component check contributed by an adapter, e.g. the SSH client.
 */
@FunctionalInterface
public interface HealthProbe {
    HealthStatus check();
}
