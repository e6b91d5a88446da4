package com.warden.observability;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate of all component probes.
 *
 * @param status worst status among the components
 * @param checks component results keyed by name
 * @param timestamp when the probes finished
 */
public record HealthResult(HealthStatus status, Map<String, ComponentHealth> checks, Instant timestamp) {

    public HealthResult {
        checks = Map.copyOf(checks);
    }
}
