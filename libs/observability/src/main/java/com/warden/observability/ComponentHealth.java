package com.warden.observability;

/**
 * Health of one collaborator, e.g. {@code scope-store} or {@code policy-engine}.
 *
 * @param name component name
 * @param status component status
 * @param message optional detail (error text, disabled notice)
 * @param latencyMs time the probe took
 */
public record ComponentHealth(String name, HealthStatus status, String message, long latencyMs) {

    public static ComponentHealth healthy(String name, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, null, latencyMs);
    }

    public static ComponentHealth degraded(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.DEGRADED, message, latencyMs);
    }

    public static ComponentHealth unhealthy(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.UNHEALTHY, message, latencyMs);
    }
}
