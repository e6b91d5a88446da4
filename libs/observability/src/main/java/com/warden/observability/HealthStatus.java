package com.warden.observability;

/** Health of a single collaborator or of the service as a whole. */
public enum HealthStatus {

    /** Working normally. */
    HEALTHY,

    /** Reachable but impaired; authorization still answers, possibly by failing closed. */
    DEGRADED,

    /** Unreachable; every decision depending on it is denied. */
    UNHEALTHY
}
