package com.warden.observability;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs every registered {@link HealthCheck} concurrently and folds the results into a
 * {@link HealthResult}. A probe that throws or exceeds the timeout counts as unhealthy.
 */
public final class HealthCheckRegistry {

    public static final long DEFAULT_TIMEOUT_MS = 5000;

    private final Map<String, HealthCheck> checks = new ConcurrentHashMap<>();
    private final long timeoutMs;

    public HealthCheckRegistry() {
        this(DEFAULT_TIMEOUT_MS);
    }

    /**
     * @param timeoutMs per-probe timeout in milliseconds
     */
    public HealthCheckRegistry(long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        this.timeoutMs = timeoutMs;
    }

    /** Registers (or replaces) the probe for a component. */
    public void register(String name, HealthCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
    }

    public boolean deregister(String name) {
        return checks.remove(name) != null;
    }

    /** Runs all probes; an empty registry is healthy. */
    public HealthResult checkAll() {
        if (checks.isEmpty()) {
            return new HealthResult(HealthStatus.HEALTHY, Map.of(), Instant.now());
        }

        Map<String, CompletableFuture<ComponentHealth>> futures = new LinkedHashMap<>();
        for (Map.Entry<String, HealthCheck> entry : checks.entrySet()) {
            futures.put(entry.getKey(), startProbe(entry.getKey(), entry.getValue()));
        }

        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;
        for (Map.Entry<String, CompletableFuture<ComponentHealth>> entry : futures.entrySet()) {
            String name = entry.getKey();
            ComponentHealth result;
            try {
                result = entry.getValue().orTimeout(timeoutMs, TimeUnit.MILLISECONDS).join();
            } catch (Exception e) {
                result = ComponentHealth.unhealthy(name, "Timeout or error: " + e.getMessage(), timeoutMs);
            }
            results.put(name, result);
            overall = worst(overall, result.status());
        }

        return new HealthResult(overall, results, Instant.now());
    }

    public int size() {
        return checks.size();
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    private static CompletableFuture<ComponentHealth> startProbe(String name, HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(
                    ComponentHealth.unhealthy(name, "Probe failed: " + e.getMessage(), 0));
        }
    }

    private static HealthStatus worst(HealthStatus a, HealthStatus b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
