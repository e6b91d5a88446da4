package com.warden.observability;

import java.util.concurrent.CompletableFuture;

/**
 * Probe of a single collaborator of the authorization core.
 *
 * <p>Probes run concurrently in {@link HealthCheckRegistry}; a probe that needs network I/O
 * should complete its future off the calling thread.
 */
@FunctionalInterface
public interface HealthCheck {

    CompletableFuture<ComponentHealth> check();
}
