package com.warden.authzservice.config;

import com.warden.observability.ComponentHealth;
import com.warden.observability.HealthCheckRegistry;
import com.warden.observability.MetricFactory;
import com.warden.observability.SpanHelper;
import com.warden.scope.ScopeVersionManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.util.concurrent.CompletableFuture;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics, tracing and component health beans.
 *
 * <p>Tracing goes through the global OpenTelemetry instance, which is a no-op until an agent or SDK
 * registers itself.
 */
@Configuration
public class ObservabilityConfig {

    static final String SCOPE_STORE_PROBE_USER = "__health__";

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    @Bean
    public SpanHelper spanHelper(ServiceProperties service) {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(service.name()));
    }

    @Bean
    public HealthCheckRegistry healthCheckRegistry(ScopeVersionManager versions) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register("scope-store", () -> CompletableFuture.supplyAsync(() -> {
            long start = System.nanoTime();
            versions.getVersion(SCOPE_STORE_PROBE_USER, null);
            return ComponentHealth.healthy("scope-store", (System.nanoTime() - start) / 1_000_000);
        }));
        return registry;
    }
}
