package com.warden.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.warden.observability.testing.InMemoryHealthCheck;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("HealthCheckRegistry")
class HealthCheckRegistryTest {

    private HealthCheckRegistry registry;
    private InMemoryHealthCheck scopeStore;
    private InMemoryHealthCheck policyEngine;

    @BeforeEach
    void setUp() {
        registry = new HealthCheckRegistry(200);
        scopeStore = new InMemoryHealthCheck("scope-store");
        policyEngine = new InMemoryHealthCheck("policy-engine");
        registry.register("scope-store", scopeStore);
        registry.register("policy-engine", policyEngine);
    }

    @Nested
    @DisplayName("aggregation")
    class Aggregation {

        @Test
        @DisplayName("all healthy yields HEALTHY")
        void allHealthy() {
            assertThat(registry.checkAll().status()).isEqualTo(HealthStatus.HEALTHY);
        }

        @Test
        @DisplayName("one degraded component degrades the whole")
        void degraded() {
            policyEngine.setDegraded("disabled, local checks only");

            var result = registry.checkAll();

            assertThat(result.status()).isEqualTo(HealthStatus.DEGRADED);
            assertThat(result.checks().get("policy-engine").message())
                    .isEqualTo("disabled, local checks only");
        }

        @Test
        @DisplayName("unhealthy wins over degraded")
        void unhealthyWins() {
            policyEngine.setDegraded("slow");
            scopeStore.setUnhealthy("down");

            assertThat(registry.checkAll().status()).isEqualTo(HealthStatus.UNHEALTHY);
        }

        @Test
        @DisplayName("a failing probe counts as unhealthy")
        void failingProbe() {
            scopeStore.failWith(new IllegalStateException("boom"));

            var result = registry.checkAll();

            assertThat(result.status()).isEqualTo(HealthStatus.UNHEALTHY);
            assertThat(result.checks().get("scope-store").message()).contains("boom");
        }

        @Test
        @DisplayName("a probe that never completes times out as unhealthy")
        void timeout() {
            registry.register("stuck", CompletableFuture::new);

            var result = registry.checkAll();

            assertThat(result.checks().get("stuck").status()).isEqualTo(HealthStatus.UNHEALTHY);
        }
    }

    @Test
    @DisplayName("empty registry is healthy")
    void emptyRegistry() {
        assertThat(new HealthCheckRegistry().checkAll().status()).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    @DisplayName("registration validates arguments")
    void validatesArguments() {
        assertThatThrownBy(() -> registry.register("", scopeStore))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register("x", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HealthCheckRegistry(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.deregister("scope-store")).isTrue();
        assertThat(registry.size()).isEqualTo(1);
    }
}
