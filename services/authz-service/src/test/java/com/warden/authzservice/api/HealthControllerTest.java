package com.warden.authzservice.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.warden.observability.HealthCheckRegistry;
import com.warden.observability.HealthStatus;
import com.warden.observability.testing.InMemoryHealthCheck;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

@DisplayName("HealthController")
class HealthControllerTest {

    private InMemoryHealthCheck scopeStore;
    private HealthController controller;

    @BeforeEach
    void setUp() {
        HealthCheckRegistry registry = new HealthCheckRegistry(200);
        scopeStore = new InMemoryHealthCheck("scope-store");
        registry.register("scope-store", scopeStore);
        controller = new HealthController(registry);
    }

    @Test
    @DisplayName("answers 200 while every component is healthy")
    void healthy() {
        var response = controller.components();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().status()).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    @DisplayName("still answers 200 when a component is degraded")
    void degraded() {
        scopeStore.setDegraded("slow");

        var response = controller.components();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().status()).isEqualTo(HealthStatus.DEGRADED);
    }

    @Test
    @DisplayName("answers 503 when a component is unhealthy")
    void unhealthy() {
        scopeStore.setUnhealthy("store unreachable");

        var response = controller.components();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().checks().get("scope-store").message()).isEqualTo("store unreachable");
    }
}
