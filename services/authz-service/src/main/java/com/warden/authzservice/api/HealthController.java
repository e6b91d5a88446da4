package com.warden.authzservice.api;

import com.warden.observability.HealthCheckRegistry;
import com.warden.observability.HealthResult;
import com.warden.observability.HealthStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Per-component health. Unhealthy answers 503; degraded still answers 200. */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckRegistry registry;

    public HealthController(HealthCheckRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/components")
    public ResponseEntity<HealthResult> components() {
        HealthResult result = registry.checkAll();
        HttpStatus status = result.status() == HealthStatus.UNHEALTHY ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }
}
