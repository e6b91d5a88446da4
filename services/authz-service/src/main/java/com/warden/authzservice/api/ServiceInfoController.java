package com.warden.authzservice.api;

import com.warden.authzservice.config.PolicyProperties;
import com.warden.authzservice.config.ServiceProperties;
import com.warden.security.CapabilityResolver;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight runtime info. Actuator's {@code /actuator/info} carries build metadata; this adds
 * the service identity and the authorization mode.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final ServiceProperties properties;
    private final PolicyProperties policy;
    private final CapabilityResolver resolver;

    public ServiceInfoController(ServiceProperties properties, PolicyProperties policy, CapabilityResolver resolver) {
        this.properties = properties;
        this.policy = policy;
        this.resolver = resolver;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "description", properties.description() != null ? properties.description() : "",
                "policy_engine", policy.enabled() ? "enabled" : "disabled",
                "roles", resolver.listAvailableRoles().size(),
                "status", "running",
                "timestamp", Instant.now().toString());
    }
}
