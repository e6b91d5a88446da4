package com.warden.authzservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code warden.service.*}.
 *
 * @param name service name used in logs and as the {@code service} metric tag. Required.
 * @param environment deployment environment, defaults to {@code development}
 * @param description human-readable description for the info endpoint
 */
@ConfigurationProperties(prefix = "warden.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment, String description) {

    /** Runs before Bean Validation, so defaults satisfy constraints. */
    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
