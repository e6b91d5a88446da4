package com.warden.authzservice.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * External policy engine, bound from {@code warden.policy.*}.
 *
 * @param enabled when false the local capability check decides and the engine is never called
 * @param url engine base URL
 * @param policyPackage dotted package evaluated for authorization decisions
 * @param timeout bound on one evaluation; exceeding it denies
 */
@ConfigurationProperties(prefix = "warden.policy")
@Validated
public record PolicyProperties(boolean enabled, String url, String policyPackage, Duration timeout) {

    public PolicyProperties {
        if (url == null || url.isBlank()) {
            url = "http://localhost:8181";
        }
        if (policyPackage == null || policyPackage.isBlank()) {
            policyPackage = "warden.authz";
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            timeout = Duration.ofSeconds(5);
        }
    }
}
