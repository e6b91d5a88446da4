package com.warden.authzservice.config;

import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Scope versioning, sweep, session and push settings, bound from {@code warden.scope.*}.
 *
 * <pre>
 * warden:
 *   scope:
 *     version-checking:
 *       max-age: 30m
 *     polling:
 *       interval: 30s
 *       batch-size: 100
 *     session:
 *       access-token-ttl: 30m
 *     notifications:
 *       max-connections-per-user: 5
 *     excluded-paths: [/actuator, /api/v1/sessions/login]
 * </pre>
 */
@ConfigurationProperties(prefix = "warden.scope")
@Validated
public record ScopeProperties(
        @DefaultValue VersionChecking versionChecking,
        @DefaultValue Polling polling,
        @DefaultValue Session session,
        @DefaultValue Notifications notifications,
        List<String> excludedPaths) {

    public static final List<String> DEFAULT_EXCLUDED_PATHS = List.of(
            "/actuator", "/api/v1/sessions/login", "/api/v1/capabilities/validate", "/api/v1/info");

    public ScopeProperties {
        if (excludedPaths == null || excludedPaths.isEmpty()) {
            excludedPaths = DEFAULT_EXCLUDED_PATHS;
        }
    }

    /**
     * @param maxAge age after which a session's last confirmed check makes the sweep re-verify it
     * @param checkOnApiRequest whether authenticated requests are checked against the current version
     */
    public record VersionChecking(@DefaultValue("30m") Duration maxAge, @DefaultValue("true") boolean checkOnApiRequest) {}

    /**
     * @param enabled whether the reconciliation sweep runs
     * @param interval delay between sweeps
     * @param batchSize maximum events and sessions handled per sweep
     */
    public record Polling(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("30s") Duration interval,
            @DefaultValue("100") @Positive int batchSize) {}

    /** @param accessTokenTtl lifetime of an issued session */
    public record Session(@DefaultValue("30m") Duration accessTokenTtl) {}

    /**
     * @param maxConnectionsPerUser live push connections allowed per user; the oldest is closed
     *     when exceeded
     * @param connectionTimeout idle timeout of a push connection
     */
    public record Notifications(
            @DefaultValue("5") @Positive int maxConnectionsPerUser,
            @DefaultValue("5m") Duration connectionTimeout) {}
}
