package com.warden.observability;

/**
 * Per-request identifiers that end up in every log line and metric of an authorization decision.
 *
 * <p>The filter chain creates the context with only a correlation ID; once the bearer token is
 * resolved it is replaced by a copy carrying the principal ({@link #withPrincipal}).
 *
 * @param correlationId unique ID for the request flow, never blank
 * @param tenantId tenant of the authenticated session (nullable before authentication)
 * @param userId authenticated principal (nullable before authentication)
 * @param sessionId session that authenticated the request (nullable)
 * @param scopeVersion scope version stamped on the session (nullable)
 */
public record CorrelationContext(
        String correlationId, String tenantId, String userId, String sessionId, Long scopeVersion) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_TENANT_ID = "tenantId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_SESSION_ID = "sessionId";
    public static final String MDC_SCOPE_VERSION = "scopeVersion";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Context for a request that is not (yet) authenticated. */
    public static CorrelationContext anonymous(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null, null);
    }

    /** Copy of this context enriched with the authenticated principal. */
    public CorrelationContext withPrincipal(
            String userId, String tenantId, String sessionId, long scopeVersion) {
        return new CorrelationContext(correlationId, tenantId, userId, sessionId, scopeVersion);
    }
}
