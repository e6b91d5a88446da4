package com.warden.scope;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Authorization state captured when a session was issued.
 *
 * <p>Immutable; the lifecycle methods return updated copies that the repository stores in place
 * of the original. Only {@code lastScopeCheckAt} and {@code active} change after issuance.
 *
 * @param sessionId session identity
 * @param token opaque bearer token; never log it
 * @param userId principal
 * @param tenantId tenant, or {@code "global"}
 * @param roles roles active at issuance
 * @param capabilities effective capabilities at issuance
 * @param scopeVersion scope version at issuance
 * @param issuedAt issuance time
 * @param expiresAt expiry time
 * @param lastScopeCheckAt last time the scope version was confirmed current
 * @param active false once expired or invalidated
 */
public record SessionSnapshot(
        String sessionId,
        String token,
        String userId,
        String tenantId,
        List<String> roles,
        Set<String> capabilities,
        long scopeVersion,
        Instant issuedAt,
        Instant expiresAt,
        Instant lastScopeCheckAt,
        boolean active) {

    public SessionSnapshot {
        tenantId = ScopeKey.normalizeTenant(tenantId);
        roles = roles == null ? List.of() : List.copyOf(roles);
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }

    public ScopeKey key() {
        return ScopeKey.of(userId, tenantId);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public SessionSnapshot checkedAt(Instant instant) {
        return new SessionSnapshot(sessionId, token, userId, tenantId, roles, capabilities,
                scopeVersion, issuedAt, expiresAt, instant, active);
    }

    public SessionSnapshot deactivated() {
        return new SessionSnapshot(sessionId, token, userId, tenantId, roles, capabilities,
                scopeVersion, issuedAt, expiresAt, lastScopeCheckAt, false);
    }

    @Override
    public String toString() {
        return "SessionSnapshot[sessionId=%s, key=%s@%s, scopeVersion=%d, active=%s]"
                .formatted(sessionId, userId, tenantId, scopeVersion, active);
    }
}
