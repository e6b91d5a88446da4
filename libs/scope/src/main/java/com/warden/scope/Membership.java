package com.warden.scope;

import java.time.Instant;
import java.util.List;

/**
 * Role held by a principal in one tenant (or globally), with the capability snapshot computed at
 * assignment time. Removal flips {@code active}; rows are never deleted.
 */
public record Membership(
        String userId,
        String tenantId,
        String role,
        List<String> capabilities,
        boolean active,
        Instant createdAt,
        Instant updatedAt) {

    public Membership {
        tenantId = ScopeKey.normalizeTenant(tenantId);
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }

    public ScopeKey key() {
        return ScopeKey.of(userId, tenantId);
    }

    public Membership deactivated(Instant at) {
        return new Membership(userId, tenantId, role, capabilities, false, createdAt, at);
    }
}
