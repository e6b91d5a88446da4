package com.warden.scope;

import com.warden.eventmodel.EventFactory;

/**
 * Identifies one scope: a principal within a tenant, or within the global scope.
 *
 * @param userId principal
 * @param tenantId tenant, or {@value #GLOBAL} when the scope is not tenant-bound
 */
public record ScopeKey(String userId, String tenantId) {

    public static final String GLOBAL = EventFactory.GLOBAL_TENANT;

    public ScopeKey {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        tenantId = normalizeTenant(tenantId);
    }

    public static ScopeKey of(String userId, String tenantId) {
        return new ScopeKey(userId, tenantId);
    }

    public static ScopeKey global(String userId) {
        return new ScopeKey(userId, GLOBAL);
    }

    /** Maps an absent tenant to {@value #GLOBAL}. */
    public static String normalizeTenant(String tenantId) {
        return tenantId == null || tenantId.isBlank() ? GLOBAL : tenantId;
    }

    public boolean isGlobal() {
        return GLOBAL.equals(tenantId);
    }

    @Override
    public String toString() {
        return userId + "@" + tenantId;
    }
}
