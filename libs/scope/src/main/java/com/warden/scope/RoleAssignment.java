package com.warden.scope;

import java.util.Set;

/**
 * Result of a role assignment.
 *
 * @param userId principal
 * @param tenantId tenant, or {@code "global"}
 * @param role assigned role
 * @param capabilities capability snapshot stored on the membership
 * @param previousVersion scope version before the assignment
 * @param scopeVersion scope version after the assignment
 */
public record RoleAssignment(
        String userId,
        String tenantId,
        String role,
        Set<String> capabilities,
        long previousVersion,
        long scopeVersion) {

    public RoleAssignment {
        capabilities = Set.copyOf(capabilities);
    }

    public boolean scopeChanged() {
        return scopeVersion != previousVersion;
    }
}
