package com.warden.security;

import java.util.List;
import java.util.Set;

/**
 * Identity and authorization state attached to an authenticated request.
 *
 * <p>The capability set is the one captured when the session was issued; the scope version
 * records which scope state it was derived from.
 *
 * @param userId authenticated user
 * @param tenantId tenant the session was issued for
 * @param sessionId session backing the request
 * @param roles roles active when the session was issued
 * @param capabilities effective capabilities captured with the session
 * @param scopeVersion scope version the session was derived from
 * @param correlationId trace correlation ID for this request
 */
public record WardenSecurityContext(
        String userId,
        String tenantId,
        String sessionId,
        List<String> roles,
        Set<String> capabilities,
        long scopeVersion,
        String correlationId) {

    public WardenSecurityContext {
        roles = roles == null ? List.of() : List.copyOf(roles);
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }

    public boolean hasCapability(String required) {
        return Capabilities.hasCapability(capabilities, required);
    }
}
