package com.warden.security;

/**
 * Compares the request's tenant with the tenant of the resource being accessed.
 *
 * <p>Holders of the universal wildcard operate across tenants; everyone else is confined to the
 * tenant their session was issued for.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * @throws TenantMismatchException if the tenants differ and the caller is not a wildcard holder
     */
    public static void enforce(WardenSecurityContext context, String resourceTenantId) {
        if (context.capabilities().contains(Capabilities.WILDCARD)) {
            return;
        }
        if (!context.tenantId().equals(resourceTenantId)) {
            throw new TenantMismatchException(context.tenantId(), resourceTenantId);
        }
    }
}
