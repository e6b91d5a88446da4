package com.warden.security;

/**
 * Thrown when a request attempts to access scope data belonging to a different tenant.
 * <p>
 * Unchecked; a tenant mismatch is a security error and is never retried.
 */
public class TenantMismatchException extends RuntimeException {

    private final String contextTenantId;
    private final String resourceTenantId;

    public TenantMismatchException(String contextTenantId, String resourceTenantId) {
        super("Tenant mismatch: session tenant '%s' cannot access data of tenant '%s'"
                .formatted(contextTenantId, resourceTenantId));
        this.contextTenantId = contextTenantId;
        this.resourceTenantId = resourceTenantId;
    }

    public String contextTenantId() {
        return contextTenantId;
    }

    public String resourceTenantId() {
        return resourceTenantId;
    }
}
