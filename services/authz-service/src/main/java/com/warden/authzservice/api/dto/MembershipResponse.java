package com.warden.authzservice.api.dto;

import java.util.List;
import java.util.Set;

/** Roles and capabilities visible to a user in a tenant, global memberships included. */
public record MembershipResponse(
        String userId, String tenantId, List<String> roles, Set<String> capabilities, long scopeVersion) {}
