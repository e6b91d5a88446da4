package com.warden.authzservice.api.dto;

import com.warden.security.RoleDefinition;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * @param capabilities effective capabilities after hierarchy expansion
 * @param inheritedFrom roles this one dominates, lowest first
 */
public record RoleResponse(
        String role,
        Set<String> capabilities,
        Set<String> directCapabilities,
        List<String> inheritedFrom,
        String description,
        boolean custom) {

    public static RoleResponse from(RoleDefinition definition) {
        return new RoleResponse(
                definition.name(),
                new TreeSet<>(definition.effectiveCapabilities()),
                new TreeSet<>(definition.directCapabilities()),
                definition.inheritsFrom(),
                definition.description(),
                definition.custom());
    }
}
