package com.warden.security;

import java.util.List;
import java.util.Set;

/**
 * Read view of a role for administration endpoints.
 *
 * @param name role name
 * @param directCapabilities capabilities declared on the role itself
 * @param effectiveCapabilities capabilities after hierarchy expansion
 * @param inheritsFrom roles dominated in the hierarchy, lowest first
 * @param description human-readable description, may be null
 * @param custom whether the role was created at runtime
 */
public record RoleDefinition(
        String name,
        Set<String> directCapabilities,
        Set<String> effectiveCapabilities,
        List<String> inheritsFrom,
        String description,
        boolean custom) {}
