package com.warden.security;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A named bundle of direct capabilities.
 *
 * <p>Roles never change once built. Custom roles created at runtime are new instances registered
 * in the {@link CapabilityCatalog}.
 *
 * @param name unique role name
 * @param directCapabilities capabilities declared on this role, without inheritance
 * @param description optional human-readable description
 * @param custom true for roles created at runtime, false for roles from configuration
 */
public record Role(String name, Set<String> directCapabilities, String description, boolean custom) {

    public Role {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        directCapabilities =
                directCapabilities == null
                        ? Set.of()
                        : Collections.unmodifiableSet(new LinkedHashSet<>(directCapabilities));
    }

    /** A role defined in configuration. */
    public static Role configured(String name, Set<String> capabilities, String description) {
        return new Role(name, capabilities, description, false);
    }

    /** Whether this role declares the universal wildcard directly. */
    public boolean isWildcard() {
        return directCapabilities.contains(Capabilities.WILDCARD);
    }
}
