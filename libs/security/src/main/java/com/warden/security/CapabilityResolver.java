package com.warden.security;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes effective capabilities from roles using the catalog and its hierarchy.
 *
 * <p>Rules for a single role:
 *
 * <ul>
 *   <li>a role that holds {@code *} directly resolves to exactly {@code {*}}
 *   <li>otherwise its direct capabilities are unioned with those of every dominated role, except
 *       that a dominated role holding {@code *} contributes nothing
 *   <li>an unknown role resolves to the empty set
 * </ul>
 *
 * Pure apart from reading the catalog; safe to share.
 */
public class CapabilityResolver {

    private static final Logger log = LoggerFactory.getLogger(CapabilityResolver.class);
    private static final Set<String> WILDCARD_ONLY = Set.of(Capabilities.WILDCARD);

    private final CapabilityCatalog catalog;

    public CapabilityResolver(CapabilityCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Direct capabilities of {@code role} plus those of every role it dominates. A role declaring
     * {@code *} resolves to {@code {*}}; a dominated wildcard role is not flattened upward.
     */
    public Set<String> effectiveCapabilities(String role) {
        Optional<Role> definition = catalog.role(role);
        if (definition.isEmpty()) {
            log.debug("Resolving capabilities for unknown role '{}'", role);
            return Set.of();
        }
        if (definition.get().isWildcard()) {
            return WILDCARD_ONLY;
        }
        Set<String> effective = new LinkedHashSet<>(definition.get().directCapabilities());
        for (String lower : catalog.hierarchy().dominatedBy(role)) {
            catalog.role(lower)
                    .filter(r -> !r.isWildcard())
                    .ifPresent(r -> effective.addAll(r.directCapabilities()));
        }
        return Collections.unmodifiableSet(effective);
    }

    /** Union over several roles; collapses to {@code {*}} as soon as any role grants it. */
    public Set<String> effectiveCapabilities(Collection<String> roles) {
        Set<String> effective = new LinkedHashSet<>();
        for (String role : roles) {
            Set<String> capabilities = effectiveCapabilities(role);
            if (capabilities.contains(Capabilities.WILDCARD)) {
                return WILDCARD_ONLY;
            }
            effective.addAll(capabilities);
        }
        return Collections.unmodifiableSet(effective);
    }

    /** Whether {@code effective} satisfies {@code required}; see {@link Capabilities#hasCapability}. */
    public boolean hasCapability(Set<String> effective, String required) {
        return Capabilities.hasCapability(effective, required);
    }

    /** Whether {@code capability} is {@code *}, {@code ns:action} or {@code ns:action*}. */
    public boolean validateCapabilityFormat(String capability) {
        return Capabilities.isValidFormat(capability);
    }

    /** Whether the catalog defines {@code role}, configured or custom. */
    public boolean isKnownRole(String role) {
        return catalog.contains(role);
    }

    /** Role names in catalog order: configured roles first, then custom ones. */
    public Set<String> listAvailableRoles() {
        return catalog.roleNames();
    }

    /** Describes {@code role}, or empty when the catalog does not define it. */
    public Optional<RoleDefinition> roleDefinition(String role) {
        return catalog.role(role).map(r -> new RoleDefinition(
                r.name(),
                r.directCapabilities(),
                effectiveCapabilities(r.name()),
                List.copyOf(catalog.hierarchy().dominatedBy(r.name())),
                r.description(),
                r.custom()));
    }

    /**
     * Creates a runtime role. Custom roles sit outside the hierarchy, so they resolve to their
     * direct capabilities only.
     *
     * @throws IllegalArgumentException if {@code name} is blank or no capabilities are given
     * @throws DuplicateRoleException if the name is taken
     * @throws CapabilityFormatException if a capability is malformed
     */
    public Role createCustomRole(String name, Set<String> capabilities, String description) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Role name must not be blank");
        }
        if (capabilities == null || capabilities.isEmpty()) {
            throw new IllegalArgumentException("Custom role needs at least one capability");
        }
        String resolvedDescription =
                description == null || description.isBlank() ? "Custom role: " + name : description;
        Role role = catalog.registerCustomRole(name, capabilities, resolvedDescription);
        log.info("Created custom role '{}' with capabilities {}", name, role.directCapabilities());
        return role;
    }
}
