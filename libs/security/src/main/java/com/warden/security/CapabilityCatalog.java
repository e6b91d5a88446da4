package com.warden.security;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry of every known role plus the static role hierarchy.
 *
 * <p>Reads go against an immutable snapshot published through a volatile field, so lookups never
 * block. Custom-role registration copies the snapshot under a lock and republishes it; two
 * concurrent registrations of the same name cannot both succeed.
 */
public final class CapabilityCatalog {

    private final RoleHierarchy hierarchy;
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile Map<String, Role> roles;

    /**
     * @throws RoleCatalogException if the hierarchy names an undefined role or a configured role
     *     carries a malformed capability
     */
    public CapabilityCatalog(Collection<Role> configuredRoles, RoleHierarchy hierarchy) {
        Map<String, Role> byName = new LinkedHashMap<>();
        for (Role role : configuredRoles) {
            if (byName.putIfAbsent(role.name(), role) != null) {
                throw new RoleCatalogException("Role '%s' is defined twice".formatted(role.name()));
            }
            var invalid = Capabilities.invalidEntries(role.directCapabilities());
            if (!invalid.isEmpty()) {
                throw new RoleCatalogException(
                        "Role '%s' has malformed capabilities %s".formatted(role.name(), invalid));
            }
        }
        for (String level : hierarchy.levels()) {
            if (!byName.containsKey(level)) {
                throw new RoleCatalogException(
                        "Role hierarchy references undefined role '%s'".formatted(level));
            }
        }
        this.hierarchy = hierarchy;
        this.roles = Collections.unmodifiableMap(byName);
    }

    public Optional<Role> role(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(roles.get(name));
    }

    public boolean contains(String name) {
        return name != null && roles.containsKey(name);
    }

    /** Role names in definition order: configured roles first, then custom roles by creation. */
    public Set<String> roleNames() {
        return roles.keySet();
    }

    public RoleHierarchy hierarchy() {
        return hierarchy;
    }

    /**
     * Adds a runtime role.
     *
     * @throws DuplicateRoleException if a role with the same name already exists
     * @throws CapabilityFormatException if any capability is malformed
     */
    public Role registerCustomRole(String name, Set<String> capabilities, String description) {
        Capabilities.requireValid(capabilities);
        writeLock.lock();
        try {
            if (roles.containsKey(name)) {
                throw new DuplicateRoleException(name);
            }
            Role role = new Role(name, capabilities, description, true);
            Map<String, Role> next = new LinkedHashMap<>(roles);
            next.put(name, role);
            roles = Collections.unmodifiableMap(next);
            return role;
        } finally {
            writeLock.unlock();
        }
    }
}
