package com.warden.scope;

import com.warden.security.Capabilities;
import com.warden.security.CapabilityResolver;
import com.warden.security.UnknownRoleException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns and removes roles, keeping memberships and scope versions in step.
 *
 * <p>After every membership write the scope of the affected (user, tenant) is set to what the
 * principal can see in that tenant: the tenant's membership plus any global membership. The version
 * therefore moves only when that view changes. The membership write, the recompute of the view
 * and the version update run under the scope key's update lock, so concurrent assignments for the
 * same key leave the scope content equal to the last membership written.
 */
public class RoleAssignmentService {

    private static final Logger log = LoggerFactory.getLogger(RoleAssignmentService.class);

    private final CapabilityResolver resolver;
    private final MembershipStore memberships;
    private final ScopeVersionManager versions;
    private final Clock clock;

    public RoleAssignmentService(
            CapabilityResolver resolver, MembershipStore memberships, ScopeVersionManager versions,
            Clock clock) {
        this.resolver = resolver;
        this.memberships = memberships;
        this.versions = versions;
        this.clock = clock;
    }

    /**
     * Gives {@code userId} the single active role {@code role} in {@code tenantId}, replacing any
     * previous role there.
     *
     * @throws UnknownRoleException if the catalog does not define {@code role}
     */
    public RoleAssignment assignRole(String userId, String role, String tenantId) {
        if (!resolver.isKnownRole(role)) {
            throw new UnknownRoleException(role);
        }
        String tenant = ScopeKey.normalizeTenant(tenantId);
        Set<String> capabilities = resolver.effectiveCapabilities(role);

        RoleAssignment assignment = versions.withKeyLock(ScopeKey.of(userId, tenant), () -> {
            Instant now = clock.instant();
            Instant createdAt = memberships.load(userId, tenant)
                    .map(Membership::createdAt)
                    .orElse(now);
            memberships.save(new Membership(
                    userId, tenant, role, new ArrayList<>(capabilities), true, createdAt, now));

            long previous = versions.getVersion(userId, tenant);
            long version = refreshScope(userId, tenant);
            return new RoleAssignment(userId, tenant, role, capabilities, previous, version);
        });
        log.info("Assigned role '{}' to {}@{} (scope version {})", role, userId, tenant, assignment.scopeVersion());
        return assignment;
    }

    /**
     * Deactivates the membership of {@code userId} in {@code tenantId}.
     *
     * @return the scope version after removal, or empty if there was no active membership
     */
    public Optional<Long> removeRole(String userId, String tenantId) {
        String tenant = ScopeKey.normalizeTenant(tenantId);
        Optional<Long> version = versions.withKeyLock(ScopeKey.of(userId, tenant), () ->
                memberships.deactivate(userId, tenant, clock.instant())
                        ? Optional.of(refreshScope(userId, tenant))
                        : Optional.<Long>empty());
        if (version.isEmpty()) {
            log.debug("No active membership to remove for {}@{}", userId, tenant);
        } else {
            log.info("Removed role of {}@{} (scope version {})", userId, tenant, version.get());
        }
        return version;
    }

    /** Distinct roles of active memberships in {@code tenantId} and the global scope. */
    public List<String> userRoles(String userId, String tenantId) {
        Set<String> roles = new LinkedHashSet<>();
        for (Membership membership : memberships.activeMemberships(userId, visibleTenants(tenantId))) {
            roles.add(membership.role());
        }
        return List.copyOf(roles);
    }

    /**
     * Union of the capability snapshots of the same memberships as {@link #userRoles}; collapses to
     * {@code {*}} when any snapshot holds the wildcard.
     */
    public Set<String> userCapabilities(String userId, String tenantId) {
        Set<String> capabilities = new LinkedHashSet<>();
        for (Membership membership : memberships.activeMemberships(userId, visibleTenants(tenantId))) {
            if (membership.capabilities().contains(Capabilities.WILDCARD)) {
                return Set.of(Capabilities.WILDCARD);
            }
            capabilities.addAll(membership.capabilities());
        }
        return Set.copyOf(capabilities);
    }

    /** Whether the capabilities {@code userId} holds in {@code tenantId} satisfy {@code capability}. */
    public boolean checkCapability(String userId, String capability, String tenantId) {
        return Capabilities.hasCapability(userCapabilities(userId, tenantId), capability);
    }

    // caller holds the key lock
    private long refreshScope(String userId, String tenant) {
        return versions.update(userId, tenant, userCapabilities(userId, tenant), userRoles(userId, tenant));
    }

    private static List<String> visibleTenants(String tenantId) {
        String tenant = ScopeKey.normalizeTenant(tenantId);
        return ScopeKey.GLOBAL.equals(tenant) ? List.of(ScopeKey.GLOBAL) : List.of(tenant, ScopeKey.GLOBAL);
    }
}
