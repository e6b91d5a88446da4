package com.warden.scope;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persisted (user, tenant) to role mapping. Each operation is a single-row transaction; at most one
 * membership exists per key.
 */
public interface MembershipStore {

    Optional<Membership> load(String userId, String tenantId);

    /** Inserts or replaces the membership for its key. */
    void save(Membership membership);

    /** Logically deletes; returns false when there was no active membership. */
    boolean deactivate(String userId, String tenantId, Instant at);

    /** Active memberships of {@code userId} in any of {@code tenantIds}. */
    List<Membership> activeMemberships(String userId, Collection<String> tenantIds);
}
