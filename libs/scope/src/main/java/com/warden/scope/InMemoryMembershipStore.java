package com.warden.scope;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

public class InMemoryMembershipStore implements MembershipStore {

    private final Map<ScopeKey, Membership> memberships = new ConcurrentHashMap<>();

    @Override
    public Optional<Membership> load(String userId, String tenantId) {
        return Optional.ofNullable(memberships.get(ScopeKey.of(userId, tenantId)));
    }

    @Override
    public void save(Membership membership) {
        memberships.put(membership.key(), membership);
    }

    @Override
    public boolean deactivate(String userId, String tenantId, Instant at) {
        AtomicBoolean flipped = new AtomicBoolean();
        memberships.computeIfPresent(ScopeKey.of(userId, tenantId), (key, membership) -> {
            if (!membership.active()) {
                return membership;
            }
            flipped.set(true);
            return membership.deactivated(at);
        });
        return flipped.get();
    }

    @Override
    public List<Membership> activeMemberships(String userId, Collection<String> tenantIds) {
        return tenantIds.stream()
                .distinct()
                .map(tenant -> memberships.get(ScopeKey.of(userId, tenant)))
                .filter(m -> m != null && m.active())
                .toList();
    }
}
