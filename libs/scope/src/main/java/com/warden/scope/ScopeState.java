package com.warden.scope;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Current authorization content of one scope.
 *
 * <p>Only {@link ScopeVersionManager} creates new states. A key with no stored state behaves as
 * {@link #initial} at version {@value #INITIAL_VERSION}.
 *
 * @param key scope identity
 * @param version monotonically increasing, starts at {@value #INITIAL_VERSION}
 * @param capabilities capability snapshot, kept sorted
 * @param roles role snapshot, kept sorted
 * @param updatedAt when this version was written, null for the lazy initial state
 */
public record ScopeState(
        ScopeKey key, long version, Set<String> capabilities, Set<String> roles, Instant updatedAt) {

    public static final long INITIAL_VERSION = 1L;

    public ScopeState {
        if (version < INITIAL_VERSION) {
            throw new IllegalArgumentException("version must be >= " + INITIAL_VERSION);
        }
        capabilities = sorted(capabilities);
        roles = sorted(roles);
    }

    public static ScopeState initial(ScopeKey key) {
        return new ScopeState(key, INITIAL_VERSION, Set.of(), Set.of(), null);
    }

    /** True when both sets equal the given ones, ignoring order and duplicates. */
    public boolean sameContent(Set<String> otherCapabilities, Set<String> otherRoles) {
        return capabilities.equals(otherCapabilities) && roles.equals(otherRoles);
    }

    private static Set<String> sorted(Set<String> values) {
        return values == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(values));
    }
}
