package com.warden.scope;

import java.util.Optional;
import java.util.Set;

/**
 * Classification of a scope change.
 */
public enum ChangeType {
    ADDED("added"),
    REMOVED("removed"),
    MODIFIED("modified");

    private final String value;

    ChangeType(String value) {
        this.value = value;
    }

    /** Wire value used in change events and notifications. */
    public String value() {
        return value;
    }

    /**
     * Classifies a change between two non-identical snapshots. {@code added} when the new snapshot
     * strictly contains the old one, {@code removed} when it is strictly contained by it,
     * {@code modified} otherwise. Capabilities and roles are compared together.
     */
    public static ChangeType classify(
            Set<String> oldCapabilities, Set<String> newCapabilities,
            Set<String> oldRoles, Set<String> newRoles) {
        boolean grew = newCapabilities.containsAll(oldCapabilities) && newRoles.containsAll(oldRoles);
        boolean shrank = oldCapabilities.containsAll(newCapabilities) && oldRoles.containsAll(newRoles);
        if (grew && !shrank) {
            return ADDED;
        }
        if (shrank && !grew) {
            return REMOVED;
        }
        return MODIFIED;
    }

    public static Optional<ChangeType> fromString(String value) {
        for (ChangeType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
