package com.warden.scope;

import com.warden.eventmodel.ScopeChangeNotification;
import java.time.Instant;
import java.util.List;

/**
 * Append-only record of one version bump. For a given key, {@code newVersion} is always
 * {@code oldVersion + 1} and events are stored in version order.
 */
public record ScopeChangeEvent(
        String eventId,
        ScopeKey key,
        long oldVersion,
        long newVersion,
        List<String> changedCapabilities,
        List<String> changedRoles,
        ChangeType changeType,
        Instant timestamp) {

    public ScopeChangeEvent {
        if (newVersion != oldVersion + 1) {
            throw new IllegalArgumentException(
                    "newVersion must be oldVersion + 1, got %d -> %d".formatted(oldVersion, newVersion));
        }
        changedCapabilities = List.copyOf(changedCapabilities);
        changedRoles = List.copyOf(changedRoles);
    }

    public String userId() {
        return key.userId();
    }

    public String tenantId() {
        return key.tenantId();
    }

    /** Flat push payload for live connections. */
    public ScopeChangeNotification toNotification() {
        return ScopeChangeNotification.of(
                key.userId(),
                key.tenantId(),
                oldVersion,
                newVersion,
                changeType.value(),
                changedCapabilities,
                changedRoles);
    }
}
