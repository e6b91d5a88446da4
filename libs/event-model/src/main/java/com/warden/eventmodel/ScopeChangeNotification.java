package com.warden.eventmodel;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Payload pushed to live connections when a principal's scope changes.
 *
 * <p>Field names and types are a stable wire contract shared with the notification layer and
 * clients; do not rename them.
 *
 * @param type always {@value #TYPE}
 * @param userId affected principal
 * @param tenantId affected tenant, or {@code "global"}
 * @param oldVersion scope version before the change
 * @param newVersion scope version after the change ({@code oldVersion + 1})
 * @param changeType {@code added}, {@code removed} or {@code modified}
 * @param changedCapabilities symmetric difference of the old and new capability sets
 * @param changedRoles symmetric difference of the old and new role sets
 * @param message human-readable hint for the client
 */
public record ScopeChangeNotification(
        @JsonProperty("type") String type,
        @JsonProperty("user_id") String userId,
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("old_version") long oldVersion,
        @JsonProperty("new_version") long newVersion,
        @JsonProperty("change_type") String changeType,
        @JsonProperty("changed_capabilities") List<String> changedCapabilities,
        @JsonProperty("changed_roles") List<String> changedRoles,
        @JsonProperty("message") String message) {

    public static final String TYPE = "scope_change";

    public static final String DEFAULT_MESSAGE =
            "Your permissions have been updated. Please refresh your session.";

    public ScopeChangeNotification {
        changedCapabilities = changedCapabilities == null ? List.of() : List.copyOf(changedCapabilities);
        changedRoles = changedRoles == null ? List.of() : List.copyOf(changedRoles);
    }

    /** Creates a notification with the standard type and message. */
    public static ScopeChangeNotification of(
            String userId,
            String tenantId,
            long oldVersion,
            long newVersion,
            String changeType,
            List<String> changedCapabilities,
            List<String> changedRoles) {
        return new ScopeChangeNotification(
                TYPE,
                userId,
                tenantId,
                oldVersion,
                newVersion,
                changeType,
                changedCapabilities,
                changedRoles,
                DEFAULT_MESSAGE);
    }
}
