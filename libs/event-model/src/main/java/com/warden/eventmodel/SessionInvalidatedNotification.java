package com.warden.eventmodel;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload pushed when one or more sessions of a principal were invalidated.
 *
 * @param type always {@value #TYPE}
 * @param userId affected principal
 * @param tenantId affected tenant, or {@code "global"}
 * @param reason machine-readable reason, e.g. {@code scope_change}, {@code expired}
 * @param message human-readable hint for the client
 */
public record SessionInvalidatedNotification(
        @JsonProperty("type") String type,
        @JsonProperty("user_id") String userId,
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("reason") String reason,
        @JsonProperty("message") String message) {

    public static final String TYPE = "session_invalidated";

    /** Creates a notification with the standard type and message. */
    public static SessionInvalidatedNotification of(String userId, String tenantId, String reason) {
        return new SessionInvalidatedNotification(
                TYPE,
                userId,
                tenantId,
                reason,
                "Your session has been invalidated. Please log in again.");
    }
}
