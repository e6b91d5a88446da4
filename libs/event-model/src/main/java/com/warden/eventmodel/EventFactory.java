package com.warden.eventmodel;

import java.time.Instant;
import java.util.UUID;

/**
 * Factory methods for {@link EventEnvelope} instances.
 *
 * <p>Assigns event IDs, fills in a missing correlation ID and lays out the scope-key entity.
 */
public final class EventFactory {

    /** Tenant value used for platform-wide (non-tenant) scopes. */
    public static final String GLOBAL_TENANT = "global";

    private EventFactory() {
        // utility class
    }

    /**
     * Wraps a scope change notification. The entity is the scope key and its sequence is the new
     * scope version.
     */
    public static EventEnvelope<ScopeChangeNotification> scopeChanged(
            ScopeChangeNotification notification,
            Instant occurredAt,
            String producer,
            String correlationId) {
        String tenantId = tenantOrGlobal(notification.tenantId());
        return new EventEnvelope<>(
                UUID.randomUUID().toString(),
                EventType.SCOPE_CHANGED.value(),
                1,
                occurredAt,
                producer,
                tenantId,
                notification.userId(),
                correlationIdOrNew(correlationId),
                EventEntity.of(
                        EntityType.SCOPE,
                        scopeEntityId(notification.userId(), tenantId),
                        notification.newVersion()),
                notification);
    }

    /** Entity ID of a scope key, {@code user@tenant}. */
    public static String scopeEntityId(String userId, String tenantId) {
        return userId + "@" + tenantOrGlobal(tenantId);
    }

    private static String tenantOrGlobal(String tenantId) {
        return tenantId == null || tenantId.isBlank() ? GLOBAL_TENANT : tenantId;
    }

    private static String correlationIdOrNew(String correlationId) {
        return correlationId == null || correlationId.isBlank()
                ? UUID.randomUUID().toString()
                : correlationId;
    }
}
