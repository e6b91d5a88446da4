package com.warden.eventmodel;

import java.time.Instant;

/**
 * Envelope wrapping every authorization event handed to downstream consumers.
 *
 * <p>The envelope carries identification, tenant and correlation metadata next to the
 * event-specific payload. The push channel to browsers does not use the envelope; it delivers the
 * flat payload ({@link ScopeChangeNotification}) whose field names are a stable contract.
 *
 * @param <T> the type of the payload
 * @param eventId unique identifier for this event instance (UUID v4)
 * @param eventType canonical event name, see {@link EventType}
 * @param eventVersion schema version of the payload, starts at 1
 * @param occurredAt when the underlying change was recorded
 * @param producer name of the component that produced the event
 * @param tenantId tenant the change applies to ({@code "global"} for platform-wide scopes)
 * @param userId principal whose authorization changed (nullable for catalog events)
 * @param correlationId correlation ID of the request that caused the change
 * @param entity the aggregate this event relates to
 * @param payload event-specific data
 */
public record EventEnvelope<T>(
        String eventId,
        String eventType,
        int eventVersion,
        Instant occurredAt,
        String producer,
        String tenantId,
        String userId,
        String correlationId,
        EventEntity entity,
        T payload) {}
