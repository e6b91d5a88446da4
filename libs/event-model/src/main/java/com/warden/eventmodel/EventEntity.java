package com.warden.eventmodel;

/**
 * The aggregate an event belongs to.
 *
 * <p>For scope events the {@code entityId} is the scope key ({@code user@tenant}) and the
 * {@code sequence} is the new scope version, so consumers can order events per key without
 * reading the payload.
 *
 * @param entityType the kind of entity, e.g. "Scope", "Session"
 * @param entityId unique identifier of the entity instance
 * @param sequence monotonically increasing number for this entity
 */
public record EventEntity(String entityType, String entityId, long sequence) {

    /** Builds an entity reference from a known {@link EntityType}. */
    public static EventEntity of(EntityType type, String entityId, long sequence) {
        return new EventEntity(type.value(), entityId, sequence);
    }
}
