package com.warden.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON serialization for envelopes and for the flat push payloads.
 *
 * <p>One mapper writes instants as ISO-8601 strings for both envelopes and push payloads.
 */
public final class EventSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private EventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Serializes an event envelope to JSON.
     *
     * @throws EventSerializationException if serialization fails
     */
    public static String serialize(EventEnvelope<?> event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize event: " + event.eventId(), e);
        }
    }

    /**
     * Serializes a push payload (e.g. {@link ScopeChangeNotification}) to JSON.
     *
     * @throws EventSerializationException if serialization fails
     */
    public static String serializePayload(Object payload) {
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(
                    "Failed to serialize payload of type " + payload.getClass().getSimpleName(), e);
        }
    }

    /**
     * Deserializes an envelope with a known payload type.
     *
     * @throws EventSerializationException if the JSON is malformed
     */
    public static <T> EventEnvelope<T> deserialize(String json, Class<T> payloadType) {
        try {
            JavaType type =
                    MAPPER.getTypeFactory().constructParametricType(EventEnvelope.class, payloadType);
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to deserialize event", e);
        }
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /** Thrown when event JSON cannot be written or read. */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
