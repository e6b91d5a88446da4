package com.warden.eventmodel;

import java.util.Optional;

/**
 * Event types emitted by the authorization core.
 *
 * <p>The {@code value} field holds the string used in JSON.
 */
public enum EventType {

    SCOPE_CHANGED("ScopeChanged");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    /** The canonical string representation used in JSON (e.g. "ScopeChanged"). */
    public String value() {
        return value;
    }

    /**
     * Looks up an EventType by its canonical string value.
     *
     * @param value the string to match (e.g. "ScopeChanged")
     * @return the matching EventType, or empty if not found
     */
    public static Optional<EventType> fromString(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
