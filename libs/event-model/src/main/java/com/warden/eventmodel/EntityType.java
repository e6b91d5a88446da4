package com.warden.eventmodel;

/** Aggregates an authorization event can be about. */
public enum EntityType {
    SCOPE("Scope");

    private final String value;

    EntityType(String value) {
        this.value = value;
    }

    /** Canonical string representation. */
    public String value() {
        return value;
    }
}
