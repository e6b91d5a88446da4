package com.warden.security;

/** Thrown when a custom role would shadow an existing role. */
public class DuplicateRoleException extends RuntimeException {

    private final String role;

    public DuplicateRoleException(String role) {
        super("Role '%s' already exists".formatted(role));
        this.role = role;
    }

    public String role() {
        return role;
    }
}
