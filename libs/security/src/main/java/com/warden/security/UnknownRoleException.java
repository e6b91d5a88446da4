package com.warden.security;

/** Thrown when an operation names a role the catalog does not define. */
public class UnknownRoleException extends RuntimeException {

    private final String role;

    public UnknownRoleException(String role) {
        super("Role '%s' is not configured".formatted(role));
        this.role = role;
    }

    public String role() {
        return role;
    }
}
