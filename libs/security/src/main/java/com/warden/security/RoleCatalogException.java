package com.warden.security;

/**
 * Configuration error in the role catalog: unknown role in the hierarchy, malformed capability,
 * duplicate hierarchy level or an unreadable file.
 *
 * <p>Raised while loading, so a bad catalog stops startup instead of failing requests later.
 */
public class RoleCatalogException extends RuntimeException {

    public RoleCatalogException(String message) {
        super(message);
    }

    public RoleCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
