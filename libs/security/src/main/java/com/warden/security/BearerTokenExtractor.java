package com.warden.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Pulls the opaque session token out of an HTTP Authorization header.
 */
public final class BearerTokenExtractor {

    private static final String PREFIX = "bearer ";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Accepts {@code "Bearer <token>"} with a case-insensitive scheme.
     *
     * @param authorizationHeader the Authorization header value, may be null
     * @return the token, or empty if the header is missing, uses another scheme or has no token
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() <= PREFIX.length()
                || !trimmed.toLowerCase(Locale.ROOT).startsWith(PREFIX)) {
            return Optional.empty();
        }
        String token = trimmed.substring(PREFIX.length()).strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
