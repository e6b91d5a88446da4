package com.warden.authzservice.infrastructure.web;

/** Thrown when an endpoint needs a session and the request has none. Mapped to 401. */
public class AuthenticationRequiredException extends RuntimeException {

    public AuthenticationRequiredException() {
        super("Authentication required");
    }
}
