package com.warden.authzservice.api;

/** Thrown by controllers when the addressed resource does not exist. Mapped to 404. */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
