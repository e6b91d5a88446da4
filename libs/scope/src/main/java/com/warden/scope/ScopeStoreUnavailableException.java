package com.warden.scope;

/**
 * Thrown when a persistence collaborator cannot serve a request. Callers fail closed.
 */
public class ScopeStoreUnavailableException extends RuntimeException {

    public ScopeStoreUnavailableException(String message) {
        super(message);
    }

    public ScopeStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
