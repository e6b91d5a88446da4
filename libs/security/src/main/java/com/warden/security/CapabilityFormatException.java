package com.warden.security;

import java.util.List;

/**
 * Thrown when a capability supplied at runtime does not follow the capability grammar.
 *
 * <p>Malformed input is rejected as a whole; nothing is coerced or silently dropped.
 */
public class CapabilityFormatException extends RuntimeException {

    private final List<String> invalidCapabilities;

    public CapabilityFormatException(List<String> invalidCapabilities) {
        super("Malformed capabilities: %s (expected namespace:action, namespace:* or *)"
                .formatted(invalidCapabilities));
        this.invalidCapabilities = List.copyOf(invalidCapabilities);
    }

    public List<String> invalidCapabilities() {
        return invalidCapabilities;
    }
}
