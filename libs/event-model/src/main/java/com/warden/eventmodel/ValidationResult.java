package com.warden.eventmodel;

import java.util.List;

/**
 * Outcome of {@link EventValidator}.
 *
 * @param valid true if no errors were found
 * @param errors human-readable error messages, empty when valid
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }
}
