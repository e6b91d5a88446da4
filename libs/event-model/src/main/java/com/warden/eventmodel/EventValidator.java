package com.warden.eventmodel;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates envelopes and scope change payloads before they leave the core.
 *
 * <p>All errors are collected and returned at once in a {@link ValidationResult}.
 */
public final class EventValidator {

    private EventValidator() {
        // utility class
    }

    /** Checks the envelope metadata. */
    public static ValidationResult validate(EventEnvelope<?> event) {
        List<String> errors = new ArrayList<>();

        if (isBlank(event.eventId())) {
            errors.add("eventId must not be null or blank");
        }
        if (isBlank(event.eventType())) {
            errors.add("eventType must not be null or blank");
        } else if (EventType.fromString(event.eventType()).isEmpty()) {
            errors.add("eventType '" + event.eventType() + "' is not a known event type");
        }
        if (event.eventVersion() < 1) {
            errors.add("eventVersion must be >= 1");
        }
        if (event.occurredAt() == null) {
            errors.add("occurredAt must not be null");
        }
        if (isBlank(event.producer())) {
            errors.add("producer must not be null or blank");
        }
        if (isBlank(event.tenantId())) {
            errors.add("tenantId must not be null or blank");
        }
        if (event.entity() == null) {
            errors.add("entity must not be null");
        } else if (isBlank(event.entity().entityId())) {
            errors.add("entity.entityId must not be null or blank");
        }
        if (event.payload() instanceof ScopeChangeNotification notification) {
            errors.addAll(validate(notification).errors());
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    /**
     * Checks a scope change payload: a version step of exactly one, a known change type and a
     * non-empty difference.
     */
    public static ValidationResult validate(ScopeChangeNotification notification) {
        List<String> errors = new ArrayList<>();

        if (!ScopeChangeNotification.TYPE.equals(notification.type())) {
            errors.add("type must be '" + ScopeChangeNotification.TYPE + "'");
        }
        if (isBlank(notification.userId())) {
            errors.add("user_id must not be null or blank");
        }
        if (notification.oldVersion() < 1) {
            errors.add("old_version must be >= 1");
        }
        if (notification.newVersion() != notification.oldVersion() + 1) {
            errors.add("new_version must equal old_version + 1");
        }
        if (!List.of("added", "removed", "modified").contains(notification.changeType())) {
            errors.add("change_type must be one of added, removed, modified");
        }
        if (notification.changedCapabilities().isEmpty() && notification.changedRoles().isEmpty()) {
            errors.add("a scope change must change at least one capability or role");
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
