package com.warden.scope;

/**
 * Counters from one reconciliation pass.
 *
 * @param eventsPublished change events handed to the notifier and marked processed
 * @param deliveryFailures events whose delivery threw
 * @param sessionsInvalidated sessions found behind their scope version and deactivated
 * @param sessionsRefreshed sessions whose version was re-confirmed after the check grew old
 */
public record ReconciliationReport(
        int eventsPublished, int deliveryFailures, int sessionsInvalidated, int sessionsRefreshed) {

    public boolean isEmpty() {
        return eventsPublished == 0 && sessionsInvalidated == 0 && sessionsRefreshed == 0;
    }
}
