package com.warden.scope;

import com.warden.eventmodel.SessionInvalidatedNotification;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One pass of the pull-side consistency sweep.
 *
 * <ol>
 *   <li>Drains pending change events to the notifier ({@link #publishPendingEvents}); a broken
 *       connection cannot wedge the log.
 *   <li>Deactivates sessions behind their scope version and tells their owners.
 *   <li>For sessions whose last check is too old, re-reads the version: still current refreshes the
 *       check time, behind invalidates.
 * </ol>
 */
public class ScopeReconciler {

    public static final String REASON_SCOPE_CHANGE = "scope_change";

    private static final Logger log = LoggerFactory.getLogger(ScopeReconciler.class);

    private final ScopeVersionManager versions;
    private final SessionRegistry sessions;
    private final ChangeNotifier notifier;

    public ScopeReconciler(ScopeVersionManager versions, SessionRegistry sessions, ChangeNotifier notifier) {
        this.versions = versions;
        this.sessions = sessions;
        this.notifier = notifier;
    }

    public ReconciliationReport reconcile(int batchSize) {
        ReconciliationReport drained = publishPendingEvents(batchSize);

        int invalidated = 0;
        int refreshed = 0;
        Set<ScopeKey> affected = new LinkedHashSet<>();
        List<SessionRef> refs = versions.sessionsNeedingUpdate();
        for (SessionRef ref : refs.subList(0, Math.min(batchSize, refs.size()))) {
            boolean behind = ref.isBehind()
                    || ref.sessionVersion() < versions.getVersion(ref.key().userId(), ref.key().tenantId());
            if (behind) {
                if (sessions.invalidate(ref.sessionId())) {
                    invalidated++;
                    affected.add(ref.key());
                }
            } else if (versions.markScopeChecked(ref.sessionId())) {
                refreshed++;
            }
        }
        for (ScopeKey key : affected) {
            try {
                notifier.notifySessionInvalidated(
                        SessionInvalidatedNotification.of(key.userId(), key.tenantId(), REASON_SCOPE_CHANGE));
            } catch (RuntimeException e) {
                log.warn("Delivery of session invalidation for {} failed: {}", key, e.getMessage());
            }
        }

        ReconciliationReport report = new ReconciliationReport(
                drained.eventsPublished(), drained.deliveryFailures(), invalidated, refreshed);
        if (!report.isEmpty()) {
            log.info("Reconciliation: {} events published ({} failed), {} sessions invalidated, {} refreshed",
                    report.eventsPublished(), report.deliveryFailures(), invalidated, refreshed);
        }
        return report;
    }

    /**
     * Drains up to {@code batchSize} pending change events to the notifier. Each drained event is
     * marked processed whether or not delivery succeeded.
     */
    public ReconciliationReport publishPendingEvents(int batchSize) {
        int failures = 0;
        List<ScopeChangeEvent> events = versions.pendingChangeEvents(batchSize);
        List<String> drained = new ArrayList<>(events.size());
        for (ScopeChangeEvent event : events) {
            try {
                notifier.notifyScopeChange(event.toNotification());
            } catch (RuntimeException e) {
                failures++;
                log.warn("Delivery of scope change {} for {} failed: {}", event.eventId(), event.key(), e.getMessage());
            }
            drained.add(event.eventId());
        }
        if (!drained.isEmpty()) {
            versions.markProcessed(drained);
        }
        return new ReconciliationReport(drained.size(), failures, 0, 0);
    }
}
