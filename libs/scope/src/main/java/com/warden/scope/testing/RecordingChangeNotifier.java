package com.warden.scope.testing;

import com.warden.eventmodel.ScopeChangeNotification;
import com.warden.eventmodel.SessionInvalidatedNotification;
import com.warden.scope.ChangeNotifier;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link ChangeNotifier} that records every payload. Can be told to fail to exercise delivery
 * error paths.
 */
public class RecordingChangeNotifier implements ChangeNotifier {

    private final List<ScopeChangeNotification> scopeChanges = new CopyOnWriteArrayList<>();
    private final List<SessionInvalidatedNotification> invalidations = new CopyOnWriteArrayList<>();
    private volatile RuntimeException failure;

    @Override
    public int notifyScopeChange(ScopeChangeNotification notification) {
        scopeChanges.add(notification);
        if (failure != null) {
            throw failure;
        }
        return 1;
    }

    @Override
    public int notifySessionInvalidated(SessionInvalidatedNotification notification) {
        invalidations.add(notification);
        if (failure != null) {
            throw failure;
        }
        return 1;
    }

    /** Subsequent deliveries are recorded, then throw {@code failure}. */
    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    public List<ScopeChangeNotification> scopeChanges() {
        return List.copyOf(scopeChanges);
    }

    public List<SessionInvalidatedNotification> invalidations() {
        return List.copyOf(invalidations);
    }
}
