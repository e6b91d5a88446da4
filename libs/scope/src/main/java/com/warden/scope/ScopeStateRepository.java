package com.warden.scope;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage for scope states and the change-event log.
 *
 * <p>Callers serialize writes per key; implementations only need single-operation atomicity.
 * An adapter that cannot reach its store throws {@link ScopeStoreUnavailableException};
 * {@link ScopeVersionManager} wraps any other runtime failure into one.
 */
public interface ScopeStateRepository {

    Optional<ScopeState> find(ScopeKey key);

    /** Persists {@code state} and appends {@code event} as one unit. */
    void saveWithEvent(ScopeState state, ScopeChangeEvent event);

    /** Unprocessed events in append order, at most {@code limit}. */
    List<ScopeChangeEvent> pendingEvents(int limit);

    void markProcessed(Collection<String> eventIds);

    /** Every event recorded for {@code key}, oldest first. */
    List<ScopeChangeEvent> history(ScopeKey key);
}
