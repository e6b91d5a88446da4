package com.warden.scope;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local authoritative store. States live in a concurrent map; the event log is an
 * insertion-ordered map guarded by its own monitor.
 */
public class InMemoryScopeStateRepository implements ScopeStateRepository {

    private final Map<ScopeKey, ScopeState> states = new ConcurrentHashMap<>();
    private final Map<String, ScopeChangeEvent> log = new LinkedHashMap<>();
    private final Map<String, Boolean> processed = new ConcurrentHashMap<>();

    @Override
    public Optional<ScopeState> find(ScopeKey key) {
        return Optional.ofNullable(states.get(key));
    }

    @Override
    public void saveWithEvent(ScopeState state, ScopeChangeEvent event) {
        synchronized (log) {
            states.put(state.key(), state);
            log.put(event.eventId(), event);
        }
    }

    @Override
    public List<ScopeChangeEvent> pendingEvents(int limit) {
        List<ScopeChangeEvent> pending = new ArrayList<>();
        synchronized (log) {
            for (ScopeChangeEvent event : log.values()) {
                if (pending.size() >= limit) {
                    break;
                }
                if (!processed.containsKey(event.eventId())) {
                    pending.add(event);
                }
            }
        }
        return pending;
    }

    @Override
    public void markProcessed(Collection<String> eventIds) {
        for (String id : eventIds) {
            processed.put(id, Boolean.TRUE);
        }
    }

    @Override
    public List<ScopeChangeEvent> history(ScopeKey key) {
        synchronized (log) {
            return log.values().stream().filter(e -> e.key().equals(key)).toList();
        }
    }
}
