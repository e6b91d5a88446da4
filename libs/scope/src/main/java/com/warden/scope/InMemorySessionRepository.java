package com.warden.scope;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Session store backed by concurrent maps. Updates go through {@code computeIfPresent}, so the
 * read-modify-write of one session is atomic.
 */
public class InMemorySessionRepository implements SessionRepository {

    private final Map<String, SessionSnapshot> sessions = new ConcurrentHashMap<>();
    private final Map<String, String> sessionIdsByToken = new ConcurrentHashMap<>();

    @Override
    public void save(SessionSnapshot session) {
        sessions.put(session.sessionId(), session);
        sessionIdsByToken.put(session.token(), session.sessionId());
    }

    @Override
    public Optional<SessionSnapshot> findById(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public Optional<SessionSnapshot> findByToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessionIdsByToken.get(token)).map(sessions::get);
    }

    @Override
    public List<SessionSnapshot> findActive(ScopeKey key) {
        return sessions.values().stream()
                .filter(SessionSnapshot::active)
                .filter(s -> s.key().equals(key))
                .toList();
    }

    @Override
    public List<SessionSnapshot> findAllActive() {
        return sessions.values().stream().filter(SessionSnapshot::active).toList();
    }

    @Override
    public boolean deactivate(String sessionId) {
        AtomicBoolean flipped = new AtomicBoolean();
        sessions.computeIfPresent(sessionId, (id, session) -> {
            if (!session.active()) {
                return session;
            }
            flipped.set(true);
            return session.deactivated();
        });
        return flipped.get();
    }

    @Override
    public boolean recordScopeCheck(String sessionId, Instant checkedAt) {
        AtomicBoolean recorded = new AtomicBoolean();
        sessions.computeIfPresent(sessionId, (id, session) -> {
            if (!session.active()) {
                return session;
            }
            recorded.set(true);
            return session.checkedAt(checkedAt);
        });
        return recorded.get();
    }
}
