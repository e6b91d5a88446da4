package com.warden.scope;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Narrow view of the session store. Per-session writes are atomic and never contend across
 * sessions.
 */
public interface SessionRepository {

    void save(SessionSnapshot session);

    Optional<SessionSnapshot> findById(String sessionId);

    Optional<SessionSnapshot> findByToken(String token);

    /** Active sessions of one scope. */
    List<SessionSnapshot> findActive(ScopeKey key);

    /** Every active session. */
    List<SessionSnapshot> findAllActive();

    /** Marks the session inactive; returns true only if it was active before. */
    boolean deactivate(String sessionId);

    /** Records a confirmed scope check; returns false if the session is unknown or inactive. */
    boolean recordScopeCheck(String sessionId, Instant checkedAt);
}
