package com.warden.scope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a session may keep acting on the scope it captured.
 *
 * <p>Authenticity and expiry come from the token-validation collaborator as a
 * {@link TokenVerdict}; this class only compares versions. A {@code VALID} outcome records the
 * check time on the session and writes nothing else. Acting on {@code STALE} (rejecting, then
 * invalidating the session) is the caller's job.
 */
public class SessionConsistencyChecker {

    private static final Logger log = LoggerFactory.getLogger(SessionConsistencyChecker.class);

    private final ScopeVersionManager versions;

    public SessionConsistencyChecker(ScopeVersionManager versions) {
        this.versions = versions;
    }

    /** Version comparison alone. Never writes. */
    public ConsistencyCheck check(long sessionScopeVersion, String userId, String tenantId) {
        long current = versions.getVersion(userId, tenantId);
        if (sessionScopeVersion < current) {
            return ConsistencyCheck.stale(sessionScopeVersion, current);
        }
        return ConsistencyCheck.valid(sessionScopeVersion, current);
    }

    /** Full check for an inbound request. */
    public ConsistencyCheck check(TokenVerdict token) {
        if (!token.isAuthentic()) {
            return ConsistencyCheck.invalid(token.rejectionReason());
        }
        SessionSnapshot session = token.session();
        ConsistencyCheck result = check(session.scopeVersion(), session.userId(), session.tenantId());
        if (result.isValid()) {
            versions.markScopeChecked(session.sessionId());
            log.debug("Session {} valid at scope version {}", session.sessionId(), result.currentVersion());
        } else {
            log.warn("Session {} of {} is stale: token version {}, current version {}",
                    session.sessionId(), session.key(), result.sessionVersion(), result.currentVersion());
        }
        return result;
    }
}
