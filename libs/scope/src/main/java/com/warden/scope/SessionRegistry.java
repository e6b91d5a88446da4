package com.warden.scope;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues sessions and answers token lookups.
 *
 * <p>Tokens are opaque, random and URL-safe; the registry is the token-validation collaborator
 * used by {@link SessionConsistencyChecker}.
 */
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);
    private static final int TOKEN_BYTES = 32;

    private final SessionRepository sessions;
    private final ScopeVersionManager versions;
    private final RoleAssignmentService assignments;
    private final Clock clock;
    private final Duration accessTokenTtl;
    private final SecureRandom random = new SecureRandom();

    public SessionRegistry(
            SessionRepository sessions,
            ScopeVersionManager versions,
            RoleAssignmentService assignments,
            Clock clock,
            Duration accessTokenTtl) {
        this.sessions = sessions;
        this.versions = versions;
        this.assignments = assignments;
        this.clock = clock;
        this.accessTokenTtl = accessTokenTtl;
    }

    /**
     * Issues a session carrying the principal's current capabilities and scope version. Issuing
     * never bumps the version.
     */
    public SessionSnapshot issueSession(String userId, String tenantId) {
        String tenant = ScopeKey.normalizeTenant(tenantId);
        // version before content: a concurrent change then leaves the session stale, never ahead
        long version = versions.getVersion(userId, tenant);
        Set<String> capabilities = assignments.userCapabilities(userId, tenant);
        List<String> roles = assignments.userRoles(userId, tenant);

        Instant now = clock.instant();
        SessionSnapshot session = new SessionSnapshot(
                UUID.randomUUID().toString(),
                newToken(),
                userId,
                tenant,
                roles,
                capabilities,
                version,
                now,
                now.plus(accessTokenTtl),
                now,
                true);
        sessions.save(session);
        log.info("Issued session {} for {}@{} at scope version {}", session.sessionId(), userId, tenant, version);
        return session;
    }

    /** Looks up the session behind {@code token}; expired sessions are deactivated on the way. */
    public TokenVerdict resolveToken(String token) {
        Optional<SessionSnapshot> found = sessions.findByToken(token);
        if (found.isEmpty()) {
            return TokenVerdict.rejected(TokenVerdict.UNKNOWN_TOKEN);
        }
        SessionSnapshot session = found.get();
        if (!session.active()) {
            return TokenVerdict.rejected(TokenVerdict.SESSION_INACTIVE);
        }
        if (session.isExpired(clock.instant())) {
            sessions.deactivate(session.sessionId());
            return TokenVerdict.rejected(TokenVerdict.SESSION_EXPIRED);
        }
        return TokenVerdict.authentic(session);
    }

    public Optional<SessionSnapshot> findSession(String sessionId) {
        return sessions.findById(sessionId);
    }

    public boolean invalidate(String sessionId) {
        boolean invalidated = sessions.deactivate(sessionId);
        if (invalidated) {
            log.info("Invalidated session {}", sessionId);
        }
        return invalidated;
    }

    /** Invalidates every active session of the scope. */
    public int invalidateUserSessions(String userId, String tenantId) {
        int count = 0;
        for (SessionSnapshot session : sessions.findActive(ScopeKey.of(userId, tenantId))) {
            if (sessions.deactivate(session.sessionId())) {
                count++;
            }
        }
        return count;
    }

    /** Deactivates every active session past its expiry. */
    public int cleanupExpired() {
        Instant now = clock.instant();
        int count = 0;
        for (SessionSnapshot session : sessions.findAllActive()) {
            if (session.isExpired(now) && sessions.deactivate(session.sessionId())) {
                count++;
            }
        }
        if (count > 0) {
            log.info("Expired {} sessions", count);
        }
        return count;
    }

    public List<SessionSnapshot> activeSessions(String userId, String tenantId) {
        return sessions.findActive(ScopeKey.of(userId, tenantId));
    }

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
