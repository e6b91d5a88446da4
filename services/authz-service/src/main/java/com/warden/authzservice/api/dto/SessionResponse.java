package com.warden.authzservice.api.dto;

import com.warden.scope.SessionSnapshot;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Session as returned to its holder. The access token is only present on login.
 */
public record SessionResponse(
        String sessionId,
        String accessToken,
        String userId,
        String tenantId,
        List<String> roles,
        Set<String> capabilities,
        long scopeVersion,
        Instant issuedAt,
        Instant expiresAt) {

    public static SessionResponse withToken(SessionSnapshot session) {
        return of(session, session.token());
    }

    public static SessionResponse withoutToken(SessionSnapshot session) {
        return of(session, null);
    }

    private static SessionResponse of(SessionSnapshot session, String token) {
        return new SessionResponse(
                session.sessionId(),
                token,
                session.userId(),
                session.tenantId(),
                session.roles(),
                new TreeSet<>(session.capabilities()),
                session.scopeVersion(),
                session.issuedAt(),
                session.expiresAt());
    }
}
