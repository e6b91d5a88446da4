package com.warden.authzservice.infrastructure.web;

import com.warden.scope.SessionSnapshot;
import com.warden.security.WardenSecurityContext;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;

/**
 * Access to the security context that {@link ScopeVersionFilter} attaches to a request after a
 * successful consistency check.
 */
public final class AuthenticatedSession {

    public static final String ATTRIBUTE = AuthenticatedSession.class.getName() + ".CONTEXT";

    private AuthenticatedSession() {
        // utility class
    }

    static WardenSecurityContext toContext(SessionSnapshot session, String correlationId) {
        return new WardenSecurityContext(
                session.userId(),
                session.tenantId(),
                session.sessionId(),
                session.roles(),
                session.capabilities(),
                session.scopeVersion(),
                correlationId);
    }

    public static Optional<WardenSecurityContext> current(HttpServletRequest request) {
        return Optional.ofNullable((WardenSecurityContext) request.getAttribute(ATTRIBUTE));
    }

    /**
     * @throws AuthenticationRequiredException if the request carries no valid session
     */
    public static WardenSecurityContext require(HttpServletRequest request) {
        return current(request).orElseThrow(AuthenticationRequiredException::new);
    }
}
