package com.warden.authzservice.api;

import com.warden.authzservice.api.dto.InvalidationResponse;
import com.warden.authzservice.api.dto.LoginRequest;
import com.warden.authzservice.api.dto.SessionResponse;
import com.warden.authzservice.infrastructure.web.AuthenticatedSession;
import com.warden.authzservice.infrastructure.web.RequiresCapability;
import com.warden.observability.MetricFactory;
import com.warden.scope.ScopeKey;
import com.warden.scope.SessionRegistry;
import com.warden.security.WardenSecurityContext;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Session issuance and lifecycle.
 *
 * <p>Login is excluded from the scope version filter and trusts the supplied user id; identity
 * proofing belongs to the upstream identity provider.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    static final String ADMIN_SESSIONS = "admin:sessions";

    private final SessionRegistry sessions;
    private final MetricFactory metrics;

    public SessionController(SessionRegistry sessions, MetricFactory metrics) {
        this.sessions = sessions;
        this.metrics = metrics;
    }

    @PostMapping("/login")
    public SessionResponse login(@Valid @RequestBody LoginRequest request) {
        return SessionResponse.withToken(sessions.issueSession(request.userId(), request.tenantId()));
    }

    @GetMapping("/me")
    public SessionResponse me(HttpServletRequest request) {
        WardenSecurityContext context = AuthenticatedSession.require(request);
        return sessions.findSession(context.sessionId())
                .map(SessionResponse::withoutToken)
                .orElseThrow(() -> new ResourceNotFoundException("Session " + context.sessionId() + " not found"));
    }

    @PostMapping("/logout")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void logout(HttpServletRequest request) {
        WardenSecurityContext context = AuthenticatedSession.require(request);
        if (sessions.invalidate(context.sessionId())) {
            metrics.increment(MetricFactory.Names.SESSIONS_INVALIDATED, "Sessions invalidated",
                    "reason", "logout");
        }
    }

    @GetMapping
    @RequiresCapability(ADMIN_SESSIONS)
    public List<SessionResponse> activeSessions(
            @RequestParam String userId, @RequestParam(required = false) String tenantId) {
        return sessions.activeSessions(userId, tenantId).stream()
                .map(SessionResponse::withoutToken)
                .toList();
    }

    @DeleteMapping("/users/{userId}")
    @RequiresCapability(ADMIN_SESSIONS)
    public InvalidationResponse invalidateUserSessions(
            @PathVariable String userId, @RequestParam(required = false) String tenantId) {
        int invalidated = sessions.invalidateUserSessions(userId, tenantId);
        if (invalidated > 0) {
            metrics.counter(MetricFactory.Names.SESSIONS_INVALIDATED, "Sessions invalidated",
                    "reason", "admin").increment(invalidated);
        }
        return new InvalidationResponse(userId, ScopeKey.normalizeTenant(tenantId), invalidated);
    }
}
