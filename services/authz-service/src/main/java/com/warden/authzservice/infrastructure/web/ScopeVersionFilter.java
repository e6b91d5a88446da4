package com.warden.authzservice.infrastructure.web;

import com.warden.authzservice.config.ScopeProperties;
import com.warden.observability.CorrelationContext;
import com.warden.observability.CorrelationContextHolder;
import com.warden.observability.MetricFactory;
import com.warden.scope.ConsistencyCheck;
import com.warden.scope.SessionConsistencyChecker;
import com.warden.scope.SessionRegistry;
import com.warden.scope.SessionSnapshot;
import com.warden.scope.TokenVerdict;
import com.warden.security.BearerTokenExtractor;
import com.warden.security.WardenSecurityContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Checks every bearer-authenticated request against the current scope version.
 *
 * <ul>
 *   <li>excluded paths and requests without a bearer token pass through untouched
 *   <li>INVALID answers 401 {@code invalid_token}
 *   <li>STALE answers 403 {@code scope_outdated} with both versions and invalidates the session so
 *       the token cannot be replayed
 *   <li>VALID attaches the session's {@link WardenSecurityContext} to the request and adds the
 *       principal to the correlation context
 * </ul>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class ScopeVersionFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(ScopeVersionFilter.class);

    static final String STALE_MESSAGE = "Your permissions have changed. Please refresh your session.";
    static final String INVALID_MESSAGE = "Invalid or expired token";

    private final SessionRegistry sessions;
    private final SessionConsistencyChecker checker;
    private final ScopeProperties properties;
    private final MetricFactory metrics;
    private final JsonErrorWriter errors;

    public ScopeVersionFilter(
            SessionRegistry sessions,
            SessionConsistencyChecker checker,
            ScopeProperties properties,
            MetricFactory metrics,
            JsonErrorWriter errors) {
        this.sessions = sessions;
        this.checker = checker;
        this.properties = properties;
        this.metrics = metrics;
        this.errors = errors;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return properties.excludedPaths().stream().anyMatch(path::startsWith);
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        Optional<String> token = BearerTokenExtractor.extract(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token.isEmpty()) {
            filterChain.doFilter(request, response);
            return;
        }

        TokenVerdict verdict = sessions.resolveToken(token.get());
        ConsistencyCheck check;
        if (!verdict.isAuthentic() || properties.versionChecking().checkOnApiRequest()) {
            check = checker.check(verdict);
        } else {
            check = ConsistencyCheck.valid(verdict.session().scopeVersion(), verdict.session().scopeVersion());
        }
        metrics.increment(MetricFactory.Names.CONSISTENCY_CHECKS, "Session consistency checks",
                "verdict", check.verdict().value());

        switch (check.verdict()) {
            case INVALID -> {
                log.debug("Rejecting request to {}: {}", request.getRequestURI(), check.reason());
                errors.write(response, HttpStatus.UNAUTHORIZED.value(), Map.of(
                        "error", JsonErrorWriter.INVALID_TOKEN,
                        "message", INVALID_MESSAGE));
            }
            case STALE -> {
                SessionSnapshot session = verdict.session();
                if (sessions.invalidate(session.sessionId())) {
                    metrics.increment(MetricFactory.Names.SESSIONS_INVALIDATED, "Sessions invalidated",
                            "reason", "stale");
                }
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("error", JsonErrorWriter.SCOPE_OUTDATED);
                body.put("message", STALE_MESSAGE);
                body.put("current_version", check.currentVersion());
                body.put("token_version", check.sessionVersion());
                errors.write(response, HttpStatus.FORBIDDEN.value(), body);
            }
            case VALID -> {
                SessionSnapshot session = verdict.session();
                String correlationId = CorrelationContextHolder.correlationId()
                        .orElseGet(() -> UUID.randomUUID().toString());
                WardenSecurityContext context = AuthenticatedSession.toContext(session, correlationId);
                request.setAttribute(AuthenticatedSession.ATTRIBUTE, context);
                CorrelationContext base = CorrelationContextHolder.get()
                        .orElseGet(() -> CorrelationContext.anonymous(correlationId));
                CorrelationContextHolder.set(base.withPrincipal(
                        session.userId(), session.tenantId(), session.sessionId(), session.scopeVersion()));
                filterChain.doFilter(request, response);
            }
        }
    }
}
