package com.warden.authzservice.infrastructure.web;

import com.warden.security.WardenSecurityContext;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Enforces {@link RequiresCapability} on controller methods.
 *
 * <p>No session answers 401 {@code authentication_required}; a session lacking the capability
 * answers 403 {@code insufficient_permissions}. The response never names the missing capability;
 * the log line does.
 */
@Component
public class RequiresCapabilityInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RequiresCapabilityInterceptor.class);

    private final JsonErrorWriter errors;

    public RequiresCapabilityInterceptor(JsonErrorWriter errors) {
        this.errors = errors;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws Exception {
        if (!(handler instanceof HandlerMethod method)) {
            return true;
        }
        RequiresCapability required = requirement(method);
        if (required == null) {
            return true;
        }

        Optional<WardenSecurityContext> context = AuthenticatedSession.current(request);
        if (context.isEmpty()) {
            errors.write(response, HttpStatus.UNAUTHORIZED.value(), Map.of(
                    "error", JsonErrorWriter.AUTHENTICATION_REQUIRED,
                    "message", "Authentication required"));
            return false;
        }
        if (!context.get().hasCapability(required.value())) {
            log.warn("Session {} of {} lacks {} for {} {}",
                    context.get().sessionId(), context.get().userId(), required.value(),
                    request.getMethod(), request.getRequestURI());
            errors.write(response, HttpStatus.FORBIDDEN.value(), Map.of(
                    "error", JsonErrorWriter.INSUFFICIENT_PERMISSIONS,
                    "message", "Insufficient permissions"));
            return false;
        }
        return true;
    }

    private static RequiresCapability requirement(HandlerMethod method) {
        RequiresCapability onMethod =
                AnnotatedElementUtils.findMergedAnnotation(method.getMethod(), RequiresCapability.class);
        if (onMethod != null) {
            return onMethod;
        }
        return AnnotatedElementUtils.findMergedAnnotation(method.getBeanType(), RequiresCapability.class);
    }
}
