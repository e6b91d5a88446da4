package com.warden.authzservice.infrastructure.web;

import com.warden.authzservice.api.ResourceNotFoundException;
import com.warden.observability.CorrelationContextHolder;
import com.warden.scope.ScopeStoreUnavailableException;
import com.warden.security.CapabilityFormatException;
import com.warden.security.DuplicateRoleException;
import com.warden.security.TenantMismatchException;
import com.warden.security.UnknownRoleException;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://warden.dev/errors/duplicate-role",
 *   "title": "Duplicate Role",
 *   "status": 409,
 *   "detail": "Role 'auditor' already exists",
 *   "timestamp": "2024-05-01T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Authorization failures carry a coarse detail only; the specific cause is logged.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String TYPE_BASE = "https://warden.dev/errors/";

    @ExceptionHandler(CapabilityFormatException.class)
    public ProblemDetail handleCapabilityFormat(CapabilityFormatException ex) {
        log.warn("Rejected malformed capabilities: {}", ex.invalidCapabilities());
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Validation Failed", "validation-failed",
                "Capabilities must have the form namespace:action, namespace:* or *");
        problem.setProperty("invalidCapabilities", ex.invalidCapabilities());
        return problem;
    }

    @ExceptionHandler(UnknownRoleException.class)
    public ProblemDetail handleUnknownRole(UnknownRoleException ex) {
        log.warn("Unknown role: {}", ex.role());
        return problem(HttpStatus.BAD_REQUEST, "Unknown Role", "unknown-role", ex.getMessage());
    }

    @ExceptionHandler(DuplicateRoleException.class)
    public ProblemDetail handleDuplicateRole(DuplicateRoleException ex) {
        log.warn("Duplicate role: {}", ex.role());
        return problem(HttpStatus.CONFLICT, "Duplicate Role", "duplicate-role", ex.getMessage());
    }

    @ExceptionHandler(TenantMismatchException.class)
    public ProblemDetail handleTenantMismatch(TenantMismatchException ex) {
        log.warn("Tenant isolation violation: {}", ex.getMessage());
        return problem(HttpStatus.FORBIDDEN, "Forbidden", "insufficient-permissions", "Insufficient permissions");
    }

    @ExceptionHandler(AuthenticationRequiredException.class)
    public ProblemDetail handleAuthenticationRequired(AuthenticationRequiredException ex) {
        return problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "authentication-required", ex.getMessage());
    }

    @ExceptionHandler(ScopeStoreUnavailableException.class)
    public ProblemDetail handleStoreUnavailable(ScopeStoreUnavailableException ex) {
        log.error("Scope store unavailable", ex);
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", "service-unavailable",
                "Authorization data is temporarily unavailable");
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ProblemDetail handleNotFound(ResourceNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ProblemDetail handleNoResource(NoResourceFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", "No endpoint " + ex.getResourcePath());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class,
        ConstraintViolationException.class,
        IllegalArgumentException.class
    })
    public ProblemDetail handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        String detail = ex instanceof HttpMessageNotReadableException
                ? "Malformed request body"
                : ex.getMessage();
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", detail);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private static ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.correlationId()
                .ifPresent(id -> problem.setProperty("correlationId", id));
        return problem;
    }
}
