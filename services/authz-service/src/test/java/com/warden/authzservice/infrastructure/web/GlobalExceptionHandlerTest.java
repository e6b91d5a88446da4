package com.warden.authzservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.warden.authzservice.api.ResourceNotFoundException;
import com.warden.observability.CorrelationContext;
import com.warden.observability.CorrelationContextHolder;
import com.warden.scope.ScopeStoreUnavailableException;
import com.warden.security.CapabilityFormatException;
import com.warden.security.DuplicateRoleException;
import com.warden.security.TenantMismatchException;
import com.warden.security.UnknownRoleException;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("maps malformed capabilities to 400 and lists them")
    void capabilityFormat() {
        ProblemDetail result = handler.handleCapabilityFormat(new CapabilityFormatException(List.of("bad")));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getType().toString()).endsWith("/validation-failed");
        assertThat(result.getProperties()).containsEntry("invalidCapabilities", List.of("bad"));
    }

    @Test
    @DisplayName("maps an unknown role to 400")
    void unknownRole() {
        assertThat(handler.handleUnknownRole(new UnknownRoleException("ghost")).getStatus()).isEqualTo(400);
    }

    @Test
    @DisplayName("maps a duplicate role to 409")
    void duplicateRole() {
        assertThat(handler.handleDuplicateRole(new DuplicateRoleException("admin")).getStatus()).isEqualTo(409);
    }

    @Test
    @DisplayName("maps a tenant mismatch to 403 without naming either tenant")
    void tenantMismatch() {
        ProblemDetail result = handler.handleTenantMismatch(new TenantMismatchException("acme", "globex"));

        assertThat(result.getStatus()).isEqualTo(403);
        assertThat(result.getDetail()).doesNotContain("acme").doesNotContain("globex");
    }

    @Test
    @DisplayName("maps an unavailable store to 503")
    void storeUnavailable() {
        ProblemDetail result = handler.handleStoreUnavailable(new ScopeStoreUnavailableException("down"));

        assertThat(result.getStatus()).isEqualTo(503);
    }

    @Test
    @DisplayName("maps a missing resource to 404")
    void notFound() {
        assertThat(handler.handleNotFound(new ResourceNotFoundException("Role 'x' not found")).getStatus())
                .isEqualTo(404);
    }

    @Test
    @DisplayName("maps IllegalArgumentException to 400")
    void illegalArgument() {
        ProblemDetail result = handler.handleBadRequest(new IllegalArgumentException("invalid input"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("invalid input");
        assertThat(result.getTitle()).isEqualTo("Bad Request");
    }

    @Test
    @DisplayName("maps anything else to 500 with a generic detail")
    void generic() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("secret internals"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getDetail()).doesNotContain("secret");
    }

    @Test
    @DisplayName("stamps timestamp and the current correlation ID")
    void stampsMetadata() {
        CorrelationContextHolder.set(CorrelationContext.anonymous("cid-42"));

        ProblemDetail result = handler.handleGeneric(new RuntimeException("oops"));

        assertThat(result.getProperties()).containsKey("timestamp").containsEntry("correlationId", "cid-42");
    }
}
