package com.warden.authzservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.warden.observability.CorrelationContext;
import com.warden.observability.CorrelationContextHolder;
import com.warden.observability.SensitiveDataRedactor;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("CorrelationIdFilter")
class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("generates a correlation ID when the client sends none")
    void generatesWhenMissing() throws Exception {
        var response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest(), response, (req, resp) -> {});

        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER)).isNotBlank();
    }

    @Test
    @DisplayName("echoes the client's correlation ID")
    void propagatesExisting() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "cid-abc-123");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader("X-Correlation-ID")).isEqualTo("cid-abc-123");
    }

    @Test
    @DisplayName("exposes the ID to the chain through the context holder and the MDC")
    void setsContextDuringChain() throws Exception {
        var fromHolder = new AtomicReference<String>();
        var fromMdc = new AtomicReference<String>();
        FilterChain capturing = (req, resp) -> {
            fromHolder.set(CorrelationContextHolder.get().map(CorrelationContext::correlationId).orElse(null));
            fromMdc.set(MDC.get(CorrelationContext.MDC_CORRELATION_ID));
        };
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "during-chain");

        filter.doFilter(request, new MockHttpServletResponse(), capturing);

        assertThat(fromHolder.get()).isEqualTo("during-chain");
        assertThat(fromMdc.get()).isEqualTo("during-chain");
    }

    @Test
    @DisplayName("clears the context after the request")
    void clearsAfterRequest() throws Exception {
        filter.doFilter(new MockHttpServletRequest(), new MockHttpServletResponse(), (req, resp) -> {});

        assertThat(CorrelationContextHolder.get()).isEmpty();
        assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isNull();
    }

    @Test
    @DisplayName("redacts credentials from the headers it logs")
    void redactsLoggedHeaders() {
        var request = new MockHttpServletRequest();
        request.addHeader("Authorization", "Bearer abc.def");
        request.addHeader("X-Session-Token", "tok-1");
        request.addHeader("X-Correlation-ID", "cid-1");

        var headers = filter.loggableHeaders(request);

        assertThat(headers)
                .containsEntry("Authorization", SensitiveDataRedactor.REDACTED)
                .containsEntry("X-Session-Token", SensitiveDataRedactor.REDACTED)
                .containsEntry("X-Correlation-ID", "cid-1");
    }
}
