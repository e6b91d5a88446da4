package com.warden.authzservice.infrastructure.web;

import com.warden.observability.CorrelationContext;
import com.warden.observability.CorrelationContextHolder;
import com.warden.observability.SensitiveDataRedactor;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates the {@value #CORRELATION_ID_HEADER} of every HTTP request.
 *
 * <p>The ID is placed in {@link CorrelationContextHolder} (and through it the SLF4J MDC) for the
 * duration of the request and echoed on the response. Runs first so that the scope check and every
 * handler log with it. At debug level the request headers are logged with credentials redacted.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(CorrelationIdFilter.class);

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
        CorrelationContextHolder.set(CorrelationContext.anonymous(correlationId));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        if (log.isDebugEnabled()) {
            log.debug("{} {} headers {}", request.getMethod(), request.getRequestURI(), loggableHeaders(request));
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            CorrelationContextHolder.clear();
        }
    }

    Map<String, Object> loggableHeaders(HttpServletRequest request) {
        Map<String, Object> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, request.getHeader(name));
        }
        return redactor.redact(headers);
    }
}
