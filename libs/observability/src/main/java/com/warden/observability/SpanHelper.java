package com.warden.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper over an OpenTelemetry {@link Tracer} that stamps the current
 * {@link CorrelationContext} on every span.
 *
 * <p>Used around calls that leave the process (policy engine, push delivery). The SDK itself is
 * configured by the hosting service; with no SDK installed the tracer is a no-op.
 */
public final class SpanHelper {

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} inside a new span. Runtime exceptions are recorded on the span and rethrown.
     *
     * @param spanName span name, e.g. {@code policy.evaluate}
     * @param kind span kind, {@link SpanKind#CLIENT} for outbound calls
     * @param attributes extra string attributes
     */
    public <T> T inSpan(String spanName, SpanKind kind, Map<String, String> attributes, Supplier<T> work) {
        var builder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(builder::setAttribute);
        Span span = builder.startSpan();

        CorrelationContextHolder.get()
                .ifPresent(
                        ctx -> {
                            span.setAttribute("correlation.id", ctx.correlationId());
                            if (ctx.tenantId() != null) {
                                span.setAttribute("tenant.id", ctx.tenantId());
                            }
                            if (ctx.userId() != null) {
                                span.setAttribute("user.id", ctx.userId());
                            }
                        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /** Internal span without extra attributes. */
    public <T> T inSpan(String spanName, Supplier<T> work) {
        return inSpan(spanName, SpanKind.INTERNAL, Map.of(), work);
    }

    public Tracer tracer() {
        return tracer;
    }
}
