package com.warden.observability;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link CorrelationContext}, mirrored into the SLF4J MDC.
 *
 * <p>Request threads are pooled, so callers must {@link #clear()} in a {@code finally} block or
 * use {@link #runWithContext(CorrelationContext, Runnable)} when handing work to another thread.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the context for the current thread and populates the MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Correlation ID of the current thread, if any. */
    public static Optional<String> correlationId() {
        return get().map(CorrelationContext::correlationId);
    }

    /** Clears the context and every MDC key it owns. */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Runs {@code runnable} with {@code context} set, then restores whatever was there before.
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            runnable.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_TENANT_ID, ctx.tenantId());
        setMdc(CorrelationContext.MDC_USER_ID, ctx.userId());
        setMdc(CorrelationContext.MDC_SESSION_ID, ctx.sessionId());
        setMdc(
                CorrelationContext.MDC_SCOPE_VERSION,
                ctx.scopeVersion() == null ? null : String.valueOf(ctx.scopeVersion()));
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_ID);
        MDC.remove(CorrelationContext.MDC_USER_ID);
        MDC.remove(CorrelationContext.MDC_SESSION_ID);
        MDC.remove(CorrelationContext.MDC_SCOPE_VERSION);
    }
}
