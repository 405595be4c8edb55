package com.bastion.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Thread-local holder for {@link CorrelationContext} with an SLF4J MDC bridge.
 * <p>
 * Servlet containers dispatch one request per thread, so the inbound filter sets the
 * context before the chain runs and must call {@link #clear()} in a {@code finally}
 * block. Pooled threads would otherwise leak one caller's identity into the logs of the
 * next request.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the context for the current thread and rewrites the MDC keys.
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

    /**
     * Records the authenticated caller on the current context.
     * <p>
     * No-op when no context was opened on this thread (e.g. a unit test that drives the
     * pipeline directly).
     */
    public static void bindIdentity(String subjectId, String username) {
        CorrelationContext current = CONTEXT.get();
        if (current != null) {
            set(current.withIdentity(subjectId, username));
        }
    }

    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
        MDC.remove(CorrelationContext.MDC_SUBJECT_ID);
        MDC.remove(CorrelationContext.MDC_USERNAME);
        MDC.remove(CorrelationContext.MDC_TRACE_ID);
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
        setMdc(CorrelationContext.MDC_SUBJECT_ID, ctx.subjectId());
        setMdc(CorrelationContext.MDC_USERNAME, ctx.username());
        setMdc(CorrelationContext.MDC_TRACE_ID, ctx.traceId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
