package com.bastion.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} for synchronous, CPU-bound work
 * such as signing or verifying a token.
 * <p>
 * The helper does not configure the SDK. Without an installed SDK the global tracer is a
 * no-op and every call here degrades to running the work directly.
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
     * Runs {@code work} inside a new span carrying {@code attributes} and the current
     * correlation identifiers.
     * <p>
     * A {@link RuntimeException} thrown by the work is recorded on the span, the span
     * status is set to ERROR, and the exception is re-thrown unchanged.
     *
     * @param spanName   span name, e.g. {@code jwt.validate_token}
     * @param attributes span attributes; null values are skipped
     * @param work       the traced work
     * @return whatever {@code work} returns
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        var builder = tracer.spanBuilder(spanName);
        attributes.forEach((key, value) -> {
            if (value != null) {
                builder.setAttribute(key, value);
            }
        });
        Span span = builder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.subjectId() != null) {
                span.setAttribute("user.id", ctx.subjectId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /** Void variant of {@link #inSpan(String, Map, Supplier)}. */
    public void inSpan(String spanName, Map<String, String> attributes, Runnable work) {
        inSpan(spanName, attributes, () -> {
            work.run();
            return null;
        });
    }

    /**
     * Adds an attribute to whichever span is current on this thread.
     * Used from inside traced work to report facts only known after it started.
     */
    public static void annotateCurrent(String key, String value) {
        if (value != null) {
            Span.current().setAttribute(key, value);
        }
    }

    public Tracer tracer() {
        return tracer;
    }
}
