package com.bastion.observability;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Immutable per-request correlation data that is mirrored into SLF4J MDC.
 * <p>
 * A context is opened by the inbound adapter with only a correlation and request ID.
 * Once the auth pipeline has accepted a bearer token the identity fields are filled in
 * through {@link #withIdentity(String, String)}, so every later log line of the request
 * names the caller.
 *
 * @param correlationId ID of the business flow, propagated from the caller when supplied
 * @param requestId     ID of this single inbound request, always generated locally
 * @param subjectId     authenticated principal (null while anonymous)
 * @param username      authenticated display name (null while anonymous)
 * @param traceId       current OpenTelemetry trace ID (null if tracing is not active)
 */
public record CorrelationContext(
        String correlationId,
        String requestId,
        String subjectId,
        String username,
        String traceId
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_SUBJECT_ID = "subjectId";
    public static final String MDC_USERNAME = "username";
    public static final String MDC_TRACE_ID = "traceId";

    /** Caller-supplied IDs end up in every log line, so only short printable tokens are kept. */
    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Opens an anonymous context for a new inbound request.
     *
     * @param correlationId the caller-supplied correlation ID; null, blank or unsafe values
     *                      (over 128 chars, or anything beyond letters, digits and {@code ._:-})
     *                      are replaced by a generated one
     */
    public static CorrelationContext forRequest(String correlationId) {
        String effective = correlationId != null && ACCEPTED_ID.matcher(correlationId).matches()
                ? correlationId
                : UUID.randomUUID().toString();
        return new CorrelationContext(effective, UUID.randomUUID().toString(), null, null, null);
    }

    /** Returns a copy carrying the authenticated identity. */
    public CorrelationContext withIdentity(String subjectId, String username) {
        return new CorrelationContext(correlationId, requestId, subjectId, username, traceId);
    }

    /** Returns a copy carrying the given trace ID. */
    public CorrelationContext withTraceId(String traceId) {
        return new CorrelationContext(correlationId, requestId, subjectId, username, traceId);
    }

    public boolean authenticated() {
        return subjectId != null;
    }
}
