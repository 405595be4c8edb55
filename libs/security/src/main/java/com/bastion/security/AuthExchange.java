package com.bastion.security;

import java.util.Optional;

/**
 * What the auth pipeline needs from one inbound request, independent of the transport.
 * <p>
 * Each framework supplies a thin implementation (servlet filter, gRPC interceptor) and
 * the pipeline logic stays in {@link AuthPipeline}.
 */
public interface AuthExchange extends AttributeStore {

    /** First value of the named header, or empty. */
    Optional<String> header(String name);

    /**
     * Answers the request with the rejection. The adapter must not invoke the downstream
     * handler afterwards.
     */
    void reject(AuthRejection rejection);

    /** Short description for logs and audit events, e.g. {@code "GET /api/v1/me"}. */
    String describe();
}
