package com.bastion.security;

/**
 * Result of one pipeline stage for one request.
 */
public enum AuthOutcome {

    /** A valid token was presented and the identity is attached. */
    AUTHENTICATED(true),

    /** Optional mode without a usable token: continue with no identity. */
    ANONYMOUS(true),

    /** Required mode without a usable token: 401 has been written. */
    REJECTED(false),

    /** The identity holds the required role. */
    GRANTED(true),

    /** No identity, or the required role is missing: 403 has been written. */
    FORBIDDEN(false);

    private final boolean proceed;

    AuthOutcome(boolean proceed) {
        this.proceed = proceed;
    }

    /** Whether the adapter should invoke the next stage or handler. */
    public boolean proceed() {
        return proceed;
    }
}
