package com.bastion.security.event;

/**
 * Kinds of audit events emitted by the token manager and the auth pipeline.
 */
public enum AuthEventType {

    TOKEN_ISSUED,
    TOKEN_VALIDATED,
    TOKEN_REJECTED,
    TOKEN_REFRESHED,
    SIGNING_KEY_ROTATED,
    /** A token's {@code kid} header does not name the active signing key. */
    KEY_ID_MISMATCH,
    /** Required-mode authentication succeeded. */
    REQUEST_AUTHENTICATED,
    /** Required-mode authentication failed and the request was answered with 401. */
    REQUEST_REJECTED,
    ROLE_GRANTED,
    ROLE_DENIED;

    /** True for the event types that describe a refused credential or request. */
    public boolean denial() {
        return this == TOKEN_REJECTED || this == REQUEST_REJECTED || this == ROLE_DENIED;
    }
}
