package com.bastion.security;

/**
 * Thrown when a bearer token cannot be accepted.
 * <p>
 * The message may contain library detail for server-side logs. Adapters must answer the
 * caller with {@link AuthRejection#unauthorized(AuthenticationFailure)} instead of the
 * message.
 */
public class AuthenticationException extends RuntimeException {

    private final AuthenticationFailure failure;

    public AuthenticationException(AuthenticationFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public AuthenticationException(AuthenticationFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public AuthenticationFailure failure() {
        return failure;
    }
}
