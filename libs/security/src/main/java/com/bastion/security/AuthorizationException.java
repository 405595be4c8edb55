package com.bastion.security;

/**
 * Thrown when an identity is missing or lacks the role a route requires.
 */
public class AuthorizationException extends RuntimeException {

    private final AuthorizationFailure failure;
    private final String requiredRole;

    public AuthorizationException(AuthorizationFailure failure, String requiredRole) {
        super("%s (required role '%s')".formatted(failure.message(), requiredRole));
        this.failure = failure;
        this.requiredRole = requiredRole;
    }

    public AuthorizationFailure failure() {
        return failure;
    }

    public String requiredRole() {
        return requiredRole;
    }
}
