package com.bastion.security;

/**
 * Why the role gate refused a request. Every value maps to HTTP 403.
 */
public enum AuthorizationFailure {

    /** The role gate ran without an identity attached to the request. */
    NO_ROLES_IN_CONTEXT("no_roles_in_context", "No roles in context"),

    /** An identity is attached but does not hold the required role. */
    INSUFFICIENT_PERMISSIONS("insufficient_permissions", "Insufficient permissions");

    private final String code;
    private final String message;

    AuthorizationFailure(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String code() {
        return code;
    }

    public String message() {
        return message;
    }
}
