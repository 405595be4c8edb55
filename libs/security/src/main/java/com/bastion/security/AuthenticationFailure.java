package com.bastion.security;

/**
 * Why a bearer credential was not accepted. Every value maps to HTTP 401.
 * <p>
 * The {@link #code()} is a stable machine-readable value for logs, metrics and audit
 * events. It is never sent to the caller; rejections carry only a generic message.
 */
public enum AuthenticationFailure {

    MISSING_CREDENTIALS("missing_credentials"),
    MALFORMED_HEADER("malformed_header"),
    MALFORMED_TOKEN("malformed_token"),
    ALGORITHM_MISMATCH("algorithm_mismatch"),
    INVALID_SIGNATURE("invalid_signature"),
    EXPIRED("expired"),
    NOT_YET_VALID("not_yet_valid");

    private final String code;

    AuthenticationFailure(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /** True for failures decided before any token reached the token manager. */
    public boolean noToken() {
        return this == MISSING_CREDENTIALS || this == MALFORMED_HEADER;
    }
}
