package com.bastion.security;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The structured error body returned when the pipeline refuses a request.
 * <p>
 * Serialized as {@code {"error": "...", "code": "UNAUTHORIZED", "status": 401}}. The
 * message is generic and never includes library or token detail.
 *
 * @param message human-readable message
 * @param code    {@code UNAUTHORIZED} or {@code FORBIDDEN}
 * @param status  matching HTTP status, 401 or 403
 */
public record AuthRejection(
        @JsonProperty("error") String message,
        String code,
        int status
) {

    public static final String UNAUTHORIZED = "UNAUTHORIZED";
    public static final String FORBIDDEN = "FORBIDDEN";

    public static final String MISSING_TOKEN_MESSAGE = "Missing or invalid authorization header";
    public static final String INVALID_TOKEN_MESSAGE = "Invalid or expired token";

    public static AuthRejection unauthorized(AuthenticationFailure failure) {
        String message = failure.noToken() ? MISSING_TOKEN_MESSAGE : INVALID_TOKEN_MESSAGE;
        return new AuthRejection(message, UNAUTHORIZED, 401);
    }

    public static AuthRejection forbidden(AuthorizationFailure failure) {
        return new AuthRejection(failure.message(), FORBIDDEN, 403);
    }
}
