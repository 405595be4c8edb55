package com.bastion.security;

import java.util.Optional;

/**
 * Extracts bearer tokens from HTTP {@code Authorization} header values.
 * <p>
 * The scheme prefix is matched exactly: {@code "Bearer "}, capital B, one space. Any
 * other form is treated as carrying no token.
 */
public final class BearerTokenExtractor {

    public static final String AUTHORIZATION_HEADER = "Authorization";
    public static final String PREFIX = "Bearer ";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * @param authorizationHeader the raw header value (may be null)
     * @return the token with surrounding whitespace trimmed, or empty if the header is
     *         missing, uses another scheme, or has nothing after the prefix
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(PREFIX)) {
            return Optional.empty();
        }
        String token = authorizationHeader.substring(PREFIX.length()).strip();
        if (token.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(token);
    }

    /**
     * Classifies a header that {@link #extract(String)} rejected.
     *
     * @return {@link AuthenticationFailure#MISSING_CREDENTIALS} for an absent or blank
     *         header, {@link AuthenticationFailure#MALFORMED_HEADER} otherwise
     */
    public static AuthenticationFailure whyMissing(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return AuthenticationFailure.MISSING_CREDENTIALS;
        }
        return AuthenticationFailure.MALFORMED_HEADER;
    }
}
