package com.bastion.identity.api;

/**
 * A freshly signed token.
 *
 * @param token     compact JWS
 * @param tokenType always {@code Bearer}
 * @param expiresIn lifetime in seconds
 * @param keyId     key ID the token was signed with, read from its header
 */
public record TokenResponse(String token, String tokenType, long expiresIn, String keyId) {

    public static TokenResponse bearer(String token, long expiresIn, String keyId) {
        return new TokenResponse(token, "Bearer", expiresIn, keyId);
    }
}
