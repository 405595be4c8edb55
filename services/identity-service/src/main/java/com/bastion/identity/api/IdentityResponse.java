package com.bastion.identity.api;

import com.bastion.security.RequestIdentity;

import java.time.Instant;
import java.util.List;

/**
 * The caller as seen by the service. Never includes the token itself.
 */
public record IdentityResponse(
        String subjectId,
        String username,
        List<String> roles,
        String issuer,
        Instant issuedAt,
        Instant expiresAt,
        String tokenId,
        String keyId) {

    public static IdentityResponse from(RequestIdentity identity) {
        var claims = identity.claims();
        return new IdentityResponse(
                identity.subjectId(),
                identity.displayName(),
                identity.roles(),
                claims.issuer(),
                claims.issuedAt(),
                claims.expiresAt(),
                claims.tokenId(),
                claims.keyId());
    }
}
