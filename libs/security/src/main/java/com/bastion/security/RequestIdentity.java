package com.bastion.security;

import com.bastion.security.token.TokenClaims;

import java.util.List;

/**
 * The validated caller of one request.
 * <p>
 * Built by the auth pipeline from verified {@link TokenClaims} and attached once to the
 * request. It is never cached or shared across requests.
 *
 * @param subjectId   principal ID
 * @param displayName username
 * @param roles       role names in token order
 * @param claims      the full verified claims
 */
public record RequestIdentity(
        String subjectId,
        String displayName,
        List<String> roles,
        TokenClaims claims
) {

    public RequestIdentity {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId must not be null or blank");
        }
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public static RequestIdentity from(TokenClaims claims) {
        return new RequestIdentity(claims.subjectId(), claims.displayName(), claims.roles(), claims);
    }
}
