package com.bastion.security.token;

import java.time.Instant;
import java.util.List;

/**
 * The identity and validity window carried inside a signed token.
 * <p>
 * Instances come from {@link TokenManager#issueToken} (via the signed token) or from
 * {@link TokenManager#validateToken}. Roles keep their issued order; duplicates and case
 * are preserved as given.
 *
 * @param subjectId   opaque principal ID ({@code user_id} and {@code sub} claims)
 * @param displayName human-readable username ({@code username} claim)
 * @param roles       role names in issued order ({@code roles} claim)
 * @param issuer      always {@link #ISSUER} for tokens minted here
 * @param issuedAt    issuance time, whole seconds
 * @param notBefore   equal to {@code issuedAt}
 * @param expiresAt   end of validity, whole seconds
 * @param tokenId     per-token ID ({@code jti} claim), hook for future revocation
 * @param keyId       ID of the signing key ({@code kid} header)
 */
public record TokenClaims(
        String subjectId,
        String displayName,
        List<String> roles,
        String issuer,
        Instant issuedAt,
        Instant notBefore,
        Instant expiresAt,
        String tokenId,
        String keyId
) {

    public static final String ISSUER = "bastion-identity";

    public static final String CLAIM_USER_ID = "user_id";
    public static final String CLAIM_USERNAME = "username";
    public static final String CLAIM_ROLES = "roles";

    public TokenClaims {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }
}
