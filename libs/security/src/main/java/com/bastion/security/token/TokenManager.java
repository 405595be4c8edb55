package com.bastion.security.token;

import com.bastion.security.AuthenticationException;
import com.bastion.security.ConfigurationException;
import com.bastion.security.SigningException;

import java.time.Duration;
import java.util.List;

/**
 * Mints, verifies, refreshes and re-keys signed bearer tokens.
 * <p>
 * Implementations are shared by every request thread. A rotation must be atomic: each
 * issue or validate call works against one complete key snapshot, never a mix of the
 * old and new key.
 */
public interface TokenManager {

    /**
     * Signs a new token for an already resolved identity.
     *
     * @param subjectId   principal ID, must not be blank
     * @param displayName username, must not be null
     * @param roles       role names, kept in order; null means none
     * @param ttl         validity, must not be null or zero nor exceed {@code JwtTokenManager.MAX_TTL}
     * @return the compact serialized token
     * @throws IllegalArgumentException on a violated precondition
     * @throws SigningException         if signing fails
     */
    String issueToken(String subjectId, String displayName, List<String> roles, Duration ttl);

    /**
     * Verifies a token against the active signing key and returns its claims.
     *
     * @throws AuthenticationException with the reason the token was refused
     */
    TokenClaims validateToken(String token);

    /**
     * Validates {@code token} and issues a fresh one for the same identity with a new
     * token ID, the active key ID and the given ttl.
     *
     * @throws AuthenticationException if {@code token} is not valid; nothing is issued
     */
    String refreshToken(String token, Duration ttl);

    /**
     * Makes {@code newSecret} the signing key under a generated key ID.
     *
     * @return the new active key ID
     * @throws ConfigurationException if the secret is empty or too short; the previous
     *                                key stays active
     */
    String rotateSigningKey(String newSecret);

    /** As {@link #rotateSigningKey(String)} with an explicit key ID. */
    String rotateSigningKey(String keyId, String newSecret);

    /**
     * Re-reads the configured {@link SecretSource} and rotates to its current secret.
     *
     * @throws ConfigurationException if the source has no secret
     */
    String rotateFromSource();

    /** The key ID placed into the {@code kid} header of newly issued tokens. */
    String activeKeyId();
}
