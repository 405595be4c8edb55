package com.bastion.security.token;

import com.bastion.security.AuthenticationException;
import com.bastion.security.AuthenticationFailure;
import com.bastion.security.ConfigurationException;
import com.bastion.security.SigningException;
import com.bastion.security.event.AuthEvent;
import com.bastion.security.event.AuthEventPublisher;
import com.bastion.security.event.AuthEventType;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.LocatorAdapter;
import io.jsonwebtoken.PrematureJwtException;
import io.jsonwebtoken.security.SecurityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.Key;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Date;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link TokenManager} backed by jjwt, signing with HMAC-SHA256 only.
 * <p>
 * The signing context is an immutable {@link SigningKeyRing} behind an
 * {@link AtomicReference}. Every issue or validate call reads the reference once and
 * works on that snapshot; rotation swaps in a new ring in a single atomic update, so a
 * request in flight sees either the old key or the new one, never a mix.
 * <p>
 * Validation checks the token's declared algorithm before the token is parsed: anything but
 * exactly {@code HS256}, {@code none} and unknown names included, is
 * {@link AuthenticationFailure#ALGORITHM_MISMATCH}. A
 * {@code kid} that does not name the active key is reported as
 * {@link AuthEventType#KEY_ID_MISMATCH}; the token is then verified with the retained key
 * of that ID if there is one, otherwise with the active key.
 */
public final class JwtTokenManager implements TokenManager {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenManager.class);

    /** The only accepted JWS algorithm. */
    public static final String ALGORITHM = "HS256";

    public static final String DEFAULT_KEY_ID = "default";

    /** Longest lifetime, in either direction, that {@link #issueToken} accepts. */
    public static final Duration MAX_TTL = Duration.ofDays(3650);

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    private final SecretSource secretSource;
    private final int retainedKeys;
    private final Clock clock;
    private final AuthEventPublisher events;
    private final AtomicReference<SigningKeyRing> keyRing;

    private JwtTokenManager(Builder builder) {
        this.secretSource = builder.secretSource;
        this.retainedKeys = builder.retainedKeys;
        this.clock = builder.clock;
        this.events = builder.events;

        String secret = secretSource.currentSecret()
                .orElseThrow(() -> new ConfigurationException(
                        "Signing secret is not configured (" + secretSource.describe() + ")"));
        this.keyRing = new AtomicReference<>(SigningKeyRing.of(SigningKey.of(builder.initialKeyId, secret)));

        log.info("Token manager ready: algorithm={}, keyId={}, retainedKeys={}, secretSource={}",
                ALGORITHM, builder.initialKeyId, retainedKeys, secretSource.describe());
    }

    public static Builder builder(SecretSource secretSource) {
        return new Builder(secretSource);
    }

    @Override
    public String issueToken(String subjectId, String displayName, List<String> roles, Duration ttl) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId must not be blank");
        }
        if (displayName == null) {
            throw new IllegalArgumentException("displayName must not be null");
        }
        if (ttl == null || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must not be null or zero");
        }
        if (ttl.abs().compareTo(MAX_TTL) > 0) {
            throw new IllegalArgumentException("ttl must not exceed " + MAX_TTL.toDays() + " days");
        }

        SigningKey key = keyRing.get().active();
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = now.plus(ttl).truncatedTo(ChronoUnit.SECONDS);
        String tokenId = "jwt-" + now.getEpochSecond() + "-" + randomHex(4);
        List<String> roleList = roles == null ? List.of() : List.copyOf(roles);

        String token;
        try {
            token = Jwts.builder()
                    .header().keyId(key.keyId()).and()
                    .issuer(TokenClaims.ISSUER)
                    .subject(subjectId)
                    .id(tokenId)
                    .issuedAt(Date.from(now))
                    .notBefore(Date.from(now))
                    .expiration(Date.from(expiresAt))
                    .claim(TokenClaims.CLAIM_USER_ID, subjectId)
                    .claim(TokenClaims.CLAIM_USERNAME, displayName)
                    .claim(TokenClaims.CLAIM_ROLES, roleList)
                    .signWith(key.secretKey(), Jwts.SIG.HS256)
                    .compact();
        } catch (JwtException e) {
            throw new SigningException("Failed to sign token for subject " + subjectId, e);
        }

        events.publish(AuthEvent.of(AuthEventType.TOKEN_ISSUED, clock.instant(),
                AuthEvent.SUBJECT_ID, subjectId,
                AuthEvent.USERNAME, displayName,
                AuthEvent.TOKEN_ID, tokenId,
                AuthEvent.KEY_ID, key.keyId()));
        return token;
    }

    @Override
    public TokenClaims validateToken(String token) {
        if (token == null || token.isBlank()) {
            throw rejected(new AuthenticationException(AuthenticationFailure.MALFORMED_TOKEN, "Token is empty"));
        }

        // jjwt refuses unknown names and "none" before the key locator runs, with its own
        // exception types; the declared algorithm is therefore checked here first.
        TokenHeader header;
        try {
            header = TokenHeader.of(token);
        } catch (AuthenticationException e) {
            throw rejected(e);
        }
        if (!ALGORITHM.equals(header.algorithm())) {
            throw rejected(new AuthenticationException(AuthenticationFailure.ALGORITHM_MISMATCH,
                    "Unexpected signing algorithm: " + header.algorithm()));
        }

        Jws<Claims> jws;
        try {
            jws = Jwts.parser()
                    .keyLocator(new KeySelector(keyRing.get()))
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token);
        } catch (AuthenticationException e) {
            throw rejected(e);
        } catch (ExpiredJwtException e) {
            throw rejected(new AuthenticationException(AuthenticationFailure.EXPIRED, e.getMessage(), e));
        } catch (PrematureJwtException e) {
            throw rejected(new AuthenticationException(AuthenticationFailure.NOT_YET_VALID, e.getMessage(), e));
        } catch (SecurityException e) {
            throw rejected(new AuthenticationException(AuthenticationFailure.INVALID_SIGNATURE, e.getMessage(), e));
        } catch (JwtException | IllegalArgumentException e) {
            if (e.getCause() instanceof AuthenticationException cause) {
                throw rejected(cause);
            }
            throw rejected(new AuthenticationException(AuthenticationFailure.MALFORMED_TOKEN, e.getMessage(), e));
        }

        TokenClaims claims = toTokenClaims(jws.getPayload(), jws.getHeader().getKeyId());
        events.publish(AuthEvent.of(AuthEventType.TOKEN_VALIDATED, clock.instant(),
                AuthEvent.SUBJECT_ID, claims.subjectId(),
                AuthEvent.TOKEN_ID, claims.tokenId(),
                AuthEvent.KEY_ID, claims.keyId()));
        return claims;
    }

    @Override
    public String refreshToken(String token, Duration ttl) {
        TokenClaims current = validateToken(token);
        String refreshed = issueToken(current.subjectId(), current.displayName(), current.roles(), ttl);
        events.publish(AuthEvent.of(AuthEventType.TOKEN_REFRESHED, clock.instant(),
                AuthEvent.SUBJECT_ID, current.subjectId(),
                AuthEvent.TOKEN_ID, current.tokenId()));
        return refreshed;
    }

    @Override
    public String rotateSigningKey(String newSecret) {
        String keyId = "key-" + clock.instant().getEpochSecond() + "-" + randomHex(3);
        return rotateSigningKey(keyId, newSecret);
    }

    @Override
    public String rotateSigningKey(String keyId, String newSecret) {
        // Built before the swap: a bad secret must leave the current ring untouched.
        SigningKey key = SigningKey.of(keyId, newSecret);
        SigningKeyRing rotated = keyRing.updateAndGet(ring -> ring.rotate(key, retainedKeys));

        log.info("Signing key rotated: keyId={}, retained={}", key.keyId(), rotated.keyIds());
        events.publish(AuthEvent.of(AuthEventType.SIGNING_KEY_ROTATED, clock.instant(),
                AuthEvent.KEY_ID, key.keyId(),
                "jwt.retained_keys", String.valueOf(rotated.size())));
        return key.keyId();
    }

    @Override
    public String rotateFromSource() {
        String secret = secretSource.currentSecret()
                .orElseThrow(() -> new ConfigurationException(
                        "Signing secret is not configured (" + secretSource.describe() + ")"));
        return rotateSigningKey(secret);
    }

    @Override
    public String activeKeyId() {
        return keyRing.get().active().keyId();
    }

    private AuthenticationException rejected(AuthenticationException e) {
        log.debug("Token rejected: reason={}, detail={}", e.failure().code(), e.getMessage());
        events.publish(AuthEvent.of(AuthEventType.TOKEN_REJECTED, clock.instant(),
                AuthEvent.REASON, e.failure().code()));
        return e;
    }

    private TokenClaims toTokenClaims(Claims body, String keyId) {
        String subjectId = stringClaim(body, TokenClaims.CLAIM_USER_ID);
        if (subjectId == null || subjectId.isBlank()) {
            throw rejected(new AuthenticationException(AuthenticationFailure.MALFORMED_TOKEN,
                    "Token has no " + TokenClaims.CLAIM_USER_ID + " claim"));
        }
        String displayName = stringClaim(body, TokenClaims.CLAIM_USERNAME);
        if (displayName == null) {
            throw rejected(new AuthenticationException(AuthenticationFailure.MALFORMED_TOKEN,
                    "Token has no " + TokenClaims.CLAIM_USERNAME + " claim"));
        }
        return new TokenClaims(
                subjectId,
                displayName,
                rolesClaim(body),
                body.getIssuer(),
                toInstant(body.getIssuedAt()),
                toInstant(body.getNotBefore()),
                toInstant(body.getExpiration()),
                body.getId(),
                keyId);
    }

    private String stringClaim(Claims body, String name) {
        Object value = body.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof String text) {
            return text;
        }
        throw rejected(new AuthenticationException(AuthenticationFailure.MALFORMED_TOKEN,
                "Claim " + name + " is not a string"));
    }

    private List<String> rolesClaim(Claims body) {
        Object value = body.get(TokenClaims.CLAIM_ROLES);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> raw)) {
            throw rejected(new AuthenticationException(AuthenticationFailure.MALFORMED_TOKEN,
                    "Claim " + TokenClaims.CLAIM_ROLES + " is not an array"));
        }
        List<String> roles = new ArrayList<>(raw.size());
        for (Object role : raw) {
            if (!(role instanceof String name)) {
                throw rejected(new AuthenticationException(AuthenticationFailure.MALFORMED_TOKEN,
                        "Claim " + TokenClaims.CLAIM_ROLES + " contains a non-string entry"));
            }
            roles.add(name);
        }
        return roles;
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }

    private static String randomHex(int bytes) {
        byte[] buffer = new byte[bytes];
        RANDOM.nextBytes(buffer);
        return HEX.formatHex(buffer);
    }

    /** Picks the verification key for one parse, against one ring snapshot. */
    private final class KeySelector extends LocatorAdapter<Key> {

        private final SigningKeyRing ring;

        private KeySelector(SigningKeyRing ring) {
            this.ring = ring;
        }

        @Override
        protected Key locate(JwsHeader header) {
            String algorithm = header.getAlgorithm();
            if (!ALGORITHM.equals(algorithm)) {
                throw new AuthenticationException(AuthenticationFailure.ALGORITHM_MISMATCH,
                        "Unexpected signing algorithm: " + algorithm);
            }

            SigningKey active = ring.active();
            String keyId = header.getKeyId();
            if (keyId == null || keyId.equals(active.keyId())) {
                return active.secretKey();
            }

            Optional<SigningKey> retained = ring.find(keyId);
            log.debug("Token kid {} differs from active kid {} (retained={})",
                    keyId, active.keyId(), retained.isPresent());
            events.publish(AuthEvent.of(AuthEventType.KEY_ID_MISMATCH, clock.instant(),
                    AuthEvent.KEY_ID, keyId,
                    AuthEvent.ACTIVE_KEY_ID, active.keyId(),
                    "jwt.kid_resolution", retained.isPresent() ? "retained" : "active"));
            return retained.orElse(active).secretKey();
        }
    }

    public static final class Builder {

        private final SecretSource secretSource;
        private String initialKeyId = DEFAULT_KEY_ID;
        private int retainedKeys = 1;
        private Clock clock = Clock.systemUTC();
        private AuthEventPublisher events = AuthEventPublisher.noop();

        private Builder(SecretSource secretSource) {
            if (secretSource == null) {
                throw new IllegalArgumentException("secretSource must not be null");
            }
            this.secretSource = secretSource;
        }

        public Builder initialKeyId(String initialKeyId) {
            this.initialKeyId = initialKeyId;
            return this;
        }

        /** Keys kept for verification, the active one included. 1 disables the grace window. */
        public Builder retainedKeys(int retainedKeys) {
            if (retainedKeys < 1) {
                throw new IllegalArgumentException("retainedKeys must be at least 1");
            }
            this.retainedKeys = retainedKeys;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder eventPublisher(AuthEventPublisher events) {
            this.events = events;
            return this;
        }

        /**
         * @throws ConfigurationException if the secret source has no usable secret
         */
        public JwtTokenManager build() {
            return new JwtTokenManager(this);
        }
    }
}
