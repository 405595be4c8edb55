package com.bastion.identity.infrastructure.tracing;

import com.bastion.observability.SpanHelper;
import com.bastion.security.token.TokenClaims;
import com.bastion.security.token.TokenHeader;
import com.bastion.security.token.TokenManager;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link TokenManager} decorator that runs every operation inside an OpenTelemetry span.
 *
 * <p>Span names: {@code jwt.generate_token}, {@code jwt.validate_token},
 * {@code jwt.refresh_token}, {@code jwt.rotate_signing_key}. Failures are recorded on the span
 * and re-thrown unchanged. Tokens and secrets never become span attributes.
 */
public class TracedTokenManager implements TokenManager {

    public static final String SPAN_GENERATE = "jwt.generate_token";
    public static final String SPAN_VALIDATE = "jwt.validate_token";
    public static final String SPAN_REFRESH = "jwt.refresh_token";
    public static final String SPAN_ROTATE = "jwt.rotate_signing_key";

    private final TokenManager delegate;
    private final SpanHelper spans;

    public TracedTokenManager(TokenManager delegate, SpanHelper spans) {
        this.delegate = delegate;
        this.spans = spans;
    }

    @Override
    public String issueToken(String subjectId, String displayName, List<String> roles, Duration ttl) {
        Map<String, String> attributes = new HashMap<>();
        attributes.put("user.id", subjectId);
        attributes.put("user.username", displayName);
        attributes.put("jwt.ttl_seconds", ttl == null ? null : String.valueOf(ttl.toSeconds()));
        return spans.inSpan(SPAN_GENERATE, attributes, () -> {
            String token = delegate.issueToken(subjectId, displayName, roles, ttl);
            SpanHelper.annotateCurrent("jwt.kid", TokenHeader.of(token).keyId());
            return token;
        });
    }

    @Override
    public TokenClaims validateToken(String token) {
        return spans.inSpan(SPAN_VALIDATE, Map.of(), () -> {
            TokenClaims claims = delegate.validateToken(token);
            SpanHelper.annotateCurrent("user.id", claims.subjectId());
            SpanHelper.annotateCurrent("jwt.id", claims.tokenId());
            SpanHelper.annotateCurrent("jwt.kid", claims.keyId());
            return claims;
        });
    }

    @Override
    public String refreshToken(String token, Duration ttl) {
        return spans.inSpan(SPAN_REFRESH, Map.of(), () -> {
            String refreshed = delegate.refreshToken(token, ttl);
            SpanHelper.annotateCurrent("jwt.kid", TokenHeader.of(refreshed).keyId());
            return refreshed;
        });
    }

    @Override
    public String rotateSigningKey(String newSecret) {
        return spans.inSpan(SPAN_ROTATE, Map.of(), () -> annotatedKeyId(delegate.rotateSigningKey(newSecret)));
    }

    @Override
    public String rotateSigningKey(String keyId, String newSecret) {
        return spans.inSpan(SPAN_ROTATE, Map.of(), () -> annotatedKeyId(delegate.rotateSigningKey(keyId, newSecret)));
    }

    @Override
    public String rotateFromSource() {
        return spans.inSpan(SPAN_ROTATE, Map.of("jwt.secret_source", "configured"),
                () -> annotatedKeyId(delegate.rotateFromSource()));
    }

    @Override
    public String activeKeyId() {
        return delegate.activeKeyId();
    }

    private static String annotatedKeyId(String keyId) {
        SpanHelper.annotateCurrent("jwt.kid", keyId);
        return keyId;
    }
}
