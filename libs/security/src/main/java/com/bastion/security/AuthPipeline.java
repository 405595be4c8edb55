package com.bastion.security;

import com.bastion.security.event.AuthEvent;
import com.bastion.security.event.AuthEventPublisher;
import com.bastion.security.event.AuthEventType;
import com.bastion.security.token.TokenClaims;
import com.bastion.security.token.TokenManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * The request-side auth chain: extract the bearer token, validate it, attach the
 * identity, and gate on roles.
 * <p>
 * All authentication and authorization failures are handled here. In
 * {@link AuthMode#REQUIRED} mode they become a 401 written through
 * {@link AuthExchange#reject}; in {@link AuthMode#OPTIONAL} mode the request continues
 * without an identity. A failed role check always becomes a 403. Signing and
 * configuration failures are not caught and reach the host's error handling.
 * <p>
 * Stateless and thread-safe; one instance serves every request.
 */
public final class AuthPipeline {

    private static final Logger log = LoggerFactory.getLogger(AuthPipeline.class);

    private final TokenManager tokenManager;
    private final AuthEventPublisher events;
    private final Clock clock;

    public AuthPipeline(TokenManager tokenManager, AuthEventPublisher events) {
        this(tokenManager, events, Clock.systemUTC());
    }

    public AuthPipeline(TokenManager tokenManager, AuthEventPublisher events, Clock clock) {
        if (tokenManager == null) {
            throw new IllegalArgumentException("tokenManager must not be null");
        }
        this.tokenManager = tokenManager;
        this.events = events == null ? AuthEventPublisher.noop() : events;
        this.clock = clock;
    }

    /**
     * Runs the extract, validate and enrich stages.
     * <p>
     * A request that already carries an identity (two auth filters mapped onto the same
     * path) is not validated again.
     *
     * @return {@link AuthOutcome#AUTHENTICATED}, {@link AuthOutcome#ANONYMOUS} (optional
     *         mode only) or {@link AuthOutcome#REJECTED} (required mode only, 401 written)
     */
    public AuthOutcome authenticate(AuthExchange exchange, AuthMode mode) {
        if (IdentityContext.isAuthenticated(exchange)) {
            return AuthOutcome.AUTHENTICATED;
        }

        String header = exchange.header(BearerTokenExtractor.AUTHORIZATION_HEADER).orElse(null);
        Optional<String> token = BearerTokenExtractor.extract(header);
        if (token.isEmpty()) {
            return unauthenticated(exchange, mode, BearerTokenExtractor.whyMissing(header));
        }

        TokenClaims claims;
        try {
            claims = tokenManager.validateToken(token.get());
        } catch (AuthenticationException e) {
            return unauthenticated(exchange, mode, e.failure());
        }

        RequestIdentity identity = RequestIdentity.from(claims);
        IdentityContext.attach(exchange, identity);

        if (mode == AuthMode.REQUIRED) {
            log.info("User authenticated: user_id={}, username={}, request={}",
                    identity.subjectId(), identity.displayName(), exchange.describe());
            events.publish(AuthEvent.of(AuthEventType.REQUEST_AUTHENTICATED, clock.instant(),
                    AuthEvent.SUBJECT_ID, identity.subjectId(),
                    AuthEvent.USERNAME, identity.displayName(),
                    AuthEvent.TOKEN_ID, claims.tokenId(),
                    AuthEvent.MODE, mode.name(),
                    AuthEvent.REQUEST, exchange.describe()));
        } else {
            log.debug("Optional authentication succeeded: user_id={}, request={}",
                    identity.subjectId(), exchange.describe());
        }
        return AuthOutcome.AUTHENTICATED;
    }

    /**
     * Runs the role gate for a route that declares {@code requiredRole}.
     *
     * @return {@link AuthOutcome#GRANTED}, or {@link AuthOutcome#FORBIDDEN} with 403 written
     */
    public AuthOutcome authorize(AuthExchange exchange, String requiredRole) {
        RequestIdentity identity;
        try {
            identity = RoleChecker.requireRole(exchange, requiredRole);
        } catch (AuthorizationException e) {
            String subjectId = IdentityContext.subjectId(exchange).orElse(null);
            log.warn("Authorization denied: reason={}, user_id={}, required_role={}, request={}",
                    e.failure().code(), subjectId, requiredRole, exchange.describe());
            events.publish(AuthEvent.of(AuthEventType.ROLE_DENIED, clock.instant(),
                    AuthEvent.SUBJECT_ID, subjectId,
                    AuthEvent.REQUIRED_ROLE, requiredRole,
                    AuthEvent.REASON, e.failure().code(),
                    AuthEvent.REQUEST, exchange.describe()));
            exchange.reject(AuthRejection.forbidden(e.failure()));
            return AuthOutcome.FORBIDDEN;
        }

        events.publish(AuthEvent.of(AuthEventType.ROLE_GRANTED, clock.instant(),
                AuthEvent.SUBJECT_ID, identity.subjectId(),
                AuthEvent.REQUIRED_ROLE, requiredRole,
                AuthEvent.REQUEST, exchange.describe()));
        return AuthOutcome.GRANTED;
    }

    private AuthOutcome unauthenticated(AuthExchange exchange, AuthMode mode, AuthenticationFailure failure) {
        if (mode == AuthMode.OPTIONAL) {
            if (failure.noToken()) {
                log.debug("No bearer token, continuing anonymously: request={}", exchange.describe());
            } else {
                log.warn("Invalid optional token, continuing anonymously: reason={}, request={}",
                        failure.code(), exchange.describe());
            }
            return AuthOutcome.ANONYMOUS;
        }

        log.warn("Authentication rejected: reason={}, request={}", failure.code(), exchange.describe());
        events.publish(AuthEvent.of(AuthEventType.REQUEST_REJECTED, clock.instant(),
                AuthEvent.REASON, failure.code(),
                AuthEvent.MODE, mode.name(),
                AuthEvent.REQUEST, exchange.describe()));
        exchange.reject(AuthRejection.unauthorized(failure));
        return AuthOutcome.REJECTED;
    }
}
