package com.bastion.security;

import com.bastion.security.token.TokenClaims;

import java.util.List;
import java.util.Optional;

/**
 * Typed access to the identity the auth pipeline attached to a request.
 * <p>
 * Every accessor returns {@link Optional#empty()} for an anonymous request, so callers
 * cannot mistake "no identity" for a real one. The identity is written once per request;
 * a second {@link #attach} fails.
 */
public final class IdentityContext {

    public static final String IDENTITY = "bastion.identity";
    public static final String SUBJECT_ID = "bastion.identity.subjectId";
    public static final String DISPLAY_NAME = "bastion.identity.displayName";
    public static final String ROLES = "bastion.identity.roles";
    public static final String CLAIMS = "bastion.identity.claims";

    private IdentityContext() {
        // utility class
    }

    /**
     * Attaches {@code identity} to the request.
     *
     * @throws IllegalStateException if an identity is already attached
     */
    public static void attach(AttributeStore store, RequestIdentity identity) {
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        if (store.attribute(IDENTITY).isPresent()) {
            throw new IllegalStateException("An identity is already attached to this request");
        }
        store.setAttribute(SUBJECT_ID, identity.subjectId());
        store.setAttribute(DISPLAY_NAME, identity.displayName());
        store.setAttribute(ROLES, identity.roles());
        store.setAttribute(CLAIMS, identity.claims());
        store.setAttribute(IDENTITY, identity);
    }

    public static Optional<RequestIdentity> identity(AttributeStore store) {
        return store.attribute(IDENTITY)
                .filter(RequestIdentity.class::isInstance)
                .map(RequestIdentity.class::cast);
    }

    public static boolean isAuthenticated(AttributeStore store) {
        return identity(store).isPresent();
    }

    public static Optional<String> subjectId(AttributeStore store) {
        return identity(store).map(RequestIdentity::subjectId);
    }

    public static Optional<String> displayName(AttributeStore store) {
        return identity(store).map(RequestIdentity::displayName);
    }

    public static Optional<List<String>> roles(AttributeStore store) {
        return identity(store).map(RequestIdentity::roles);
    }

    public static Optional<TokenClaims> claims(AttributeStore store) {
        return identity(store).map(RequestIdentity::claims);
    }

    /**
     * @throws AuthenticationException with {@link AuthenticationFailure#MISSING_CREDENTIALS}
     *                                 when the request is anonymous
     */
    public static RequestIdentity require(AttributeStore store) {
        return identity(store).orElseThrow(() -> new AuthenticationException(
                AuthenticationFailure.MISSING_CREDENTIALS, "No identity attached to request"));
    }
}
