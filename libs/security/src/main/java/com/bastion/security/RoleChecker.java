package com.bastion.security;

import java.util.List;

/**
 * Role checks over plain role-name lists.
 * <p>
 * Matching is exact and case-sensitive. There is no hierarchy: holding {@code admin}
 * does not imply {@code user}.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    public static boolean hasRole(List<String> roles, String required) {
        if (roles == null || required == null) {
            return false;
        }
        for (String role : roles) {
            if (required.equals(role)) {
                return true;
            }
        }
        return false;
    }

    public static boolean hasRole(RequestIdentity identity, String required) {
        return identity != null && hasRole(identity.roles(), required);
    }

    /**
     * Checks the identity attached to a request against a required role.
     *
     * @return the identity, when it holds the role
     * @throws AuthorizationException {@link AuthorizationFailure#NO_ROLES_IN_CONTEXT} when no
     *                                identity is attached,
     *                                {@link AuthorizationFailure#INSUFFICIENT_PERMISSIONS}
     *                                when the role is missing
     */
    public static RequestIdentity requireRole(AttributeStore store, String required) {
        RequestIdentity identity = IdentityContext.identity(store)
                .orElseThrow(() -> new AuthorizationException(AuthorizationFailure.NO_ROLES_IN_CONTEXT, required));
        if (!hasRole(identity, required)) {
            throw new AuthorizationException(AuthorizationFailure.INSUFFICIENT_PERMISSIONS, required);
        }
        return identity;
    }
}
