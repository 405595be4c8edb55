package com.bastion.security.token;

import java.util.Optional;

/**
 * Supplies the current signing secret. Consulted once at startup and again on every
 * {@link TokenManager#rotateFromSource()}.
 */
@FunctionalInterface
public interface SecretSource {

    /** @return the secret, or empty when it is not configured */
    Optional<String> currentSecret();

    /** Human-readable origin for log and error messages. Never the secret itself. */
    default String describe() {
        return getClass().getSimpleName();
    }
}
