package com.bastion.security.token;

import java.util.Optional;

/**
 * A fixed secret, for tests and local runs where no environment is provisioned.
 */
public final class StaticSecretSource implements SecretSource {

    private final String secret;

    public StaticSecretSource(String secret) {
        this.secret = secret;
    }

    @Override
    public Optional<String> currentSecret() {
        return secret == null || secret.isEmpty() ? Optional.empty() : Optional.of(secret);
    }

    @Override
    public String describe() {
        return "static configuration";
    }
}
