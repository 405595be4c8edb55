package com.bastion.security.token;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Reads the signing secret from an environment variable, {@code JWT_SECRET} by default.
 * Blank values count as not configured.
 */
public final class EnvironmentSecretSource implements SecretSource {

    public static final String DEFAULT_VARIABLE = "JWT_SECRET";

    private final String variable;
    private final UnaryOperator<String> environment;

    public EnvironmentSecretSource() {
        this(DEFAULT_VARIABLE);
    }

    public EnvironmentSecretSource(String variable) {
        this(variable, System::getenv);
    }

    /** Visible for tests: reads variables through {@code environment} instead of the process. */
    public EnvironmentSecretSource(String variable, UnaryOperator<String> environment) {
        if (variable == null || variable.isBlank()) {
            throw new IllegalArgumentException("variable must not be blank");
        }
        this.variable = variable;
        this.environment = environment;
    }

    @Override
    public Optional<String> currentSecret() {
        String value = environment.apply(variable);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    @Override
    public String describe() {
        return "environment variable " + variable;
    }
}
