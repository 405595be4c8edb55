package com.bastion.identity.config;

import com.bastion.security.token.EnvironmentSecretSource;
import com.bastion.security.token.JwtTokenManager;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Type-safe configuration for the identity service, bound from {@code bastion.identity.*}.
 *
 * <pre>
 * bastion:
 *   identity:
 *     name: identity-service
 *     environment: production
 *     secret-env-variable: JWT_SECRET
 *     retained-keys: 2
 *     default-token-ttl: 1h
 * </pre>
 *
 * @param name              Service name used for logging, metrics and /api/v1/info. Required.
 * @param environment       Deployment environment (development, staging, production).
 * @param secretEnvVariable Environment variable holding the signing secret.
 * @param secret            Literal signing secret for local and test runs; wins over the
 *                          environment variable when set.
 * @param initialKeyId      Key ID advertised for the startup secret.
 * @param retainedKeys      Signing keys kept for verification after rotation, active included.
 * @param defaultTokenTtl   Lifetime for minted and refreshed tokens when the request gives none.
 * @param requiredPaths     URL patterns that require a valid bearer token.
 * @param optionalPaths     URL patterns that accept but do not require one.
 * @param grpcMethodRoles   Full gRPC method name to the role it requires.
 * @param corsAllowedOrigins Browser origins allowed to call {@code /api/**} with credentials.
 */
@ConfigurationProperties(prefix = "bastion.identity")
@Validated
public record IdentityProperties(
        @NotBlank String name,
        String environment,
        String secretEnvVariable,
        String secret,
        String initialKeyId,
        @Min(1) int retainedKeys,
        Duration defaultTokenTtl,
        List<String> requiredPaths,
        List<String> optionalPaths,
        Map<String, String> grpcMethodRoles,
        List<String> corsAllowedOrigins) {

    public static final List<String> DEFAULT_REQUIRED_PATHS = List.of("/api/v1/me", "/api/v1/admin/*");
    public static final List<String> DEFAULT_OPTIONAL_PATHS = List.of("/api/v1/info");
    public static final List<String> DEFAULT_CORS_ORIGINS = List.of("http://localhost:3000", "http://localhost:5173");

    /** Applies defaults for optional fields. Runs before Bean Validation. */
    public IdentityProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (secretEnvVariable == null || secretEnvVariable.isBlank()) {
            secretEnvVariable = EnvironmentSecretSource.DEFAULT_VARIABLE;
        }
        if (initialKeyId == null || initialKeyId.isBlank()) {
            initialKeyId = JwtTokenManager.DEFAULT_KEY_ID;
        }
        if (retainedKeys == 0) {
            retainedKeys = 1;
        }
        if (defaultTokenTtl == null || defaultTokenTtl.isZero() || defaultTokenTtl.isNegative()) {
            defaultTokenTtl = Duration.ofHours(24);
        }
        requiredPaths = requiredPaths == null ? DEFAULT_REQUIRED_PATHS : List.copyOf(requiredPaths);
        optionalPaths = optionalPaths == null ? DEFAULT_OPTIONAL_PATHS : List.copyOf(optionalPaths);
        grpcMethodRoles = grpcMethodRoles == null ? Map.of() : Map.copyOf(grpcMethodRoles);
        corsAllowedOrigins = corsAllowedOrigins == null ? DEFAULT_CORS_ORIGINS : List.copyOf(corsAllowedOrigins);
    }

    public boolean hasLiteralSecret() {
        return secret != null && !secret.isBlank();
    }

    /** Never prints the literal secret. */
    @Override
    public String toString() {
        return "IdentityProperties[name=%s, environment=%s, secretEnvVariable=%s, literalSecret=%s, initialKeyId=%s, retainedKeys=%d, defaultTokenTtl=%s]"
                .formatted(name, environment, secretEnvVariable, hasLiteralSecret(), initialKeyId,
                        retainedKeys, defaultTokenTtl);
    }
}
