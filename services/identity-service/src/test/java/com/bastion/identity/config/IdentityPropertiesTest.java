package com.bastion.identity.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link IdentityProperties} compact-constructor defaults.
 */
@DisplayName("IdentityProperties")
class IdentityPropertiesTest {

    @Test
    @DisplayName("applies defaults for every optional field")
    void defaults() {
        var props = new IdentityProperties("identity", null, null, null, null, 0, null, null, null, null, null);

        assertThat(props.environment()).isEqualTo("development");
        assertThat(props.secretEnvVariable()).isEqualTo("JWT_SECRET");
        assertThat(props.initialKeyId()).isEqualTo("default");
        assertThat(props.retainedKeys()).isEqualTo(1);
        assertThat(props.defaultTokenTtl()).isEqualTo(Duration.ofHours(24));
        assertThat(props.requiredPaths()).containsExactly("/api/v1/me", "/api/v1/admin/*");
        assertThat(props.optionalPaths()).containsExactly("/api/v1/info");
        assertThat(props.grpcMethodRoles()).isEmpty();
        assertThat(props.corsAllowedOrigins()).containsExactly("http://localhost:3000", "http://localhost:5173");
        assertThat(props.hasLiteralSecret()).isFalse();
    }

    @Test
    @DisplayName("keeps explicit values")
    void explicitValues() {
        var props = new IdentityProperties("identity", "production", "APP_KEY", "s3cret", "k1", 3,
                Duration.ofMinutes(30), List.of("/secure/*"), List.of(), Map.of("svc/Method", "admin"),
                List.of("https://console.example.com"));

        assertThat(props.secretEnvVariable()).isEqualTo("APP_KEY");
        assertThat(props.retainedKeys()).isEqualTo(3);
        assertThat(props.defaultTokenTtl()).isEqualTo(Duration.ofMinutes(30));
        assertThat(props.requiredPaths()).containsExactly("/secure/*");
        assertThat(props.optionalPaths()).isEmpty();
        assertThat(props.grpcMethodRoles()).containsEntry("svc/Method", "admin");
        assertThat(props.corsAllowedOrigins()).containsExactly("https://console.example.com");
        assertThat(props.hasLiteralSecret()).isTrue();
    }

    @Test
    @DisplayName("toString never prints the literal secret")
    void hidesSecret() {
        var props = new IdentityProperties("identity", null, null, "s3cret-value", null, 1, null, null, null, null, null);

        assertThat(props.toString()).doesNotContain("s3cret-value").contains("literalSecret=true");
    }
}
