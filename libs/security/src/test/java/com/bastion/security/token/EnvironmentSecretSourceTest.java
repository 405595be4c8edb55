package com.bastion.security.token;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EnvironmentSecretSource")
class EnvironmentSecretSourceTest {

    @Test
    @DisplayName("reads the named variable")
    void readsVariable() {
        var source = new EnvironmentSecretSource("APP_SECRET", Map.of("APP_SECRET", "value")::get);

        assertThat(source.currentSecret()).contains("value");
        assertThat(source.describe()).isEqualTo("environment variable APP_SECRET");
    }

    @Test
    @DisplayName("treats an unset or blank variable as not configured")
    void unsetOrBlank() {
        assertThat(new EnvironmentSecretSource("JWT_SECRET", name -> null).currentSecret()).isEmpty();
        assertThat(new EnvironmentSecretSource("JWT_SECRET", name -> "  ").currentSecret()).isEmpty();
    }

    @Test
    @DisplayName("defaults to JWT_SECRET")
    void defaultVariable() {
        assertThat(EnvironmentSecretSource.DEFAULT_VARIABLE).isEqualTo("JWT_SECRET");
        assertThatThrownBy(() -> new EnvironmentSecretSource(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("a static source with an empty secret is not configured")
    void staticSource() {
        assertThat(new StaticSecretSource("").currentSecret()).isEmpty();
        assertThat(new StaticSecretSource("s").currentSecret()).contains("s");
    }
}
