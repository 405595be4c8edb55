package com.bastion.security.event;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AuthEvent")
class AuthEventTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    @DisplayName("builds attributes from pairs, dropping null values")
    void pairs() {
        var event = AuthEvent.of(AuthEventType.ROLE_DENIED, NOW,
                AuthEvent.SUBJECT_ID, null,
                AuthEvent.REQUIRED_ROLE, "admin");

        assertThat(event.attributes()).containsOnlyKeys(AuthEvent.REQUIRED_ROLE);
        assertThat(event.attribute(AuthEvent.REQUIRED_ROLE)).isEqualTo("admin");
        assertThat(event.attribute(AuthEvent.SUBJECT_ID)).isNull();
    }

    @Test
    @DisplayName("rejects an odd number of strings")
    void oddPairs() {
        assertThatThrownBy(() -> AuthEvent.of(AuthEventType.TOKEN_ISSUED, NOW, "user.id"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("attributes are read-only")
    void immutable() {
        var event = AuthEvent.of(AuthEventType.TOKEN_ISSUED, NOW, AuthEvent.SUBJECT_ID, "u1");

        assertThatThrownBy(() -> event.attributes().put("x", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("denial types are the rejection and denial events")
    void denial() {
        assertThat(AuthEventType.TOKEN_REJECTED.denial()).isTrue();
        assertThat(AuthEventType.REQUEST_REJECTED.denial()).isTrue();
        assertThat(AuthEventType.ROLE_DENIED.denial()).isTrue();
        assertThat(AuthEventType.KEY_ID_MISMATCH.denial()).isFalse();
        assertThat(AuthEventType.TOKEN_ISSUED.denial()).isFalse();
    }
}
