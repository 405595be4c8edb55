package com.bastion.security.event;

import com.bastion.security.testing.RecordingAuthEventListener;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("AuthEventPublisher")
class AuthEventPublisherTest {

    private static final AuthEvent EVENT = AuthEvent.of(AuthEventType.TOKEN_ISSUED, Instant.now(),
            AuthEvent.SUBJECT_ID, "u1");

    @Test
    @DisplayName("delivers each event to every listener in order")
    void fansOut() {
        var first = new RecordingAuthEventListener();
        var second = new RecordingAuthEventListener();

        AuthEventPublisher.of(first, second).publish(EVENT);

        assertThat(first.events()).containsExactly(EVENT);
        assertThat(second.events()).containsExactly(EVENT);
    }

    @Test
    @DisplayName("a failing listener does not stop delivery to the others")
    void isolatesFailures() {
        var recording = new RecordingAuthEventListener();
        AuthEventListener failing = event -> {
            throw new IllegalStateException("boom");
        };

        assertThatCode(() -> new AuthEventPublisher(List.of(failing, recording)).publish(EVENT))
                .doesNotThrowAnyException();
        assertThat(recording.events()).hasSize(1);
    }

    @Test
    @DisplayName("noop publisher has no listeners")
    void noop() {
        assertThat(AuthEventPublisher.noop().listenerCount()).isZero();
        assertThatCode(() -> AuthEventPublisher.noop().publish(EVENT)).doesNotThrowAnyException();
    }
}
