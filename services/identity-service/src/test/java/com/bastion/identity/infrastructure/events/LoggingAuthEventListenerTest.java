package com.bastion.identity.infrastructure.events;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.bastion.security.event.AuthEvent;
import com.bastion.security.event.AuthEventType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LoggingAuthEventListener")
class LoggingAuthEventListenerTest {

    private final LoggingAuthEventListener listener = new LoggingAuthEventListener();
    private final Logger audit = (Logger) LoggerFactory.getLogger(LoggingAuthEventListener.AUDIT_LOGGER);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attach() {
        appender.start();
        audit.addAppender(appender);
    }

    @AfterEach
    void detach() {
        audit.detachAppender(appender);
    }

    @Test
    @DisplayName("denials are logged at WARN, other events at INFO")
    void levels() {
        listener.onEvent(AuthEvent.of(AuthEventType.ROLE_DENIED, Instant.now(), AuthEvent.REQUIRED_ROLE, "admin"));
        listener.onEvent(AuthEvent.of(AuthEventType.TOKEN_ISSUED, Instant.now(), AuthEvent.SUBJECT_ID, "u1"));

        assertThat(appender.list).extracting(ILoggingEvent::getLevel).containsExactly(Level.WARN, Level.INFO);
        assertThat(appender.list.get(0).getFormattedMessage()).contains("ROLE_DENIED").contains("required.role=admin");
    }
}
