package com.bastion.identity.infrastructure.events;

import com.bastion.security.event.AuthEvent;
import com.bastion.security.event.AuthEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every auth event to the {@code bastion.audit} logger: denials at WARN, the rest at
 * INFO. Attributes never contain tokens or secrets, so they are logged as is.
 */
public class LoggingAuthEventListener implements AuthEventListener {

    public static final String AUDIT_LOGGER = "bastion.audit";

    private static final Logger audit = LoggerFactory.getLogger(AUDIT_LOGGER);

    @Override
    public void onEvent(AuthEvent event) {
        if (event.type().denial()) {
            audit.warn("auth_event={} at={} {}", event.type(), event.occurredAt(), event.attributes());
        } else if (audit.isInfoEnabled()) {
            audit.info("auth_event={} at={} {}", event.type(), event.occurredAt(), event.attributes());
        }
    }
}
