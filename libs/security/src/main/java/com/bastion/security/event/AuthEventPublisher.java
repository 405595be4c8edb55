package com.bastion.security.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fans audit events out to the registered listeners.
 * <p>
 * Emission is best-effort: a listener that throws is logged and skipped, and the
 * remaining listeners still receive the event. Token handling and request flow never
 * depend on a listener succeeding.
 */
public final class AuthEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(AuthEventPublisher.class);

    private static final AuthEventPublisher NOOP = new AuthEventPublisher(List.of());

    private final List<AuthEventListener> listeners;

    public AuthEventPublisher(List<? extends AuthEventListener> listeners) {
        if (listeners == null) {
            throw new IllegalArgumentException("listeners must not be null");
        }
        this.listeners = List.copyOf(listeners);
    }

    /** A publisher with no listeners. */
    public static AuthEventPublisher noop() {
        return NOOP;
    }

    public static AuthEventPublisher of(AuthEventListener... listeners) {
        return new AuthEventPublisher(List.of(listeners));
    }

    public void publish(AuthEvent event) {
        for (AuthEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Auth event listener {} failed on {}: {}",
                        listener.getClass().getName(), event.type(), e.toString());
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }
}
