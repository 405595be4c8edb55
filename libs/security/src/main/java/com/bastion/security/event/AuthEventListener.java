package com.bastion.security.event;

/**
 * Receives audit events. Implementations must be thread-safe; events arrive from every
 * request thread concurrently.
 */
@FunctionalInterface
public interface AuthEventListener {

    AuthEventListener NOOP = event -> { };

    void onEvent(AuthEvent event);
}
