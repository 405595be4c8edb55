package com.bastion.security.testing;

import com.bastion.security.event.AuthEvent;
import com.bastion.security.event.AuthEventListener;
import com.bastion.security.event.AuthEventType;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Captures every event it receives, in order.
 */
public final class RecordingAuthEventListener implements AuthEventListener {

    private final List<AuthEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(AuthEvent event) {
        events.add(event);
    }

    public List<AuthEvent> events() {
        return List.copyOf(events);
    }

    public List<AuthEvent> ofType(AuthEventType type) {
        return events.stream().filter(event -> event.type() == type).toList();
    }

    public List<AuthEventType> types() {
        return events.stream().map(AuthEvent::type).toList();
    }

    public void clear() {
        events.clear();
    }
}
