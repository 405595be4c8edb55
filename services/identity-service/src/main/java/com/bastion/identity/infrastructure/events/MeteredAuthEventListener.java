package com.bastion.identity.infrastructure.events;

import com.bastion.observability.MetricFactory;
import com.bastion.security.event.AuthEvent;
import com.bastion.security.event.AuthEventListener;

import java.util.Locale;

/**
 * Counts auth events in {@code bastion.auth.events}, tagged by event type and reason.
 */
public class MeteredAuthEventListener implements AuthEventListener {

    public static final String METRIC = "bastion.auth.events";
    public static final String NO_REASON = "none";

    private final MetricFactory metrics;

    public MeteredAuthEventListener(MetricFactory metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onEvent(AuthEvent event) {
        String reason = event.attribute(AuthEvent.REASON);
        metrics.counter(METRIC, "Token and request authentication events",
                        "type", event.type().name().toLowerCase(Locale.ROOT),
                        "reason", reason == null ? NO_REASON : reason)
                .increment();
    }
}
