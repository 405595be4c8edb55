package com.bastion.security.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One audit fact about token handling or request authentication.
 * <p>
 * Attributes are plain strings so that any collector (log line, metric tag, span
 * attribute) can consume them. They never carry a raw token or a secret.
 *
 * @param type       what happened
 * @param occurredAt when it happened
 * @param attributes identity and reason attributes, insertion ordered
 */
public record AuthEvent(AuthEventType type, Instant occurredAt, Map<String, String> attributes) {

    public static final String SUBJECT_ID = "user.id";
    public static final String USERNAME = "user.username";
    public static final String TOKEN_ID = "jwt.id";
    public static final String KEY_ID = "jwt.kid";
    public static final String ACTIVE_KEY_ID = "jwt.active_kid";
    public static final String REASON = "reason";
    public static final String MODE = "auth.mode";
    public static final String REQUIRED_ROLE = "required.role";
    public static final String REQUEST = "request";

    public AuthEvent {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt must not be null");
        }
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Builds an event from alternating key/value pairs. Pairs whose value is null are
     * dropped.
     *
     * @throws IllegalArgumentException if an odd number of strings is given
     */
    public static AuthEvent of(AuthEventType type, Instant occurredAt, String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must contain key/value pairs");
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                attributes.put(keyValues[i], keyValues[i + 1]);
            }
        }
        return new AuthEvent(type, occurredAt, attributes);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }
}
