package com.bastion.security.testing;

import com.bastion.security.AuthExchange;
import com.bastion.security.AuthRejection;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link AuthExchange} over plain maps for driving the pipeline without a web framework.
 */
public final class InMemoryAuthExchange implements AuthExchange {

    private final Map<String, String> headers = new HashMap<>();
    private final Map<String, Object> attributes = new HashMap<>();
    private final String description;
    private AuthRejection rejection;

    public InMemoryAuthExchange() {
        this("GET /test");
    }

    public InMemoryAuthExchange(String description) {
        this.description = description;
    }

    public static InMemoryAuthExchange withAuthorization(String headerValue) {
        return new InMemoryAuthExchange().header("Authorization", headerValue);
    }

    public static InMemoryAuthExchange withBearer(String token) {
        return withAuthorization("Bearer " + token);
    }

    public InMemoryAuthExchange header(String name, String value) {
        headers.put(name, value);
        return this;
    }

    @Override
    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    @Override
    public Optional<Object> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    @Override
    public void setAttribute(String key, Object value) {
        attributes.put(key, value);
    }

    @Override
    public void reject(AuthRejection rejection) {
        if (this.rejection != null) {
            throw new IllegalStateException("Exchange already rejected");
        }
        this.rejection = rejection;
    }

    @Override
    public String describe() {
        return description;
    }

    public Optional<AuthRejection> rejection() {
        return Optional.ofNullable(rejection);
    }
}
