package com.bastion.security;

import java.util.Optional;

/**
 * Request-scoped key/value storage: servlet request attributes, a gRPC call's
 * attribute map, or a plain map in tests.
 */
public interface AttributeStore {

    Optional<Object> attribute(String key);

    void setAttribute(String key, Object value);
}
