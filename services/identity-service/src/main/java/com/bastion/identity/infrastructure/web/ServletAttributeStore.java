package com.bastion.identity.infrastructure.web;

import com.bastion.security.AttributeStore;
import jakarta.servlet.http.HttpServletRequest;

import java.util.Optional;

/**
 * {@link AttributeStore} over servlet request attributes. Lets controllers read the identity
 * the auth filter attached through {@link com.bastion.security.IdentityContext}.
 */
public class ServletAttributeStore implements AttributeStore {

    protected final HttpServletRequest request;

    public ServletAttributeStore(HttpServletRequest request) {
        this.request = request;
    }

    @Override
    public Optional<Object> attribute(String key) {
        return Optional.ofNullable(request.getAttribute(key));
    }

    @Override
    public void setAttribute(String key, Object value) {
        request.setAttribute(key, value);
    }
}
