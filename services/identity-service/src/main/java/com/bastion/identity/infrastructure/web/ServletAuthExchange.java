package com.bastion.identity.infrastructure.web;

import com.bastion.security.AuthExchange;
import com.bastion.security.AuthRejection;
import com.bastion.security.AuthRejectionSerializer;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * Servlet binding of {@link AuthExchange}: headers and attributes come from the request,
 * rejections are written straight to the response as JSON.
 */
public class ServletAuthExchange extends ServletAttributeStore implements AuthExchange {

    private final HttpServletResponse response;

    public ServletAuthExchange(HttpServletRequest request, HttpServletResponse response) {
        super(request);
        this.response = response;
    }

    @Override
    public Optional<String> header(String name) {
        return Optional.ofNullable(request.getHeader(name));
    }

    @Override
    public void reject(AuthRejection rejection) {
        if (response.isCommitted()) {
            throw new IllegalStateException("Response already committed for " + describe());
        }
        byte[] body = AuthRejectionSerializer.toJson(rejection);
        response.setStatus(rejection.status());
        response.setContentType(AuthRejectionSerializer.CONTENT_TYPE);
        response.setContentLength(body.length);
        try {
            response.getOutputStream().write(body);
            response.flushBuffer();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write auth rejection for " + describe(), e);
        }
    }

    @Override
    public String describe() {
        return request.getMethod() + " " + request.getRequestURI();
    }
}
