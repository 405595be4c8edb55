package com.bastion.identity.infrastructure.grpc;

import com.bastion.security.AuthExchange;
import com.bastion.security.AuthRejection;
import io.grpc.Metadata;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link AuthExchange} over one inbound gRPC call. Rejections are only recorded here;
 * {@link GrpcAuthInterceptor} turns them into a closed call.
 */
class GrpcAuthExchange implements AuthExchange {

    private final Metadata headers;
    private final String fullMethodName;
    private final Map<String, Object> attributes = new HashMap<>();
    private AuthRejection rejection;

    GrpcAuthExchange(Metadata headers, String fullMethodName) {
        this.headers = headers;
        this.fullMethodName = fullMethodName;
    }

    @Override
    public Optional<String> header(String name) {
        // gRPC metadata keys are lower-case.
        var key = Metadata.Key.of(name.toLowerCase(Locale.ROOT), Metadata.ASCII_STRING_MARSHALLER);
        return Optional.ofNullable(headers.get(key));
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
        this.rejection = rejection;
    }

    @Override
    public String describe() {
        return "grpc " + fullMethodName;
    }

    Optional<AuthRejection> rejection() {
        return Optional.ofNullable(rejection);
    }
}
