package com.bastion.identity.infrastructure.grpc;

import com.bastion.observability.CorrelationContext;
import com.bastion.observability.CorrelationContextHolder;
import com.bastion.security.AuthMode;
import com.bastion.security.AuthPipeline;
import com.bastion.security.event.AuthEventPublisher;
import com.bastion.security.testing.TestIdentityFactory;
import com.bastion.security.token.JwtTokenManager;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerServiceDefinition;
import io.grpc.Status;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Drives a wrapped service definition through all three interceptors.
 */
@DisplayName("GrpcInterceptorChain")
class GrpcInterceptorChainTest {

    private static final String METHOD = "bastion.identity.v1.TokenService/WhoAmI";
    private static final Metadata.Key<String> AUTHORIZATION =
            Metadata.Key.of("authorization", Metadata.ASCII_STRING_MARSHALLER);

    private JwtTokenManager tokenManager;
    private MethodDescriptor<String, String> descriptor;
    private AtomicReference<CorrelationContext> seen;

    @SuppressWarnings("unchecked")
    @BeforeEach
    void setUp() {
        tokenManager = TestIdentityFactory.tokenManager();
        MethodDescriptor.Marshaller<String> marshaller = mock(MethodDescriptor.Marshaller.class);
        descriptor = MethodDescriptor.<String, String>newBuilder()
                .setType(MethodDescriptor.MethodType.UNARY)
                .setFullMethodName(METHOD)
                .setRequestMarshaller(marshaller)
                .setResponseMarshaller(marshaller)
                .build();
        seen = new AtomicReference<>();
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    private ServerCallHandler<String, String> wrapped(ServerCallHandler<String, String> method) {
        var chain = new GrpcInterceptorChain(
                new GrpcExceptionInterceptor(),
                new GrpcCorrelationInterceptor(),
                new GrpcAuthInterceptor(
                        new AuthPipeline(tokenManager, AuthEventPublisher.noop()), AuthMode.REQUIRED, Map.of()));
        ServerServiceDefinition definition = chain.wrap(
                ServerServiceDefinition.builder("bastion.identity.v1.TokenService")
                        .addMethod(descriptor, method)
                        .build());
        @SuppressWarnings("unchecked")
        var handler = (ServerCallHandler<String, String>) definition.getMethod(METHOD).getServerCallHandler();
        return handler;
    }

    @SuppressWarnings("unchecked")
    private ServerCall<String, String> call() {
        ServerCall<String, String> call = mock(ServerCall.class);
        when(call.getMethodDescriptor()).thenReturn(descriptor);
        return call;
    }

    private Metadata bearer() {
        var metadata = new Metadata();
        metadata.put(AUTHORIZATION,
                "Bearer " + tokenManager.issueToken("u1", "alice", List.of("user"), Duration.ofMinutes(5)));
        return metadata;
    }

    @Test
    @DisplayName("an authenticated call runs with the caller in the correlation context")
    void authenticatedCallCarriesCaller() {
        var call = call();
        ServerCallHandler<String, String> method = (c, h) -> new ServerCall.Listener<>() {
            @Override
            public void onHalfClose() {
                seen.set(CorrelationContextHolder.get().orElse(null));
            }
        };

        wrapped(method).startCall(call, bearer()).onHalfClose();

        verify(call, never()).close(any(), any());
        assertThat(seen.get().subjectId()).isEqualTo("u1");
        assertThat(seen.get().username()).isEqualTo("alice");
    }

    @Test
    @DisplayName("an anonymous call never reaches the service")
    void anonymousCallRejected() {
        var call = call();
        ServerCallHandler<String, String> method = (c, h) -> {
            throw new AssertionError("service must not start");
        };

        wrapped(method).startCall(call, new Metadata());

        var status = ArgumentCaptor.forClass(Status.class);
        verify(call).close(status.capture(), any());
        assertThat(status.getValue().getCode()).isEqualTo(Status.Code.UNAUTHENTICATED);
    }

    @Test
    @DisplayName("a failing service method is mapped by the outermost interceptor")
    void serviceFailureMapped() {
        var call = call();
        ServerCallHandler<String, String> method = (c, h) -> new ServerCall.Listener<>() {
            @Override
            public void onHalfClose() {
                throw new IllegalArgumentException("ttl must be positive");
            }
        };

        wrapped(method).startCall(call, bearer()).onHalfClose();

        var status = ArgumentCaptor.forClass(Status.class);
        verify(call).close(status.capture(), any());
        assertThat(status.getValue().getCode()).isEqualTo(Status.Code.INVALID_ARGUMENT);
    }
}
