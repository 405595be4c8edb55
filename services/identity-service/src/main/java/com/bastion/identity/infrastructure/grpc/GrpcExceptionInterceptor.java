package com.bastion.identity.infrastructure.grpc;

import com.bastion.security.AuthRejection;
import com.bastion.security.AuthenticationException;
import com.bastion.security.AuthorizationException;
import com.bastion.security.ConfigurationException;
import com.bastion.security.SigningException;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns exceptions thrown by a service method into a closed call with a status the client
 * can act on. Auth failures reach the client with the same generic messages as the HTTP
 * rejection body; the failure code only goes to the log.
 *
 * <p>Mapping: authentication to {@code UNAUTHENTICATED}, authorization to
 * {@code PERMISSION_DENIED}, {@link IllegalArgumentException} to {@code INVALID_ARGUMENT},
 * {@link StatusRuntimeException} to its own status. Signing, configuration and any other
 * failure become {@code INTERNAL} without detail.
 */
public class GrpcExceptionInterceptor implements ServerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(GrpcExceptionInterceptor.class);

    static final String INTERNAL_MESSAGE = "Internal server error";

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        ServerCall.Listener<ReqT> delegate;
        try {
            delegate = next.startCall(call, headers);
        } catch (RuntimeException e) {
            closeWith(call, e);
            return new ServerCall.Listener<>() {};
        }
        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<>(delegate) {
            @Override
            public void onMessage(ReqT message) {
                try {
                    super.onMessage(message);
                } catch (RuntimeException e) {
                    closeWith(call, e);
                }
            }

            @Override
            public void onHalfClose() {
                try {
                    super.onHalfClose();
                } catch (RuntimeException e) {
                    closeWith(call, e);
                }
            }
        };
    }

    private void closeWith(ServerCall<?, ?> call, RuntimeException e) {
        call.close(toStatus(e), new Metadata());
    }

    /** Package-private for testing. */
    Status toStatus(Throwable throwable) {
        if (throwable instanceof StatusRuntimeException sre) {
            return sre.getStatus();
        }
        if (throwable instanceof AuthenticationException authentication) {
            log.warn("Call rejected: reason={}", authentication.failure().code());
            return Status.UNAUTHENTICATED
                    .withDescription(AuthRejection.unauthorized(authentication.failure()).message());
        }
        if (throwable instanceof AuthorizationException authorization) {
            log.warn("Call forbidden: reason={}, required_role={}",
                    authorization.failure().code(), authorization.requiredRole());
            return Status.PERMISSION_DENIED.withDescription(authorization.failure().message());
        }
        if (throwable instanceof IllegalArgumentException) {
            return Status.INVALID_ARGUMENT.withDescription(throwable.getMessage());
        }
        if (throwable instanceof SigningException || throwable instanceof ConfigurationException) {
            log.error("Token infrastructure failure during call", throwable);
        } else {
            log.error("Unhandled failure during call", throwable);
        }
        return Status.INTERNAL.withDescription(INTERNAL_MESSAGE);
    }
}
