package com.bastion.identity.infrastructure.grpc;

import com.bastion.observability.CorrelationContextHolder;
import com.bastion.security.AuthMode;
import com.bastion.security.AuthOutcome;
import com.bastion.security.AuthPipeline;
import com.bastion.security.AuthRejection;
import com.bastion.security.IdentityContext;
import com.bastion.security.RequestIdentity;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;

import java.util.Map;
import java.util.Optional;

/**
 * gRPC binding of the auth pipeline.
 *
 * <p>Reads the bearer token from the {@code authorization} metadata key and, on success,
 * places the {@link RequestIdentity} into the call's {@link Context} under
 * {@link #IDENTITY_KEY}. Methods listed in {@code methodRoles} (full method name to role)
 * are also passed through the role gate. Refused calls are closed with
 * {@code UNAUTHENTICATED} or {@code PERMISSION_DENIED} carrying the generic rejection
 * message, and the service method is never invoked.
 *
 * <p>Like {@link GrpcCorrelationInterceptor}, this is registered with the gRPC server by
 * whoever builds it; the identity service exposes a ready instance as a bean.
 */
public class GrpcAuthInterceptor implements ServerInterceptor {

    public static final Context.Key<RequestIdentity> IDENTITY_KEY = Context.key(IdentityContext.IDENTITY);

    private final AuthPipeline pipeline;
    private final AuthMode mode;
    private final Map<String, String> methodRoles;

    public GrpcAuthInterceptor(AuthPipeline pipeline, AuthMode mode, Map<String, String> methodRoles) {
        this.pipeline = pipeline;
        this.mode = mode;
        this.methodRoles = Map.copyOf(methodRoles);
    }

    /** The identity of the call running on this thread, if it was authenticated. */
    public static Optional<RequestIdentity> currentIdentity() {
        return Optional.ofNullable(IDENTITY_KEY.get());
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        String method = call.getMethodDescriptor().getFullMethodName();
        var exchange = new GrpcAuthExchange(headers, method);

        AuthOutcome outcome = pipeline.authenticate(exchange, mode);
        if (!outcome.proceed()) {
            return refuse(call, Status.UNAUTHENTICATED, exchange);
        }

        String requiredRole = methodRoles.get(method);
        if (requiredRole != null && !pipeline.authorize(exchange, requiredRole).proceed()) {
            return refuse(call, Status.PERMISSION_DENIED, exchange);
        }

        Optional<RequestIdentity> identity = IdentityContext.identity(exchange);
        if (identity.isEmpty()) {
            return next.startCall(call, headers);
        }
        CorrelationContextHolder.bindIdentity(identity.get().subjectId(), identity.get().displayName());
        Context context = Context.current().withValue(IDENTITY_KEY, identity.get());
        return Contexts.interceptCall(context, call, headers, next);
    }

    private static <ReqT, RespT> ServerCall.Listener<ReqT> refuse(
            ServerCall<ReqT, RespT> call, Status status, GrpcAuthExchange exchange) {
        String message = exchange.rejection().map(AuthRejection::message).orElse(null);
        call.close(status.withDescription(message), new Metadata());
        return new ServerCall.Listener<>() {};
    }
}
