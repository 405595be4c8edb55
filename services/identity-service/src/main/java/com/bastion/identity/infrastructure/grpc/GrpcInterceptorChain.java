package com.bastion.identity.infrastructure.grpc;

import io.grpc.BindableService;
import io.grpc.ServerInterceptors;
import io.grpc.ServerServiceDefinition;

/**
 * The identity interceptors in the order a call must pass them: exception mapping outermost,
 * then correlation, then authentication.
 *
 * <p>Whoever builds the gRPC server wraps each service with {@link #wrap(BindableService)}.
 */
public class GrpcInterceptorChain {

    private final GrpcExceptionInterceptor exceptionInterceptor;
    private final GrpcCorrelationInterceptor correlationInterceptor;
    private final GrpcAuthInterceptor authInterceptor;

    public GrpcInterceptorChain(
            GrpcExceptionInterceptor exceptionInterceptor,
            GrpcCorrelationInterceptor correlationInterceptor,
            GrpcAuthInterceptor authInterceptor) {
        this.exceptionInterceptor = exceptionInterceptor;
        this.correlationInterceptor = correlationInterceptor;
        this.authInterceptor = authInterceptor;
    }

    public ServerServiceDefinition wrap(BindableService service) {
        return wrap(service.bindService());
    }

    public ServerServiceDefinition wrap(ServerServiceDefinition definition) {
        // ServerInterceptors runs the last interceptor first.
        return ServerInterceptors.intercept(
                definition, authInterceptor, correlationInterceptor, exceptionInterceptor);
    }
}
