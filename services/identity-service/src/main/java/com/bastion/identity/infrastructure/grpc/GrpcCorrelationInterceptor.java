package com.bastion.identity.infrastructure.grpc;

import com.bastion.observability.CorrelationContext;
import com.bastion.observability.CorrelationContextHolder;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;

/**
 * gRPC counterpart of the HTTP correlation filter.
 *
 * <p>Takes {@code x-correlation-id} from the call metadata (or generates one) and opens the
 * {@link CorrelationContext} before the rest of the chain starts, so {@link GrpcAuthInterceptor}
 * can bind the caller into it. gRPC delivers listener callbacks on executor threads that need
 * not be the one that started the call, so the context as it stands once the chain has started
 * is re-bound around every callback and cleared afterwards.
 */
public class GrpcCorrelationInterceptor implements ServerInterceptor {

    public static final Metadata.Key<String> CORRELATION_ID_KEY =
            Metadata.Key.of("x-correlation-id", Metadata.ASCII_STRING_MARSHALLER);

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        CorrelationContextHolder.set(CorrelationContext.forRequest(headers.get(CORRELATION_ID_KEY)));
        ServerCall.Listener<ReqT> delegate;
        CorrelationContext started;
        try {
            delegate = next.startCall(call, headers);
            started = CorrelationContextHolder.get().orElse(null);
        } finally {
            CorrelationContextHolder.clear();
        }
        return started == null ? delegate : new ContextBindingListener<>(delegate, started);
    }

    private static final class ContextBindingListener<ReqT>
            extends ForwardingServerCallListener.SimpleForwardingServerCallListener<ReqT> {

        private final CorrelationContext context;

        ContextBindingListener(ServerCall.Listener<ReqT> delegate, CorrelationContext context) {
            super(delegate);
            this.context = context;
        }

        @Override
        public void onMessage(ReqT message) {
            CorrelationContextHolder.set(context);
            try {
                super.onMessage(message);
            } finally {
                CorrelationContextHolder.clear();
            }
        }

        @Override
        public void onHalfClose() {
            CorrelationContextHolder.set(context);
            try {
                super.onHalfClose();
            } finally {
                CorrelationContextHolder.clear();
            }
        }

        @Override
        public void onReady() {
            CorrelationContextHolder.set(context);
            try {
                super.onReady();
            } finally {
                CorrelationContextHolder.clear();
            }
        }

        @Override
        public void onComplete() {
            CorrelationContextHolder.set(context);
            try {
                super.onComplete();
            } finally {
                CorrelationContextHolder.clear();
            }
        }

        @Override
        public void onCancel() {
            CorrelationContextHolder.set(context);
            try {
                super.onCancel();
            } finally {
                CorrelationContextHolder.clear();
            }
        }
    }
}
