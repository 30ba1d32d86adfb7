package com.tollgate.authorizer.infrastructure.grpc;

import com.tollgate.observability.CorrelationContext;
import com.tollgate.observability.CorrelationContextHolder;
import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;

/**
 * gRPC counterpart of the servlet {@code CorrelationIdFilter}: opens a {@link CorrelationContext}
 * from {@code x-correlation-id} metadata, returns the id in the response headers, and clears the
 * context once the call completes or is cancelled.
 *
 * <p>Must run ahead of {@link GrpcExceptionInterceptor} and {@link
 * GrpcAuthorizationInterceptor} so denials are logged with a correlation id.
 */
public class GrpcCorrelationInterceptor implements ServerInterceptor {

    public static final Metadata.Key<String> CORRELATION_ID_KEY =
            Metadata.Key.of("x-correlation-id", Metadata.ASCII_STRING_MARSHALLER);

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        CorrelationContext context =
                CorrelationContext.forInboundCall(headers.get(CORRELATION_ID_KEY));
        CorrelationContextHolder.set(context);

        ServerCall<ReqT, RespT> echoing =
                new ForwardingServerCall.SimpleForwardingServerCall<>(call) {
                    @Override
                    public void sendHeaders(Metadata responseHeaders) {
                        responseHeaders.put(CORRELATION_ID_KEY, context.correlationId());
                        super.sendHeaders(responseHeaders);
                    }
                };

        ServerCall.Listener<ReqT> delegate;
        try {
            delegate = next.startCall(echoing, headers);
        } catch (RuntimeException e) {
            CorrelationContextHolder.clear();
            throw e;
        }
        return new ClearingListener<>(delegate);
    }

    private static final class ClearingListener<ReqT>
            extends ForwardingServerCallListener.SimpleForwardingServerCallListener<ReqT> {

        ClearingListener(ServerCall.Listener<ReqT> delegate) {
            super(delegate);
        }

        @Override
        public void onComplete() {
            try {
                super.onComplete();
            } finally {
                CorrelationContextHolder.clear();
            }
        }

        @Override
        public void onCancel() {
            try {
                super.onCancel();
            } finally {
                CorrelationContextHolder.clear();
            }
        }
    }
}
