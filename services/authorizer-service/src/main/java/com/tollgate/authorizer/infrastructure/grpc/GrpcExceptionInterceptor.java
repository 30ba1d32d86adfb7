package com.tollgate.authorizer.infrastructure.grpc;

import com.tollgate.security.AuthorizerConfigurationException;
import com.tollgate.security.SecretStoreUnavailableException;
import io.grpc.ForwardingServerCall;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the {@code UNKNOWN} status gRPC reports for an escaped exception into one that tells the
 * client whether to retry.
 *
 * <ul>
 *   <li>{@link SecretStoreUnavailableException}: {@code UNAVAILABLE}, retryable
 *   <li>{@link AuthorizerConfigurationException}: {@code FAILED_PRECONDITION}
 *   <li>{@link IllegalArgumentException}: {@code INVALID_ARGUMENT}
 *   <li>{@link StatusRuntimeException} or {@link StatusException}: its own status
 *   <li>anything else: {@code INTERNAL}
 * </ul>
 *
 * Descriptions for the authorizer's own exceptions are fixed strings; their messages name the
 * secret parameter and stay in the server log.
 */
public class GrpcExceptionInterceptor implements ServerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(GrpcExceptionInterceptor.class);

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        return next.startCall(
                new ForwardingServerCall.SimpleForwardingServerCall<>(call) {
                    @Override
                    public void close(Status status, Metadata trailers) {
                        Status mapped =
                                status.getCode() == Status.Code.UNKNOWN && status.getCause() != null
                                        ? mapException(status.getCause())
                                        : status;
                        super.close(mapped, trailers);
                    }
                },
                headers);
    }

    /** Package-private for testing. */
    Status mapException(Throwable throwable) {
        if (throwable instanceof SecretStoreUnavailableException) {
            log.warn("gRPC call failed, secret store unavailable: {}", throwable.getMessage());
            return Status.UNAVAILABLE.withDescription("Secret store unavailable").withCause(throwable);
        }
        if (throwable instanceof AuthorizerConfigurationException) {
            log.error("gRPC call failed, authorizer misconfigured", throwable);
            return Status.FAILED_PRECONDITION
                    .withDescription("Authorizer misconfigured")
                    .withCause(throwable);
        }
        if (throwable instanceof IllegalArgumentException) {
            log.warn("gRPC bad request: {}", throwable.getMessage());
            return Status.INVALID_ARGUMENT.withDescription(throwable.getMessage()).withCause(throwable);
        }
        if (throwable instanceof StatusRuntimeException sre) {
            return sre.getStatus();
        }
        if (throwable instanceof StatusException se) {
            return se.getStatus();
        }
        log.error("gRPC internal error", throwable);
        return Status.INTERNAL.withDescription("Internal server error").withCause(throwable);
    }
}
