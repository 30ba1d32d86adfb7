package com.tollgate.authorizer.infrastructure.grpc;

import com.tollgate.authorizer.service.AuthorizationService;
import com.tollgate.security.AuthorizationDecision;
import com.tollgate.security.AuthorizationRequest;
import com.tollgate.security.RequestHeaders;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Deadline;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Applies the token decision to gRPC calls.
 *
 * <p>Credentials are read from call metadata ({@code x-client-token} or {@code authorization}),
 * the full method name is the resource, and the call deadline, when present, bounds the secret
 * fetch. Deny closes the call with {@code UNAUTHENTICATED} and the error type as description;
 * Allow continues with the principal id in {@link #PRINCIPAL_ID}.
 */
public class GrpcAuthorizationInterceptor implements ServerInterceptor {

    /** Hashed principal id of an allowed call. */
    public static final Context.Key<String> PRINCIPAL_ID = Context.key("tollgate-principal-id");

    private final AuthorizationService authorizationService;
    private final Clock clock;

    public GrpcAuthorizationInterceptor(AuthorizationService authorizationService, Clock clock) {
        this.authorizationService = authorizationService;
        this.clock = clock;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        var request =
                new AuthorizationRequest(
                        headersOf(headers),
                        call.getMethodDescriptor().getFullMethodName(),
                        deadlineOf(Context.current().getDeadline()));
        AuthorizationDecision decision = authorizationService.authorize(request);

        if (!decision.isAllowed()) {
            call.close(
                    Status.UNAUTHENTICATED.withDescription(decision.errorType().orElse("denied")),
                    new Metadata());
            return new ServerCall.Listener<>() {};
        }

        Context context = Context.current().withValue(PRINCIPAL_ID, decision.principalId());
        return Contexts.interceptCall(context, call, headers, next);
    }

    static RequestHeaders headersOf(Metadata metadata) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : metadata.keys()) {
            if (name.endsWith(Metadata.BINARY_HEADER_SUFFIX)) {
                continue;
            }
            String value = metadata.get(Metadata.Key.of(name, Metadata.ASCII_STRING_MARSHALLER));
            if (value != null) {
                headers.put(name, value);
            }
        }
        return RequestHeaders.of(headers);
    }

    private Instant deadlineOf(Deadline deadline) {
        if (deadline == null) {
            return null;
        }
        return clock.instant().plusMillis(deadline.timeRemaining(TimeUnit.MILLISECONDS));
    }
}
