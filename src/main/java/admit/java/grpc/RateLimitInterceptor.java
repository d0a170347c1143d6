package admit.java.grpc;

import admit.java.engine.AdmissionEngine;
import admit.java.engine.AdmissionResult;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;

/**
 * Server interceptor that admits each call through an {@link AdmissionEngine}
 * before it reaches the service.
 *
 * <p>Rejected calls are closed with RESOURCE_EXHAUSTED; the description carries
 * the rejection message and the {@code retry-after} trailer the hint in seconds.
 */
public final class RateLimitInterceptor implements ServerInterceptor {

    static final Metadata.Key<String> RETRY_AFTER =
        Metadata.Key.of("retry-after", Metadata.ASCII_STRING_MARSHALLER);

    private final AdmissionEngine engine;
    private final GrpcClientKeyExtractor keys;

    public RateLimitInterceptor(AdmissionEngine engine, GrpcClientKeyExtractor keys) {
        if (engine == null) throw new IllegalArgumentException("engine cannot be null");
        if (keys == null) throw new IllegalArgumentException("keys cannot be null");
        this.engine = engine;
        this.keys = keys;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
        ServerCall<ReqT, RespT> call,
        Metadata headers,
        ServerCallHandler<ReqT, RespT> next
    ) {
        AdmissionResult result = engine.check(keys.keyFor(new GrpcClientKeyExtractor.Call(call, headers)));
        if (result.allowed()) {
            return next.startCall(call, headers);
        }

        Metadata trailers = new Metadata();
        trailers.put(RETRY_AFTER, Long.toString(result.retryAfterSeconds()));
        call.close(Status.RESOURCE_EXHAUSTED.withDescription(result.error()), trailers);
        return new ServerCall.Listener<>() {
        };
    }
}
