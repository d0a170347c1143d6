package admit.java.grpc;

import admit.java.engine.ClientKeyExtractor;
import admit.java.engine.ClientKeys;
import io.grpc.Grpc;
import io.grpc.Metadata;
import io.grpc.ServerCall;

import java.util.Optional;

/**
 * Keys gRPC callers by network address: the x-forwarded-for metadata entry
 * when trusted, otherwise the transport's remote IP address.
 */
public final class GrpcClientKeyExtractor implements ClientKeyExtractor<GrpcClientKeyExtractor.Call> {

    static final Metadata.Key<String> FORWARDED_FOR =
        Metadata.Key.of("x-forwarded-for", Metadata.ASCII_STRING_MARSHALLER);

    /**
     * What the extractor can see of an inbound call.
     */
    public record Call(ServerCall<?, ?> serverCall, Metadata headers) {
    }

    private final boolean trustForwardedFor;

    public GrpcClientKeyExtractor(boolean trustForwardedFor) {
        this.trustForwardedFor = trustForwardedFor;
    }

    @Override
    public Optional<String> extract(Call call) {
        if (trustForwardedFor) {
            Optional<String> forwarded = ClientKeys.firstForwardedFor(call.headers().get(FORWARDED_FOR));
            if (forwarded.isPresent()) {
                return forwarded;
            }
        }
        return ClientKeys.hostOf(call.serverCall().getAttributes().get(Grpc.TRANSPORT_ATTR_REMOTE_ADDR));
    }
}
