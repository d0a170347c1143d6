package admit.java.grpc;

import admit.java.engine.AdmissionEngine;
import admit.java.engine.AdmissionResult;
import admit.java.engine.ClientKeys;
import admit.proto.AdmissionServiceGrpc;
import admit.proto.CheckAdmissionRequest;
import admit.proto.CheckAdmissionResponse;
import admit.proto.HealthCheckRequest;
import admit.proto.HealthCheckResponse;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * gRPC service implementation for admission checks.
 *
 * <p>This is a thin wrapper over AdmissionEngine with:
 * <ul>
 *   <li>Shared-key fallback for an empty client key</li>
 *   <li>Error handling (INVALID_ARGUMENT / INTERNAL)</li>
 *   <li>Protobuf conversion (AdmissionResult → CheckAdmissionResponse)</li>
 * </ul>
 *
 * <p>Thread-safety: AdmissionEngine handles concurrency internally.
 * This service is stateless and can handle concurrent RPCs.
 */
public final class AdmissionServiceImpl extends AdmissionServiceGrpc.AdmissionServiceImplBase {

    private static final Logger log = LoggerFactory.getLogger(AdmissionServiceImpl.class);

    private final AdmissionEngine engine;

    /**
     * @param engine Admission engine (must be thread-safe)
     * @throws IllegalArgumentException if engine is null
     */
    public AdmissionServiceImpl(AdmissionEngine engine) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        this.engine = engine;
    }

    @Override
    public void checkAdmission(
        CheckAdmissionRequest request,
        StreamObserver<CheckAdmissionResponse> responseObserver
    ) {
        try {
            // Protobuf strings are never null, only empty
            String clientKey = ClientKeys.orShared(Optional.of(request.getClientKey()));

            AdmissionResult result = engine.check(clientKey);

            CheckAdmissionResponse.Builder response = CheckAdmissionResponse.newBuilder()
                .setAllowed(result.allowed())
                .setRetryAfterSeconds(result.retryAfterSeconds());
            if (!result.allowed()) {
                response.setError(result.error()).setLimiter(result.limiter());
            }

            responseObserver.onNext(response.build());
            responseObserver.onCompleted();

        } catch (IllegalArgumentException e) {
            responseObserver.onError(
                Status.INVALID_ARGUMENT
                    .withDescription(e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
        } catch (Exception e) {
            log.error("Admission check failed", e);
            responseObserver.onError(
                Status.INTERNAL
                    .withDescription("Internal error: " + e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
        }
    }

    @Override
    public void healthCheck(
        HealthCheckRequest request,
        StreamObserver<HealthCheckResponse> responseObserver
    ) {
        // If we can respond, we're serving
        HealthCheckResponse response = HealthCheckResponse.newBuilder()
            .setStatus(HealthCheckResponse.Status.SERVING)
            .build();

        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }
}
