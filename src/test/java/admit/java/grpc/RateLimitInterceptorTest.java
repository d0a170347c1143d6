package admit.java.grpc;

import admit.core.clock.ManualClock;
import admit.java.engine.AdmissionEngine;
import admit.java.engine.RateLimiterConfig;
import admit.proto.AdmissionServiceGrpc;
import admit.proto.HealthCheckRequest;
import admit.proto.HealthCheckResponse;
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.Server;
import io.grpc.ServerInterceptors;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.MetadataUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests RateLimitInterceptor guarding a whole service.
 */
class RateLimitInterceptorTest {

    private Server server;
    private ManagedChannel channel;

    private void startServer(boolean trustForwardedFor) throws Exception {
        AdmissionEngine guard = AdmissionEngine.fromConfigs(new ManualClock(0L),
            List.of(RateLimiterConfig.fixedWindow(60_000L, 2)), 100);
        AdmissionServiceImpl service = new AdmissionServiceImpl(new AdmissionEngine(List.of()));

        String serverName = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder.forName(serverName)
            .directExecutor()
            .addService(ServerInterceptors.intercept(service,
                new RateLimitInterceptor(guard, new GrpcClientKeyExtractor(trustForwardedFor))))
            .build()
            .start();

        channel = InProcessChannelBuilder.forName(serverName)
            .directExecutor()
            .build();
    }

    @AfterEach
    void tearDown() throws Exception {
        if (channel != null) {
            channel.shutdown();
            channel.awaitTermination(5, TimeUnit.SECONDS);
        }
        if (server != null) {
            server.shutdown();
            server.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    private HealthCheckResponse healthCheckAs(String forwardedFor) {
        Metadata headers = new Metadata();
        headers.put(GrpcClientKeyExtractor.FORWARDED_FOR, forwardedFor);
        return AdmissionServiceGrpc.newBlockingStub(channel)
            .withInterceptors(MetadataUtils.newAttachHeadersInterceptor(headers))
            .healthCheck(HealthCheckRequest.newBuilder().build());
    }

    @Test
    void testRejectedCall_closedWithResourceExhausted() throws Exception {
        startServer(true);

        healthCheckAs("203.0.113.1");
        healthCheckAs("203.0.113.1");

        StatusRuntimeException exception = assertThrows(
            StatusRuntimeException.class,
            () -> healthCheckAs("203.0.113.1")
        );

        assertEquals(Status.Code.RESOURCE_EXHAUSTED, exception.getStatus().getCode());
        assertEquals("Too many requests", exception.getStatus().getDescription());
        assertNotNull(exception.getTrailers());
        assertEquals("60", exception.getTrailers().get(RateLimitInterceptor.RETRY_AFTER));
    }

    @Test
    void testTrustedForwardedFor_separatesCallers() throws Exception {
        startServer(true);

        healthCheckAs("203.0.113.1");
        healthCheckAs("203.0.113.1");

        assertEquals(HealthCheckResponse.Status.SERVING, healthCheckAs("203.0.113.2").getStatus());
    }

    @Test
    void testUntrustedForwardedFor_fallsBackToSharedKey() throws Exception {
        // In-process transport has no IP address, so every caller is "shared"
        startServer(false);

        healthCheckAs("203.0.113.1");
        healthCheckAs("203.0.113.2");

        StatusRuntimeException exception = assertThrows(
            StatusRuntimeException.class,
            () -> healthCheckAs("203.0.113.3")
        );
        assertEquals(Status.Code.RESOURCE_EXHAUSTED, exception.getStatus().getCode());
    }
}
