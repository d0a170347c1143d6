package admit.java.grpc;

import io.grpc.BindableService;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * gRPC server exposing the admission service.
 *
 * <p>Features:
 * <ul>
 *   <li>Configurable port (0 picks a free one)</li>
 *   <li>Graceful shutdown with timeout</li>
 * </ul>
 */
public final class RateLimitServer {

    private static final Logger log = LoggerFactory.getLogger(RateLimitServer.class);
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Server server;

    /**
     * @param port Port to listen on
     * @param service Admission service
     */
    public RateLimitServer(int port, BindableService service) {
        this.server = ServerBuilder.forPort(port)
            .addService(service)
            .build();
    }

    /**
     * @throws IOException if server fails to start
     */
    public void start() throws IOException {
        server.start();
        log.info("gRPC server started on port {}", server.getPort());
    }

    /**
     * Stops the server gracefully.
     *
     * @throws InterruptedException if shutdown is interrupted
     */
    public void stop() throws InterruptedException {
        if (!server.shutdown().awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            log.warn("gRPC server did not stop within {}s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
            server.shutdownNow();
        }
        log.info("gRPC server stopped");
    }

    /**
     * Blocks until server is terminated.
     */
    public void blockUntilShutdown() throws InterruptedException {
        server.awaitTermination();
    }

    /**
     * @return port number, or -1 if not started
     */
    public int getPort() {
        return server.getPort();
    }
}
