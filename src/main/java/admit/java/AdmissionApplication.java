package admit.java;

import admit.core.algorithms.delayed_throttle.DelayedThrottle;
import admit.core.clock.Clock;
import admit.core.clock.SystemClock;
import admit.core.model.RateLimiter;
import admit.core.state.InMemoryStateStore;
import admit.core.state.StateStore;
import admit.java.config.AdmissionConfig;
import admit.java.config.AdmissionConfigLoader;
import admit.java.engine.AdmissionEngine;
import admit.java.engine.DelayedAdmission;
import admit.java.engine.ExecutorTaskScheduler;
import admit.java.engine.StateSweeper;
import admit.java.grpc.AdmissionServiceImpl;
import admit.java.grpc.RateLimitServer;
import admit.java.http.AdmissionHttpServer;
import admit.java.http.HttpClientKeyExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Wires configuration, limiters, the idle-key sweeper and both transports.
 *
 * <p>Usage:
 * <pre>
 * java -Dadmit.http.port=8080 -Dadmit.token-bucket.capacity=50 -jar admission-limiter.jar
 * </pre>
 */
public final class AdmissionApplication {

    private static final Logger log = LoggerFactory.getLogger(AdmissionApplication.class);

    private final AdmissionEngine engine;
    private final DelayedAdmission throttle;
    private final ExecutorTaskScheduler throttleScheduler;
    private final ExecutorTaskScheduler sweepScheduler;
    private final StateSweeper sweeper;
    private final AdmissionHttpServer httpServer;
    private final RateLimitServer grpcServer;
    private final CountDownLatch stopped = new CountDownLatch(1);

    public AdmissionApplication(AdmissionConfig config, Clock clock) {
        this.engine = AdmissionEngine.fromConfigs(
            clock, AdmissionConfigLoader.limiterConfigs(config), config.maxKeys());

        List<StateStore<?>> stores = new ArrayList<>(engine.stateStores());

        if (config.throttle().enabled()) {
            long window = config.throttle().windowDurationMs();
            DelayedThrottle delayedThrottle = new DelayedThrottle(
                clock,
                new InMemoryStateStore<>(config.maxKeys(), window),
                window,
                config.throttle().maxRequests());
            this.throttleScheduler = new ExecutorTaskScheduler("admit-throttle", 2);
            this.throttle = new DelayedAdmission(delayedThrottle, throttleScheduler);
            stores.add(delayedThrottle.stateStore());
        } else {
            this.throttleScheduler = null;
            this.throttle = null;
        }

        this.sweepScheduler = new ExecutorTaskScheduler("admit-sweeper", 1);
        this.sweeper = new StateSweeper(clock, sweepScheduler, stores, config.sweepIntervalMs());

        this.httpServer = new AdmissionHttpServer(
            config.http().host(),
            config.http().port(),
            AdmissionHttpServer.routes(engine, throttle,
                new HttpClientKeyExtractor(config.http().trustForwardedFor())));

        this.grpcServer = config.grpc().enabled()
            ? new RateLimitServer(config.grpc().port(), new AdmissionServiceImpl(engine))
            : null;
    }

    public void start() throws IOException {
        for (RateLimiter limiter : engine.limiters()) {
            log.info("Limiter enabled: {}", limiter.name());
        }
        if (throttle != null) {
            log.info("Delayed throttle enabled on /throttled");
        }
        sweeper.start();
        httpServer.start();
        if (grpcServer != null) {
            grpcServer.start();
        }
    }

    public void stop() throws InterruptedException {
        try {
            sweeper.close();
            httpServer.stop();
            if (grpcServer != null) {
                grpcServer.stop();
            }
            if (throttleScheduler != null) {
                throttleScheduler.close();
            }
            sweepScheduler.close();
        } finally {
            stopped.countDown();
        }
    }

    public void awaitShutdown() throws InterruptedException {
        stopped.await();
    }

    public int httpPort() {
        return httpServer.getPort();
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        AdmissionApplication app = new AdmissionApplication(AdmissionConfigLoader.load(), SystemClock.instance());
        app.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down (JVM shutdown hook)...");
            try {
                app.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted", e);
            }
        }));

        app.awaitShutdown();
    }
}
