package admit.java.http;

import admit.java.engine.AdmissionEngine;
import admit.java.engine.ClientKeyExtractor;
import admit.java.engine.DelayedAdmission;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * HTTP front end with admission control.
 *
 * <p>Routes:
 * <ul>
 *   <li>{@code /} behind the limiter chain (429 on rejection)</li>
 *   <li>{@code /throttled} behind the delayed throttle, when one is configured</li>
 * </ul>
 */
public final class AdmissionHttpServer {

    private static final Logger log = LoggerFactory.getLogger(AdmissionHttpServer.class);

    static final String ROOT_MESSAGE = "Rate limiting demo server is running";
    static final String THROTTLED_MESSAGE = "Throttled endpoint reached";

    private final Undertow server;

    public AdmissionHttpServer(String host, int port, HttpHandler root) {
        this.server = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(root)
            .build();
    }

    /**
     * @param throttle delayed admission for {@code /throttled}, or null to leave the route out
     */
    public static HttpHandler routes(
        AdmissionEngine engine,
        DelayedAdmission throttle,
        ClientKeyExtractor<HttpServerExchange> keys
    ) {
        PathHandler paths = Handlers.path()
            .addExactPath("/", new RateLimitHandler(engine, keys, text(ROOT_MESSAGE)));
        if (throttle != null) {
            paths.addExactPath("/throttled", new ThrottleHandler(throttle, keys, text(THROTTLED_MESSAGE)));
        }
        return paths;
    }

    public void start() {
        server.start();
        log.info("HTTP server started on port {}", getPort());
    }

    public void stop() {
        server.stop();
        log.info("HTTP server stopped");
    }

    /**
     * @return bound port, useful when started on port 0
     */
    public int getPort() {
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    private static HttpHandler text(String message) {
        return (HttpServerExchange exchange) -> {
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
            exchange.getResponseSender().send(message);
        };
    }
}
