package admit.java.http;

import admit.java.engine.AdmissionEngine;
import admit.java.engine.AdmissionResult;
import admit.java.engine.ClientKeyExtractor;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;

/**
 * Undertow handler that runs every request through an {@link AdmissionEngine}
 * before the wrapped handler.
 *
 * On rejection the exchange ends with 429 and a JSON body; the wrapped handler
 * is never invoked.
 */
public final class RateLimitHandler implements HttpHandler {

    private final AdmissionEngine engine;
    private final ClientKeyExtractor<HttpServerExchange> keys;
    private final HttpHandler next;

    public RateLimitHandler(AdmissionEngine engine, ClientKeyExtractor<HttpServerExchange> keys, HttpHandler next) {
        if (engine == null) throw new IllegalArgumentException("engine cannot be null");
        if (keys == null) throw new IllegalArgumentException("keys cannot be null");
        if (next == null) throw new IllegalArgumentException("next cannot be null");
        this.engine = engine;
        this.keys = keys;
        this.next = next;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        AdmissionResult result = engine.check(keys.keyFor(exchange));
        if (result.allowed()) {
            next.handleRequest(exchange);
            return;
        }
        RejectionWriter.write(exchange, result);
    }
}
