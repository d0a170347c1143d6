package admit.java.http;

import admit.java.engine.ClientKeyExtractor;
import admit.java.engine.ClientKeys;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.util.Optional;

/**
 * Keys HTTP clients by network address.
 *
 * Client identification priority:
 * 1. First X-Forwarded-For entry, only when forwarding is trusted
 * 2. Peer IP address of the connection
 */
public final class HttpClientKeyExtractor implements ClientKeyExtractor<HttpServerExchange> {

    private final boolean trustForwardedFor;

    public HttpClientKeyExtractor(boolean trustForwardedFor) {
        this.trustForwardedFor = trustForwardedFor;
    }

    @Override
    public Optional<String> extract(HttpServerExchange exchange) {
        if (trustForwardedFor) {
            Optional<String> forwarded = ClientKeys.firstForwardedFor(
                exchange.getRequestHeaders().getFirst(Headers.X_FORWARDED_FOR));
            if (forwarded.isPresent()) {
                return forwarded;
            }
        }
        return ClientKeys.hostOf(exchange.getSourceAddress());
    }
}
