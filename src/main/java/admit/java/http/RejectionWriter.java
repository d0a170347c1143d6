package admit.java.http;

import admit.java.engine.AdmissionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;

/**
 * Ends an exchange with 429 Too Many Requests.
 */
final class RejectionWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private RejectionWriter() {
    }

    static void write(HttpServerExchange exchange, AdmissionResult result) throws JsonProcessingException {
        String body = MAPPER.writeValueAsString(new RejectionBody(result.error(), result.retryAfterSeconds()));

        exchange.setStatusCode(StatusCodes.TOO_MANY_REQUESTS);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseHeaders().put(Headers.RETRY_AFTER, Long.toString(result.retryAfterSeconds()));
        exchange.getResponseSender().send(body);
    }
}
