package admit.java.http;

/**
 * JSON body of a 429 response: {@code {"error": "...", "retryAfter": 12}}.
 */
public record RejectionBody(String error, long retryAfter) {
}
