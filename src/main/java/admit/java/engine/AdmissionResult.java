package admit.java.engine;

/**
 * Verdict of the whole limiter chain for one request.
 *
 * @param allowed true when every limiter admitted the request
 * @param limiter name of the limiter that rejected, null when allowed
 * @param error message for the rejection body, null when allowed
 * @param retryAfterSeconds retry hint from the rejecting limiter, 0 when allowed
 */
public record AdmissionResult(
    boolean allowed,
    String limiter,
    String error,
    long retryAfterSeconds
) {
    private static final AdmissionResult ADMITTED = new AdmissionResult(true, null, null, 0L);

    public static AdmissionResult admitted() {
        return ADMITTED;
    }

    public static AdmissionResult rejected(String limiter, String error, long retryAfterSeconds) {
        return new AdmissionResult(false, limiter, error, Math.max(0L, retryAfterSeconds));
    }
}
