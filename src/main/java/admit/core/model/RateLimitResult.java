package admit.core.model;

/**
 * Outcome of one admission check. Produced per request, never stored.
 *
 * @param decision ALLOW or REJECT
 * @param retryAfterSeconds hint for the caller, 0 when allowed
 */
public record RateLimitResult(
    Decision decision,
    long retryAfterSeconds
) {
    private static final RateLimitResult ALLOWED = new RateLimitResult(Decision.ALLOW, 0L);

    public static RateLimitResult allow() {
        return ALLOWED;
    }

    public static RateLimitResult reject(long retryAfterSeconds) {
        return new RateLimitResult(Decision.REJECT, Math.max(0L, retryAfterSeconds));
    }

    /**
     * Rejects with a hint expressed in milliseconds, rounded up to whole seconds.
     */
    public static RateLimitResult rejectAfterMillis(long retryAfterMillis) {
        return reject(ceilSeconds(retryAfterMillis));
    }

    public boolean allowed() {
        return decision == Decision.ALLOW;
    }

    public static long ceilSeconds(long millis) {
        if (millis <= 0) return 0L;
        return (millis + 999L) / 1000L;
    }
}
