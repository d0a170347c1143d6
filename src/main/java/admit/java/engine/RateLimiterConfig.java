package admit.java.engine;

/**
 * Configuration for creating a RateLimiter instance. Fixed at construction.
 *
 * @param algorithmType The algorithm to use
 * @param limit Maximum requests per window, or bucket capacity
 * @param refillRatePerSecond Tokens per second (TOKEN_BUCKET only)
 * @param windowDurationMillis Window length (window-based algorithms only)
 * @param leakIntervalMillis Time to drain one slot (LEAKY_BUCKET only)
 */
public record RateLimiterConfig(
    AlgorithmType algorithmType,
    long limit,
    double refillRatePerSecond,
    long windowDurationMillis,
    long leakIntervalMillis
) {
    public RateLimiterConfig {
        if (algorithmType == null) throw new IllegalArgumentException("algorithmType cannot be null");
        if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
        if (algorithmType.isWindowBased() && limit > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("limit must fit in an int for " + algorithmType);
        }
    }

    public static RateLimiterConfig fixedWindow(long windowDurationMillis, int maxRequests) {
        requireWindow(windowDurationMillis);
        return new RateLimiterConfig(AlgorithmType.FIXED_WINDOW, maxRequests, 0.0, windowDurationMillis, 0L);
    }

    public static RateLimiterConfig slidingWindowLog(long windowDurationMillis, int maxRequests) {
        requireWindow(windowDurationMillis);
        return new RateLimiterConfig(AlgorithmType.SLIDING_WINDOW_LOG, maxRequests, 0.0, windowDurationMillis, 0L);
    }

    public static RateLimiterConfig slidingWindowCounter(long windowDurationMillis, int maxRequests) {
        requireWindow(windowDurationMillis);
        return new RateLimiterConfig(AlgorithmType.SLIDING_WINDOW_COUNTER, maxRequests, 0.0, windowDurationMillis, 0L);
    }

    /**
     * @param capacity Maximum tokens (burst size)
     * @param refillRatePerSecond Tokens added per second
     */
    public static RateLimiterConfig tokenBucket(long capacity, double refillRatePerSecond) {
        if (!(refillRatePerSecond > 0) || Double.isInfinite(refillRatePerSecond)) {
            throw new IllegalArgumentException("refillRatePerSecond must be > 0");
        }
        return new RateLimiterConfig(AlgorithmType.TOKEN_BUCKET, capacity, refillRatePerSecond, 0L, 0L);
    }

    /**
     * @param capacity Maximum queued requests
     * @param leakIntervalMillis Time for one request to drain
     */
    public static RateLimiterConfig leakyBucket(long capacity, long leakIntervalMillis) {
        if (leakIntervalMillis <= 0) throw new IllegalArgumentException("leakIntervalMillis must be > 0");
        return new RateLimiterConfig(AlgorithmType.LEAKY_BUCKET, capacity, 0.0, 0L, leakIntervalMillis);
    }

    /**
     * Idle time after which a key's state behaves exactly like a missing one,
     * so the sweeper can drop it without changing any decision.
     */
    public long idleTtlMillis() {
        return switch (algorithmType) {
            case FIXED_WINDOW, SLIDING_WINDOW_LOG -> windowDurationMillis;
            case SLIDING_WINDOW_COUNTER -> saturatingMultiply(windowDurationMillis, 2);
            case TOKEN_BUCKET -> (long) Math.ceil(limit * 1000.0 / refillRatePerSecond);
            case LEAKY_BUCKET -> saturatingMultiply(leakIntervalMillis, limit);
        };
    }

    private static long saturatingMultiply(long a, long b) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private static void requireWindow(long windowDurationMillis) {
        if (windowDurationMillis <= 0) throw new IllegalArgumentException("windowDurationMillis must be > 0");
    }
}
