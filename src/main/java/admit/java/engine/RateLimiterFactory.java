package admit.java.engine;

import admit.core.algorithms.fixed_window.FixedWindow;
import admit.core.algorithms.leaky_bucket.LeakyBucket;
import admit.core.algorithms.sliding_window.SlidingWindowLog;
import admit.core.algorithms.sliding_window_counter.SlidingWindowCounter;
import admit.core.algorithms.token_bucket.TokenBucket;
import admit.core.clock.Clock;
import admit.core.model.RateLimiter;
import admit.core.state.InMemoryStateStore;

/**
 * Factory for creating RateLimiter instances based on configuration.
 *
 * Every limiter gets its own fresh {@link InMemoryStateStore}; stores are
 * never shared between limiters.
 *
 * Thread-safety: This class is stateless and thread-safe.
 */
public final class RateLimiterFactory {

    private RateLimiterFactory() {
        // Utility class, no instantiation
    }

    /**
     * @param clock Clock instance for time control (injected for testability)
     * @param config Configuration specifying algorithm and parameters
     * @param maxKeys Maximum number of client keys the limiter's store tracks
     * @return A new RateLimiter instance
     * @throws IllegalArgumentException if configuration is invalid
     */
    public static RateLimiter create(Clock clock, RateLimiterConfig config, int maxKeys) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (config == null) throw new IllegalArgumentException("config cannot be null");

        long ttl = config.idleTtlMillis();

        return switch (config.algorithmType()) {
            case FIXED_WINDOW -> new FixedWindow(
                clock,
                new InMemoryStateStore<>(maxKeys, ttl),
                config.windowDurationMillis(),
                Math.toIntExact(config.limit())
            );

            case SLIDING_WINDOW_LOG -> new SlidingWindowLog(
                clock,
                new InMemoryStateStore<>(maxKeys, ttl),
                config.windowDurationMillis(),
                Math.toIntExact(config.limit())
            );

            case SLIDING_WINDOW_COUNTER -> new SlidingWindowCounter(
                clock,
                new InMemoryStateStore<>(maxKeys, ttl),
                config.windowDurationMillis(),
                Math.toIntExact(config.limit())
            );

            case TOKEN_BUCKET -> new TokenBucket(
                clock,
                new InMemoryStateStore<>(maxKeys, ttl),
                config.limit(),
                config.refillRatePerSecond()
            );

            case LEAKY_BUCKET -> new LeakyBucket(
                clock,
                new InMemoryStateStore<>(maxKeys, ttl),
                config.limit(),
                config.leakIntervalMillis()
            );
        };
    }
}
