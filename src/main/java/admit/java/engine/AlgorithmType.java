package admit.java.engine;

/**
 * Supported immediate-rejection algorithms.
 *
 * - FIXED_WINDOW: Simple reset, has boundary problem, O(1) memory
 * - SLIDING_WINDOW_LOG: Exact precision, no boundary problem, O(limit) memory
 * - SLIDING_WINDOW_COUNTER: Two weighted buckets, O(1) memory
 * - TOKEN_BUCKET: Whole-token refill, burst-friendly, O(1) memory
 * - LEAKY_BUCKET: Bounded queue drained at a constant pace, O(1) memory
 */
public enum AlgorithmType {
    /**
     * Best for: Simple cases where a 2x spike at window edges is acceptable.
     */
    FIXED_WINDOW,

    /**
     * Best for: Login, password reset and other endpoints that need an exact bound.
     */
    SLIDING_WINDOW_LOG,

    /**
     * Best for: High-traffic APIs that want smoothing without per-request memory.
     */
    SLIDING_WINDOW_COUNTER,

    /**
     * Best for: User-facing APIs with idle periods and short bursts.
     */
    TOKEN_BUCKET,

    /**
     * Best for: Backends that need a steady, linear request pace.
     */
    LEAKY_BUCKET;

    /**
     * Window-based limiters count requests in an int.
     */
    public boolean isWindowBased() {
        return this == FIXED_WINDOW || this == SLIDING_WINDOW_LOG || this == SLIDING_WINDOW_COUNTER;
    }
}
