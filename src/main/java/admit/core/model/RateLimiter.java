package admit.core.model;

import admit.core.state.StateStore;

/**
 * Pure core contract: no I/O, no threads.
 * Each implementation owns one {@link StateStore} partitioned by client key;
 * stores are never shared between limiters.
 */
public interface RateLimiter {

    RateLimitResult tryAcquire(String key);

    /**
     * Message placed in the rejection response body.
     */
    default String rejectionMessage() {
        return "Too many requests";
    }

    default String name() {
        return getClass().getSimpleName();
    }

    StateStore<?> stateStore();
}
