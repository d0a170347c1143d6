package admit.core.state;

import java.util.Optional;

/**
 * Per-limiter mapping from client key to algorithm state.
 *
 * Implementations must run each {@link #compute} call for a given key
 * atomically with respect to other calls for the same key. Calls for
 * different keys may run in parallel.
 *
 * @param <S> algorithm-specific state type
 */
public interface StateStore<S> {

    /**
     * Applies {@code function} to the key's current state (null on first
     * observation) and stores the state it returns.
     *
     * @return the result carried by the transition
     */
    <R> R compute(String key, long nowMillis, StateFunction<S, R> function);

    /**
     * Current state for the key, if tracked. Does not count as an access.
     */
    Optional<S> peek(String key);

    int size();

    /**
     * Drops keys that have not been accessed for longer than the store's
     * idle TTL.
     *
     * @return number of keys removed
     */
    int evictIdle(long nowMillis);

    void clear();
}
