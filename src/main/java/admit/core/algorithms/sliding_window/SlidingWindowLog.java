package admit.core.algorithms.sliding_window;

import admit.core.clock.Clock;
import admit.core.model.RateLimitResult;
import admit.core.model.RateLimiter;
import admit.core.state.StateStore;
import admit.core.state.StateTransition;

/**
 * Exact sliding window (log):
 * keeps the timestamp of every admitted request.
 *
 * Pros: exact rolling count, no boundary burst.
 * Cons: O(maxRequests) memory per key and pruning cost per request.
 *
 * A timestamp ts is still inside the window while now - ts <= windowMillis.
 */
public final class SlidingWindowLog implements RateLimiter {
    private final Clock clock;
    private final StateStore<LogState> store;
    private final long windowMillis;
    private final int maxRequests;

    public SlidingWindowLog(Clock clock, StateStore<LogState> store, long windowMillis, int maxRequests) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (store == null) throw new IllegalArgumentException("store cannot be null");
        if (windowMillis <= 0) throw new IllegalArgumentException("window <= 0");
        if (maxRequests <= 0) throw new IllegalArgumentException("maxRequests <= 0");
        this.clock = clock;
        this.store = store;
        this.windowMillis = windowMillis;
        this.maxRequests = maxRequests;
    }

    @Override
    public RateLimitResult tryAcquire(String key) {
        return store.compute(key, clock.nowMillis(), this::step);
    }

    private StateTransition<LogState, RateLimitResult> step(LogState state, long now) {
        LogState log = state != null ? state : new LogState();
        log.removeBefore(now - windowMillis);

        if (log.size() < maxRequests) {
            log.append(now);
            return StateTransition.of(log, RateLimitResult.allow());
        }

        long retryAfter = windowMillis - (now - log.oldest());
        return StateTransition.of(log, RateLimitResult.rejectAfterMillis(retryAfter));
    }

    /**
     * Requests counted in the window ending now, without recording one.
     */
    public int countInWindow(String key) {
        if (store.peek(key).isEmpty()) {
            return 0;
        }
        long now = clock.nowMillis();
        return store.compute(key, now, (state, ts) -> {
            if (state == null) {
                return StateTransition.of(null, 0);
            }
            state.removeBefore(ts - windowMillis);
            return StateTransition.of(state, state.size());
        });
    }

    @Override
    public StateStore<LogState> stateStore() {
        return store;
    }
}
