package admit.core.algorithms.sliding_window_counter;

import admit.core.clock.Clock;
import admit.core.model.RateLimitResult;
import admit.core.model.RateLimiter;
import admit.core.state.StateStore;
import admit.core.state.StateTransition;

/**
 * Sliding Window Counter (approximation):
 * - two epoch-aligned buckets of windowMillis each: current and previous
 * - estimate = current * (1 - weight) + previous * weight, where weight is the
 *   elapsed fraction of the current bucket
 *
 * Pros: O(1) state per key.
 * Cons: approximation; every request is counted, admitted or not, and the
 * retry hint is the whole window rather than an exact time.
 */
public final class SlidingWindowCounter implements RateLimiter {
    private final Clock clock;
    private final StateStore<CounterPairState> store;
    private final long windowMillis;
    private final int maxRequests;

    public SlidingWindowCounter(Clock clock, StateStore<CounterPairState> store, long windowMillis, int maxRequests) {
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

    private StateTransition<CounterPairState, RateLimitResult> step(CounterPairState state, long now) {
        long bucketStart = align(now);
        double weight = weight(now, bucketStart);

        CounterPairState next;
        if (state == null) {
            next = CounterPairState.firstAt(bucketStart, windowMillis);
        } else if (bucketStart > state.current().start()) {
            next = state.rollTo(bucketStart, windowMillis);
        } else {
            next = state.increment();
        }

        double estimate = next.estimateAt(bucketStart, weight, windowMillis);
        if (estimate > maxRequests) {
            return StateTransition.of(next, RateLimitResult.rejectAfterMillis(windowMillis));
        }
        return StateTransition.of(next, RateLimitResult.allow());
    }

    /**
     * Weighted request count for the key at the current time, without counting a request.
     */
    public double estimatedCount(String key) {
        long now = clock.nowMillis();
        long bucketStart = align(now);
        return store.peek(key)
            .map(s -> s.estimateAt(bucketStart, weight(now, bucketStart), windowMillis))
            .orElse(0.0);
    }

    private long align(long now) {
        return Math.floorDiv(now, windowMillis) * windowMillis;
    }

    private double weight(long now, long bucketStart) {
        return (double) (now - bucketStart) / windowMillis;
    }

    @Override
    public StateStore<CounterPairState> stateStore() {
        return store;
    }
}
