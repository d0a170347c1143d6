package admit.core.algorithms.leaky_bucket;

import admit.core.clock.Clock;
import admit.core.model.RateLimitResult;
import admit.core.model.RateLimiter;
import admit.core.state.StateStore;
import admit.core.state.StateTransition;

/**
 * Leaky Bucket as a bounded queue:
 * - each admitted request occupies one slot
 * - one slot drains every leakIntervalMillis
 * - a request is admitted only while the queue has headroom
 *
 * Like the token bucket, lastLeak advances by whole intervals only, so partial
 * intervals are not lost between calls. An emptied queue restarts its interval
 * at the current time.
 */
public final class LeakyBucket implements RateLimiter {
    private final Clock clock;
    private final StateStore<LeakyQueueState> store;
    private final long capacity;
    private final long leakIntervalMillis;

    public LeakyBucket(Clock clock, StateStore<LeakyQueueState> store, long capacity, long leakIntervalMillis) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (store == null) throw new IllegalArgumentException("store cannot be null");
        if (capacity <= 0) throw new IllegalArgumentException("capacity <= 0");
        if (leakIntervalMillis <= 0) throw new IllegalArgumentException("leak interval <= 0");
        this.clock = clock;
        this.store = store;
        this.capacity = capacity;
        this.leakIntervalMillis = leakIntervalMillis;
    }

    @Override
    public RateLimitResult tryAcquire(String key) {
        return store.compute(key, clock.nowMillis(), this::step);
    }

    private StateTransition<LeakyQueueState, RateLimitResult> step(LeakyQueueState state, long now) {
        if (state == null) {
            return StateTransition.of(new LeakyQueueState(1, now), RateLimitResult.allow());
        }

        LeakyQueueState drained = leak(state, now);
        if (drained.queueLevel() < capacity) {
            return StateTransition.of(
                new LeakyQueueState(drained.queueLevel() + 1, drained.lastLeak()),
                RateLimitResult.allow());
        }
        return StateTransition.of(drained, RateLimitResult.rejectAfterMillis(leakIntervalMillis));
    }

    private LeakyQueueState leak(LeakyQueueState state, long now) {
        long elapsed = Math.max(0L, now - state.lastLeak());
        long leaked = elapsed / leakIntervalMillis;
        if (leaked <= 0) {
            return state;
        }
        long level = Math.max(0L, state.queueLevel() - leaked);
        if (level == 0) {
            // Nothing drains from an empty queue; the next request starts a fresh interval.
            return new LeakyQueueState(0, now);
        }
        return new LeakyQueueState(level, state.lastLeak() + leaked * leakIntervalMillis);
    }

    /**
     * Queue level for the key at the current time, without enqueuing.
     */
    public long queueLevel(String key) {
        long now = clock.nowMillis();
        return store.peek(key)
            .map(s -> leak(s, now).queueLevel())
            .orElse(0L);
    }

    @Override
    public String rejectionMessage() {
        return "Too many requests - bucket overflow";
    }

    @Override
    public StateStore<LeakyQueueState> stateStore() {
        return store;
    }
}
