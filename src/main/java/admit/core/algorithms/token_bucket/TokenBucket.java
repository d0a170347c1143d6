package admit.core.algorithms.token_bucket;

import admit.core.clock.Clock;
import admit.core.model.RateLimitResult;
import admit.core.model.RateLimiter;
import admit.core.state.StateStore;
import admit.core.state.StateTransition;

/**
 * Token Bucket:
 * - capacity: tokens max
 * - refillRatePerSecond: whole tokens credited as time passes
 *
 * Pros: allows bursts up to capacity with a stable average rate.
 * Cons: retry hint is one refill period, not the exact wait.
 *
 * lastRefill only advances by the time the credited tokens account for, so
 * sub-token progress carries over to the next call instead of being dropped.
 * Once the bucket is full lastRefill moves to now: a full bucket is then the
 * same state a never-seen key starts from.
 */
public final class TokenBucket implements RateLimiter {
    private final Clock clock;
    private final StateStore<TokenBucketState> store;
    private final long capacity;
    private final double refillRatePerSecond;
    private final long retryAfterSeconds;

    public TokenBucket(Clock clock, StateStore<TokenBucketState> store, long capacity, double refillRatePerSecond) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (store == null) throw new IllegalArgumentException("store cannot be null");
        if (capacity <= 0) throw new IllegalArgumentException("capacity <= 0");
        if (!(refillRatePerSecond > 0) || Double.isInfinite(refillRatePerSecond)) {
            throw new IllegalArgumentException("refill rate must be positive and finite");
        }
        this.clock = clock;
        this.store = store;
        this.capacity = capacity;
        this.refillRatePerSecond = refillRatePerSecond;
        this.retryAfterSeconds = (long) Math.ceil(1.0 / refillRatePerSecond);
    }

    @Override
    public RateLimitResult tryAcquire(String key) {
        return store.compute(key, clock.nowMillis(), this::step);
    }

    private StateTransition<TokenBucketState, RateLimitResult> step(TokenBucketState state, long now) {
        if (state == null) {
            return StateTransition.of(new TokenBucketState(capacity - 1, now), RateLimitResult.allow());
        }

        TokenBucketState refilled = refill(state, now);
        if (refilled.tokens() >= 1) {
            return StateTransition.of(
                new TokenBucketState(refilled.tokens() - 1, refilled.lastRefill()),
                RateLimitResult.allow());
        }
        return StateTransition.of(refilled, RateLimitResult.reject(retryAfterSeconds));
    }

    private TokenBucketState refill(TokenBucketState state, long now) {
        long elapsed = Math.max(0L, now - state.lastRefill());
        long tokensToAdd = (long) Math.floor(elapsed / 1000.0 * refillRatePerSecond);
        if (tokensToAdd <= 0) {
            return state;
        }

        double tokens = Math.min(capacity, state.tokens() + tokensToAdd);
        if (tokens >= capacity) {
            // A full bucket accrues nothing, so no partial progress survives.
            return new TokenBucketState(tokens, now);
        }
        long credited = (long) (tokensToAdd * 1000.0 / refillRatePerSecond);
        long lastRefill = Math.min(now, state.lastRefill() + credited);
        return new TokenBucketState(tokens, lastRefill);
    }

    /**
     * Tokens the key could spend right now, without spending one.
     */
    public double availableTokens(String key) {
        long now = clock.nowMillis();
        return store.peek(key)
            .map(s -> refill(s, now).tokens())
            .orElse((double) capacity);
    }

    @Override
    public String rejectionMessage() {
        return "Too many requests - token bucket empty";
    }

    @Override
    public StateStore<TokenBucketState> stateStore() {
        return store;
    }
}
