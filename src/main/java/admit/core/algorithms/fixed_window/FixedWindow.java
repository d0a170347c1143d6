package admit.core.algorithms.fixed_window;

import admit.core.clock.Clock;
import admit.core.model.RateLimitResult;
import admit.core.model.RateLimiter;
import admit.core.state.StateStore;
import admit.core.state.StateTransition;

/**
 * Fixed window counter.
 * Each key's window opens on its first request and lasts windowMillis;
 * the next request after that opens a new one.
 *
 * A burst straddling a window boundary can see up to 2x maxRequests in a short
 * interval. That is the known trade-off of this algorithm.
 */
public final class FixedWindow implements RateLimiter {
    private final Clock clock;
    private final StateStore<WindowState> store;
    private final long windowMillis;
    private final int maxRequests;

    public FixedWindow(Clock clock, StateStore<WindowState> store, long windowMillis, int maxRequests) {
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

    private StateTransition<WindowState, RateLimitResult> step(WindowState state, long now) {
        if (state == null) {
            return StateTransition.of(WindowState.openAt(now), RateLimitResult.allow());
        }

        long elapsed = Math.max(0L, now - state.windowStart());
        if (elapsed >= windowMillis) {
            return StateTransition.of(WindowState.openAt(now), RateLimitResult.allow());
        }

        if (state.count() < maxRequests) {
            return StateTransition.of(state.increment(), RateLimitResult.allow());
        }

        return StateTransition.of(state, RateLimitResult.rejectAfterMillis(windowMillis - elapsed));
    }

    @Override
    public StateStore<WindowState> stateStore() {
        return store;
    }
}
