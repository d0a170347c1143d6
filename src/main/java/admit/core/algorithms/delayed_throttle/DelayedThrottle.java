package admit.core.algorithms.delayed_throttle;

import admit.core.algorithms.sliding_window.LogState;
import admit.core.clock.Clock;
import admit.core.state.StateStore;
import admit.core.state.StateTransition;

/**
 * Sliding log that answers "wait" instead of "no".
 *
 * A timestamp ts counts while now - ts < windowMillis. When the window is full
 * the caller is told how long until the oldest timestamp leaves it; nothing is
 * recorded for a deferred request until it asks again and gets in.
 */
public final class DelayedThrottle {
    private final Clock clock;
    private final StateStore<LogState> store;
    private final long windowMillis;
    private final int maxRequests;

    public DelayedThrottle(Clock clock, StateStore<LogState> store, long windowMillis, int maxRequests) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (store == null) throw new IllegalArgumentException("store cannot be null");
        if (windowMillis <= 0) throw new IllegalArgumentException("window <= 0");
        if (maxRequests <= 0) throw new IllegalArgumentException("maxRequests <= 0");
        this.clock = clock;
        this.store = store;
        this.windowMillis = windowMillis;
        this.maxRequests = maxRequests;
    }

    public ThrottleDecision tryEnter(String key) {
        return store.compute(key, clock.nowMillis(), this::step);
    }

    private StateTransition<LogState, ThrottleDecision> step(LogState state, long now) {
        LogState log = state != null ? state : new LogState();
        log.removeBefore(now - windowMillis + 1);

        if (log.size() < maxRequests) {
            log.append(now);
            return StateTransition.of(log, ThrottleDecision.admitNow());
        }

        long delay = windowMillis - (now - log.oldest());
        return StateTransition.of(log, ThrottleDecision.deferFor(delay));
    }

    public StateStore<LogState> stateStore() {
        return store;
    }

    public long windowMillis() {
        return windowMillis;
    }
}
