package admit.java.engine;

import admit.core.clock.Clock;
import admit.core.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Periodically drops idle keys from a set of state stores so per-client state
 * does not grow for the life of the process.
 */
public final class StateSweeper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StateSweeper.class);

    private final Clock clock;
    private final TaskScheduler scheduler;
    private final List<StateStore<?>> stores;
    private final long intervalMillis;

    private volatile boolean closed;
    private volatile TaskScheduler.ScheduledTask next;

    public StateSweeper(Clock clock, TaskScheduler scheduler, List<StateStore<?>> stores, long intervalMillis) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (scheduler == null) throw new IllegalArgumentException("scheduler cannot be null");
        if (stores == null) throw new IllegalArgumentException("stores cannot be null");
        if (intervalMillis <= 0) throw new IllegalArgumentException("intervalMillis must be > 0");
        this.clock = clock;
        this.scheduler = scheduler;
        this.stores = List.copyOf(stores);
        this.intervalMillis = intervalMillis;
    }

    public void start() {
        scheduleNext();
    }

    /**
     * Runs one sweep over every store.
     *
     * @return total keys removed
     */
    public int sweep() {
        long now = clock.nowMillis();
        int removed = 0;
        for (StateStore<?> store : stores) {
            removed += store.evictIdle(now);
        }
        if (removed > 0) {
            log.debug("Swept {} idle keys", removed);
        }
        return removed;
    }

    private void runAndReschedule() {
        if (closed) {
            return;
        }
        try {
            sweep();
        } catch (RuntimeException e) {
            log.warn("Idle key sweep failed", e);
        }
        scheduleNext();
    }

    private void scheduleNext() {
        if (!closed) {
            next = scheduler.schedule(this::runAndReschedule, intervalMillis);
        }
    }

    @Override
    public void close() {
        closed = true;
        TaskScheduler.ScheduledTask pending = next;
        if (pending != null) {
            pending.cancel();
        }
    }
}
