package admit.java.engine;

import admit.core.clock.ManualClock;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link TaskScheduler} driven by a {@link ManualClock}: tasks run only inside
 * {@link #advanceMillis}, in due-time order, with the clock set to their due time.
 */
final class ManualTaskScheduler implements TaskScheduler {

    private record Pending(long dueMillis, Runnable task, AtomicBoolean finished) {
    }

    private final ManualClock clock;
    private final List<Pending> pending = new ArrayList<>();

    ManualTaskScheduler(ManualClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized ScheduledTask schedule(Runnable task, long delayMillis) {
        Pending entry = new Pending(clock.nowMillis() + Math.max(0L, delayMillis), task, new AtomicBoolean());
        pending.add(entry);
        return () -> entry.finished().compareAndSet(false, true);
    }

    void advanceMillis(long delta) {
        long target = clock.nowMillis() + delta;
        while (true) {
            Pending next = pollDue(target);
            if (next == null) {
                break;
            }
            if (next.dueMillis() > clock.nowMillis()) {
                clock.setMillis(next.dueMillis());
            }
            if (next.finished().compareAndSet(false, true)) {
                next.task().run();
            }
        }
        clock.setMillis(target);
    }

    synchronized int pendingCount() {
        int count = 0;
        for (Pending p : pending) {
            if (!p.finished().get()) {
                count++;
            }
        }
        return count;
    }

    private synchronized Pending pollDue(long target) {
        Pending earliest = null;
        for (Pending p : pending) {
            if (p.dueMillis() <= target && (earliest == null || p.dueMillis() < earliest.dueMillis())) {
                earliest = p;
            }
        }
        if (earliest != null) {
            pending.remove(earliest);
        }
        return earliest;
    }
}
