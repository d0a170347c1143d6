package admit.java.engine;

import admit.core.algorithms.delayed_throttle.ThrottleDecision;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Handle to a request waiting for the delayed throttle.
 *
 * Moves once from PENDING to either DONE (continuation ran) or CANCELLED.
 * A cancel and an admission check never interleave: a cancelled deferral takes
 * no slot, and an admitted one can no longer be cancelled.
 */
public final class Deferral {

    private enum State { PENDING, DONE, CANCELLED }

    private final AtomicReference<State> state = new AtomicReference<>(State.PENDING);
    private volatile TaskScheduler.ScheduledTask pending;

    /**
     * Stops the continuation from running. No-op once it has run.
     *
     * @return true if this call cancelled the deferral
     */
    public synchronized boolean cancel() {
        if (!state.compareAndSet(State.PENDING, State.CANCELLED)) {
            return false;
        }
        TaskScheduler.ScheduledTask task = pending;
        if (task != null) {
            task.cancel();
        }
        return true;
    }

    public boolean isCancelled() {
        return state.get() == State.CANCELLED;
    }

    public boolean isDone() {
        return state.get() == State.DONE;
    }

    void track(TaskScheduler.ScheduledTask task) {
        this.pending = task;
        if (isCancelled()) {
            task.cancel();
        }
    }

    /**
     * Runs the admission check unless the deferral was cancelled, and marks it
     * done when the check admits.
     *
     * @return the check's decision, or null if the deferral is no longer pending
     */
    synchronized ThrottleDecision attempt(Supplier<ThrottleDecision> check) {
        if (state.get() != State.PENDING) {
            return null;
        }
        ThrottleDecision decision = check.get();
        if (decision.admitted()) {
            state.set(State.DONE);
        }
        return decision;
    }
}
