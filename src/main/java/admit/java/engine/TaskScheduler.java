package admit.java.engine;

/**
 * One-shot delayed execution. Kept as an interface so tests can drive time by hand.
 */
public interface TaskScheduler {

    /**
     * Runs {@code task} once, no earlier than {@code delayMillis} from now.
     */
    ScheduledTask schedule(Runnable task, long delayMillis);

    /**
     * Handle to a scheduled run.
     */
    @FunctionalInterface
    interface ScheduledTask {
        /**
         * Prevents the run if it has not started. No-op afterwards.
         *
         * @return true if this call prevented the run
         */
        boolean cancel();
    }
}
