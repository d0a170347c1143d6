package admit.core.clock;

/**
 * Real system clock.
 *
 * Anchors System.nanoTime() to the wall clock once, so readings are monotonic
 * but still epoch-based (sliding window counter buckets align to the epoch).
 * Use this for production or concurrent tests where determinism isn't required.
 */
public final class SystemClock implements Clock {
    private static final SystemClock INSTANCE = new SystemClock();

    private static final long EPOCH_OFFSET_MILLIS =
        System.currentTimeMillis() - System.nanoTime() / 1_000_000L;

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowMillis() {
        return EPOCH_OFFSET_MILLIS + System.nanoTime() / 1_000_000L;
    }
}
