package admit.java.engine;

import admit.core.algorithms.leaky_bucket.LeakyBucket;
import admit.core.algorithms.sliding_window_counter.SlidingWindowCounter;
import admit.core.clock.ManualClock;
import admit.core.model.RateLimiter;
import admit.core.state.InMemoryStateStore;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterConfigTest {

    @Test
    void testIdleTtl_perAlgorithm() {
        assertEquals(900_000L, RateLimiterConfig.fixedWindow(900_000L, 100).idleTtlMillis());
        assertEquals(900_000L, RateLimiterConfig.slidingWindowLog(900_000L, 100).idleTtlMillis());
        assertEquals(120_000L, RateLimiterConfig.slidingWindowCounter(60_000L, 20).idleTtlMillis());
        assertEquals(10_000L, RateLimiterConfig.tokenBucket(10, 1.0).idleTtlMillis());
        assertEquals(4_000L, RateLimiterConfig.tokenBucket(10, 2.5).idleTtlMillis());
        assertEquals(10_000L, RateLimiterConfig.leakyBucket(10, 1_000L).idleTtlMillis());
    }

    @Test
    void testIdleTtl_saturatesInsteadOfOverflowing() {
        RateLimiterConfig config = RateLimiterConfig.leakyBucket(Long.MAX_VALUE / 2, 1_000L);
        assertEquals(Long.MAX_VALUE, config.idleTtlMillis());
    }

    @Test
    void testFactory_buildsMatchingLimiterWithTtlStore() {
        RateLimiter limiter = RateLimiterFactory.create(new ManualClock(0L),
            RateLimiterConfig.slidingWindowCounter(60_000L, 20), 500);

        assertInstanceOf(SlidingWindowCounter.class, limiter);
        InMemoryStateStore<?> store = (InMemoryStateStore<?>) limiter.stateStore();
        assertEquals(500, store.maxKeys());
        assertEquals(120_000L, store.idleTtlMillis());

        assertInstanceOf(LeakyBucket.class, RateLimiterFactory.create(new ManualClock(0L),
            RateLimiterConfig.leakyBucket(10, 1_000L), 500));
    }

    @Test
    void testInvalidConfigs() {
        assertThrows(IllegalArgumentException.class, () -> RateLimiterConfig.fixedWindow(0L, 10));
        assertThrows(IllegalArgumentException.class, () -> RateLimiterConfig.fixedWindow(1_000L, 0));
        assertThrows(IllegalArgumentException.class, () -> RateLimiterConfig.slidingWindowCounter(-1L, 10));
        assertThrows(IllegalArgumentException.class, () -> RateLimiterConfig.tokenBucket(10, 0.0));
        assertThrows(IllegalArgumentException.class, () -> RateLimiterConfig.tokenBucket(0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> RateLimiterConfig.leakyBucket(10, 0L));
        assertThrows(IllegalArgumentException.class,
            () -> new RateLimiterConfig(null, 10, 0.0, 1_000L, 0L));
        assertThrows(IllegalArgumentException.class,
            () -> RateLimiterFactory.create(null, RateLimiterConfig.tokenBucket(1, 1.0), 10));
    }

    @Test
    void testWindowLimit_mustFitInAnInt() {
        long tooLarge = Integer.MAX_VALUE + 1L;

        assertThrows(IllegalArgumentException.class,
            () -> new RateLimiterConfig(AlgorithmType.FIXED_WINDOW, tooLarge, 0.0, 1_000L, 0L));
        assertThrows(IllegalArgumentException.class,
            () -> new RateLimiterConfig(AlgorithmType.SLIDING_WINDOW_LOG, tooLarge, 0.0, 1_000L, 0L));
        assertThrows(IllegalArgumentException.class,
            () -> new RateLimiterConfig(AlgorithmType.SLIDING_WINDOW_COUNTER, tooLarge, 0.0, 1_000L, 0L));

        // bucket capacities are longs
        assertEquals(tooLarge, RateLimiterConfig.leakyBucket(tooLarge, 1_000L).limit());
        assertEquals(Integer.MAX_VALUE, (int) RateLimiterConfig.fixedWindow(1_000L, Integer.MAX_VALUE).limit());
    }
}
