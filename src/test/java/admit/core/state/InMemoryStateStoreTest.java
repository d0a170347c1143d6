package admit.core.state;

import org.junit.jupiter.api.Test;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryStateStoreTest {

    private static StateFunction<Integer, Integer> increment() {
        return (current, now) -> {
            int next = current == null ? 1 : current + 1;
            return StateTransition.of(next, next);
        };
    }

    @Test
    void testCompute_firstObservationSeesNull() {
        InMemoryStateStore<Integer> store = new InMemoryStateStore<>();

        Boolean sawNull = store.compute("a", 0L, (current, now) -> StateTransition.of(1, current == null));

        assertTrue(sawNull);
        assertEquals(Integer.valueOf(1), store.peek("a").orElseThrow());
    }

    @Test
    void testCompute_passesTimestampThrough() {
        InMemoryStateStore<Long> store = new InMemoryStateStore<>();

        Long seen = store.compute("a", 1234L, (current, now) -> StateTransition.of(now, now));

        assertEquals(1234L, seen);
    }

    @Test
    void testPeek_doesNotCreateEntries() {
        InMemoryStateStore<Integer> store = new InMemoryStateStore<>();

        assertTrue(store.peek("missing").isEmpty());
        assertEquals(0, store.size());
    }

    @Test
    void testLruEviction_dropsLeastRecentlyUsedKey() {
        InMemoryStateStore<Integer> store = new InMemoryStateStore<>(2, InMemoryStateStore.NO_IDLE_EXPIRY);

        store.compute("a", 0L, increment());
        store.compute("b", 0L, increment());
        store.compute("a", 0L, increment());
        store.compute("c", 0L, increment());

        assertEquals(2, store.size());
        assertTrue(store.peek("b").isEmpty(), "b was least recently used");
        assertEquals(Integer.valueOf(2), store.peek("a").orElseThrow());
        assertEquals(Integer.valueOf(1), store.peek("c").orElseThrow());
    }

    @Test
    void testEvictIdle_removesOnlyKeysIdlePastTtl() {
        InMemoryStateStore<Integer> store = new InMemoryStateStore<>(100, 1_000L);

        store.compute("a", 0L, increment());
        store.compute("b", 500L, increment());

        assertEquals(0, store.evictIdle(1_000L), "exactly the TTL is not idle yet");
        assertEquals(1, store.evictIdle(1_001L));
        assertTrue(store.peek("a").isEmpty());
        assertTrue(store.peek("b").isPresent());

        assertEquals(1, store.evictIdle(1_501L));
        assertEquals(0, store.size());
    }

    @Test
    void testEvictIdle_accessResetsIdleTime() {
        InMemoryStateStore<Integer> store = new InMemoryStateStore<>(100, 1_000L);

        store.compute("a", 0L, increment());
        store.compute("a", 900L, increment());

        assertEquals(0, store.evictIdle(1_000L));
        assertEquals(0, store.evictIdle(1_900L));
        assertEquals(1, store.evictIdle(1_901L));
    }

    @Test
    void testEvictIdle_noExpiryConfigured() {
        InMemoryStateStore<Integer> store = new InMemoryStateStore<>();
        store.compute("a", 0L, increment());

        assertEquals(0, store.evictIdle(Long.MAX_VALUE));
        assertEquals(1, store.size());
    }

    @Test
    void testEvictIdle_skipsEntryInUse() {
        InMemoryStateStore<Integer> store = new InMemoryStateStore<>(100, 1L);
        store.compute("a", 0L, increment());

        Integer removedDuringCompute = store.compute("a", 0L,
            (current, now) -> StateTransition.of(current, store.evictIdle(1_000L)));

        assertEquals(Integer.valueOf(0), removedDuringCompute);
        assertEquals(1, store.size());
    }

    @Test
    void testLruEviction_skipsKeyInUse() throws Exception {
        InMemoryStateStore<Integer> store = new InMemoryStateStore<>(1, InMemoryStateStore.NO_IDLE_EXPIRY);
        CountDownLatch inside = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<Integer> first = executor.submit(() -> store.compute("a", 0L, (current, now) -> {
                inside.countDown();
                awaitQuietly(release);
                int next = current == null ? 1 : current + 1;
                return StateTransition.of(next, next);
            }));
            assertTrue(inside.await(5, TimeUnit.SECONDS));

            // over the bound, but "a" is locked and must stay
            store.compute("b", 0L, increment());
            assertEquals(2, store.size());

            Future<Integer> second = executor.submit(() -> store.compute("a", 0L, increment()));
            release.countDown();

            assertEquals(Integer.valueOf(1), first.get(5, TimeUnit.SECONDS));
            assertEquals(Integer.valueOf(2), second.get(5, TimeUnit.SECONDS));
            assertEquals(Integer.valueOf(2), store.peek("a").orElseThrow());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testLruEviction_resumesOnceKeyIsFree() {
        InMemoryStateStore<Integer> store = new InMemoryStateStore<>(1, InMemoryStateStore.NO_IDLE_EXPIRY);
        store.compute("a", 0L, increment());

        store.compute("a", 0L, (current, now) -> StateTransition.of(current, store.compute("b", now, increment())));
        assertEquals(2, store.size(), "a was in use when b arrived");

        store.compute("c", 0L, increment());
        assertEquals(1, store.size());
        assertTrue(store.peek("c").isPresent());
    }

    @Test
    void testCompute_retriesWhenEntryRemovedWhileWaiting() throws Exception {
        InMemoryStateStore<Integer> store = new InMemoryStateStore<>();
        CountDownLatch inside = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger waiterResult = new AtomicInteger();

        Thread holder = new Thread(() -> store.compute("a", 0L, (current, now) -> {
            inside.countDown();
            awaitQuietly(release);
            return StateTransition.of(10, 10);
        }));
        holder.start();
        assertTrue(inside.await(5, TimeUnit.SECONDS));

        Thread waiter = new Thread(() -> waiterResult.set(store.compute("a", 0L, increment())));
        waiter.start();
        while (waiter.getState() != Thread.State.WAITING) {
            assertTrue(waiter.isAlive());
            Thread.onSpinWait();
        }

        store.clear();
        release.countDown();
        holder.join(5_000L);
        waiter.join(5_000L);

        assertEquals(1, waiterResult.get(), "waiter must start over on a fresh entry");
        assertEquals(Integer.valueOf(1), store.peek("a").orElseThrow());
        assertEquals(1, store.size());
    }

    @Test
    void testCompute_rejectsNullKeyAndNullTransition() {
        InMemoryStateStore<Integer> store = new InMemoryStateStore<>();

        assertThrows(IllegalArgumentException.class, () -> store.compute(null, 0L, increment()));
        assertThrows(IllegalStateException.class, () -> store.compute("a", 0L, (current, now) -> null));
    }

    @Test
    void testClear() {
        InMemoryStateStore<Integer> store = new InMemoryStateStore<>();
        store.compute("a", 0L, increment());
        store.compute("b", 0L, increment());

        store.clear();

        assertEquals(0, store.size());
        assertTrue(store.peek("a").isEmpty());
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryStateStore<Integer>(0, 1_000L));
        assertThrows(IllegalArgumentException.class, () -> new InMemoryStateStore<Integer>(10, 0L));
    }

    @Test
    void testConcurrent_computeIsAtomicPerKey() throws InterruptedException {
        InMemoryStateStore<Integer> store = new InMemoryStateStore<>();

        int numThreads = 8;
        int incrementsPerThread = 1_000;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < incrementsPerThread; j++) {
                        store.compute("counter", 0L, increment());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();

        assertEquals(Integer.valueOf(numThreads * incrementsPerThread), store.peek("counter").orElseThrow());
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
