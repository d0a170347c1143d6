package admit.core.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local state store with a per-key lock.
 *
 * Memory management:
 * - At most maxKeys keys are tracked; the least recently used key is dropped
 *   beyond that. Keys with a compute in progress are skipped, so the bound
 *   can be exceeded by the number of keys in use at that moment
 * - {@link #evictIdle(long)} drops keys untouched for longer than idleTtlMillis.
 *   Limiters pick a TTL after which their state is equivalent to an absent
 *   entry, so a sweep never changes a decision
 *
 * Removal never breaks per-key atomicity: an entry is retired under its lock
 * before it leaves the map, and {@link #compute} retries on a fresh entry when
 * it locks a retired one.
 *
 * Nothing is persisted: a restart starts every key from empty.
 */
public final class InMemoryStateStore<S> implements StateStore<S> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStateStore.class);

    public static final int DEFAULT_MAX_KEYS = 10_000;
    public static final long NO_IDLE_EXPIRY = Long.MAX_VALUE;

    private final LRUCache<String, StateEntry<S>> entries;
    private final long idleTtlMillis;

    public InMemoryStateStore() {
        this(DEFAULT_MAX_KEYS, NO_IDLE_EXPIRY);
    }

    /**
     * @param maxKeys Maximum number of keys to track (LRU eviction beyond this)
     * @param idleTtlMillis Idle time after which a key may be swept
     */
    public InMemoryStateStore(int maxKeys, long idleTtlMillis) {
        if (maxKeys <= 0) {
            throw new IllegalArgumentException("maxKeys must be > 0");
        }
        if (idleTtlMillis <= 0) {
            throw new IllegalArgumentException("idleTtlMillis must be > 0");
        }
        this.idleTtlMillis = idleTtlMillis;
        this.entries = new LRUCache<>(maxKeys,
            (key, entry) -> entry.tryRetire(),
            (key, entry) -> log.debug("Evicted least recently used key {}", key));
    }

    @Override
    public <R> R compute(String key, long nowMillis, StateFunction<S, R> function) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }

        while (true) {
            StateEntry<S> entry = getOrCreate(key, nowMillis);

            ReentrantLock lock = entry.getLock();
            lock.lock();
            try {
                if (entry.isRetired()) {
                    continue;
                }
                StateTransition<S, R> transition = function.apply(entry.getState(), nowMillis);
                if (transition == null) {
                    throw new IllegalStateException("state function returned no transition for key " + key);
                }
                entry.update(transition.state(), nowMillis);
                return transition.result();
            } finally {
                lock.unlock();
            }
        }
    }

    @Override
    public Optional<S> peek(String key) {
        StateEntry<S> entry = entries.get(key);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.getState());
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public int evictIdle(long nowMillis) {
        if (idleTtlMillis == NO_IDLE_EXPIRY) {
            return 0;
        }
        return entries.removeIf((key, entry) -> entry.tryRetireIfIdle(nowMillis, idleTtlMillis));
    }

    @Override
    public void clear() {
        entries.removeIf((key, entry) -> {
            entry.retire();
            return true;
        });
    }

    public int maxKeys() {
        return entries.maxSize();
    }

    public long idleTtlMillis() {
        return idleTtlMillis;
    }

    /**
     * putIfAbsent semantics: only one entry (and one lock) is ever created per
     * live key, even when several threads see it missing at once.
     */
    private StateEntry<S> getOrCreate(String key, long nowMillis) {
        StateEntry<S> entry = entries.get(key);
        if (entry != null) {
            return entry;
        }

        StateEntry<S> created = new StateEntry<>(nowMillis);
        StateEntry<S> existing = entries.putIfAbsent(key, created);
        return existing != null ? existing : created;
    }
}
