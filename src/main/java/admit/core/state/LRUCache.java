package admit.core.state;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.BiPredicate;

/**
 * LRU (Least Recently Used) cache with eviction callback.
 *
 * This implementation provides:
 * - O(1) get/putIfAbsent operations
 * - Access-order based eviction (least recently accessed entries evicted first)
 * - Optional guard that keeps entries from being evicted while in use
 * - Thread-safe operations via synchronized methods
 * - Predicate-based bulk removal for idle sweeps
 *
 * @param <K> Key type
 * @param <V> Value type
 */
public final class LRUCache<K, V> {

    private static final int INITIAL_CAPACITY = 16;

    private final int maxSize;
    private final LinkedHashMap<K, V> map;
    private final BiPredicate<K, V> evictionGuard;
    private final BiConsumer<K, V> evictionCallback;

    /**
     * Creates an LRU cache with specified max size and eviction callback.
     *
     * @param maxSize Maximum number of entries (must be > 0)
     * @param evictionCallback Callback invoked when an entry is evicted for size (can be null)
     * @throws IllegalArgumentException if maxSize <= 0
     */
    public LRUCache(int maxSize, BiConsumer<K, V> evictionCallback) {
        this(maxSize, null, evictionCallback);
    }

    /**
     * @param evictionGuard Decides whether an over-size candidate may go (can be null).
     *                      Candidates it refuses stay, and the next least recently used
     *                      entry is tried instead
     */
    public LRUCache(int maxSize, BiPredicate<K, V> evictionGuard, BiConsumer<K, V> evictionCallback) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }

        this.maxSize = maxSize;
        this.evictionGuard = evictionGuard;
        this.evictionCallback = evictionCallback;

        // accessOrder=true for LRU behavior
        this.map = new LinkedHashMap<>(Math.min(maxSize, INITIAL_CAPACITY), 0.75f, true);
    }

    public LRUCache(int maxSize) {
        this(maxSize, null, null);
    }

    /**
     * Retrieves a value and marks the entry as recently used.
     *
     * @return The value, or null if not present
     */
    public synchronized V get(K key) {
        return map.get(key);
    }

    /**
     * Inserts a value only if the key is not already present.
     * May trigger eviction if size exceeds maxSize. The inserted key is never
     * the one evicted; when the guard refuses every other entry the cache
     * stays above maxSize until a later insert.
     *
     * @return The existing value if present, or null if the new value was inserted
     */
    public synchronized V putIfAbsent(K key, V value) {
        V existing = map.get(key);
        if (existing != null) {
            return existing;
        }
        map.put(key, value);
        evictOverflow(key);
        return null;
    }

    private void evictOverflow(K inserted) {
        Iterator<Map.Entry<K, V>> it = map.entrySet().iterator();
        while (map.size() > maxSize && it.hasNext()) {
            Map.Entry<K, V> eldest = it.next();
            if (eldest.getKey().equals(inserted)) {
                continue;
            }
            if (evictionGuard != null && !evictionGuard.test(eldest.getKey(), eldest.getValue())) {
                continue;
            }
            it.remove();
            if (evictionCallback != null) {
                evictionCallback.accept(eldest.getKey(), eldest.getValue());
            }
        }
    }

    /**
     * Removes every entry matching the predicate. Does not change access order
     * of the survivors and does NOT invoke the eviction callback.
     *
     * @return Number of entries removed
     */
    public synchronized int removeIf(BiPredicate<? super K, ? super V> predicate) {
        int removed = 0;
        Iterator<Map.Entry<K, V>> it = map.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<K, V> e = it.next();
            if (predicate.test(e.getKey(), e.getValue())) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public synchronized int size() {
        return map.size();
    }

    public synchronized void clear() {
        map.clear();
    }

    public int maxSize() {
        return maxSize;
    }
}
