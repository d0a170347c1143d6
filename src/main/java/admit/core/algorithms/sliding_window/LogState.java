package admit.core.algorithms.sliding_window;

import java.util.ArrayDeque;

/**
 * Ordered request timestamps for one key, oldest first.
 * Mutable: only touch it inside the owning store's compute call.
 */
public final class LogState {
    private final ArrayDeque<Long> events = new ArrayDeque<>();

    /**
     * Drops every timestamp strictly before cutoff.
     */
    public void removeBefore(long cutoff) {
        while (!events.isEmpty() && events.peekFirst() < cutoff) {
            events.removeFirst();
        }
    }

    public void append(long timestamp) {
        events.addLast(timestamp);
    }

    public int size() {
        return events.size();
    }

    /**
     * @throws java.util.NoSuchElementException if empty
     */
    public long oldest() {
        return events.getFirst();
    }
}
