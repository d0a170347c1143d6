package admit.core.algorithms.sliding_window_counter;

/**
 * Counts for the bucket containing "now" and the one right before it.
 * Buckets are aligned to multiples of the window length from the epoch.
 */
public record CounterPairState(Bucket current, Bucket previous) {

    public record Bucket(long start, long count) {
    }

    static CounterPairState firstAt(long bucketStart, long windowMillis) {
        return new CounterPairState(
            new Bucket(bucketStart, 1),
            new Bucket(bucketStart - windowMillis, 0));
    }

    /**
     * Moves to a new bucket. The old current bucket only becomes "previous"
     * when it is adjacent to the new one; after a longer gap previous is empty.
     */
    CounterPairState rollTo(long bucketStart, long windowMillis) {
        long previousStart = bucketStart - windowMillis;
        Bucket previous = current.start() == previousStart
            ? current
            : new Bucket(previousStart, 0);
        return new CounterPairState(new Bucket(bucketStart, 1), previous);
    }

    CounterPairState increment() {
        return new CounterPairState(new Bucket(current.start(), current.count() + 1), previous);
    }

    /**
     * Weighted count as seen from the bucket starting at bucketStart.
     */
    double estimateAt(long bucketStart, double weight, long windowMillis) {
        if (current.start() == bucketStart) {
            return current.count() * (1 - weight) + previous.count() * weight;
        }
        if (current.start() == bucketStart - windowMillis) {
            return current.count() * weight;
        }
        return 0.0;
    }
}
