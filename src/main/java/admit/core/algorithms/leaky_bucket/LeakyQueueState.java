package admit.core.algorithms.leaky_bucket;

/**
 * @param queueLevel occupied queue slots, in [0, capacity]
 * @param lastLeak time up to which leaks have been applied
 */
public record LeakyQueueState(long queueLevel, long lastLeak) {
}
