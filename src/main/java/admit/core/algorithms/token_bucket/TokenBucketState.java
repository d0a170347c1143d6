package admit.core.algorithms.token_bucket;

/**
 * @param tokens tokens left, in [0, capacity]
 * @param lastRefill time up to which refill has been credited
 */
public record TokenBucketState(double tokens, long lastRefill) {
}
