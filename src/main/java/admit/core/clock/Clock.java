package admit.core.clock;

/**
 * Time source for every limiter. Milliseconds since the Unix epoch.
 */
public interface Clock {
    long nowMillis();
}
