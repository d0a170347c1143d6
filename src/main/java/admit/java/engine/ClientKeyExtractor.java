package admit.java.engine;

import java.util.Optional;

/**
 * Maps an inbound request to the key its limiter state is partitioned by.
 *
 * @param <R> transport request type
 */
@FunctionalInterface
public interface ClientKeyExtractor<R> {

    /**
     * @return the caller's identity, or empty when the request carries none
     */
    Optional<String> extract(R request);

    /**
     * Like {@link #extract} but never empty: callers without an identity all
     * share {@link ClientKeys#SHARED_KEY}, and therefore one bucket.
     */
    default String keyFor(R request) {
        return ClientKeys.orShared(extract(request));
    }
}
