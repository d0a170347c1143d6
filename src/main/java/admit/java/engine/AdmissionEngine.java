package admit.java.engine;

import admit.core.clock.Clock;
import admit.core.model.RateLimitResult;
import admit.core.model.RateLimiter;
import admit.core.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Thread-safe admission engine chaining several limiters in front of one handler.
 *
 * Features:
 * - A request passes only if every limiter admits it (logical AND)
 * - Limiters are consulted in order; the first rejection short-circuits and
 *   later limiters never see the request
 * - Each limiter keeps its own per-key state with per-key locking
 * - Fail closed: a limiter that throws counts as a rejection
 *
 * Usage example:
 * <pre>
 * AdmissionEngine engine = AdmissionEngine.fromConfigs(SystemClock.instance(), List.of(
 *     RateLimiterConfig.fixedWindow(900_000, 100),
 *     RateLimiterConfig.tokenBucket(10, 1.0)), 10_000);
 *
 * AdmissionResult result = engine.check("203.0.113.7");
 * if (!result.allowed()) {
 *     // 429 with result.error() and result.retryAfterSeconds()
 * }
 * </pre>
 */
public final class AdmissionEngine {

    private static final Logger log = LoggerFactory.getLogger(AdmissionEngine.class);

    static final String FAIL_CLOSED_ERROR = "Rate limiter unavailable";
    static final long FAIL_CLOSED_RETRY_AFTER_SECONDS = 1L;

    private final List<RateLimiter> limiters;

    /**
     * @param limiters Limiters in evaluation order; an empty chain admits everything
     */
    public AdmissionEngine(List<RateLimiter> limiters) {
        if (limiters == null) {
            throw new IllegalArgumentException("limiters cannot be null");
        }
        this.limiters = List.copyOf(limiters);
    }

    /**
     * Builds one limiter per config, each with its own state store.
     */
    public static AdmissionEngine fromConfigs(Clock clock, List<RateLimiterConfig> configs, int maxKeys) {
        if (configs == null) {
            throw new IllegalArgumentException("configs cannot be null");
        }
        List<RateLimiter> limiters = new ArrayList<>(configs.size());
        for (RateLimiterConfig config : configs) {
            limiters.add(RateLimiterFactory.create(clock, config, maxKeys));
        }
        return new AdmissionEngine(limiters);
    }

    /**
     * Runs the request through every limiter in order.
     *
     * @param clientKey Partition key for the caller (e.g., network address)
     * @throws IllegalArgumentException if clientKey is null
     */
    public AdmissionResult check(String clientKey) {
        if (clientKey == null) {
            throw new IllegalArgumentException("clientKey cannot be null");
        }

        for (RateLimiter limiter : limiters) {
            RateLimitResult result;
            try {
                result = limiter.tryAcquire(clientKey);
            } catch (RuntimeException e) {
                log.error("Limiter {} failed for key {}; rejecting", limiter.name(), clientKey, e);
                return AdmissionResult.rejected(limiter.name(), FAIL_CLOSED_ERROR, FAIL_CLOSED_RETRY_AFTER_SECONDS);
            }

            if (!result.allowed()) {
                log.debug("Key {} rejected by {} (retry after {}s)",
                    clientKey, limiter.name(), result.retryAfterSeconds());
                return AdmissionResult.rejected(limiter.name(), limiter.rejectionMessage(), result.retryAfterSeconds());
            }
        }
        return AdmissionResult.admitted();
    }

    public List<StateStore<?>> stateStores() {
        List<StateStore<?>> stores = new ArrayList<>(limiters.size());
        for (RateLimiter limiter : limiters) {
            stores.add(limiter.stateStore());
        }
        return stores;
    }

    public List<RateLimiter> limiters() {
        return limiters;
    }

    /**
     * Clears all limiter state. Primarily useful for testing.
     */
    public void clear() {
        for (RateLimiter limiter : limiters) {
            limiter.stateStore().clear();
        }
    }
}
