package admit.java.config;

import admit.java.engine.RateLimiterConfig;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.spi.ConfigSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link AdmissionConfig} from the standard config sources and turns it
 * into limiter configurations.
 */
public final class AdmissionConfigLoader {

    private AdmissionConfigLoader() {
    }

    public static AdmissionConfig load() {
        return load(List.of());
    }

    /**
     * @param extraSources additional sources, e.g. command line overrides or test values
     */
    public static AdmissionConfig load(List<ConfigSource> extraSources) {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
            .addDefaultSources()
            .withSources(extraSources.toArray(new ConfigSource[0]))
            .withMapping(AdmissionConfig.class)
            .build();
        return config.getConfigMapping(AdmissionConfig.class);
    }

    /**
     * Enabled immediate-rejection limiters in chain order: fixed window,
     * sliding log, sliding counter, token bucket, leaky bucket.
     */
    public static List<RateLimiterConfig> limiterConfigs(AdmissionConfig config) {
        List<RateLimiterConfig> configs = new ArrayList<>();
        if (config.fixedWindow().enabled()) {
            configs.add(RateLimiterConfig.fixedWindow(
                config.fixedWindow().windowDurationMs(), config.fixedWindow().maxRequests()));
        }
        if (config.slidingLog().enabled()) {
            configs.add(RateLimiterConfig.slidingWindowLog(
                config.slidingLog().windowDurationMs(), config.slidingLog().maxRequests()));
        }
        if (config.slidingCounter().enabled()) {
            configs.add(RateLimiterConfig.slidingWindowCounter(
                config.slidingCounter().windowDurationMs(), config.slidingCounter().maxRequests()));
        }
        if (config.tokenBucket().enabled()) {
            configs.add(RateLimiterConfig.tokenBucket(
                config.tokenBucket().capacity(), config.tokenBucket().refillRatePerSecond()));
        }
        if (config.leakyBucket().enabled()) {
            configs.add(RateLimiterConfig.leakyBucket(
                config.leakyBucket().capacity(), config.leakyBucket().leakIntervalMs()));
        }
        return configs;
    }
}
