package admit.java.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the admission service.
 *
 * <p>Configuration prefix: {@code admit}
 *
 * <p>Sources, highest priority first: system properties, environment variables
 * (e.g. {@code ADMIT_TOKEN_BUCKET_CAPACITY}), then
 * {@code META-INF/microprofile-config.properties}. Limits are read once at
 * startup.
 */
@ConfigMapping(prefix = "admit")
public interface AdmissionConfig {

    /**
     * Maximum client keys each limiter tracks before LRU eviction.
     */
    @WithDefault("10000")
    int maxKeys();

    /**
     * Interval between idle key sweeps.
     */
    @WithDefault("60000")
    long sweepIntervalMs();

    Http http();

    Grpc grpc();

    Window fixedWindow();

    Window slidingLog();

    Window slidingCounter();

    TokenBucket tokenBucket();

    LeakyBucket leakyBucket();

    Window throttle();

    interface Http {

        @WithDefault("0.0.0.0")
        String host();

        @WithDefault("3000")
        int port();

        /**
         * Key clients by the first X-Forwarded-For entry. Only enable behind a
         * proxy that sets the header; otherwise clients pick their own key.
         */
        @WithDefault("false")
        boolean trustForwardedFor();
    }

    interface Grpc {

        @WithDefault("true")
        boolean enabled();

        @WithDefault("9090")
        int port();

        @WithDefault("false")
        boolean trustForwardedFor();
    }

    /**
     * Window-based limiters: fixed window, sliding log, sliding counter and the
     * delayed throttle. Defaults per limiter live in microprofile-config.properties.
     */
    interface Window {

        @WithDefault("true")
        boolean enabled();

        long windowDurationMs();

        int maxRequests();
    }

    interface TokenBucket {

        @WithDefault("true")
        boolean enabled();

        @WithDefault("10")
        long capacity();

        @WithDefault("1")
        double refillRatePerSecond();
    }

    interface LeakyBucket {

        @WithDefault("true")
        boolean enabled();

        @WithDefault("10")
        long capacity();

        @WithDefault("1000")
        long leakIntervalMs();
    }
}
