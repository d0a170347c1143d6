package admit.core.algorithms.delayed_throttle;

/**
 * Either "go now" (delayMillis == 0) or "come back after delayMillis".
 * The throttle never rejects.
 */
public record ThrottleDecision(long delayMillis) {

    private static final ThrottleDecision NOW = new ThrottleDecision(0L);

    public static ThrottleDecision admitNow() {
        return NOW;
    }

    public static ThrottleDecision deferFor(long delayMillis) {
        return new ThrottleDecision(Math.max(1L, delayMillis));
    }

    public boolean admitted() {
        return delayMillis == 0L;
    }
}
