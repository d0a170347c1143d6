package admit.core.algorithms.fixed_window;

/**
 * @param count requests counted in the current window (>= 1 once created)
 * @param windowStart time of the request that opened the window
 */
public record WindowState(int count, long windowStart) {

    static WindowState openAt(long nowMillis) {
        return new WindowState(1, nowMillis);
    }

    WindowState increment() {
        return new WindowState(count + 1, windowStart);
    }
}
