package admit.java.engine;

import admit.core.algorithms.delayed_throttle.DelayedThrottle;
import admit.core.algorithms.delayed_throttle.ThrottleDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Queue-and-retry admission on top of {@link DelayedThrottle}.
 *
 * A deferred request asks the throttle again when its timer fires, at the later
 * time. If other requests for the same key filled the window meanwhile, it waits
 * again rather than going over the limit. Requests are delayed, never rejected.
 */
public final class DelayedAdmission {

    private static final Logger log = LoggerFactory.getLogger(DelayedAdmission.class);

    private final DelayedThrottle throttle;
    private final TaskScheduler scheduler;

    public DelayedAdmission(DelayedThrottle throttle, TaskScheduler scheduler) {
        if (throttle == null) throw new IllegalArgumentException("throttle cannot be null");
        if (scheduler == null) throw new IllegalArgumentException("scheduler cannot be null");
        this.throttle = throttle;
        this.scheduler = scheduler;
    }

    /**
     * Admits and records the request if the window has room.
     */
    public ThrottleDecision tryEnter(String clientKey) {
        return throttle.tryEnter(clientKey);
    }

    /**
     * Schedules {@code continuation} to run once the key's window has room,
     * checking first after {@code delayMillis}.
     */
    public Deferral defer(String clientKey, long delayMillis, Runnable continuation) {
        if (clientKey == null) throw new IllegalArgumentException("clientKey cannot be null");
        if (continuation == null) throw new IllegalArgumentException("continuation cannot be null");

        Deferral deferral = new Deferral();
        log.debug("Deferring request for key {} by {} ms", clientKey, delayMillis);
        scheduleAttempt(clientKey, delayMillis, continuation, deferral);
        return deferral;
    }

    private void scheduleAttempt(String clientKey, long delayMillis, Runnable continuation, Deferral deferral) {
        deferral.track(scheduler.schedule(() -> attempt(clientKey, continuation, deferral), delayMillis));
    }

    private void attempt(String clientKey, Runnable continuation, Deferral deferral) {
        ThrottleDecision decision = deferral.attempt(() -> throttle.tryEnter(clientKey));
        if (decision == null) {
            return;
        }

        if (!decision.admitted()) {
            log.debug("Window for key {} still full, waiting {} ms more", clientKey, decision.delayMillis());
            scheduleAttempt(clientKey, decision.delayMillis(), continuation, deferral);
            return;
        }

        try {
            continuation.run();
        } catch (RuntimeException e) {
            log.error("Deferred continuation for key {} failed", clientKey, e);
        }
    }

    public DelayedThrottle throttle() {
        return throttle;
    }
}
