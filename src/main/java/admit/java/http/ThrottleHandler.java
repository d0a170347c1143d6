package admit.java.http;

import admit.core.algorithms.delayed_throttle.ThrottleDecision;
import admit.java.engine.ClientKeyExtractor;
import admit.java.engine.Deferral;
import admit.java.engine.DelayedAdmission;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.SameThreadExecutor;

/**
 * Undertow handler that delays requests over the limit instead of rejecting them.
 *
 * A deferred exchange is suspended and resumed on the worker pool once the
 * throttle has room. If the exchange completes first (e.g. the connection
 * closes), the pending deferral is cancelled.
 */
public final class ThrottleHandler implements HttpHandler {

    private final DelayedAdmission admission;
    private final ClientKeyExtractor<HttpServerExchange> keys;
    private final HttpHandler next;

    public ThrottleHandler(DelayedAdmission admission, ClientKeyExtractor<HttpServerExchange> keys, HttpHandler next) {
        if (admission == null) throw new IllegalArgumentException("admission cannot be null");
        if (keys == null) throw new IllegalArgumentException("keys cannot be null");
        if (next == null) throw new IllegalArgumentException("next cannot be null");
        this.admission = admission;
        this.keys = keys;
        this.next = next;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String key = keys.keyFor(exchange);
        ThrottleDecision decision = admission.tryEnter(key);
        if (decision.admitted()) {
            next.handleRequest(exchange);
            return;
        }

        // Schedule only after this call stack has returned and the exchange is suspended.
        exchange.dispatch(SameThreadExecutor.INSTANCE, () -> {
            Deferral deferral = admission.defer(key, decision.delayMillis(), () -> exchange.dispatch(next));
            exchange.addExchangeCompleteListener((completed, nextListener) -> {
                deferral.cancel();
                nextListener.proceed();
            });
        });
    }
}
