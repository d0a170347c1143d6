package admit.core.state;

@FunctionalInterface
public interface StateFunction<S, R> {
    StateTransition<S, R> apply(S current, long nowMillis);
}
