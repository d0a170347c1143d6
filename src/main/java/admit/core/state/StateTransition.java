package admit.core.state;

/**
 * New state to store for a key, plus the value handed back to the caller.
 */
public record StateTransition<S, R>(S state, R result) {

    public static <S, R> StateTransition<S, R> of(S state, R result) {
        return new StateTransition<>(state, result);
    }
}
