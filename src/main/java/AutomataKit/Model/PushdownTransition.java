package AutomataKit.Model;

import java.util.List;
import java.util.Objects;

/**
 * One move of a pushdown automaton: in {@code state}, reading {@code input} (or eps) with {@code stackTop}
 * on top, pop the top and push {@code replacement} so that its first symbol ends up on top, then go to
 * {@code nextState}. Replacement entries equal to eps push nothing.
 */
public record PushdownTransition(String state, String input, String stackTop, List<String> replacement,
                                 String nextState) {
    public PushdownTransition {
        Objects.requireNonNull(state);
        Objects.requireNonNull(input);
        Objects.requireNonNull(stackTop);
        Objects.requireNonNull(nextState);
        replacement = List.copyOf(replacement);
    }

    @Override
    public String toString() {
        return state + " " + input + " " + stackTop + " " + String.join(" ", replacement) + " " + nextState;
    }
}
