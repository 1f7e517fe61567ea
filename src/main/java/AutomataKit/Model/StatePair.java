package AutomataKit.Model;

/**
 * A state of the product of two automata.
 */
public record StatePair(String left, String right) {
    @Override
    public String toString() {
        return "(" + left + ", " + right + ")";
    }
}
