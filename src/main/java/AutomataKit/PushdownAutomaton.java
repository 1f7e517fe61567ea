package AutomataKit;

import AutomataKit.Format.DotFormat;
import AutomataKit.Model.PushdownTransition;
import AutomataKit.Model.SearchLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Single-stack pushdown automaton. A word is accepted when it is fully read and either the current
 * state is terminal or the stack is empty.
 */
public class PushdownAutomaton implements Automaton {
    private static final Logger LOG = LoggerFactory.getLogger(PushdownAutomaton.class);

    private final SortedSet<String> states = new TreeSet<>();
    private final SortedSet<String> inputAlphabet = new TreeSet<>();
    private final SortedSet<String> stackAlphabet = new TreeSet<>();
    private final SortedSet<String> terminalStates = new TreeSet<>();
    private final List<PushdownTransition> transitions = new ArrayList<>();
    private final String startState;
    private final String initialStackSymbol;

    private SearchLimits limits = SearchLimits.defaults();

    /**
     * @param states - all state labels; must contain the start state
     * @param startState - the single start state
     * @param initialStackSymbol - the only symbol on the stack before reading
     */
    public PushdownAutomaton(Collection<String> states, String startState, String initialStackSymbol) {
        this.states.addAll(states);
        if (!this.states.contains(startState)) {
            throw new IllegalArgumentException("Unknown start state: " + startState);
        }
        this.startState = startState;
        this.initialStackSymbol = Objects.requireNonNull(initialStackSymbol);
    }

    public void addInputSymbol(String symbol) {
        if (EPSILON.equals(symbol)) {
            throw new IllegalArgumentException("'" + EPSILON + "' is reserved and cannot be part of an alphabet");
        }
        inputAlphabet.add(Objects.requireNonNull(symbol));
    }

    public void addStackSymbol(String symbol) {
        stackAlphabet.add(Objects.requireNonNull(symbol));
    }

    public void addTerminalState(String state) {
        terminalStates.add(requireState(state));
    }

    public void addTransition(PushdownTransition transition) {
        requireState(transition.state());
        requireState(transition.nextState());
        if (!EPSILON.equals(transition.input()) && !inputAlphabet.contains(transition.input())) {
            throw new IllegalArgumentException("Symbol " + transition.input() + " is not in the input alphabet");
        }
        transitions.add(transition);
    }

    private String requireState(String state) {
        if (!states.contains(state)) {
            throw new IllegalArgumentException("Unknown state: " + state);
        }
        return state;
    }

    public SearchLimits getLimits() {
        return limits;
    }

    public void setLimits(SearchLimits limits) {
        this.limits = Objects.requireNonNull(limits);
    }

    @Override
    public SortedSet<String> getStates() {
        return Collections.unmodifiableSortedSet(states);
    }

    public SortedSet<String> getInputAlphabet() {
        return Collections.unmodifiableSortedSet(inputAlphabet);
    }

    public SortedSet<String> getStackAlphabet() {
        return Collections.unmodifiableSortedSet(stackAlphabet);
    }

    @Override
    public SortedSet<String> getTerminalStates() {
        return Collections.unmodifiableSortedSet(terminalStates);
    }

    public String getStartState() {
        return startState;
    }

    public String getInitialStackSymbol() {
        return initialStackSymbol;
    }

    public List<PushdownTransition> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }

    public boolean accepts(String input) {
        return accepts(Words.symbols(input));
    }

    /**
     * Depth-first search over configurations, trying transitions in declaration order.
     * Branches deeper than {@link SearchLimits#getMaxSearchDepth()} are abandoned, and the search gives up
     * (rejecting) after {@link SearchLimits#getMaxExpansions()} configurations.
     */
    public boolean accepts(List<String> input) {
        for (String symbol : input) {
            if (!inputAlphabet.contains(symbol)) {
                LOG.debug("Symbol {} is outside the input alphabet", symbol);
                return false;
            }
        }

        Deque<Configuration> pending = new ArrayDeque<>();
        pending.push(new Configuration(startState, 0, new StackCell(initialStackSymbol, null), 0));
        int expansions = 0;

        while (!pending.isEmpty()) {
            Configuration current = pending.pop();
            boolean inputRead = current.position() == input.size();
            if (inputRead && (terminalStates.contains(current.state()) || current.stack() == null)) {
                return true;
            }
            if (current.stack() == null) {
                continue; // nothing left to match against
            }
            if (current.depth() >= limits.getMaxSearchDepth()) {
                LOG.trace("Depth cap reached in {}", current.state());
                continue;
            }
            if (++expansions > limits.getMaxExpansions()) {
                LOG.debug("Search gave up after {} expansions", limits.getMaxExpansions());
                return false;
            }

            String next = inputRead ? EPSILON : input.get(current.position());
            String top = current.stack().symbol();
            List<Configuration> successors = new ArrayList<>();
            for (PushdownTransition t : transitions) {
                if (t.state().equals(current.state()) && t.stackTop().equals(top)
                    && (t.input().equals(next) || t.input().equals(EPSILON))) {
                    int position = t.input().equals(EPSILON) ? current.position() : current.position() + 1;
                    successors.add(new Configuration(t.nextState(), position,
                        replaceTop(current.stack(), t.replacement()), current.depth() + 1));
                }
            }
            // pushed in reverse so the first matching transition is explored first
            for (int i = successors.size() - 1; i >= 0; i--) {
                pending.push(successors.get(i));
            }
        }
        return false;
    }

    /**
     * Test every word in order.
     * @return acceptance result per word
     */
    public List<Boolean> acceptsAll(List<String> words) {
        List<Boolean> results = new ArrayList<>(words.size());
        for (String word : words) {
            results.add(accepts(word));
        }
        return results;
    }

    private static StackCell replaceTop(StackCell stack, List<String> replacement) {
        StackCell result = stack.below();
        for (int i = replacement.size() - 1; i >= 0; i--) {
            String symbol = replacement.get(i);
            if (!EPSILON.equals(symbol)) {
                result = new StackCell(symbol, result);
            }
        }
        return result;
    }

    @Override
    public String toDot() {
        return DotFormat.pushdownAutomaton(startState, terminalStates, transitions);
    }

    @Override
    public String toString() {
        return "States: " + states + "\nInput Alphabet: " + inputAlphabet + "\nStack Alphabet: " + stackAlphabet
            + "\nStart State: " + startState + "\nInitial Stack Symbol: " + initialStackSymbol
            + "\nTerminal States: " + terminalStates + "\nTransitions: " + transitions;
    }

    // Immutable stack, shared between configurations; null is the empty stack.
    private record StackCell(String symbol, StackCell below) { }

    private record Configuration(String state, int position, StackCell stack, int depth) { }
}
