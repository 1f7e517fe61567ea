package AutomataKit;

import AutomataKit.Format.DotFormat;
import AutomataKit.Model.StatePair;
import AutomataKit.Partition.Partition;
import AutomataKit.Partition.PartitionRefinement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Deterministic finite automaton over string labels with a possibly partial transition function.
 * <p>
 * {@link #equals(Object)} is structural; language equivalence is {@link #isEquivalentTo(DeterministicAutomaton)}.
 */
public class DeterministicAutomaton implements Automaton {
    private static final Logger LOG = LoggerFactory.getLogger(DeterministicAutomaton.class);

    static final String SINK = "sink";

    private final SortedSet<String> states;
    private final SortedSet<String> alphabet;
    private final SortedSet<String> startStates;
    private final SortedSet<String> terminalStates;
    // state -> symbol -> successor
    private final SortedMap<String, SortedMap<String, String>> transitions;

    public DeterministicAutomaton() {
        this.states = new TreeSet<>();
        this.alphabet = new TreeSet<>();
        this.startStates = new TreeSet<>();
        this.terminalStates = new TreeSet<>();
        this.transitions = new TreeMap<>();
    }

    private DeterministicAutomaton(DeterministicAutomaton other) {
        this.states = new TreeSet<>(other.states);
        this.alphabet = new TreeSet<>(other.alphabet);
        this.startStates = new TreeSet<>(other.startStates);
        this.terminalStates = new TreeSet<>(other.terminalStates);
        this.transitions = new TreeMap<>();
        for (Map.Entry<String, SortedMap<String, String>> e : other.transitions.entrySet()) {
            this.transitions.put(e.getKey(), new TreeMap<>(e.getValue()));
        }
    }

    public DeterministicAutomaton copy() {
        return new DeterministicAutomaton(this);
    }

    public void addState(String state) {
        states.add(Objects.requireNonNull(state));
    }

    public void addSymbol(String symbol) {
        if (EPSILON.equals(symbol)) {
            throw new IllegalArgumentException("'" + EPSILON + "' is reserved and cannot be part of an alphabet");
        }
        alphabet.add(Objects.requireNonNull(symbol));
    }

    public void addStartState(String state) {
        startStates.add(requireState(state));
    }

    public void addTerminalState(String state) {
        terminalStates.add(requireState(state));
    }

    /**
     * Define (or redefine) the successor of a state on a symbol.
     */
    public void setTransition(String from, String symbol, String to) {
        requireState(from);
        requireState(to);
        if (!alphabet.contains(symbol)) {
            throw new IllegalArgumentException("Symbol " + symbol + " is not in the alphabet");
        }
        transitions.computeIfAbsent(from, k -> new TreeMap<>()).put(symbol, to);
    }

    private String requireState(String state) {
        if (!states.contains(state)) {
            throw new IllegalArgumentException("Unknown state: " + state);
        }
        return state;
    }

    /**
     * @return successor, or null if the transition is undefined
     */
    public String getTransition(String state, String symbol) {
        SortedMap<String, String> row = transitions.get(state);
        return row == null ? null : row.get(symbol);
    }

    @Override
    public SortedSet<String> getStates() {
        return Collections.unmodifiableSortedSet(states);
    }

    public SortedSet<String> getAlphabet() {
        return Collections.unmodifiableSortedSet(alphabet);
    }

    public SortedSet<String> getStartStates() {
        return Collections.unmodifiableSortedSet(startStates);
    }

    @Override
    public SortedSet<String> getTerminalStates() {
        return Collections.unmodifiableSortedSet(terminalStates);
    }

    /**
     * The start state. A DFA may carry a start set; it is treated as already merged into its smallest label.
     */
    public String getStartState() {
        if (startStates.isEmpty()) {
            throw new IllegalStateException("Automaton has no start state");
        }
        return startStates.first();
    }

    public boolean isTerminal(String state) {
        return terminalStates.contains(state);
    }

    public int transitionCount() {
        int count = 0;
        for (SortedMap<String, String> row : transitions.values()) {
            count += row.size();
        }
        return count;
    }

    Collection<String> successors(String state) {
        SortedMap<String, String> row = transitions.get(state);
        return row == null ? Collections.emptyList() : row.values();
    }

    private Map<String, Set<String>> predecessorIndex() {
        Map<String, Set<String>> index = new HashMap<>();
        for (Map.Entry<String, SortedMap<String, String>> row : transitions.entrySet()) {
            for (String to : row.getValue().values()) {
                index.computeIfAbsent(to, k -> new HashSet<>()).add(row.getKey());
            }
        }
        return index;
    }

    public boolean isComplete() {
        for (String state : states) {
            SortedMap<String, String> row = transitions.get(state);
            // with an empty alphabet a state without a row has nothing left to define
            if (row == null ? !alphabet.isEmpty() : !row.keySet().containsAll(alphabet)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Route every undefined transition to a fresh sink state that loops on every symbol.
     * Does nothing if the automaton is already complete.
     * @return this automaton
     */
    public DeterministicAutomaton complete() {
        if (isComplete()) {
            return this;
        }
        String sink = freshLabel(SINK);
        states.add(sink);
        for (String state : states) {
            SortedMap<String, String> row = transitions.computeIfAbsent(state, k -> new TreeMap<>());
            for (String symbol : alphabet) {
                row.putIfAbsent(symbol, sink);
            }
        }
        LOG.debug("Completed automaton with sink state {}", sink);
        return this;
    }

    private String freshLabel(String base) {
        String label = base;
        for (int i = 1; states.contains(label); i++) {
            label = base + "_" + i;
        }
        return label;
    }

    /**
     * Keep only the states that are reachable from a start state and lead to a terminal state.
     * If no state qualifies the start states are kept, so the result recognizes the empty language.
     * @return this automaton
     */
    public DeterministicAutomaton pruneUnreachableAndUnproductive() {
        Set<String> reachable = StateSets.reach(startStates, this::successors);
        Map<String, Set<String>> predecessors = predecessorIndex();
        Set<String> productive = StateSets.reach(terminalStates,
            s -> predecessors.getOrDefault(s, Collections.emptySet()));

        SortedSet<String> kept = StateSets.intersection(reachable, productive);
        if (kept.isEmpty()) {
            kept = StateSets.intersection(startStates, states);
        }
        LOG.debug("Pruning kept {} of {} states", kept.size(), states.size());
        retainStates(kept);
        return this;
    }

    private void retainStates(Set<String> kept) {
        states.retainAll(kept);
        startStates.retainAll(kept);
        terminalStates.retainAll(kept);
        Iterator<Map.Entry<String, SortedMap<String, String>>> rows = transitions.entrySet().iterator();
        while (rows.hasNext()) {
            Map.Entry<String, SortedMap<String, String>> row = rows.next();
            if (!kept.contains(row.getKey())) {
                rows.remove();
                continue;
            }
            row.getValue().values().retainAll(kept);
            if (row.getValue().isEmpty()) {
                rows.remove();
            }
        }
    }

    /**
     * Minimal complete automaton for the same language. This automaton is left untouched.
     * @return new automaton whose states are the smallest labels of each equivalence class
     */
    public DeterministicAutomaton minimize() {
        DeterministicAutomaton completed = copy().complete();
        if (completed.states.isEmpty()) {
            return completed;
        }
        Partition partition = PartitionRefinement.refine(completed);

        DeterministicAutomaton minimized = new DeterministicAutomaton();
        minimized.alphabet.addAll(completed.alphabet);
        for (SortedSet<String> block : partition.getBlocks()) {
            String representative = block.first();
            minimized.states.add(representative);
            if (!StateSets.isDisjoint(block, completed.terminalStates)) {
                minimized.terminalStates.add(representative);
            }
        }
        for (String representative : minimized.getStates()) {
            for (String symbol : completed.alphabet) {
                String successor = completed.getTransition(representative, symbol);
                minimized.setTransition(representative, symbol, partition.representative(successor));
            }
        }
        if (!completed.startStates.isEmpty()) {
            minimized.addStartState(partition.representative(completed.getStartState()));
        }

        minimized.retainStates(StateSets.reach(minimized.startStates, minimized::successors));
        LOG.debug("Minimized {} states to {}", completed.states.size(), minimized.states.size());
        return minimized;
    }

    /**
     * @return true if minimizing would not change the number of states or transitions
     */
    public boolean isMinimal() {
        DeterministicAutomaton minimized = minimize();
        return states.size() == minimized.states.size() && transitionCount() == minimized.transitionCount();
    }

    /**
     * Whether no terminal state is reachable from the start states.
     */
    public boolean isEmptyLanguage() {
        return StateSets.isDisjoint(StateSets.reach(startStates, this::successors), terminalStates);
    }

    /**
     * Language equivalence, decided by breadth-first exploration of the product of both completed automata.
     * Neither operand is modified.
     */
    public boolean isEquivalentTo(DeterministicAutomaton other) {
        if (startStates.isEmpty() || other.startStates.isEmpty()) {
            return isEmptyLanguage() && other.isEmptyLanguage();
        }
        SortedSet<String> symbols = StateSets.union(alphabet, other.alphabet);
        DeterministicAutomaton left = copy();
        left.alphabet.addAll(symbols);
        left.complete();
        DeterministicAutomaton right = other.copy();
        right.alphabet.addAll(symbols);
        right.complete();

        StatePair start = new StatePair(left.getStartState(), right.getStartState());
        Set<StatePair> visited = new HashSet<>();
        Deque<StatePair> queue = new ArrayDeque<>();
        visited.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            StatePair pair = queue.poll();
            if (left.isTerminal(pair.left()) != right.isTerminal(pair.right())) {
                LOG.debug("Automata disagree on {}", pair);
                return false;
            }
            for (String symbol : symbols) {
                StatePair next = new StatePair(left.getTransition(pair.left(), symbol),
                    right.getTransition(pair.right(), symbol));
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return true;
    }

    public boolean accepts(String word) {
        return accepts(Words.symbols(word));
    }

    public boolean accepts(List<String> word) {
        if (startStates.isEmpty()) {
            return false;
        }
        String current = getStartState();
        for (String symbol : word) {
            current = getTransition(current, symbol);
            if (current == null) {
                return false;
            }
        }
        return isTerminal(current);
    }

    @Override
    public String toDot() {
        List<DotFormat.Edge> edges = new ArrayList<>();
        for (Map.Entry<String, SortedMap<String, String>> row : transitions.entrySet()) {
            for (Map.Entry<String, String> t : row.getValue().entrySet()) {
                edges.add(new DotFormat.Edge(row.getKey(), t.getKey(), t.getValue()));
            }
        }
        return DotFormat.finiteAutomaton(states, startStates, terminalStates, edges);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DeterministicAutomaton)) {
            return false;
        }
        DeterministicAutomaton that = (DeterministicAutomaton) o;
        return states.equals(that.states) && alphabet.equals(that.alphabet)
            && startStates.equals(that.startStates) && terminalStates.equals(that.terminalStates)
            && transitions.equals(that.transitions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, alphabet, startStates, terminalStates, transitions);
    }

    @Override
    public String toString() {
        return "States: " + states + "\nAlphabet: " + alphabet + "\nStart States: " + startStates
            + "\nTerminal States: " + terminalStates + "\nTransitions: " + transitions;
    }
}
