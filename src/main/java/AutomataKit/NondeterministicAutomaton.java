package AutomataKit;

import AutomataKit.Format.DotFormat;
import AutomataKit.Model.SearchLimits;
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
 * Nondeterministic finite automaton with optional {@value Automaton#EPSILON} moves.
 */
public class NondeterministicAutomaton implements Automaton {
    private static final Logger LOG = LoggerFactory.getLogger(NondeterministicAutomaton.class);

    private final SortedSet<String> states;
    private final SortedSet<String> alphabet;
    private final SortedSet<String> startStates;
    private final SortedSet<String> terminalStates;
    // state -> symbol (or eps) -> non-empty successor set
    private final SortedMap<String, SortedMap<String, SortedSet<String>>> transitions;

    private SearchLimits limits = SearchLimits.defaults();

    public NondeterministicAutomaton() {
        this.states = new TreeSet<>();
        this.alphabet = new TreeSet<>();
        this.startStates = new TreeSet<>();
        this.terminalStates = new TreeSet<>();
        this.transitions = new TreeMap<>();
    }

    private NondeterministicAutomaton(NondeterministicAutomaton other) {
        this.states = new TreeSet<>(other.states);
        this.alphabet = new TreeSet<>(other.alphabet);
        this.startStates = new TreeSet<>(other.startStates);
        this.terminalStates = new TreeSet<>(other.terminalStates);
        this.transitions = new TreeMap<>();
        for (Map.Entry<String, SortedMap<String, SortedSet<String>>> row : other.transitions.entrySet()) {
            SortedMap<String, SortedSet<String>> copied = new TreeMap<>();
            for (Map.Entry<String, SortedSet<String>> t : row.getValue().entrySet()) {
                copied.put(t.getKey(), new TreeSet<>(t.getValue()));
            }
            this.transitions.put(row.getKey(), copied);
        }
        this.limits = other.limits;
    }

    public NondeterministicAutomaton copy() {
        return new NondeterministicAutomaton(this);
    }

    public SearchLimits getLimits() {
        return limits;
    }

    public void setLimits(SearchLimits limits) {
        this.limits = Objects.requireNonNull(limits);
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
     * Add a move from one state to another; the symbol may be {@value Automaton#EPSILON}.
     */
    public void addTransition(String from, String symbol, String to) {
        requireState(from);
        requireState(to);
        if (!EPSILON.equals(symbol) && !alphabet.contains(symbol)) {
            throw new IllegalArgumentException("Symbol " + symbol + " is not in the alphabet");
        }
        transitions.computeIfAbsent(from, k -> new TreeMap<>())
            .computeIfAbsent(symbol, k -> new TreeSet<>())
            .add(to);
    }

    private String requireState(String state) {
        if (!states.contains(state)) {
            throw new IllegalArgumentException("Unknown state: " + state);
        }
        return state;
    }

    public SortedSet<String> getTransitions(String state, String symbol) {
        SortedMap<String, SortedSet<String>> row = transitions.get(state);
        if (row == null) {
            return Collections.emptySortedSet();
        }
        SortedSet<String> targets = row.get(symbol);
        return targets == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(targets);
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

    public boolean hasEpsilonMoves() {
        for (SortedMap<String, SortedSet<String>> row : transitions.values()) {
            if (row.containsKey(EPSILON)) {
                return true;
            }
        }
        return false;
    }

    private Collection<String> successors(String state) {
        SortedMap<String, SortedSet<String>> row = transitions.get(state);
        if (row == null) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        for (SortedSet<String> targets : row.values()) {
            result.addAll(targets);
        }
        return result;
    }

    private SortedSet<String> step(Collection<String> from, String symbol) {
        SortedSet<String> result = new TreeSet<>();
        for (String state : from) {
            result.addAll(getTransitions(state, symbol));
        }
        return result;
    }

    /**
     * The given states together with everything reachable from them by epsilon moves alone.
     */
    public SortedSet<String> epsilonClosure(Collection<String> from) {
        return StateSets.reach(from, s -> getTransitions(s, EPSILON));
    }

    /**
     * Subset construction. Start and successor subsets are closed over epsilon moves, so the result
     * recognizes the same language as this automaton. Subsets get the labels 0, 1, 2, ... in breadth-first
     * discovery order. Empty successor subsets produce no transition, so the result may be partial.
     * @return new deterministic automaton; this automaton is left untouched
     */
    public DeterministicAutomaton toDeterministic() {
        DeterministicAutomaton out = new DeterministicAutomaton();
        for (String symbol : alphabet) {
            out.addSymbol(symbol);
        }

        Map<SortedSet<String>, String> outStateMap = new HashMap<>();
        Deque<DeterminizeRecord> queue = new ArrayDeque<>();

        SortedSet<String> init = epsilonClosure(startStates);
        String initOut = addSubsetState(out, outStateMap, init);
        out.addStartState(initOut);
        queue.add(new DeterminizeRecord(init, initOut));

        while (!queue.isEmpty()) {
            DeterminizeRecord curr = queue.poll();
            for (String symbol : alphabet) {
                SortedSet<String> succ = epsilonClosure(step(curr.subset(), symbol));
                if (succ.isEmpty()) {
                    continue;
                }
                String outSucc = outStateMap.get(succ);
                if (outSucc == null) {
                    // add new state to DFA and to queue
                    outSucc = addSubsetState(out, outStateMap, succ);
                    queue.add(new DeterminizeRecord(succ, outSucc));
                }
                out.setTransition(curr.label(), symbol, outSucc);
            }
        }
        LOG.debug("Subset construction: {} NFA states -> {} DFA states", states.size(), out.getStates().size());
        return out;
    }

    private String addSubsetState(DeterministicAutomaton out, Map<SortedSet<String>, String> outStateMap,
                                  SortedSet<String> subset) {
        String label = String.valueOf(outStateMap.size());
        out.addState(label);
        if (!StateSets.isDisjoint(subset, terminalStates)) {
            out.addTerminalState(label);
        }
        outStateMap.put(subset, label);
        LOG.trace("Subset {} -> {}", subset, label);
        return label;
    }

    public boolean accepts(String word) {
        return accepts(Words.symbols(word));
    }

    /**
     * Simulate the set of current states over the word. Epsilon moves are followed before and after every
     * consumed symbol. Each epsilon layer and each consumed symbol costs one step; running out of steps
     * rejects.
     */
    public boolean accepts(List<String> word) {
        StepBudget budget = new StepBudget(limits.getMaxEpsilonSteps());
        SortedSet<String> frontier = new TreeSet<>(startStates);
        if (!closeWithinBudget(frontier, budget)) {
            return false;
        }
        for (String symbol : word) {
            if (EPSILON.equals(symbol) || !budget.spend()) {
                return false;
            }
            SortedSet<String> next = step(frontier, symbol);
            if (next.isEmpty() || !closeWithinBudget(next, budget)) {
                return false;
            }
            LOG.trace("{} --{}--> {}", frontier, symbol, next);
            frontier = next;
        }
        return !StateSets.isDisjoint(frontier, terminalStates);
    }

    /**
     * Extend the frontier in place, one epsilon layer at a time.
     * @return false if the budget ran out first
     */
    private boolean closeWithinBudget(SortedSet<String> frontier, StepBudget budget) {
        Set<String> layer = new HashSet<>(frontier);
        while (true) {
            Set<String> next = new HashSet<>();
            for (String state : layer) {
                for (String target : getTransitions(state, EPSILON)) {
                    if (frontier.add(target)) {
                        next.add(target);
                    }
                }
            }
            if (next.isEmpty()) {
                return true;
            }
            if (!budget.spend()) {
                LOG.debug("Epsilon step cap of {} reached", limits.getMaxEpsilonSteps());
                return false;
            }
            layer = next;
        }
    }

    /**
     * Keep only the states reachable from a start state (over any move, epsilon included) that also lead
     * to a terminal state. Successor sets are cut down to kept states; moves left without successors
     * disappear. If no state qualifies the start states are kept.
     * @return this automaton
     */
    public NondeterministicAutomaton pruneUnreachableAndUnproductive() {
        Set<String> reachable = StateSets.reach(startStates, this::successors);

        Map<String, Set<String>> predecessors = new HashMap<>();
        for (Map.Entry<String, SortedMap<String, SortedSet<String>>> row : transitions.entrySet()) {
            for (SortedSet<String> targets : row.getValue().values()) {
                for (String to : targets) {
                    predecessors.computeIfAbsent(to, k -> new HashSet<>()).add(row.getKey());
                }
            }
        }
        Set<String> productive = StateSets.reach(terminalStates,
            s -> predecessors.getOrDefault(s, Collections.emptySet()));

        SortedSet<String> kept = StateSets.intersection(reachable, productive);
        if (kept.isEmpty()) {
            kept = StateSets.intersection(startStates, states);
        }
        LOG.debug("Pruning kept {} of {} states", kept.size(), states.size());

        states.retainAll(kept);
        startStates.retainAll(kept);
        terminalStates.retainAll(kept);
        Iterator<Map.Entry<String, SortedMap<String, SortedSet<String>>>> rows = transitions.entrySet().iterator();
        while (rows.hasNext()) {
            Map.Entry<String, SortedMap<String, SortedSet<String>>> row = rows.next();
            if (!kept.contains(row.getKey())) {
                rows.remove();
                continue;
            }
            Iterator<SortedSet<String>> moves = row.getValue().values().iterator();
            while (moves.hasNext()) {
                SortedSet<String> targets = moves.next();
                targets.retainAll(kept);
                if (targets.isEmpty()) {
                    moves.remove();
                }
            }
            if (row.getValue().isEmpty()) {
                rows.remove();
            }
        }
        return this;
    }

    @Override
    public String toDot() {
        List<DotFormat.Edge> edges = new ArrayList<>();
        for (Map.Entry<String, SortedMap<String, SortedSet<String>>> row : transitions.entrySet()) {
            for (Map.Entry<String, SortedSet<String>> t : row.getValue().entrySet()) {
                for (String to : t.getValue()) {
                    edges.add(new DotFormat.Edge(row.getKey(), t.getKey(), to));
                }
            }
        }
        return DotFormat.finiteAutomaton(states, startStates, terminalStates, edges);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NondeterministicAutomaton)) {
            return false;
        }
        NondeterministicAutomaton that = (NondeterministicAutomaton) o;
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

    private record DeterminizeRecord(SortedSet<String> subset, String label) { }

    private static final class StepBudget {
        private int remaining;

        StepBudget(int steps) {
            this.remaining = steps;
        }

        boolean spend() {
            return --remaining >= 0;
        }
    }
}
