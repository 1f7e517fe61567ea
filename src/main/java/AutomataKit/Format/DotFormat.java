package AutomataKit.Format;

import AutomataKit.Model.PushdownTransition;
import AutomataKit.Model.StatePair;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Graphviz output. A projection only; nothing reads it back.
 */
public final class DotFormat {
    private static final String HEADER =
        "digraph G {\n"
            + "    ranksep=0.5;\n"
            + "    nodesep=0.5;\n"
            + "    rankdir=LR;\n"
            + "    node [shape=\"circle\", fontsize=\"16\"];\n"
            + "    fontsize=\"10\";\n"
            + "    compound=true;\n\n";

    static final String ENTRY_PREFIX = "__start_";

    private DotFormat() {
    }

    /**
     * A labelled move between two states of a finite automaton.
     */
    public record Edge(String from, String symbol, String to) { }

    /**
     * Terminal states are double circles, each start state gets an invisible entry point, and all
     * symbols between the same two states share one edge.
     */
    public static String finiteAutomaton(Collection<String> states, Set<String> startStates,
                                         Set<String> terminalStates, Collection<Edge> edges) {
        String entry = entryPrefix(states);
        StringBuilder dot = new StringBuilder(HEADER);
        for (String state : states) {
            if (startStates.contains(state)) {
                dot.append("    ").append(quote(entry + state)).append(" [shape=point, style=invis];\n");
            }
        }
        for (String state : states) {
            if (terminalStates.contains(state)) {
                dot.append("    ").append(quote(state)).append(" [shape=doublecircle];\n");
            } else {
                dot.append("    ").append(quote(state)).append(";\n");
            }
        }
        dot.append('\n');
        for (String state : states) {
            if (startStates.contains(state)) {
                dot.append("    ").append(quote(entry + state)).append(" -> ").append(quote(state)).append(";\n");
            }
        }

        Map<StatePair, List<String>> labels = new LinkedHashMap<>();
        for (Edge edge : edges) {
            labels.computeIfAbsent(new StatePair(edge.from(), edge.to()), k -> new ArrayList<>()).add(edge.symbol());
        }
        for (Map.Entry<StatePair, List<String>> e : labels.entrySet()) {
            dot.append("    ").append(quote(e.getKey().left())).append(" -> ").append(quote(e.getKey().right()))
                .append(" [label=").append(quote(String.join(", ", e.getValue()))).append("];\n");
        }
        dot.append("}\n");
        return dot.toString();
    }

    public static String pushdownAutomaton(String startState, Set<String> terminalStates,
                                           List<PushdownTransition> transitions) {
        StringBuilder dot = new StringBuilder("digraph PdAutomaton {\n");
        dot.append("\trankdir=LR;\n");
        dot.append("\tnode [shape=circle];\n");
        dot.append("\t__start [shape=point];\n");
        dot.append("\t__start -> ").append(quote(startState)).append(";\n");
        for (String terminal : terminalStates) {
            dot.append('\t').append(quote(terminal)).append(" [shape=doublecircle];\n");
        }
        for (PushdownTransition t : transitions) {
            String label = t.input() + "| " + t.stackTop() + "-> " + String.join(" ", t.replacement());
            dot.append('\t').append(quote(t.state())).append(" -> ").append(quote(t.nextState()))
                .append(" [label=").append(quote(label)).append("];\n");
        }
        dot.append("}\n");
        return dot.toString();
    }

    /**
     * Prefix for the invisible entry nodes that no state label starts with, so entry nodes never
     * merge with states.
     */
    static String entryPrefix(Collection<String> states) {
        String prefix = ENTRY_PREFIX;
        while (startsWithAny(states, prefix)) {
            prefix = "_" + prefix;
        }
        return prefix;
    }

    private static boolean startsWithAny(Collection<String> states, String prefix) {
        for (String state : states) {
            if (state.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    static String quote(String id) {
        return '"' + id.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
