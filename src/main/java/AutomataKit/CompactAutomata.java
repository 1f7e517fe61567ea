package AutomataKit;

import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.fsa.NFAs;

import java.util.HashMap;
import java.util.Map;

/**
 * Conversions to AutomataLib's compact automata, used to cross-check our own constructions.
 */
public final class CompactAutomata {
    private CompactAutomata() {
    }

    public static CompactDFA<String> toCompactDFA(DeterministicAutomaton dfa) {
        final Alphabet<String> alphabet = Alphabets.fromCollection(dfa.getAlphabet());
        final CompactDFA<String> out = new CompactDFA<>(alphabet);
        final Map<String, Integer> ids = new HashMap<>();
        final String start = dfa.getStartStates().isEmpty() ? null : dfa.getStartState();

        for (String state : dfa.getStates()) {
            boolean accepting = dfa.isTerminal(state);
            int id = state.equals(start) ? out.addInitialState(accepting) : out.addState(accepting);
            ids.put(state, id);
        }
        for (String state : dfa.getStates()) {
            for (String symbol : alphabet) {
                String to = dfa.getTransition(state, symbol);
                if (to != null) {
                    out.setTransition(ids.get(state), symbol, ids.get(to));
                }
            }
        }
        return out;
    }

    /**
     * @param nfa - automaton without epsilon moves; AutomataLib has no notion of them
     */
    public static CompactNFA<String> toCompactNFA(NondeterministicAutomaton nfa) {
        if (nfa.hasEpsilonMoves()) {
            throw new IllegalArgumentException("Epsilon moves cannot be converted to a CompactNFA");
        }
        final Alphabet<String> alphabet = Alphabets.fromCollection(nfa.getAlphabet());
        final CompactNFA<String> out = new CompactNFA<>(alphabet, nfa.getStates().size());
        final Map<String, Integer> ids = new HashMap<>();

        for (String state : nfa.getStates()) {
            int id = out.addState(nfa.getTerminalStates().contains(state));
            out.setInitial(id, nfa.getStartStates().contains(state));
            ids.put(state, id);
        }
        for (String state : nfa.getStates()) {
            for (String symbol : alphabet) {
                for (String to : nfa.getTransitions(state, symbol)) {
                    out.addTransition(ids.get(state), symbol, ids.get(to));
                }
            }
        }
        return out;
    }

    /**
     * Sanity check: our subset construction and AutomataLib's recognize the same language.
     * @param nfa - automaton without epsilon moves
     */
    public static boolean agreesWithAutomataLib(NondeterministicAutomaton nfa) {
        final CompactNFA<String> compact = toCompactNFA(nfa);
        final Alphabet<String> alphabet = compact.getInputAlphabet();
        final CompactDFA<String> reference = NFAs.determinize(compact, alphabet);
        final CompactDFA<String> ours = toCompactDFA(nfa.toDeterministic().complete());
        return Automata.testEquivalence(reference, ours, alphabet);
    }
}
