package AutomataKit.Format;

import AutomataKit.Automaton;
import AutomataKit.DeterministicAutomaton;
import AutomataKit.NondeterministicAutomaton;
import AutomataKit.PushdownAutomaton;
import AutomataKit.Model.PushdownTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Line-based text format.
 * <p>
 * Finite automata: states, alphabet, start states, terminal states (one whitespace-separated line each),
 * then one {@code from symbol to} transition per line. Lines with another field count are skipped.
 * <p>
 * Pushdown automata: states, input alphabet, stack alphabet, start state, initial stack symbol, terminal
 * states, then one {@code from input stackTop replacement... to} transition per line. A short transition
 * line is an error.
 * <p>
 * Readers build a fresh automaton and only return it once the whole description was accepted.
 */
public final class AutomatonFormat {
    private static final Logger LOG = LoggerFactory.getLogger(AutomatonFormat.class);

    private static final int FINITE_HEADER_LINES = 4;
    private static final int PUSHDOWN_HEADER_LINES = 6;
    private static final int MIN_PUSHDOWN_FIELDS = 5;

    private AutomatonFormat() {
    }

    public static DeterministicAutomaton readDeterministic(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readDeterministic(reader);
        }
    }

    public static DeterministicAutomaton readDeterministic(Reader reader) throws IOException {
        List<String> lines = readLines(reader);
        requireHeader(lines, FINITE_HEADER_LINES);

        DeterministicAutomaton dfa = new DeterministicAutomaton();
        try {
            fields(lines.get(0)).forEach(dfa::addState);
            fields(lines.get(1)).forEach(dfa::addSymbol);
            fields(lines.get(2)).forEach(dfa::addStartState);
            fields(lines.get(3)).forEach(dfa::addTerminalState);
        } catch (IllegalArgumentException e) {
            throw new MalformedAutomatonException("Invalid header: " + e.getMessage(), e);
        }
        for (int i = FINITE_HEADER_LINES; i < lines.size(); i++) {
            List<String> parts = fields(lines.get(i));
            if (parts.size() != 3) {
                LOG.debug("Skipping line {}: '{}'", i + 1, lines.get(i));
                continue;
            }
            String defined = dfa.getTransition(parts.get(0), parts.get(1));
            if (defined != null && !defined.equals(parts.get(2))) {
                throw new MalformedAutomatonException("Line " + (i + 1) + ": " + parts.get(0) + " already moves to "
                    + defined + " on " + parts.get(1));
            }
            try {
                dfa.setTransition(parts.get(0), parts.get(1), parts.get(2));
            } catch (IllegalArgumentException e) {
                throw new MalformedAutomatonException("Line " + (i + 1) + ": " + e.getMessage(), e);
            }
        }
        return dfa;
    }

    public static NondeterministicAutomaton readNondeterministic(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readNondeterministic(reader);
        }
    }

    public static NondeterministicAutomaton readNondeterministic(Reader reader) throws IOException {
        List<String> lines = readLines(reader);
        requireHeader(lines, FINITE_HEADER_LINES);

        NondeterministicAutomaton nfa = new NondeterministicAutomaton();
        try {
            fields(lines.get(0)).forEach(nfa::addState);
            fields(lines.get(1)).forEach(nfa::addSymbol);
            fields(lines.get(2)).forEach(nfa::addStartState);
            fields(lines.get(3)).forEach(nfa::addTerminalState);
        } catch (IllegalArgumentException e) {
            throw new MalformedAutomatonException("Invalid header: " + e.getMessage(), e);
        }
        for (int i = FINITE_HEADER_LINES; i < lines.size(); i++) {
            List<String> parts = fields(lines.get(i));
            if (parts.size() != 3) {
                LOG.debug("Skipping line {}: '{}'", i + 1, lines.get(i));
                continue;
            }
            try {
                nfa.addTransition(parts.get(0), parts.get(1), parts.get(2));
            } catch (IllegalArgumentException e) {
                throw new MalformedAutomatonException("Line " + (i + 1) + ": " + e.getMessage(), e);
            }
        }
        return nfa;
    }

    public static PushdownAutomaton readPushdown(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readPushdown(reader);
        }
    }

    public static PushdownAutomaton readPushdown(Reader reader) throws IOException {
        List<String> lines = readLines(reader);
        requireHeader(lines, PUSHDOWN_HEADER_LINES);

        String startState = lines.get(3).trim();
        String initialStackSymbol = lines.get(4).trim();
        if (startState.isEmpty() || initialStackSymbol.isEmpty()) {
            throw new MalformedAutomatonException("Missing start state or initial stack symbol");
        }

        PushdownAutomaton pda;
        try {
            pda = new PushdownAutomaton(fields(lines.get(0)), startState, initialStackSymbol);
            fields(lines.get(1)).forEach(pda::addInputSymbol);
            fields(lines.get(2)).forEach(pda::addStackSymbol);
            fields(lines.get(5)).forEach(pda::addTerminalState);
        } catch (IllegalArgumentException e) {
            throw new MalformedAutomatonException("Invalid header: " + e.getMessage(), e);
        }
        for (int i = PUSHDOWN_HEADER_LINES; i < lines.size(); i++) {
            List<String> parts = fields(lines.get(i));
            if (parts.isEmpty()) {
                continue;
            }
            if (parts.size() < MIN_PUSHDOWN_FIELDS) {
                throw new MalformedAutomatonException("Invalid transition format: " + lines.get(i));
            }
            try {
                pda.addTransition(new PushdownTransition(parts.get(0), parts.get(1), parts.get(2),
                    parts.subList(3, parts.size() - 1), parts.get(parts.size() - 1)));
            } catch (IllegalArgumentException e) {
                throw new MalformedAutomatonException("Line " + (i + 1) + ": " + e.getMessage(), e);
            }
        }
        return pda;
    }

    /**
     * Read a words file: one word per line, blank lines included as the empty word.
     */
    public static List<String> readWords(Path path) throws IOException {
        return Files.readAllLines(path, StandardCharsets.UTF_8);
    }

    public static void write(DeterministicAutomaton dfa, Writer writer) throws IOException {
        writeHeader(writer, dfa.getStates(), dfa.getAlphabet(), dfa.getStartStates(), dfa.getTerminalStates());
        for (String state : dfa.getStates()) {
            for (String symbol : dfa.getAlphabet()) {
                String to = dfa.getTransition(state, symbol);
                if (to != null) {
                    writer.write(state + " " + symbol + " " + to + "\n");
                }
            }
        }
        writer.flush();
    }

    public static void write(NondeterministicAutomaton nfa, Writer writer) throws IOException {
        writeHeader(writer, nfa.getStates(), nfa.getAlphabet(), nfa.getStartStates(), nfa.getTerminalStates());
        List<String> symbols = new ArrayList<>(nfa.getAlphabet());
        symbols.add(Automaton.EPSILON);
        for (String state : nfa.getStates()) {
            for (String symbol : symbols) {
                for (String to : nfa.getTransitions(state, symbol)) {
                    writer.write(state + " " + symbol + " " + to + "\n");
                }
            }
        }
        writer.flush();
    }

    public static void write(PushdownAutomaton pda, Writer writer) throws IOException {
        writer.write(String.join(" ", pda.getStates()) + "\n");
        writer.write(String.join(" ", pda.getInputAlphabet()) + "\n");
        writer.write(String.join(" ", pda.getStackAlphabet()) + "\n");
        writer.write(pda.getStartState() + "\n");
        writer.write(pda.getInitialStackSymbol() + "\n");
        writer.write(String.join(" ", pda.getTerminalStates()) + "\n");
        for (PushdownTransition t : pda.getTransitions()) {
            writer.write(t + "\n");
        }
        writer.flush();
    }

    private static void writeHeader(Writer writer, Iterable<String> states, Iterable<String> alphabet,
                                    Iterable<String> start, Iterable<String> terminal) throws IOException {
        writer.write(String.join(" ", states) + "\n");
        writer.write(String.join(" ", alphabet) + "\n");
        writer.write(String.join(" ", start) + "\n");
        writer.write(String.join(" ", terminal) + "\n");
    }

    private static List<String> readLines(Reader reader) throws IOException {
        BufferedReader buffered = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        try {
            return buffered.lines().collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private static void requireHeader(List<String> lines, int headerLines) throws MalformedAutomatonException {
        if (lines.size() < headerLines) {
            throw new MalformedAutomatonException("File does not contain enough lines: expected at least "
                + headerLines + ", found " + lines.size());
        }
    }

    private static List<String> fields(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(trimmed.split("\\s+"));
    }
}
