package AutomataKit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.SortedSet;

/**
 * Common view of every recognizer in this package.
 */
public interface Automaton {
    /** Reserved symbol for a move that consumes no input. */
    String EPSILON = "eps";

    SortedSet<String> getStates();

    SortedSet<String> getTerminalStates();

    /**
     * Graphviz description of this automaton.
     * @return digraph source
     */
    String toDot();

    default void writeDot(Path path) throws IOException {
        Files.writeString(path, toDot(), StandardCharsets.UTF_8);
    }
}
