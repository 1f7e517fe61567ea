package AutomataKit.Format;

import java.io.IOException;

/**
 * The text describing an automaton could be read but does not describe a valid automaton.
 */
public class MalformedAutomatonException extends IOException {
    private static final long serialVersionUID = 1L;

    public MalformedAutomatonException(String message) {
        super(message);
    }

    public MalformedAutomatonException(String message, Throwable cause) {
        super(message, cause);
    }
}
