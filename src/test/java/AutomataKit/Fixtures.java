package AutomataKit;

import AutomataKit.Format.AutomatonFormat;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

public class Fixtures {
  public static Path getFilePath(String resourcePath) {
    try {
      return Paths.get(Objects.requireNonNull(
          Fixtures.class.getClassLoader().getResource(resourcePath)).toURI());
    } catch (URISyntaxException e) {
      throw new IllegalStateException(e);
    }
  }

  public static DeterministicAutomaton dfa(String resourcePath) {
    try {
      return AutomatonFormat.readDeterministic(getFilePath(resourcePath));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static NondeterministicAutomaton nfa(String resourcePath) {
    try {
      return AutomatonFormat.readNondeterministic(getFilePath(resourcePath));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static PushdownAutomaton pda(String resourcePath) {
    try {
      return AutomatonFormat.readPushdown(getFilePath(resourcePath));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
