package AutomataKit;

import AutomataKit.Format.AutomatonFormat;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

class AutomataCommandLineTest {

  private static String run(AutomataCommandLine.Options options, String command, String... args) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8)) {
      AutomataCommandLine.run(command, List.of(args), options, out);
    }
    return bytes.toString(StandardCharsets.UTF_8);
  }

  private static String path(String fixture) {
    return Fixtures.getFilePath(fixture).toString();
  }

  @Test
  void testDeterministic() throws IOException {
    String report = run(new AutomataCommandLine.Options(), "dfa", path("dfa_even_a.txt"));
    Assertions.assertTrue(report.contains("Original DFA size: 4"));
    Assertions.assertTrue(report.contains("Pruned DFA size: 4"));
    Assertions.assertTrue(report.contains("Minimized DFA size: 2"));
    Assertions.assertTrue(report.contains("Already minimal: false"));
    Assertions.assertTrue(report.contains("Equivalent to minimized: true"));
  }

  @Test
  void testNondeterministic() throws IOException {
    AutomataCommandLine.Options options = new AutomataCommandLine.Options();
    options.verify = true;
    String report = run(options, "nfa", path("nfa_scenario.txt"), "ab", "ba");
    Assertions.assertTrue(report.contains("Unminimized SC DFA size: 2"));
    Assertions.assertTrue(report.contains("AutomataLib agrees: true"));
    Assertions.assertTrue(report.contains("\"ab\" accepted"));
    Assertions.assertTrue(report.contains("\"ba\" declined"));

    report = run(options, "NFA", path("nfa_eps.txt"));
    Assertions.assertTrue(report.contains("Verification skipped"));
  }

  @Test
  void testPushdownWords() throws IOException {
    String report = run(new AutomataCommandLine.Options(), "pda", path("pda_parens.txt"), "(())", ")(");
    Assertions.assertTrue(report.contains("\"(())\" accepted"));
    Assertions.assertTrue(report.contains("\")(\" declined"));

    report = run(new AutomataCommandLine.Options(), "pda-words", path("pda_parens.txt"), path("parens_words.txt"));
    List<String> results = new ArrayList<>();
    for (String line : report.split("\n")) {
      if (line.endsWith("accepted") || line.endsWith("declined")) {
        results.add(line);
      }
    }
    Assertions.assertEquals(
        List.of("\"(())\" accepted", "\"(()\" declined", "\"\" accepted", "\")(\" declined"), results);
  }

  @Test
  void testEquivalence() throws IOException {
    String report = run(new AutomataCommandLine.Options(), "equiv", path("dfa_even_a.txt"), path("dfa_even_a_min.txt"));
    Assertions.assertTrue(report.contains("Sizes: 4 / 2"));
    Assertions.assertTrue(report.contains("Equivalent: true"));

    report = run(new AutomataCommandLine.Options(), "equiv", path("dfa_even_a.txt"), path("dfa_partial.txt"));
    Assertions.assertTrue(report.contains("Equivalent: false"));
  }

  @Test
  void testOutputFiles(@TempDir Path dir) throws IOException {
    AutomataCommandLine.Options options = new AutomataCommandLine.Options();
    options.dotFile = dir.resolve("min.dot");
    options.outFile = dir.resolve("min.txt");
    String report = run(options, "dfa", path("dfa_partial.txt"));
    Assertions.assertTrue(report.contains("Writing to file: " + options.dotFile));

    Assertions.assertTrue(Files.readString(options.dotFile).startsWith("digraph G {"));
    DeterministicAutomaton written = AutomatonFormat.readDeterministic(options.outFile);
    Assertions.assertEquals(Fixtures.dfa("dfa_partial.txt").minimize(), written);

    options.outFile = dir.resolve("parens.txt");
    run(options, "pda", path("pda_parens.txt"));
    Assertions.assertTrue(AutomatonFormat.readPushdown(options.outFile).accepts("()"));
  }

  @Test
  void testBadInput() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> run(new AutomataCommandLine.Options(), "bogus", path("dfa_even_a.txt")));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> run(new AutomataCommandLine.Options(), "equiv", path("dfa_even_a.txt")));
    Assertions.assertThrows(IOException.class,
        () -> run(new AutomataCommandLine.Options(), "pda", path("pda_short_header.txt")));
  }
}
