package AutomataKit;

import AutomataKit.Format.AutomatonFormat;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public class AutomataCommandLine {
  static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

  /**
   * Parsed flags. Positional arguments are kept separately.
   */
  static final class Options {
    boolean verify;
    Path dotFile;
    Path outFile;
  }

  public static void main(String[] args) {
    Options options = new Options();
    List<String> positional = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        // must happen before the first logger is created
        System.setProperty(LOG_LEVEL_PROPERTY, "debug");
      } else if ("--verify".equalsIgnoreCase(arg)) {
        options.verify = true;
      } else if ("--dot".equalsIgnoreCase(arg) || "--out".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for " + arg);
          printUsageAndExit(); // exits
        }
        Path value = Paths.get(args[++i]); // consume the value
        if ("--dot".equalsIgnoreCase(arg)) {
          options.dotFile = value;
        } else {
          options.outFile = value;
        }
      } else if (arg.startsWith("-")) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() < 2) {
      printUsageAndExit();
    }

    try {
      long before = System.currentTimeMillis();
      run(positional.get(0), positional.subList(1, positional.size()), options, System.out);
      long after = System.currentTimeMillis();
      System.out.println(positional.get(0) + " duration: " + ((after - before) / 1000f) + "s");
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      printUsageAndExit();
    } catch (IOException e) {
      System.err.println("Error: " + e.getMessage());
      System.exit(1);
    }
  }

  private static void printUsageAndExit() {
    System.out.println(
        "AutomataKit [--debug] [--verify] [--dot <file>] [--out <file>] <command> <file> [args...]");
    System.out.println("[--debug] : Additional debug output");
    System.out.println("[--verify] : Cross-check determinization against AutomataLib (NFA without eps moves)");
    System.out.println("[--dot <file>] : Write the resulting automaton as Graphviz");
    System.out.println("[--out <file>] : Write the resulting automaton in the text format");
    System.out.println();
    System.out.println("<command> : one of the choices below:");
    System.out.println("  dfa <file>: complete, prune and minimize a DFA.");
    System.out.println("  nfa <file> [word...]: determinize and minimize an NFA, then test the words.");
    System.out.println("  pda <file> [word...]: test the words against a PDA.");
    System.out.println("  pda-words <file> <words file>: test every line of the words file against a PDA.");
    System.out.println("  equiv <file> <file>: check two DFAs for language equivalence.");
    System.exit(0);
  }

  /**
   * Choose command to run.
   * @param command - command passed in from command-line
   * @param args - remaining positional arguments, the automaton file first
   * @param options - parsed flags
   * @param out - report destination
   */
  static void run(String command, List<String> args, Options options, PrintStream out) throws IOException {
    Path file = Paths.get(args.get(0));
    List<String> rest = args.subList(1, args.size());
    switch (command.toLowerCase()) {
      case "dfa" -> deterministic(file, options, out);
      case "nfa" -> nondeterministic(file, rest, options, out);
      case "pda" -> pushdown(file, rest, options, out);
      case "pda-words" -> {
        if (rest.isEmpty()) {
          throw new IllegalArgumentException("pda-words needs a words file");
        }
        pushdown(file, AutomatonFormat.readWords(Paths.get(rest.get(0))), options, out);
      }
      case "equiv" -> {
        if (rest.isEmpty()) {
          throw new IllegalArgumentException("equiv needs two files");
        }
        equivalence(file, Paths.get(rest.get(0)), out);
      }
      default -> throw new IllegalArgumentException("Unexpected command: " + command);
    }
  }

  private static void deterministic(Path file, Options options, PrintStream out) throws IOException {
    final DeterministicAutomaton dfa = AutomatonFormat.readDeterministic(file);
    out.println("Original DFA size: " + dfa.getStates().size());
    out.println("Alphabet size: " + dfa.getAlphabet().size());
    out.println("Complete: " + dfa.isComplete());

    final DeterministicAutomaton pruned = dfa.copy().pruneUnreachableAndUnproductive();
    out.println("Pruned DFA size: " + pruned.getStates().size());

    final DeterministicAutomaton minimized = dfa.minimize();
    out.println("Minimized DFA size: " + minimized.getStates().size());
    out.println("Already minimal: " + dfa.isMinimal());
    out.println("Equivalent to minimized: " + dfa.isEquivalentTo(minimized));

    writeOutputs(minimized, options, out);
  }

  private static void nondeterministic(Path file, List<String> words, Options options, PrintStream out)
      throws IOException {
    final NondeterministicAutomaton nfa = AutomatonFormat.readNondeterministic(file);
    out.println("Original NFA size: " + nfa.getStates().size());
    out.println("Alphabet size: " + nfa.getAlphabet().size());

    final DeterministicAutomaton dfa = nfa.toDeterministic();
    out.println("Unminimized SC DFA size: " + dfa.getStates().size());
    final DeterministicAutomaton minimized = dfa.minimize();
    out.println("Minimized DFA size: " + minimized.getStates().size());

    if (options.verify) {
      if (nfa.hasEpsilonMoves()) {
        out.println("Verification skipped: automaton has epsilon moves");
      } else {
        out.println("AutomataLib agrees: " + CompactAutomata.agreesWithAutomataLib(nfa));
      }
    }
    for (String word : words) {
      printResult(out, word, nfa.accepts(word));
    }

    writeOutputs(minimized, options, out);
  }

  private static void pushdown(Path file, List<String> words, Options options, PrintStream out)
      throws IOException {
    final PushdownAutomaton pda = AutomatonFormat.readPushdown(file);
    out.println("PDA size: " + pda.getStates().size());
    out.println("Transitions: " + pda.getTransitions().size());
    List<Boolean> results = pda.acceptsAll(words);
    for (int i = 0; i < words.size(); i++) {
      printResult(out, words.get(i), results.get(i));
    }
    if (options.dotFile != null) {
      out.println("Writing to file: " + options.dotFile);
      pda.writeDot(options.dotFile);
    }
    if (options.outFile != null) {
      out.println("Writing to file: " + options.outFile);
      try (Writer writer = Files.newBufferedWriter(options.outFile, StandardCharsets.UTF_8)) {
        AutomatonFormat.write(pda, writer);
      }
    }
  }

  private static void equivalence(Path first, Path second, PrintStream out) throws IOException {
    final DeterministicAutomaton a = AutomatonFormat.readDeterministic(first);
    final DeterministicAutomaton b = AutomatonFormat.readDeterministic(second);
    out.println("Sizes: " + a.getStates().size() + " / " + b.getStates().size());
    out.println("Minimized sizes: " + a.minimize().getStates().size() + " / " + b.minimize().getStates().size());
    out.println("Equivalent: " + a.isEquivalentTo(b));
  }

  private static void printResult(PrintStream out, String word, boolean accepted) {
    out.println("\"" + word + "\" " + (accepted ? "accepted" : "declined"));
  }

  private static void writeOutputs(DeterministicAutomaton dfa, Options options, PrintStream out)
      throws IOException {
    if (options.dotFile != null) {
      out.println("Writing to file: " + options.dotFile);
      dfa.writeDot(options.dotFile);
    }
    if (options.outFile != null) {
      out.println("Writing to file: " + options.outFile);
      try (Writer writer = Files.newBufferedWriter(options.outFile, StandardCharsets.UTF_8)) {
        AutomatonFormat.write(dfa, writer);
      }
    }
  }
}
