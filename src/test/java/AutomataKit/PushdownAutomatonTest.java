package AutomataKit;

import AutomataKit.Model.PushdownTransition;
import AutomataKit.Model.SearchLimits;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

public class PushdownAutomatonTest {

  private static PushdownAutomaton looping(String... replacements) {
    PushdownAutomaton pda = new PushdownAutomaton(Set.of("q"), "q", "Z");
    pda.addInputSymbol("a");
    pda.addStackSymbol("Z");
    for (String replacement : replacements) {
      pda.addTransition(new PushdownTransition("q", Automaton.EPSILON, "Z",
          List.of(replacement.split(" ")), "q"));
    }
    return pda;
  }

  @Test
  void testBalancedParentheses() {
    PushdownAutomaton pda = Fixtures.pda("pda_parens.txt");
    Assertions.assertTrue(pda.accepts("(())"));
    Assertions.assertTrue(pda.accepts("()()"));
    Assertions.assertTrue(pda.accepts("")); // empty stack after popping Z
    Assertions.assertFalse(pda.accepts("(()"));
    Assertions.assertFalse(pda.accepts(")("));
    Assertions.assertFalse(pda.accepts("())"));
  }

  @Test
  void testOutsideAlphabetRejects() {
    PushdownAutomaton pda = Fixtures.pda("pda_parens.txt");
    Assertions.assertFalse(pda.accepts("(a)"));
    Assertions.assertFalse(pda.accepts(List.of("(", Automaton.EPSILON, ")")));
  }

  @Test
  void testAcceptByTerminalState() {
    PushdownAutomaton pda = Fixtures.pda("pda_anbn.txt");
    Assertions.assertTrue(pda.accepts("ab"));
    Assertions.assertTrue(pda.accepts("aaabbb"));
    Assertions.assertFalse(pda.accepts("")); // q is not terminal and the stack is never emptied
    Assertions.assertFalse(pda.accepts("aab"));
    Assertions.assertFalse(pda.accepts("abb"));
    Assertions.assertFalse(pda.accepts("ba"));
  }

  @Test
  void testReplacementOrder() {
    PushdownAutomaton pda = new PushdownAutomaton(List.of("q", "r", "f"), "q", "Z");
    pda.addInputSymbol("x");
    pda.addInputSymbol("y");
    pda.addTerminalState("f");
    // push "A B" so that A ends on top
    pda.addTransition(new PushdownTransition("q", "x", "Z", List.of("A", "B"), "r"));
    pda.addTransition(new PushdownTransition("r", "y", "A", List.of("eps"), "r"));
    pda.addTransition(new PushdownTransition("r", "y", "B", List.of("B"), "f"));
    Assertions.assertTrue(pda.accepts("xyy"));
    Assertions.assertFalse(pda.accepts("xy"));
  }

  @Test
  void testEpsilonLoopHitsDepthCap() {
    PushdownAutomaton pda = looping("Z Z");
    pda.setLimits(SearchLimits.defaults().withMaxSearchDepth(50));
    Assertions.assertFalse(pda.accepts(""));
    Assertions.assertFalse(pda.accepts("a"));
  }

  @Test
  void testBranchingLoopHitsExpansionCap() {
    PushdownAutomaton pda = looping("Z Z", "Z Z Z");
    pda.setLimits(new SearchLimits(10, 200, 5000));
    Assertions.assertFalse(pda.accepts("a"));
  }

  @Test
  void testLaterBranchStillFound() {
    // first transition loops forever, second one pops to an empty stack
    PushdownAutomaton pda = looping("Z Z", "eps");
    pda.setLimits(SearchLimits.defaults().withMaxSearchDepth(20));
    Assertions.assertTrue(pda.accepts(""));
  }

  @Test
  void testAcceptsAll() {
    PushdownAutomaton pda = Fixtures.pda("pda_parens.txt");
    Assertions.assertEquals(List.of(true, false, true, false), pda.acceptsAll(List.of("(())", "(()", "", ")(")));
  }

  @Test
  void testConstruction() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new PushdownAutomaton(List.of("q"), "missing", "Z"));
    PushdownAutomaton pda = new PushdownAutomaton(List.of("q"), "q", "Z");
    Assertions.assertThrows(IllegalArgumentException.class, () -> pda.addInputSymbol(Automaton.EPSILON));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> pda.addTransition(new PushdownTransition("q", "x", "Z", List.of(), "q")));
  }

  @Test
  void testDot() {
    String dot = Fixtures.pda("pda_parens.txt").toDot();
    Assertions.assertTrue(dot.startsWith("digraph PdAutomaton {"));
    Assertions.assertTrue(dot.contains("__start -> \"q\";"));
    Assertions.assertTrue(dot.contains("\"q\" -> \"q\" [label=\"(| Z-> X Z\"];"));
    Assertions.assertTrue(dot.contains("\"q\" -> \"q\" [label=\"eps| Z-> eps\"];"));
  }
}
