package AutomataKit;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Random NFAs in the style of Tabakov and Vardi: a fixed number of distinct edges per letter and a
 * fixed number of accepting states. The first state is always initial and accepting.
 */
public class RandomAutomata {
  static final List<String> ALPHABET = List.of("0", "1");

  /**
   * @param r
   *      random instance
   * @param size
   *      number of states
   * @param td
   *      transition density, in [0,size]
   * @param ad
   *      acceptance density, in (0,1]
   * @return
   *      a random NFA, not necessarily connected
   */
  public static NondeterministicAutomaton generateNFA(Random r, int size, float td, float ad) {
    int edgeNum = Math.round(td * size);
    int acceptNum = Math.max(1, Math.round(ad * size));
    NondeterministicAutomaton nfa = basicNFA(size);

    // acceptNum-1 more final states, from [1,size)
    for (int f : distinctIntegers(r, acceptNum - 1, 1, size)) {
      nfa.addTerminalState(label(f));
    }
    for (String a : ALPHABET) {
      for (int edgeIndex : distinctIntegers(r, edgeNum, 0, size * size)) {
        nfa.addTransition(label(edgeIndex / size), a, label(edgeIndex % size));
      }
    }
    return nfa;
  }

  static NondeterministicAutomaton basicNFA(int size) {
    NondeterministicAutomaton nfa = new NondeterministicAutomaton();
    for (int i = 0; i < size; i++) {
      nfa.addState(label(i));
    }
    ALPHABET.forEach(nfa::addSymbol);
    nfa.addStartState(label(0));
    nfa.addTerminalState(label(0));
    return nfa;
  }

  public static NondeterministicAutomaton getRandomAutomaton(int randomSeed, int size) {
    return generateNFA(new Random(randomSeed), size, 1.25f, 0.5f);
  }

  /**
   * Same as {@link #getRandomAutomaton(int, int)}, plus the given number of random epsilon moves.
   */
  public static NondeterministicAutomaton getRandomEpsilonAutomaton(int randomSeed, int size, int epsilonEdges) {
    Random random = new Random(randomSeed);
    NondeterministicAutomaton nfa = generateNFA(random, size, 1.25f, 0.5f);
    for (int edgeIndex : distinctIntegers(random, epsilonEdges, 0, size * size)) {
      nfa.addTransition(label(edgeIndex / size), Automaton.EPSILON, label(edgeIndex % size));
    }
    return nfa;
  }

  static String label(int i) {
    return "s" + i;
  }

  // partial Fisher-Yates over [min,max)
  private static int[] distinctIntegers(Random r, int num, int min, int max) {
    List<Integer> pool = new ArrayList<>();
    for (int i = min; i < max; i++) {
      pool.add(i);
    }
    int[] result = new int[Math.min(num, pool.size())];
    for (int i = 0; i < result.length; i++) {
      int j = i + r.nextInt(pool.size() - i);
      Integer tmp = pool.get(i);
      pool.set(i, pool.get(j));
      pool.set(j, tmp);
      result[i] = pool.get(i);
    }
    return result;
  }
}
