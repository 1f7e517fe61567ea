package AutomataKit.Partition;

import AutomataKit.DeterministicAutomaton;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Hopcroft-style coarsest stable partition of a complete DFA.
 * <p>
 * Starts from {terminal, non-terminal}. A splitter (A, c) splits every block that is only partly
 * inside pre_c(A). The part inside pre_c(A) keeps the old block id, the rest gets a fresh id.
 * If the old block was still waiting in the worklist, the fresh block joins it; otherwise only the
 * smaller half is queued (the part inside pre_c(A) on ties).
 */
public final class PartitionRefinement {
    private static final Logger LOG = LoggerFactory.getLogger(PartitionRefinement.class);

    private final DeterministicAutomaton dfa;
    private final List<String> symbols;
    // symbol -> target -> sources
    private final Map<String, Map<String, List<String>>> predecessors;

    private final Partition partition = new Partition();
    private final IntArrayFIFOQueue worklist = new IntArrayFIFOQueue();
    private final BitSet pending = new BitSet();

    private PartitionRefinement(DeterministicAutomaton dfa) {
        this.dfa = dfa;
        this.symbols = new ArrayList<>(dfa.getAlphabet());
        this.predecessors = buildPredecessors(dfa, symbols);
    }

    /**
     * Compute the coarsest partition of the states that respects acceptance and every transition.
     * @param dfa - complete automaton; it is not modified
     * @return stable partition
     */
    public static Partition refine(DeterministicAutomaton dfa) {
        if (!dfa.isComplete()) {
            throw new IllegalArgumentException("Partition refinement needs a complete automaton");
        }
        PartitionRefinement refinement = new PartitionRefinement(dfa);
        refinement.initialize();
        refinement.computeCoarsestStablePartition();
        return refinement.partition;
    }

    private static Map<String, Map<String, List<String>>> buildPredecessors(
        DeterministicAutomaton dfa, List<String> symbols) {
        Map<String, Map<String, List<String>>> result = new HashMap<>();
        for (String symbol : symbols) {
            Map<String, List<String>> bySymbol = new HashMap<>();
            for (String state : dfa.getStates()) {
                String target = dfa.getTransition(state, symbol);
                bySymbol.computeIfAbsent(target, k -> new ArrayList<>()).add(state);
            }
            result.put(symbol, bySymbol);
        }
        return result;
    }

    private void initialize() {
        TreeSet<String> terminal = new TreeSet<>();
        TreeSet<String> nonTerminal = new TreeSet<>();
        for (String state : dfa.getStates()) {
            if (dfa.isTerminal(state)) {
                terminal.add(state);
            } else {
                nonTerminal.add(state);
            }
        }
        for (TreeSet<String> block : List.of(terminal, nonTerminal)) {
            if (!block.isEmpty()) {
                enqueue(partition.addBlock(block));
            }
        }
    }

    private void computeCoarsestStablePartition() {
        int splits = 0;
        while (!worklist.isEmpty()) {
            int splitterId = worklist.dequeueInt();
            pending.clear(splitterId);
            // the splitter may itself be split below; the halves are covered by the worklist rules
            List<String> splitter = new ArrayList<>(partition.block(splitterId));

            for (String symbol : symbols) {
                Int2ObjectSortedMap<TreeSet<String>> touched = preImageByBlock(splitter, symbol);
                for (Int2ObjectMap.Entry<TreeSet<String>> entry : touched.int2ObjectEntrySet()) {
                    int blockId = entry.getIntKey();
                    TreeSet<String> inside = entry.getValue();
                    TreeSet<String> block = partition.block(blockId);
                    if (inside.size() == block.size()) {
                        continue;
                    }
                    TreeSet<String> outside = new TreeSet<>(block);
                    outside.removeAll(inside);

                    partition.replaceBlock(blockId, inside);
                    int freshId = partition.addBlock(outside);
                    splits++;
                    LOG.trace("Splitter {} on '{}' split {} into {} and {}", splitterId, symbol, blockId, inside, outside);

                    if (pending.get(blockId)) {
                        enqueue(freshId);
                    } else {
                        enqueue(inside.size() <= outside.size() ? blockId : freshId);
                    }
                }
            }
        }
        LOG.debug("Partition refinement: {} states, {} blocks after {} splits",
            dfa.getStates().size(), partition.size(), splits);
    }

    /**
     * States with a transition on the symbol into the splitter, grouped by their current block.
     */
    private Int2ObjectSortedMap<TreeSet<String>> preImageByBlock(List<String> splitter, String symbol) {
        Map<String, List<String>> bySymbol = predecessors.get(symbol);
        Int2ObjectSortedMap<TreeSet<String>> touched = new Int2ObjectRBTreeMap<>();
        for (String target : splitter) {
            for (String source : bySymbol.getOrDefault(target, Collections.emptyList())) {
                int blockId = partition.blockOf(source);
                TreeSet<String> inside = touched.get(blockId);
                if (inside == null) {
                    inside = new TreeSet<>();
                    touched.put(blockId, inside);
                }
                inside.add(source);
            }
        }
        return touched;
    }

    private void enqueue(int blockId) {
        if (!pending.get(blockId)) {
            pending.set(blockId);
            worklist.enqueue(blockId);
        }
    }
}
