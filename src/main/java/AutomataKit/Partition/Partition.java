package AutomataKit.Partition;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Blocks of equivalent states, addressed by block id.
 * Owned by a single refinement run; handed to the caller once the run is stable.
 */
public final class Partition {
    static final int NO_BLOCK = -1;

    private final List<TreeSet<String>> blocks = new ArrayList<>();
    private final Object2IntMap<String> blockOf = new Object2IntOpenHashMap<>();

    Partition() {
        blockOf.defaultReturnValue(NO_BLOCK);
    }

    /**
     * Append a block; members are moved out of any block they belonged to before.
     * @return id of the new block
     */
    int addBlock(TreeSet<String> members) {
        int id = blocks.size();
        blocks.add(members);
        for (String state : members) {
            blockOf.put(state, id);
        }
        return id;
    }

    void replaceBlock(int id, TreeSet<String> members) {
        blocks.set(id, members);
    }

    TreeSet<String> block(int id) {
        return blocks.get(id);
    }

    public int size() {
        return blocks.size();
    }

    public int blockOf(String state) {
        int id = blockOf.getInt(state);
        if (id == NO_BLOCK) {
            throw new IllegalArgumentException("State " + state + " is not partitioned");
        }
        return id;
    }

    /**
     * Lexicographically smallest member of the block holding the state.
     */
    public String representative(String state) {
        return blocks.get(blockOf(state)).first();
    }

    public List<SortedSet<String>> getBlocks() {
        List<SortedSet<String>> view = new ArrayList<>(blocks.size());
        for (TreeSet<String> block : blocks) {
            view.add(Collections.unmodifiableSortedSet(block));
        }
        return view;
    }

    @Override
    public String toString() {
        return blocks.toString();
    }
}
