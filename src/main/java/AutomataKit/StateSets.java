package AutomataKit;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Set algebra on state labels. Results are always fresh sorted sets, operands are never modified.
 */
public final class StateSets {
    private StateSets() {
    }

    public static SortedSet<String> union(Collection<String> a, Collection<String> b) {
        SortedSet<String> result = new TreeSet<>(a);
        result.addAll(b);
        return result;
    }

    public static SortedSet<String> intersection(Collection<String> a, Collection<String> b) {
        SortedSet<String> result = new TreeSet<>(a);
        result.retainAll(b);
        return result;
    }

    public static SortedSet<String> difference(Collection<String> a, Collection<String> b) {
        SortedSet<String> result = new TreeSet<>(a);
        result.removeAll(b);
        return result;
    }

    public static boolean isDisjoint(Set<String> a, Set<String> b) {
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        for (String s : smaller) {
            if (larger.contains(s)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Breadth-first closure of the seeds under a successor function.
     * @param seeds - start of the walk, always part of the result
     * @param successors - one step of the walk; must not return null
     * @return every label reachable from a seed in zero or more steps
     */
    public static SortedSet<String> reach(Collection<String> seeds,
                                          Function<String, ? extends Collection<String>> successors) {
        SortedSet<String> visited = new TreeSet<>(seeds);
        Deque<String> queue = new ArrayDeque<>(visited);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : successors.apply(current)) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return visited;
    }
}
