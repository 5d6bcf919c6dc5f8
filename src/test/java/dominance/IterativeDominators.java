package dominance;

import flowgraph.DirectedGraph;
import flowgraph.DirectedGraph.Vertex;

import java.util.*;

/**
 * Reference dominator computation by the iterative fixed-point method over
 * dominator sets. Quadratic, used only to check the fast algorithm on small graphs.
 */
final class IterativeDominators {

    private IterativeDominators() {
    }

    /**
     * Dom(entry) = {entry}; Dom(n) = {n} ∪ ⋂ Dom(p) over the reachable predecessors p of n.
     *
     * @return a map from each node reachable from entry to the ids of its dominators.
     */
    static Map<Long, Set<Long>> computeDominators(DirectedGraph<Vertex> graph, Vertex entry) {
        Set<Long> reachable = new LinkedHashSet<>();
        Deque<Vertex> stack = new ArrayDeque<>();
        stack.push(entry);
        reachable.add(entry.getId());
        Map<Long, Set<Long>> predecessors = new HashMap<>();
        while (!stack.isEmpty()) {
            Vertex current = stack.pop();
            for (Vertex succ : graph.getSuccessors(current)) {
                predecessors.computeIfAbsent(succ.getId(), k -> new HashSet<>()).add(current.getId());
                if (reachable.add(succ.getId())) {
                    stack.push(succ);
                }
            }
        }

        Map<Long, Set<Long>> dominators = new HashMap<>();
        for (Long node : reachable) {
            if (node == entry.getId()) {
                dominators.put(node, new HashSet<>(Collections.singleton(node)));
            } else {
                dominators.put(node, new HashSet<>(reachable));
            }
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            for (Long node : reachable) {
                if (node == entry.getId()) {
                    continue;
                }
                Set<Long> newDoms = new HashSet<>(reachable);
                for (Long pred : predecessors.getOrDefault(node, Collections.emptySet())) {
                    newDoms.retainAll(dominators.get(pred));
                }
                newDoms.add(node);
                if (!newDoms.equals(dominators.get(node))) {
                    dominators.put(node, newDoms);
                    changed = true;
                }
            }
        }
        return dominators;
    }

    /**
     * The immediate dominator of n is the strict dominator of n that every other
     * strict dominator of n dominates.
     */
    static Map<Long, Long> computeImmediateDominators(Map<Long, Set<Long>> dominators, long entry) {
        Map<Long, Long> idom = new HashMap<>();
        for (Map.Entry<Long, Set<Long>> e : dominators.entrySet()) {
            long node = e.getKey();
            if (node == entry) {
                continue;
            }
            Set<Long> candidates = new HashSet<>(e.getValue());
            candidates.remove(node);
            for (Long candidate : candidates) {
                if (dominators.get(candidate).containsAll(candidates)) {
                    idom.put(node, candidate);
                    break;
                }
            }
        }
        return idom;
    }
}
