package dominance;

import flowgraph.Node;

import java.util.*;

/**
 * DominatorTree is the immutable result of a dominator computation. All lookups are
 * keyed by node id, so any node object with the same id as a graph node may be used.
 *
 * @param <N> the node type
 */
public final class DominatorTree<N extends Node> {

    private final N root;
    private final Map<Long, N> reachable = new LinkedHashMap<>();
    private final Map<Long, N> dominatorOf;
    private final Map<Long, List<N>> dominatedBy;

    DominatorTree(N root, List<N> preorder, Map<Long, N> dominatorOf, Map<Long, List<N>> dominatedBy) {
        this.root = root;
        for (N node : preorder) {
            reachable.put(node.getId(), node);
        }
        this.dominatorOf = dominatorOf;
        Map<Long, List<N>> children = new HashMap<>();
        dominatedBy.forEach((id, nodes) -> children.put(id, Collections.unmodifiableList(nodes)));
        this.dominatedBy = children;
    }

    /**
     * @return the root the tree was computed from.
     */
    public N getRoot() {
        return root;
    }

    /**
     * Returns the immediate dominator of n.
     *
     * @param n a node.
     * @return the immediate dominator, or null if n is the root or is not reachable from it.
     */
    public N getDominatorOf(N n) {
        return dominatorOf.get(n.getId());
    }

    /**
     * Returns the nodes immediately dominated by n. The list is read-only and empty
     * when n dominates nothing or is unreachable.
     */
    public List<N> getDominatedBy(N n) {
        return dominatedBy.getOrDefault(n.getId(), Collections.emptyList());
    }

    /**
     * Reports whether a dominates b. Every reachable node dominates itself.
     */
    public boolean dominates(N a, N b) {
        if (!contains(a) || !contains(b)) {
            return false;
        }
        for (N x = b; x != null; x = getDominatorOf(x)) {
            if (x.getId() == a.getId()) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return the number of dominator tree edges between n and the root, 0 for the
     * root and -1 for unreachable nodes.
     */
    public int depthOf(N n) {
        if (!contains(n)) {
            return -1;
        }
        int depth = 0;
        for (N x = getDominatorOf(n); x != null; x = getDominatorOf(x)) {
            depth++;
        }
        return depth;
    }

    public boolean contains(N n) {
        return reachable.containsKey(n.getId());
    }

    /**
     * @return the reachable nodes in the order the search numbered them, root first.
     */
    public List<N> getNodes() {
        return List.copyOf(reachable.values());
    }

    public int size() {
        return reachable.size();
    }
}
