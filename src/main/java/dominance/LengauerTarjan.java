package dominance;

import flowgraph.FlowGraph;
import flowgraph.Node;

import java.util.*;

/**
 * LengauerTarjan holds the per-call state of the Lengauer-Tarjan dominator algorithm
 * (T. Lengauer and R. E. Tarjan, A fast algorithm for finding dominators in a flowgraph,
 * TOPLAS 1(1), 1979).
 *
 * Every reachable node is stored once in an arena indexed by its DFS preorder number
 * (its rank, root = 0). All cross references between nodes (parent, ancestor, label,
 * dom, buckets, predecessors) are ranks into that arena.
 *
 * Subclasses supply the EVAL/LINK pair of the path-compression forest. An instance is
 * good for exactly one call to {@link #run}.
 *
 * @param <N> the node type
 */
abstract class LengauerTarjan<N extends Node> {

    static final int NONE = -1;

    // vertex.get(i) is the node numbered i by the search.
    protected final List<N> vertex = new ArrayList<>();

    // Maps the potentially sparse node ids onto the dense ranks above.
    private final Map<Long, Integer> indexOf = new HashMap<>();

    // parent[w]: spanning-tree parent of w, NONE only for the root.
    protected int[] parent;

    // pred.get(w): ranks v such that (v, w) is an edge. Parallel edges repeat v.
    protected final List<List<Integer>> pred = new ArrayList<>();

    // semi[w]: before w is processed, the rank of w itself. Afterwards, the rank
    // of the semidominator of w.
    protected int[] semi;

    // bucket.get(w): vertices whose semidominator is w. Drained when the child
    // of w currently being processed is linked.
    protected List<List<Integer>> bucket;

    // dom[w]: after the main loop either the immediate dominator of w, or a vertex
    // of smaller rank with the same immediate dominator. After the final pass,
    // exactly the immediate dominator.
    protected int[] dom;

    // ancestor[w]: NONE exactly when w is a root of the forest.
    protected int[] ancestor;

    // label[w]: starts as w and only ever moves to a vertex with a smaller semi.
    protected int[] label;

    private final List<Integer> parentOf = new ArrayList<>();

    /** EVAL: the vertex of minimum semi on the forest path above v. */
    abstract int eval(int v);

    /** LINK: adds the edge (v, w) to the forest. */
    abstract void link(int v, int w);

    /** Allocates any extra forest state once the number of vertices is known. */
    void initForest(int n) {
    }

    final DominatorTree<N> run(N root, FlowGraph<N> graph) {
        dfs(graph, root);
        int n = vertex.size();
        allocate(n);

        for (int w = n - 1; w > 0; w--) {
            // Semidominator of w from all incoming edges.
            for (int v : pred.get(w)) {
                int u = eval(v);
                if (semi[u] < semi[w]) {
                    semi[w] = semi[u];
                }
            }
            bucket.get(semi[w]).add(w);

            int p = parent[w];
            link(p, w);

            // Implicitly define the immediate dominators of parent's bucket.
            List<Integer> waiting = bucket.get(p);
            for (int v : waiting) {
                int u = eval(v);
                dom[v] = semi[u] < semi[v] ? u : p;
            }
            waiting.clear();
        }

        for (int w = 1; w < n; w++) {
            if (dom[w] != semi[w]) {
                dom[w] = dom[dom[w]];
            }
        }
        return buildTree(root);
    }

    /**
     * Numbers every node reachable from root in DFS preorder and records the
     * spanning-tree parents and the full predecessor lists.
     */
    private void dfs(FlowGraph<N> graph, N root) {
        Deque<Frame<N>> stack = new ArrayDeque<>();
        int rootRank = discover(root, NONE);
        stack.push(new Frame<>(rootRank, successorsOf(graph, root)));

        while (!stack.isEmpty()) {
            Frame<N> top = stack.peek();
            if (!top.successors.hasNext()) {
                stack.pop();
                continue;
            }
            N w = top.successors.next();
            if (w == null) {
                throw new IllegalStateException("graph returned a null successor of node "
                        + vertex.get(top.rank).getId());
            }
            Integer idx = indexOf.get(w.getId());
            if (idx == null) {
                idx = discover(w, top.rank);
                stack.push(new Frame<>(idx, successorsOf(graph, w)));
            }
            pred.get(idx).add(top.rank);
        }
    }

    private int discover(N node, int parentRank) {
        int rank = vertex.size();
        indexOf.put(node.getId(), rank);
        vertex.add(node);
        parentOf.add(parentRank);
        pred.add(new ArrayList<>());
        return rank;
    }

    private Iterator<N> successorsOf(FlowGraph<N> graph, N node) {
        List<N> successors = graph.getSuccessors(node);
        if (successors == null) {
            throw new IllegalStateException("graph returned no successor list for node " + node.getId());
        }
        return successors.iterator();
    }

    private void allocate(int n) {
        parent = new int[n];
        semi = new int[n];
        dom = new int[n];
        ancestor = new int[n];
        label = new int[n];
        bucket = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            parent[i] = parentOf.get(i);
            semi[i] = i;
            dom[i] = NONE;
            ancestor[i] = NONE;
            label[i] = i;
            bucket.add(new ArrayList<>());
        }
        initForest(n);
    }

    /**
     * COMPRESS, iteratively: walk up to the vertex one hop below the forest root,
     * then relabel and splice on the way back down.
     */
    protected final void compress(int v) {
        Deque<Integer> path = new ArrayDeque<>();
        for (int x = v; ancestor[ancestor[x]] != NONE; x = ancestor[x]) {
            path.push(x);
        }
        while (!path.isEmpty()) {
            int x = path.pop();
            int a = ancestor[x];
            if (semi[label[a]] < semi[label[x]]) {
                label[x] = label[a];
            }
            ancestor[x] = ancestor[a];
        }
    }

    private DominatorTree<N> buildTree(N root) {
        Map<Long, N> dominatorOf = new HashMap<>();
        Map<Long, List<N>> dominatedBy = new HashMap<>();
        for (int w = 1; w < vertex.size(); w++) {
            N idom = vertex.get(dom[w]);
            dominatorOf.put(vertex.get(w).getId(), idom);
            dominatedBy.computeIfAbsent(idom.getId(), id -> new ArrayList<>()).add(vertex.get(w));
        }
        return new DominatorTree<>(root, vertex, dominatorOf, dominatedBy);
    }

    private static class Frame<N> {
        final int rank;
        final Iterator<N> successors;

        Frame(int rank, Iterator<N> successors) {
            this.rank = rank;
            this.successors = successors;
        }
    }
}
