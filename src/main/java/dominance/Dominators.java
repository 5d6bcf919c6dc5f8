package dominance;

import flowgraph.FlowGraph;
import flowgraph.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Dominators computes dominator trees of flow graphs.
 *
 * Both entry points return the same tree for the same input; they differ only in
 * how the path-compression forest is linked. Nodes not reachable from the root are
 * left out of the result. A graph that returns null successors throws
 * {@link IllegalStateException} and no tree is produced.
 */
public final class Dominators {

    private static final Logger logger = LoggerFactory.getLogger(Dominators.class);

    private Dominators() {
    }

    /**
     * Computes the dominator tree of graph from root using the simple
     * Lengauer-Tarjan algorithm.
     *
     * @param root  the entry node.
     * @param graph the flow graph.
     * @return the dominator tree of every node reachable from root.
     */
    public static <N extends Node> DominatorTree<N> compute(N root, FlowGraph<N> graph) {
        return run("simple", new SimpleLengauerTarjan<>(), root, graph);
    }

    /**
     * Computes the dominator tree of graph from root using the balanced
     * (sophisticated) Lengauer-Tarjan algorithm.
     */
    public static <N extends Node> DominatorTree<N> computeBalanced(N root, FlowGraph<N> graph) {
        return run("balanced", new BalancedLengauerTarjan<>(), root, graph);
    }

    private static <N extends Node> DominatorTree<N> run(String strategy, LengauerTarjan<N> lt,
                                                          N root, FlowGraph<N> graph) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(graph, "graph");
        DominatorTree<N> tree = lt.run(root, graph);
        logger.debug("Computed {} dominator tree from root {} over {} reachable nodes",
                strategy, root.getId(), tree.size());
        return tree;
    }
}
