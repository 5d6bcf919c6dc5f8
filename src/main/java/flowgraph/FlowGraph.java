package flowgraph;

import java.util.List;

/**
 * Read-only view of a directed graph as consumed by the dominator computation.
 *
 * @param <N> the node type
 */
public interface FlowGraph<N extends Node> {

    /**
     * Returns the targets of the outgoing edges of the given node.
     * The list may be empty and may repeat a target if the graph has parallel edges.
     *
     * @param node a node of this graph.
     * @return the successors of node, never null.
     */
    List<N> getSuccessors(N node);
}
