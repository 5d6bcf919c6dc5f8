package flowgraph;

/**
 * A vertex of a flow graph. The id must be unique within the graph and stable
 * for as long as the graph is being analysed.
 */
public interface Node {
    long getId();
}
