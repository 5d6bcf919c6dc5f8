package flowgraph;

import java.util.*;

/**
 * DirectedGraph is a simple adjacency-list flow graph keyed by node id.
 * Parallel edges are kept: adding the same edge twice yields the target twice
 * in the successor list.
 *
 * @param <N> the node type
 */
public class DirectedGraph<N extends Node> implements FlowGraph<N> {

    /**
     * A plain node carrying only an id and an optional display name.
     */
    public static class Vertex implements Node {
        private final long id;
        private final String name;

        public Vertex(long id) {
            this(id, null);
        }

        public Vertex(long id, String name) {
            this.id = id;
            this.name = name == null ? String.valueOf(id) : name;
        }

        @Override
        public long getId() { return id; }
        public String getName() { return name; }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Vertex)) return false;
            return id == ((Vertex) obj).id;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(id);
        }

        @Override
        public String toString() { return name; }
    }

    private final Map<Long, N> nodes = new LinkedHashMap<>();
    private final Map<Long, List<N>> successors = new HashMap<>();
    private int edgeCount = 0;

    public void addNode(N node) {
        Objects.requireNonNull(node, "node");
        if (!nodes.containsKey(node.getId())) {
            nodes.put(node.getId(), node);
            successors.put(node.getId(), new ArrayList<>());
        }
    }

    public void addEdge(N from, N to) {
        addNode(from);
        addNode(to);
        successors.get(from.getId()).add(to);
        edgeCount++;
    }

    public boolean containsNode(N node) {
        return nodes.containsKey(node.getId());
    }

    public Collection<N> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int edgeCount() {
        return edgeCount;
    }

    @Override
    public List<N> getSuccessors(N node) {
        List<N> out = successors.get(node.getId());
        return out == null ? Collections.emptyList() : Collections.unmodifiableList(out);
    }
}
