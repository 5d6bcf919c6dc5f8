package dominance;

import flowgraph.DirectedGraph;
import flowgraph.DirectedGraph.Vertex;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks both algorithm variants on many small random graphs against the
 * iterative dominator-set computation.
 */
class DominatorsPropertyTest {

    private static final int GRAPHS = 500;
    private static final int MAX_NODES = 12;

    @Test
    void shouldAgreeWithIterativeDominatorSets() {
        Random random = new Random(20170713L);
        for (int i = 0; i < GRAPHS; i++) {
            List<Vertex> vertices = new ArrayList<>();
            DirectedGraph<Vertex> graph = randomGraph(random, vertices);
            Vertex root = vertices.get(0);

            Map<Long, Set<Long>> sets = IterativeDominators.computeDominators(graph, root);
            Map<Long, Long> expected = IterativeDominators.computeImmediateDominators(sets, root.getId());

            DominatorTree<Vertex> simple = Dominators.compute(root, graph);
            DominatorTree<Vertex> balanced = Dominators.computeBalanced(root, graph);

            for (Vertex v : vertices) {
                Long want = expected.get(v.getId());
                assertEquals(want, idOf(simple.getDominatorOf(v)), "simple, graph " + i + ", node " + v);
                assertEquals(want, idOf(balanced.getDominatorOf(v)), "balanced, graph " + i + ", node " + v);
                assertEquals(new HashSet<>(simple.getDominatedBy(v)), new HashSet<>(balanced.getDominatedBy(v)));
            }
            assertEquals(sets.size(), simple.size());
        }
    }

    @Test
    void shouldPlaceDominatorsBeforeDominees() {
        Random random = new Random(42L);
        for (int i = 0; i < GRAPHS; i++) {
            List<Vertex> vertices = new ArrayList<>();
            DirectedGraph<Vertex> graph = randomGraph(random, vertices);
            Vertex root = vertices.get(0);

            DominatorTree<Vertex> tree = Dominators.compute(root, graph);
            List<Vertex> preorder = tree.getNodes();
            assertEquals(root, preorder.get(0));

            for (int rank = 1; rank < preorder.size(); rank++) {
                Vertex n = preorder.get(rank);
                Vertex idom = tree.getDominatorOf(n);
                assertNotNull(idom, "reachable node without dominator: " + n);
                assertTrue(preorder.indexOf(idom) < rank, "dominator " + idom + " ranked after " + n);
                assertTrue(tree.getDominatedBy(idom).contains(n));
            }
        }
    }

    @Test
    void shouldReachRootAtDepthOfEveryNode() {
        Random random = new Random(7L);
        for (int i = 0; i < GRAPHS; i++) {
            List<Vertex> vertices = new ArrayList<>();
            DirectedGraph<Vertex> graph = randomGraph(random, vertices);
            Vertex root = vertices.get(0);

            DominatorTree<Vertex> tree = Dominators.compute(root, graph);
            for (Vertex n : tree.getNodes()) {
                int steps = 0;
                Vertex x = n;
                Set<Long> seen = new HashSet<>();
                while (x.getId() != root.getId()) {
                    assertTrue(seen.add(x.getId()), "cycle in dominator chain");
                    x = tree.getDominatorOf(x);
                    steps++;
                }
                assertEquals(tree.depthOf(n), steps);
                assertTrue(tree.dominates(root, n));
            }
        }
    }

    @Test
    void shouldExcludeEveryUnreachableNode() {
        Random random = new Random(99L);
        for (int i = 0; i < GRAPHS; i++) {
            List<Vertex> vertices = new ArrayList<>();
            DirectedGraph<Vertex> graph = randomGraph(random, vertices);
            Vertex root = vertices.get(0);

            Set<Long> reachable = IterativeDominators.computeDominators(graph, root).keySet();
            DominatorTree<Vertex> tree = Dominators.compute(root, graph);

            for (Vertex v : vertices) {
                if (reachable.contains(v.getId())) {
                    continue;
                }
                assertFalse(tree.contains(v));
                assertNull(tree.getDominatorOf(v));
                assertTrue(tree.getDominatedBy(v).isEmpty());
                for (Vertex n : tree.getNodes()) {
                    assertFalse(tree.getDominatedBy(n).contains(v));
                }
            }
        }
    }

    // Random graph with sparse ids, occasional parallel edges and self loops.
    private static DirectedGraph<Vertex> randomGraph(Random random, List<Vertex> vertices) {
        DirectedGraph<Vertex> graph = new DirectedGraph<>();
        int n = 1 + random.nextInt(MAX_NODES);
        for (int i = 0; i < n; i++) {
            Vertex v = new Vertex(1_000L * i + random.nextInt(1_000), "v" + i);
            vertices.add(v);
            graph.addNode(v);
        }
        double density = 0.1 + random.nextDouble() * 0.3;
        for (Vertex from : vertices) {
            for (Vertex to : vertices) {
                if (random.nextDouble() < density) {
                    graph.addEdge(from, to);
                    if (random.nextInt(10) == 0) {
                        graph.addEdge(from, to);
                    }
                }
            }
        }
        return graph;
    }

    private static Long idOf(Vertex v) {
        return v == null ? null : v.getId();
    }
}
