package dominance;

import flowgraph.DirectedGraph.Vertex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

class DominatorTreeTest {

    private TestGraph g;
    private DominatorTree<Vertex> tree;

    @BeforeEach
    void setUp() {
        // R -> A -> {B, C} -> D, plus an unreachable X -> D
        g = new TestGraph().edges("R->A", "A->B", "A->C", "B->D", "C->D", "X->D");
        tree = Dominators.compute(g.v("R"), g.graph);
    }

    @Test
    void shouldExposeRootAndReachableNodesInSearchOrder() {
        assertSame(g.v("R"), tree.getRoot());
        assertEquals(List.of(g.v("R"), g.v("A"), g.v("B"), g.v("D"), g.v("C")), tree.getNodes());
        assertEquals(5, tree.size());
    }

    @Test
    void shouldListChildrenOfEachDominator() {
        assertEquals(List.of(g.v("A")), tree.getDominatedBy(g.v("R")));
        assertEquals(Set.of(g.v("B"), g.v("C"), g.v("D")), new HashSet<>(tree.getDominatedBy(g.v("A"))));
        assertTrue(tree.getDominatedBy(g.v("D")).isEmpty());
    }

    @Test
    void shouldNotAllowCallersToModifyChildren() {
        List<Vertex> children = tree.getDominatedBy(g.v("A"));
        assertThrows(UnsupportedOperationException.class, () -> children.add(g.v("R")));
        assertThrows(UnsupportedOperationException.class, () -> tree.getDominatedBy(g.v("D")).add(g.v("R")));
        assertThrows(UnsupportedOperationException.class, () -> tree.getNodes().clear());
    }

    @Test
    void shouldLookUpByIdRatherThanInstance() {
        Vertex sameD = new Vertex(g.v("D").getId(), "copy of D");
        assertEquals(g.v("A"), tree.getDominatorOf(sameD));
    }

    @Test
    void shouldAnswerDominanceQueries() {
        assertTrue(tree.dominates(g.v("R"), g.v("D")));
        assertTrue(tree.dominates(g.v("A"), g.v("D")));
        assertTrue(tree.dominates(g.v("D"), g.v("D")));
        assertFalse(tree.dominates(g.v("B"), g.v("D")));
        assertFalse(tree.dominates(g.v("D"), g.v("A")));
        assertFalse(tree.dominates(g.v("X"), g.v("D")));
        assertFalse(tree.dominates(g.v("R"), g.v("X")));
    }

    @Test
    void shouldReportDepthInTree() {
        assertEquals(0, tree.depthOf(g.v("R")));
        assertEquals(1, tree.depthOf(g.v("A")));
        assertEquals(2, tree.depthOf(g.v("D")));
        assertEquals(-1, tree.depthOf(g.v("X")));
    }
}
