package com.hcltech.composable.graph;

import com.hcltech.composable.common.metrics.InMemoryMetrics;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryLinkGraphTest implements LinkGraphContractTest {

    @Override
    public LinkGraph newGraph() {
        return new InMemoryLinkGraph();
    }

    @Test
    void constructor_rejectsNonPositiveDepth() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryLinkGraph(0, new InMemoryMetrics()));
    }

    @Test
    void link_upToTheBoundIsAllowed() {
        var g = new InMemoryLinkGraph(2, new InMemoryMetrics());
        g.link(A, B);
        g.link(B, C);
        assertEquals(2, g.depthOf(A));
        assertEquals(C, g.findRoot(A));
    }

    @Test
    void link_beyondTheBoundIsRefused_andLeavesTheGraphAlone() {
        var g = new InMemoryLinkGraph(2, new InMemoryMetrics());
        g.link(A, B);
        g.link(B, C);
        var before = g.edges();

        var ex = assertThrows(CompositionException.class, () -> g.link(C, D));
        assertEquals(ErrorKind.DEPTH_EXCEEDED, ex.kind());
        assertEquals(List.of(C, D), ex.nodes());
        assertEquals(before, g.edges());
        assertTrue(g.getChildren(D).isEmpty());
        assertEquals(C, g.findRoot(A));
    }

    @Test
    void updateTarget_countsTheHeightOfTheMovedSubtree() {
        var e = NodeId.of("0xeeee", 1);
        var g = new InMemoryLinkGraph(2, new InMemoryMetrics());
        g.link(A, B);
        g.link(B, C);
        g.link(D, e);

        var ex = assertThrows(CompositionException.class, () -> g.updateTarget(B, D));
        assertEquals(ErrorKind.DEPTH_EXCEEDED, ex.kind());
        assertEquals(C, g.getTarget(B).orElseThrow());
        assertEquals(Set.of(B), g.getChildren(C));
        assertEquals(Set.of(D), g.getChildren(e));

        g.updateTarget(B, e);
        assertEquals(2, g.depthOf(A));
    }

    @Test
    void findRoot_onARestoredCycleIsGraphCorrupted_withTheWalkedChain() {
        var g = InMemoryLinkGraph.restore(Map.of(A, B, B, C, C, A), 2, new InMemoryMetrics());

        var ex = assertThrows(CompositionException.class, () -> g.findRoot(A));
        assertEquals(ErrorKind.GRAPH_CORRUPTED, ex.kind());
        assertEquals(List.of(A, B, C), ex.nodes());
        assertTrue(ForestValidation.validate(g).isError());
    }

    @Test
    void restore_keepsTheEdgesAndTheirChildren() {
        var g = InMemoryLinkGraph.restore(Map.of(A, C, B, C), 10, new InMemoryMetrics());
        assertEquals(Map.of(A, C, B, C), g.edges());
        assertEquals(Set.of(A, B), g.getChildren(C));
        assertTrue(ForestValidation.validate(g).isValue());
    }

    @Test
    void findRoot_recordsDepthHistogram() {
        var metrics = new InMemoryMetrics();
        var g = new InMemoryLinkGraph(10, metrics);
        g.link(A, B);
        g.findRoot(A);
        g.findRoot(B);
        assertEquals(List.of(1L, 0L), metrics.histograms.get("composable.findRoot.depth"));
    }

    @Test
    void getChildren_isSortedAndDetached() {
        var g = new InMemoryLinkGraph();
        g.link(D, A);
        g.link(B, A);
        g.link(C, A);
        var kids = g.getChildren(A);
        assertEquals(List.of(B, C, D), new ArrayList<>(kids));
        g.unlink(C);
        assertEquals(3, kids.size());
    }

    @Test
    void randomOperations_neverBreakTheForestNorItsDepthBound() {
        var g = new InMemoryLinkGraph(3, new InMemoryMetrics());
        var random = new Random(42);
        List<NodeId> nodes = new ArrayList<>();
        for (int i = 0; i < 30; i++) nodes.add(NodeId.of("0xf00d", i));

        for (int step = 0; step < 2_000; step++) {
            NodeId s = nodes.get(random.nextInt(nodes.size()));
            NodeId t = nodes.get(random.nextInt(nodes.size()));
            try {
                switch (random.nextInt(3)) {
                    case 0 -> g.link(s, t);
                    case 1 -> g.updateTarget(s, t);
                    default -> g.unlink(s);
                }
            } catch (CompositionException expected) {
                assertNotEquals(ErrorKind.GRAPH_CORRUPTED, expected.kind());
            }
        }

        assertTrue(ForestValidation.validate(g).isValue(), () -> ForestValidation.validate(g).getErrors().toString());
        for (NodeId n : nodes) {
            assertTrue(g.depthOf(n) <= 3);
            NodeId root = g.findRoot(n);
            assertTrue(g.getTarget(root).isEmpty());
            Set<NodeId> seen = new HashSet<>();
            for (NodeId cur = n; cur != null; cur = g.getTarget(cur).orElse(null)) assertTrue(seen.add(cur));
        }
    }
}
