package com.hcltech.composable.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ForestValidationTest {

    static final NodeId A = NodeId.of("0x01", 1);
    static final NodeId B = NodeId.of("0x01", 2);
    static final NodeId C = NodeId.of("0x01", 3);

    @Test
    void healthyGraphValidates() {
        var g = new InMemoryLinkGraph();
        g.link(A, B);
        g.link(C, B);
        assertTrue(ForestValidation.validate(g).isValue());
    }

    @Test
    void cycleIsReportedOnce() {
        var errors = ForestValidation.validate(
                Map.of(A, B, B, A),
                Map.of(A, Set.of(B), B, Set.of(A)),
                10).errorsOrThrow();
        assertEquals(List.of("Cycle through " + A + " reachable from " + A), errors);
    }

    @Test
    void reverseIndexMismatchesAreReported() {
        var errors = ForestValidation.validate(
                Map.of(A, B),
                Map.of(C, Set.of(A)),
                10).errorsOrThrow();
        assertEquals(2, errors.size(), errors::toString);
        assertTrue(errors.get(0).contains("missing from reverse index"));
        assertTrue(errors.get(1).contains("Reverse index lists " + A + " under " + C));
    }

    @Test
    void overDeepChainIsReported() {
        var errors = ForestValidation.validate(
                Map.of(A, B, B, C),
                Map.of(B, Set.of(A), C, Set.of(B)),
                1).errorsOrThrow();
        assertEquals(List.of("Depth of " + A + " exceeds 1"), errors);
    }
}
