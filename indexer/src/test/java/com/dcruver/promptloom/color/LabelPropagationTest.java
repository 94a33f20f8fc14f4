package com.dcruver.promptloom.color;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for label propagation over small co-occurrence graphs.
 */
class LabelPropagationTest {

    @Test
    void testSeparatesTwoTrianglesJoinedByWeakEdge() {
        CoOccurrenceGraph graph = new CoOccurrenceGraph();
        graph.addEdge(1, 2, 5);
        graph.addEdge(2, 3, 5);
        graph.addEdge(1, 3, 5);
        graph.addEdge(4, 5, 5);
        graph.addEdge(5, 6, 5);
        graph.addEdge(4, 6, 5);
        graph.addEdge(3, 4, 1);

        LabelPropagation.Result result = LabelPropagation.run(List.of(6L, 5L, 4L, 3L, 2L, 1L, 7L), graph);

        Map<Long, Long> labels = result.labels();
        assertEquals(labels.get(1L), labels.get(2L));
        assertEquals(labels.get(1L), labels.get(3L));
        assertEquals(labels.get(4L), labels.get(5L));
        assertEquals(labels.get(4L), labels.get(6L));
        assertNotEquals(labels.get(1L), labels.get(4L));
        assertEquals(7L, labels.get(7L), "isolated tag keeps its own label");
        assertTrue(result.converged());
        assertTrue(result.iterations() <= LabelPropagation.MAX_ITERATIONS);
    }

    @Test
    void testIsDeterministic() {
        CoOccurrenceGraph graph = new CoOccurrenceGraph();
        graph.addEdge(10, 11, 2);
        graph.addEdge(11, 12, 3);
        graph.addEdge(12, 13, 2);
        graph.addEdge(13, 10, 3);

        Map<Long, Long> first = LabelPropagation.run(List.of(10L, 11L, 12L, 13L), graph).labels();
        Map<Long, Long> second = LabelPropagation.run(List.of(13L, 12L, 11L, 10L), graph).labels();

        assertEquals(first, second);
    }

    @Test
    void testTiesGoToLowestLabel() {
        assertEquals(3L, LabelPropagation.strongest(Map.of(9L, 4L, 3L, 4L, 5L, 2L)));
        assertEquals(5L, LabelPropagation.strongest(Map.of(9L, 4L, 3L, 4L, 5L, 7L)));
    }

    @Test
    void testGraphIgnoresSelfLoopsAndEmptyWeights() {
        CoOccurrenceGraph graph = new CoOccurrenceGraph();
        graph.addEdge(1, 1, 4);
        graph.addEdge(1, 2, 0);
        graph.addEdge(1, 2, 3);
        graph.addEdge(2, 1, 2);

        assertEquals(1, graph.getEdgeCount());
        assertEquals(5, graph.weight(1, 2));
        assertEquals(5, graph.weight(2, 1));
        assertTrue(graph.neighbors(3).isEmpty());
    }
}
