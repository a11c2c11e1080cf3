package com.architecture.memory.codegraph.service.graph.query;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class StronglyConnectedComponentsTest {

    @Test
    void findCycles_returnsTriangleStartingAtSmallestId() {
        Map<String, Set<String>> graph = Map.of(
                "C", Set.of("A"),
                "A", Set.of("B"),
                "B", Set.of("C"));

        assertThat(StronglyConnectedComponents.findCycles(graph))
                .containsExactly(List.of("A", "B", "C"));
    }

    @Test
    void findCycles_ignoresAcyclicGraph() {
        Map<String, Set<String>> graph = Map.of(
                "A", Set.of("B", "C"),
                "B", Set.of("C"));

        assertThat(StronglyConnectedComponents.findCycles(graph)).isEmpty();
    }

    @Test
    void findCycles_separatesIndependentComponents() {
        Map<String, Set<String>> graph = Map.of(
                "x1", Set.of("x2"),
                "x2", Set.of("x1", "a1"),
                "a1", Set.of("a2"),
                "a2", Set.of("a1"));

        assertThat(StronglyConnectedComponents.findCycles(graph))
                .containsExactly(List.of("a1", "a2"), List.of("x1", "x2"));
    }

    @Test
    void findCycles_skipsSelfLoops() {
        assertThat(StronglyConnectedComponents.findCycles(Map.of("A", Set.of("A")))).isEmpty();
    }

    @Test
    void findCycles_handlesLongChainWithoutStackOverflow() {
        Map<String, Set<String>> graph = new HashMap<>();
        int size = 50_000;
        for (int i = 0; i < size; i++) {
            graph.put(String.format("n%06d", i), Set.of(String.format("n%06d", (i + 1) % size)));
        }

        List<List<String>> cycles = StronglyConnectedComponents.findCycles(graph);

        assertThat(cycles).hasSize(1);
        assertThat(cycles.get(0)).hasSize(size).startsWith("n000000", "n000001");
    }
}
