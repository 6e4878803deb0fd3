package com.cobf.complexity.structural.graphs;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SimpleCyclesTest {

    /** Builds an ordered graph from "a->b" edge strings. */
    private static Map<String, List<String>> graph(String... edges) {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        for (String edge : edges) {
            String[] ends = edge.split("->");
            graph.computeIfAbsent(ends[0], k -> new ArrayList<>()).add(ends[1]);
            graph.computeIfAbsent(ends[1], k -> new ArrayList<>());
        }
        return graph;
    }

    @Test
    void testSelfLoopIsOneVertexCycle() {
        assertEquals(List.of(List.of("a")), SimpleCycles.find(graph("a->a")));
    }

    @Test
    void testMutualRecursion() {
        assertEquals(List.of(List.of("a", "b")), SimpleCycles.find(graph("a->b", "b->a")));
    }

    @Test
    void testAcyclicGraphHasNoCycles() {
        assertTrue(SimpleCycles.find(graph("a->b", "b->c", "a->c")).isEmpty());
        assertTrue(SimpleCycles.verticesOnCycles(graph("a->b")).isEmpty());
    }

    @Test
    void testCyclesSharingVertices() {
        List<List<String>> cycles = SimpleCycles.find(graph("a->b", "b->a", "b->c", "c->a"));

        assertEquals(2, cycles.size());
        assertTrue(cycles.contains(List.of("a", "b")));
        assertTrue(cycles.contains(List.of("a", "b", "c")));
    }

    @Test
    void testCompleteGraphOnThreeVertices() {
        List<List<String>> cycles = SimpleCycles.find(
                graph("a->b", "a->c", "b->a", "b->c", "c->a", "c->b"));

        assertEquals(5, cycles.size(), "Three two-cycles and two three-cycles");
        for (List<String> cycle : cycles) {
            assertEquals(Set.copyOf(cycle).size(), cycle.size(), "Cycles are elementary: " + cycle);
        }
    }

    @Test
    void testDuplicateEdgesAreIgnored() {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        graph.put("a", List.of("b", "b"));
        graph.put("b", List.of("a"));

        assertEquals(1, SimpleCycles.find(graph).size());
    }

    @Test
    void testVerticesOnCyclesSkipsCallersOutsideCycles() {
        Set<String> recursive = SimpleCycles.verticesOnCycles(
                graph("main->fib", "fib->fib", "main->even", "even->odd", "odd->even", "odd->log"));

        assertEquals(Set.of("fib", "even", "odd"), recursive);
    }
}
