package com.cobf.complexity.structural.cfg;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Basic-block graph of one function.
 * Blocks are small function-local integers. A graph without meaningful
 * control flow is collapsed to its entry block alone, without edges.
 */
public class ControlFlowGraph {

    private final Map<Integer, Set<Integer>> successors;
    private final int entry;
    private final int exit;

    public ControlFlowGraph(Map<Integer, Set<Integer>> successors, int entry, int exit) {
        Map<Integer, Set<Integer>> copy = new TreeMap<>();
        successors.forEach((node, targets) -> copy.put(node, Collections.unmodifiableSet(new TreeSet<>(targets))));
        this.successors = Collections.unmodifiableMap(copy);
        this.entry = entry;
        this.exit = exit;
    }

    public static ControlFlowGraph singleNode(int node) {
        return new ControlFlowGraph(Map.of(node, Set.of()), node, node);
    }

    public int entry() {
        return entry;
    }

    public int exit() {
        return exit;
    }

    public boolean isCollapsed() {
        return entry == exit;
    }

    public Set<Integer> nodes() {
        return successors.keySet();
    }

    public Set<Integer> successors(int node) {
        return successors.getOrDefault(node, Set.of());
    }

    public int nodeCount() {
        return successors.size();
    }

    /** Total out-degree over all blocks. */
    public int edgeCount() {
        return successors.values().stream().mapToInt(Set::size).sum();
    }

    /** Structural cyclomatic number E - N + 2. */
    public int cyclomatic() {
        return edgeCount() - nodeCount() + 2;
    }

    @Override
    public String toString() {
        return "ControlFlowGraph" + successors;
    }
}
