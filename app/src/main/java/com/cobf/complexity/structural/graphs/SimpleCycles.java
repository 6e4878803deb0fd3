package com.cobf.complexity.structural.graphs;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Enumerates the elementary (simple) cycles of a directed graph using
 * Johnson's algorithm. A self-loop is reported as a one-vertex cycle.
 *
 * Vertices are ordered by first appearance in the adjacency map, then in
 * the successor collections. Each cycle is listed once, starting at its
 * least vertex in that order.
 *
 * @param <V> vertex type
 */
public class SimpleCycles<V> {

    private final List<V> vertices = new ArrayList<>();
    private final Map<V, Integer> index = new HashMap<>();
    private final List<List<Integer>> adjacency = new ArrayList<>();

    // Per-search state
    private final Deque<Integer> stack = new ArrayDeque<>();
    private boolean[] blocked;
    private List<Set<Integer>> blockedBy;
    private Set<Integer> component;
    private int start;
    private List<List<V>> cycles;

    public SimpleCycles(Map<V, ? extends Collection<V>> graph) {
        for (Map.Entry<V, ? extends Collection<V>> entry : graph.entrySet()) {
            vertex(entry.getKey());
            for (V target : entry.getValue()) {
                vertex(target);
            }
        }
        for (int i = 0; i < vertices.size(); i++) {
            adjacency.add(new ArrayList<>());
        }
        for (Map.Entry<V, ? extends Collection<V>> entry : graph.entrySet()) {
            List<Integer> targets = adjacency.get(index.get(entry.getKey()));
            for (V target : entry.getValue()) {
                int t = index.get(target);
                if (!targets.contains(t)) {
                    targets.add(t);
                }
            }
        }
    }

    public static <V> List<List<V>> find(Map<V, ? extends Collection<V>> graph) {
        return new SimpleCycles<>(graph).findAll();
    }

    /** Vertices that lie on at least one simple cycle. */
    public static <V> Set<V> verticesOnCycles(Map<V, ? extends Collection<V>> graph) {
        Set<V> result = new LinkedHashSet<>();
        find(graph).forEach(result::addAll);
        return result;
    }

    private void vertex(V v) {
        if (!index.containsKey(v)) {
            index.put(v, vertices.size());
            vertices.add(v);
        }
    }

    public List<List<V>> findAll() {
        cycles = new ArrayList<>();
        int n = vertices.size();
        int from = 0;
        while (from < n) {
            // Least vertex of a non-trivial strongly connected component of the subgraph induced by [from, n)
            Set<Integer> scc = leastComponent(from);
            if (scc == null) {
                break;
            }
            start = scc.stream().min(Integer::compare).orElseThrow();
            component = scc;
            blocked = new boolean[n];
            blockedBy = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                blockedBy.add(new HashSet<>());
            }
            circuit(start);
            from = start + 1;
        }
        return cycles;
    }

    private boolean circuit(int v) {
        boolean found = false;
        stack.push(v);
        blocked[v] = true;
        for (int w : adjacency.get(v)) {
            if (!component.contains(w)) {
                continue;
            }
            if (w == start) {
                recordCycle();
                found = true;
            } else if (!blocked[w] && circuit(w)) {
                found = true;
            }
        }
        if (found) {
            unblock(v);
        } else {
            for (int w : adjacency.get(v)) {
                if (component.contains(w)) {
                    blockedBy.get(w).add(v);
                }
            }
        }
        stack.pop();
        return found;
    }

    private void unblock(int u) {
        blocked[u] = false;
        List<Integer> waiting = new ArrayList<>(blockedBy.get(u));
        blockedBy.get(u).clear();
        for (int w : waiting) {
            if (blocked[w]) {
                unblock(w);
            }
        }
    }

    private void recordCycle() {
        List<V> cycle = new ArrayList<>();
        // the stack holds the path in reverse
        stack.descendingIterator().forEachRemaining(i -> cycle.add(vertices.get(i)));
        cycles.add(cycle);
    }

    /**
     * Tarjan's strongly connected components over vertices {@code >= from};
     * returns the component holding the least vertex among those components
     * that contain a cycle, or null when there is none.
     */
    private Set<Integer> leastComponent(int from) {
        Tarjan tarjan = new Tarjan(from);
        Set<Integer> best = null;
        int bestMin = Integer.MAX_VALUE;
        for (Set<Integer> scc : tarjan.components) {
            boolean cyclic = scc.size() > 1 || adjacency.get(scc.iterator().next()).contains(scc.iterator().next());
            if (!cyclic) {
                continue;
            }
            int min = scc.stream().min(Integer::compare).orElseThrow();
            if (min < bestMin) {
                bestMin = min;
                best = scc;
            }
        }
        return best;
    }

    private final class Tarjan {
        private final int from;
        private final int[] order;
        private final int[] low;
        private final boolean[] onStack;
        private final Deque<Integer> path = new ArrayDeque<>();
        private final List<Set<Integer>> components = new ArrayList<>();
        private int counter = 1;

        Tarjan(int from) {
            this.from = from;
            int n = vertices.size();
            order = new int[n];
            low = new int[n];
            onStack = new boolean[n];
            for (int v = from; v < n; v++) {
                if (order[v] == 0) {
                    connect(v);
                }
            }
        }

        private void connect(int v) {
            order[v] = counter;
            low[v] = counter;
            counter++;
            path.push(v);
            onStack[v] = true;
            for (int w : adjacency.get(v)) {
                if (w < from) {
                    continue;
                }
                if (order[w] == 0) {
                    connect(w);
                    low[v] = Math.min(low[v], low[w]);
                } else if (onStack[w]) {
                    low[v] = Math.min(low[v], order[w]);
                }
            }
            if (low[v] == order[v]) {
                Set<Integer> scc = new HashSet<>();
                int w;
                do {
                    w = path.pop();
                    onStack[w] = false;
                    scc.add(w);
                } while (w != v);
                components.add(scc);
            }
        }
    }
}
