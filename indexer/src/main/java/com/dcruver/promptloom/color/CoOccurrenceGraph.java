package com.dcruver.promptloom.color;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Weighted undirected graph of tags that appear together in file names or folders.
 */
public class CoOccurrenceGraph {

    private final Map<Long, Map<Long, Integer>> adjacency = new HashMap<>();
    private int edgeCount;

    /**
     * Add an edge; a repeated pair accumulates weight. Self-loops are ignored.
     */
    public void addEdge(long a, long b, int weight) {
        if (a == b || weight <= 0) {
            return;
        }
        int merged = adjacency.computeIfAbsent(a, k -> new HashMap<>()).merge(b, weight, Integer::sum);
        adjacency.computeIfAbsent(b, k -> new HashMap<>()).merge(a, weight, Integer::sum);
        if (merged == weight) {
            edgeCount++;
        }
    }

    public Map<Long, Integer> neighbors(long node) {
        return Collections.unmodifiableMap(adjacency.getOrDefault(node, Map.of()));
    }

    public int weight(long a, long b) {
        return adjacency.getOrDefault(a, Map.of()).getOrDefault(b, 0);
    }

    public int getEdgeCount() {
        return edgeCount;
    }
}
