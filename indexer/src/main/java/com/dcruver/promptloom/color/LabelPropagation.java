package com.dcruver.promptloom.color;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;

/**
 * Asynchronous label propagation over a {@link CoOccurrenceGraph}.
 *
 * Every node starts in its own community (label = node id). Passes visit nodes in ascending id
 * order and move each node to the label with the greatest summed edge weight among its neighbours,
 * taking the lowest label on ties. Updates are visible immediately within a pass. The run stops
 * after a pass with no change or after {@link #MAX_ITERATIONS} passes.
 */
public final class LabelPropagation {

    public static final int MAX_ITERATIONS = 20;

    private LabelPropagation() {
    }

    public record Result(Map<Long, Long> labels, int iterations, boolean converged) {
    }

    public static Result run(Collection<Long> nodes, CoOccurrenceGraph graph) {
        TreeSet<Long> ordered = new TreeSet<>(nodes);
        Map<Long, Long> labels = new HashMap<>();
        for (Long node : ordered) {
            labels.put(node, node);
        }

        int iterations = 0;
        boolean converged = false;
        while (iterations < MAX_ITERATIONS) {
            iterations++;
            boolean changed = false;

            for (Long node : ordered) {
                Map<Long, Integer> neighbors = graph.neighbors(node);
                if (neighbors.isEmpty()) {
                    continue;
                }

                Map<Long, Long> scores = new HashMap<>();
                neighbors.forEach((neighbor, weight) ->
                    scores.merge(labels.getOrDefault(neighbor, neighbor), (long) weight, Long::sum));

                long best = strongest(scores);
                if (best != labels.get(node)) {
                    labels.put(node, best);
                    changed = true;
                }
            }

            if (!changed) {
                converged = true;
                break;
            }
        }

        return new Result(labels, iterations, converged);
    }

    /**
     * Label with the highest score; lowest label wins ties.
     */
    static long strongest(Map<Long, Long> scores) {
        long bestLabel = Long.MAX_VALUE;
        long bestScore = Long.MIN_VALUE;
        for (Map.Entry<Long, Long> entry : scores.entrySet()) {
            long label = entry.getKey();
            long score = entry.getValue();
            if (score > bestScore || (score == bestScore && label < bestLabel)) {
                bestLabel = label;
                bestScore = score;
            }
        }
        return bestLabel;
    }
}
