package io.github.eutro.pathprof.passes;

import io.github.eutro.pathprof.ProfilingException;
import io.github.eutro.pathprof.cfg.Edge;
import io.github.eutro.pathprof.cfg.ProfileGraph;
import org.jetbrains.annotations.Nullable;

import java.util.PriorityQueue;

/**
 * Topological ordering of the blocks of a {@link ProfileGraph}, using Kahn's algorithm.
 * <p>
 * Among the blocks that are ready at any point, the one with the lowest id comes first,
 * so the order is deterministic for a given graph.
 */
public final class TopologicalOrder {
    private TopologicalOrder() {
    }

    /**
     * Compute a topological order, if there is one.
     *
     * @param graph The graph.
     * @return The block ids in topological order, or null if the graph has a cycle.
     */
    @Nullable
    public static int[] compute(ProfileGraph graph) {
        int blockCount = graph.blockCount();
        int[] inDegree = new int[blockCount];
        for (Edge edge : graph.edges()) {
            inDegree[edge.to]++;
        }
        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < blockCount; i++) {
            if (inDegree[i] == 0) ready.add(i);
        }
        int[] order = new int[blockCount];
        int count = 0;
        while (!ready.isEmpty()) {
            int block = ready.poll();
            order[count++] = block;
            for (int index : graph.outEdgeIndices(block)) {
                int to = graph.edges().get(index).to;
                if (--inDegree[to] == 0) ready.add(to);
            }
        }
        return count == blockCount ? order : null;
    }

    /**
     * Compute a topological order.
     *
     * @param graph The graph.
     * @return The block ids in topological order.
     * @throws ProfilingException If the graph has a cycle.
     */
    public static int[] require(ProfileGraph graph) {
        int[] order = compute(graph);
        if (order == null) {
            throw new ProfilingException(ProfilingException.Kind.TOPOLOGICAL_ORDER_UNAVAILABLE,
                    "graph has a cycle");
        }
        return order;
    }
}
