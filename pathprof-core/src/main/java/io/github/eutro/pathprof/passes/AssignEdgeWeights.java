package io.github.eutro.pathprof.passes;

import io.github.eutro.pathprof.ProfilingException;
import io.github.eutro.pathprof.cfg.Edge;
import io.github.eutro.pathprof.cfg.ProfileGraph;

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns each edge the Ball-Larus increment, so that summing the weights along any
 * path from the entry to the exit gives a distinct number in {@code [0, NumPaths(START))}.
 * <p>
 * The out-edges of each block, in edge order, get the running total of the path counts
 * of the targets of the edges before them.
 */
public class AssignEdgeWeights implements IRPass<ProfileGraph, ProfileGraph> {
    public static final AssignEdgeWeights INSTANCE = new AssignEdgeWeights();

    @Override
    public ProfileGraph run(ProfileGraph graph) {
        int[] order = TopologicalOrder.require(graph);
        int exit = graph.exit();
        List<Edge> edges = new ArrayList<>(graph.edges());
        for (int block : order) {
            if (block == exit) continue;
            long val = 0;
            for (int index : graph.outEdgeIndices(block)) {
                Edge edge = edges.get(index);
                edges.set(index, edge.withWeight(val));
                val += graph.numPaths(edge.to);
            }
            if (val != graph.numPaths(block)) {
                throw new ProfilingException(ProfilingException.Kind.EDGE_WEIGHT_INVARIANT_VIOLATION,
                        String.format("out-edges of %s cover %d paths, expected %d",
                                graph.name(block), val, graph.numPaths(block)));
            }
        }
        return graph.withEdges(edges);
    }
}
