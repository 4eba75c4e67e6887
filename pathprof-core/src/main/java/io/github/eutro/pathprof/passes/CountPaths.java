package io.github.eutro.pathprof.passes;

import com.google.common.flogger.GoogleLogger;
import io.github.eutro.pathprof.cfg.Edge;
import io.github.eutro.pathprof.cfg.ProfileGraph;

/**
 * Computes, for each block, the number of distinct paths from it to the exit.
 * <p>
 * The exit has one path, and every other block has the sum of the counts of
 * its successors, over each out-edge. Blocks that cannot reach the exit have none.
 */
public class CountPaths implements IRPass<ProfileGraph, ProfileGraph> {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    public static final CountPaths INSTANCE = new CountPaths();

    @Override
    public ProfileGraph run(ProfileGraph graph) {
        int[] order = TopologicalOrder.require(graph);
        int exit = graph.exit();
        long[] numPaths = new long[graph.blockCount()];
        for (int i = order.length - 1; i >= 0; i--) {
            int block = order[i];
            if (block == exit) {
                numPaths[block] = 1;
                continue;
            }
            long sum = 0;
            for (int index : graph.outEdgeIndices(block)) {
                Edge edge = graph.edges().get(index);
                sum = Math.addExact(sum, numPaths[edge.to]);
            }
            numPaths[block] = sum;
        }
        logger.atFine().log("%d acyclic paths from %s", numPaths[graph.entry()], graph.name(graph.entry()));
        return graph.withNumPaths(numPaths);
    }
}
