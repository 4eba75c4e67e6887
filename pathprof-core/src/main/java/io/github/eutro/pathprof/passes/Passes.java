package io.github.eutro.pathprof.passes;

import io.github.eutro.pathprof.ProfilerOptions;
import io.github.eutro.pathprof.cfg.ControlFlowGraph;
import io.github.eutro.pathprof.cfg.ProfileGraph;
import io.github.eutro.pathprof.display.DotDisplay;

/**
 * Some pre-composed passes.
 */
public class Passes {
    /**
     * Turns a CFG into an acyclic graph with a path count for every block.
     */
    public static final IRPass<ControlFlowGraph, ProfileGraph> REDUCE_AND_COUNT =
            FindBackEdges.INSTANCE
                    .then(ReduceToDag.INSTANCE)
                    .then(CountPaths.INSTANCE);

    /**
     * Numbers the paths of a CFG, with increments placed only on the chords of a maximum spanning tree.
     */
    public static final IRPass<ControlFlowGraph, ProfileGraph> NUMBER_PATHS =
            REDUCE_AND_COUNT
                    .then(AssignEdgeWeights.INSTANCE)
                    .then(OptimizeEventCounting.INSTANCE);

    /**
     * Numbers the paths of a CFG, with an increment on every edge of nonzero weight.
     */
    public static final IRPass<ControlFlowGraph, ProfileGraph> NUMBER_PATHS_UNOPTIMIZED =
            REDUCE_AND_COUNT
                    .then(AssignEdgeWeights.INSTANCE)
                    .then(CopyWeights.INSTANCE);

    /**
     * Get the path numbering pass selected by some options, writing the graph to the debug
     * output directory before and after weighting, if there is one.
     *
     * @param options The options.
     * @return The pass.
     */
    public static IRPass<ControlFlowGraph, ProfileGraph> numberPaths(ProfilerOptions options) {
        IRPass<ProfileGraph, ProfileGraph> placeIncrements = options.isOptimizeEventCounting()
                ? OptimizeEventCounting.INSTANCE
                : CopyWeights.INSTANCE;
        return REDUCE_AND_COUNT
                .then(DotDisplay.debugDisplay("dag", options))
                .then(AssignEdgeWeights.INSTANCE)
                .then(placeIncrements)
                .then(DotDisplay.debugDisplay("weighted", options));
    }
}
