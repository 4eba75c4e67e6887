package io.github.eutro.pathprof.passes;

import io.github.eutro.pathprof.ProfilingException;
import io.github.eutro.pathprof.cfg.Edge;
import io.github.eutro.pathprof.cfg.ProfileGraph;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes every back edge {@code u -> v}, and adds synthetic edges {@code START -> v} and
 * {@code u -> END} in its place, after all the original edges.
 */
public class ReduceToDag implements IRPass<ProfileGraph, ProfileGraph> {
    public static final ReduceToDag INSTANCE = new ReduceToDag();

    @Override
    public ProfileGraph run(ProfileGraph graph) {
        int entry = graph.entry();
        int exit = graph.exit();
        List<Edge> edges = new ArrayList<>();
        for (Edge edge : graph.edges()) {
            if (!edge.backEdge) edges.add(edge);
        }
        for (Edge backEdge : graph.backEdges()) {
            edges.add(Edge.synthetic(backEdge, entry, backEdge.to));
            edges.add(Edge.synthetic(backEdge, backEdge.from, exit));
        }
        ProfileGraph dag = graph.withEdges(edges);
        if (TopologicalOrder.compute(dag) == null) {
            throw new ProfilingException(ProfilingException.Kind.ACYCLICITY_VIOLATION,
                    "graph still has a cycle after removing " + graph.backEdges().size() + " back edges");
        }
        return dag;
    }
}
