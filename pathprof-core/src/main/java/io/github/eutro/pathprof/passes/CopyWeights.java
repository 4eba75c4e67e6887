package io.github.eutro.pathprof.passes;

import io.github.eutro.pathprof.cfg.Edge;
import io.github.eutro.pathprof.cfg.ProfileGraph;

import java.util.ArrayList;
import java.util.List;

/**
 * Uses the Ball-Larus weight of every edge as both its runtime increment and its decoding weight,
 * instrumenting every edge.
 */
public class CopyWeights implements IRPass<ProfileGraph, ProfileGraph> {
    public static final CopyWeights INSTANCE = new CopyWeights();

    @Override
    public ProfileGraph run(ProfileGraph graph) {
        List<Edge> edges = new ArrayList<>(graph.edges().size());
        for (Edge edge : graph.edges()) {
            edges.add(edge.withWeight2(edge.weight));
        }
        return graph.withEdges(edges);
    }
}
