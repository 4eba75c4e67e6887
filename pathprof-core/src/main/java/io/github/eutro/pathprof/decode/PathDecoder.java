package io.github.eutro.pathprof.decode;

import com.google.common.flogger.GoogleLogger;
import io.github.eutro.pathprof.cfg.Edge;
import io.github.eutro.pathprof.cfg.ProfileGraph;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Recovers the blocks of a path from its id, using the decoding weights of a numbered graph.
 * <p>
 * Starting at the entry, the decoder repeatedly follows the out-edge with the greatest
 * {@link Edge#weight2} not exceeding what is left of the id, and subtracts that weight.
 * <p>
 * A path that begins with a synthetic edge from the entry starts at a loop header, so the
 * entry is left out; a path that ends with a synthetic edge to the exit stops at the source
 * of a back edge, so the exit is left out.
 */
public class PathDecoder {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private final ProfileGraph graph;

    public PathDecoder(ProfileGraph graph) {
        if (!graph.hasNumPaths()) {
            throw new IllegalArgumentException("graph has not been numbered");
        }
        this.graph = graph;
    }

    /**
     * Get the number of distinct path ids.
     *
     * @return The number of paths from the entry, all ids being below it.
     */
    public long numPaths() {
        return graph.numPaths(graph.entry());
    }

    /**
     * Decode a path id to the edges of its path.
     *
     * @param pathId The path id.
     * @return The edges, in order.
     * @throws IllegalArgumentException If the id is outside {@code [0, numPaths())}.
     * @throws IllegalStateException    If the weights of the graph do not decode the id exactly.
     */
    public List<Edge> decodeEdges(long pathId) {
        if (pathId < 0 || pathId >= numPaths()) {
            throw new IllegalArgumentException(String.format(
                    "path id %d outside [0, %d)", pathId, numPaths()));
        }
        List<Edge> path = new ArrayList<>();
        int exit = graph.exit();
        int node = graph.entry();
        long remaining = pathId;
        while (node != exit) {
            Edge next = pickEdge(node, remaining);
            if (next == null) {
                throw new IllegalStateException(String.format(
                        "no edge out of %s for remaining %d of path %d", graph.name(node), remaining, pathId));
            }
            path.add(next);
            remaining -= next.weight2;
            node = next.to;
        }
        if (remaining != 0) {
            throw new IllegalStateException(String.format(
                    "path %d reached %s with %d left over", pathId, graph.name(exit), remaining));
        }
        return path;
    }

    @Nullable
    private Edge pickEdge(int node, long remaining) {
        Edge best = null;
        for (Edge edge : graph.outEdges(node)) {
            // edges into dead ends carry no paths, and share their weight with the next edge
            if (graph.numPaths(edge.to) == 0 || edge.weight2 > remaining) continue;
            if (best == null || edge.weight2 > best.weight2) {
                best = edge;
            } else if (edge.weight2 == best.weight2) {
                logger.atWarning().log("edges %s and %s out of %s have the same weight %d, choosing the first",
                        best, edge, graph.name(node), edge.weight2);
            }
        }
        return best;
    }

    /**
     * Decode a path id to the names of the blocks on its path.
     *
     * @param pathId The path id.
     * @return The block names, in order.
     */
    public List<String> decode(long pathId) {
        List<Edge> edges = decodeEdges(pathId);
        List<String> names = new ArrayList<>(edges.size() + 1);
        for (Edge edge : edges) {
            if (edge.synthetic && edge.from == graph.entry()) continue;
            names.add(graph.name(edge.from));
        }
        if (edges.isEmpty() || !edges.get(edges.size() - 1).synthetic) {
            names.add(graph.name(graph.exit()));
        }
        return names;
    }

    /**
     * Decode the ids recorded over one run, in the order they were recorded, into the
     * blocks executed by the whole run.
     *
     * @param pathIds The path ids.
     * @return The block names of each path, concatenated.
     */
    public List<String> decodeTrace(Iterable<Long> pathIds) {
        List<String> names = new ArrayList<>();
        for (long pathId : pathIds) {
            names.addAll(decode(pathId));
        }
        return names;
    }
}
