package io.github.eutro.pathprof.passes;

import com.google.common.flogger.GoogleLogger;
import io.github.eutro.pathprof.ProfilingException;
import io.github.eutro.pathprof.cfg.Edge;
import io.github.eutro.pathprof.cfg.ProfileGraph;

import java.util.*;

/**
 * Moves the path increments off the edges of a maximum spanning tree and onto the
 * remaining edges (chords), so that only chords need to be instrumented.
 * <p>
 * The tree is built over the undirected view of the graph, plus an edge closing
 * {@code END -> START}, which is always taken into the tree first. Each chord
 * {@code u -> v} with weight {@code w} gets the runtime weight
 * {@code w + sum(tree path from v to u)}, where tree edges count positively in
 * their own direction and negatively against it. Every edge keeps its original
 * weight as {@link Edge#weight2}, for decoding.
 * <p>
 * The sum of runtime weights along any path from the entry to the exit equals the
 * sum of its original weights.
 */
public class OptimizeEventCounting implements IRPass<ProfileGraph, ProfileGraph> {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    public static final OptimizeEventCounting INSTANCE = new OptimizeEventCounting();

    @Override
    public ProfileGraph run(ProfileGraph graph) {
        int blockCount = graph.blockCount();
        List<Edge> edges = graph.edges();
        int closing = edges.size();

        List<Integer> byWeight = new ArrayList<>(closing + 1);
        for (int i = 0; i <= closing; i++) {
            byWeight.add(i);
        }
        // stable, so equal weights stay in edge order
        byWeight.sort(Comparator.comparingLong((Integer $) -> $ == closing ? Long.MAX_VALUE : edges.get($).weight)
                .reversed());

        UnionFind sets = new UnionFind(blockCount);
        boolean[] inTree = new boolean[closing + 1];
        List<List<TreeStep>> tree = new ArrayList<>(blockCount);
        for (int i = 0; i < blockCount; i++) {
            tree.add(new ArrayList<>());
        }
        for (int index : byWeight) {
            int from = index == closing ? graph.exit() : edges.get(index).from;
            int to = index == closing ? graph.entry() : edges.get(index).to;
            if (sets.union(from, to)) {
                inTree[index] = true;
                long weight = index == closing ? 0 : edges.get(index).weight;
                tree.get(from).add(new TreeStep(to, weight));
                tree.get(to).add(new TreeStep(from, -weight));
            }
        }

        List<Edge> result = new ArrayList<>(closing);
        int chords = 0;
        for (int i = 0; i < closing; i++) {
            Edge edge = edges.get(i);
            if (inTree[i]) {
                result.add(edge.withTreeEdge(true).withWeight2(edge.weight).withWeight(0));
            } else {
                result.add(edge.withTreeEdge(false)
                        .withWeight2(edge.weight)
                        .withWeight(edge.weight + treePathSum(graph, tree, edge.to, edge.from)));
                chords++;
            }
        }
        logger.atFine().log("%d of %d edges are chords", chords, closing);
        return graph.withEdges(result);
    }

    /**
     * Sum the weights along the path between two blocks of a spanning tree.
     *
     * @param graph The graph the tree spans, for naming blocks.
     * @param tree  For each block, the steps to its neighbours in the tree.
     * @param from  The block to start from.
     * @param to    The block to end at.
     * @return The sum of the step weights along the path.
     * @throws ProfilingException If the blocks are not connected in the tree.
     */
    static long treePathSum(ProfileGraph graph, List<List<TreeStep>> tree, int from, int to) {
        int n = tree.size();
        boolean[] seen = new boolean[n];
        long[] sums = new long[n];
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(from);
        seen[from] = true;
        while (!stack.isEmpty()) {
            int node = stack.pop();
            if (node == to) return sums[node];
            for (TreeStep step : tree.get(node)) {
                if (!seen[step.to]) {
                    seen[step.to] = true;
                    sums[step.to] = sums[node] + step.weight;
                    stack.push(step.to);
                }
            }
        }
        throw new ProfilingException(ProfilingException.Kind.SPANNING_TREE_PATH_NOT_FOUND,
                String.format("no tree path from %s to %s", graph.name(from), graph.name(to)));
    }

    static final class TreeStep {
        final int to;
        final long weight;

        TreeStep(int to, long weight) {
            this.to = to;
            this.weight = weight;
        }
    }

    private static final class UnionFind {
        private final int[] parent;

        UnionFind(int size) {
            parent = new int[size];
            for (int i = 0; i < size; i++) {
                parent[i] = i;
            }
        }

        int find(int x) {
            int root = x;
            while (parent[root] != root) root = parent[root];
            while (parent[x] != root) {
                int next = parent[x];
                parent[x] = root;
                x = next;
            }
            return root;
        }

        /**
         * Merge the sets of two elements.
         *
         * @return Whether they were in different sets.
         */
        boolean union(int a, int b) {
            int ra = find(a);
            int rb = find(b);
            if (ra == rb) return false;
            parent[rb] = ra;
            return true;
        }
    }
}
