package io.github.eutro.pathprof.passes;

import com.google.common.flogger.GoogleLogger;
import io.github.eutro.pathprof.cfg.ControlFlowGraph;
import io.github.eutro.pathprof.cfg.Edge;
import io.github.eutro.pathprof.cfg.ProfileGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Marks the edges that close a cycle in a depth-first traversal from the entry block.
 * <p>
 * An edge {@code u -> v} is a back edge if {@code v} is on the current traversal path when
 * the edge is explored. Successors are explored in edge order.
 * <p>
 * Blocks left unvisited by the traversal from the entry are then traversed in id order, so
 * that cycles in unreachable code are broken too.
 */
public class FindBackEdges implements IRPass<ControlFlowGraph, ProfileGraph> {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    /**
     * A singleton instance of this pass.
     */
    public static final FindBackEdges INSTANCE = new FindBackEdges();

    @Override
    public ProfileGraph run(ControlFlowGraph cfg) {
        ProfileGraph graph = ProfileGraph.of(cfg);
        int entry = graph.entry();
        boolean[] visited = new boolean[graph.blockCount()];
        boolean[] onPath = new boolean[graph.blockCount()];
        boolean[] isBack = new boolean[graph.edges().size()];

        Deque<int[]> stack = new ArrayDeque<>();
        walk(graph, entry, visited, onPath, isBack, stack);
        for (int block = 0; block < graph.blockCount(); block++) {
            if (!visited[block]) {
                logger.atFine().log("%s is unreachable", graph.name(block));
                walk(graph, block, visited, onPath, isBack, stack);
            }
        }

        List<Edge> edges = new ArrayList<>(graph.edges().size());
        List<Edge> backEdges = new ArrayList<>();
        for (int i = 0; i < graph.edges().size(); i++) {
            Edge edge = graph.edges().get(i).withBackEdge(isBack[i]);
            edges.add(edge);
            if (isBack[i]) backEdges.add(edge);
        }
        logger.atFine().log("found %d back edges: %s", backEdges.size(), backEdges);
        return graph.withEdges(edges, backEdges);
    }

    private static void walk(
            ProfileGraph graph,
            int root,
            boolean[] visited,
            boolean[] onPath,
            boolean[] isBack,
            Deque<int[]> stack
    ) {
        // each frame is {block, index of the next out-edge to explore}
        stack.push(new int[]{root, 0});
        visited[root] = true;
        onPath[root] = true;
        while (!stack.isEmpty()) {
            int[] frame = stack.peek();
            int[] out = graph.outEdgeIndices(frame[0]);
            if (frame[1] == out.length) {
                onPath[frame[0]] = false;
                stack.pop();
                continue;
            }
            int index = out[frame[1]++];
            int to = graph.edges().get(index).to;
            if (onPath[to]) {
                isBack[index] = true;
            } else if (!visited[to]) {
                visited[to] = true;
                onPath[to] = true;
                stack.push(new int[]{to, 0});
            }
        }
    }
}
