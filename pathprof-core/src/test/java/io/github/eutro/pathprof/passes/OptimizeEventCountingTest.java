package io.github.eutro.pathprof.passes;

import io.github.eutro.pathprof.ProfilingException;
import io.github.eutro.pathprof.cfg.ProfileGraph;
import io.github.eutro.pathprof.ir.LinearIR;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OptimizeEventCountingTest {
    private static final String DIAMOND = "A:\n  if :x > 0 else C\nB:\n  y = 1\n  goto done\nC:\n  y = 2\ndone:\n";

    private static void link(List<List<OptimizeEventCounting.TreeStep>> tree, int from, int to, long weight) {
        tree.get(from).add(new OptimizeEventCounting.TreeStep(to, weight));
        tree.get(to).add(new OptimizeEventCounting.TreeStep(from, -weight));
    }

    @Test
    void testTreePathSum() {
        ProfileGraph graph = Passes.REDUCE_AND_COUNT.run(BuildCfg.INSTANCE.run(LinearIR.parse(DIAMOND)));
        int a = graph.cfg().block("A").id;
        int b = graph.cfg().block("B").id;
        int c = graph.cfg().block("C").id;
        int end = graph.exit();

        List<List<OptimizeEventCounting.TreeStep>> tree = new ArrayList<>();
        for (int i = 0; i < graph.blockCount(); i++) {
            tree.add(new ArrayList<>());
        }
        link(tree, a, b, 5);
        link(tree, b, c, 2);

        assertEquals(7, OptimizeEventCounting.treePathSum(graph, tree, a, c));
        assertEquals(-7, OptimizeEventCounting.treePathSum(graph, tree, c, a));
        assertEquals(0, OptimizeEventCounting.treePathSum(graph, tree, b, b));

        // END was left out of the tree
        ProfilingException e = assertThrows(ProfilingException.class,
                () -> OptimizeEventCounting.treePathSum(graph, tree, a, end));
        assertEquals(ProfilingException.Kind.SPANNING_TREE_PATH_NOT_FOUND, e.getKind());
        assertTrue(e.getMessage().contains("from A to END"), e.getMessage());
    }
}
