package io.github.eutro.pathprof.test;

import io.github.eutro.pathprof.cfg.BasicBlock;
import io.github.eutro.pathprof.cfg.ControlFlowGraph;
import io.github.eutro.pathprof.cfg.Edge;
import io.github.eutro.pathprof.cfg.EdgeLabel;
import io.github.eutro.pathprof.ir.LinearIR;
import io.github.eutro.pathprof.passes.BuildCfg;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BuildCfgTest {
    private static List<String> names(ControlFlowGraph cfg) {
        List<String> names = new ArrayList<>();
        for (BasicBlock block : cfg.blocks()) {
            names.add(block.name);
        }
        return names;
    }

    private static List<String> edges(ControlFlowGraph cfg) {
        List<String> edges = new ArrayList<>();
        for (Edge edge : cfg.edges()) {
            edges.add(cfg.block(edge.from).name + "->" + cfg.block(edge.to).name + ":" + edge.label);
        }
        return edges;
    }

    @Test
    void testDiamond() {
        ControlFlowGraph cfg = Utils.getCfg("/diamond.ir");
        assertEquals(Arrays.asList("START", "A", "B", "C", "END"), names(cfg));
        assertEquals(0, cfg.block("A").firstIndex);
        assertEquals(0, cfg.block("A").lastIndex);
        assertEquals(1, cfg.block("B").firstIndex);
        assertEquals(2, cfg.block("B").lastIndex);
        assertEquals(3, cfg.block("C").firstIndex);
        assertEquals(Arrays.asList(
                "START->A:flow_edge",
                "A->B:Cond_True",
                "A->C:Cond_False",
                "B->END:flow_edge",
                "C->END:flow_edge"
        ), edges(cfg));
    }

    @Test
    void testLoop() {
        ControlFlowGraph cfg = Utils.getCfg("/loop.ir");
        assertEquals(Arrays.asList("START", "B0", "H", "B2", "END"), names(cfg));
        assertEquals(Arrays.asList(
                "START->B0:flow_edge",
                "B0->H:flow_edge",
                "H->B2:Cond_True",
                "H->END:Cond_False",
                "B2->H:flow_edge"
        ), edges(cfg));
    }

    @Test
    void testEmptyProgram() {
        ControlFlowGraph cfg = BuildCfg.INSTANCE.run(LinearIR.parse("# nothing\n"));
        assertEquals(Arrays.asList("START", "END"), names(cfg));
        assertEquals(1, cfg.edges().size());
        assertEquals(EdgeLabel.FLOW, cfg.edges().get(0).label);
    }

    @Test
    void testReservedAndClashingNames() {
        ControlFlowGraph cfg = BuildCfg.INSTANCE.run(LinearIR.parse(
                "END:\n" +
                        "  if x else B0\n" +
                        "  x = 1\n" +
                        "B0:\n" +
                        "  goto END\n"
        ));
        // "END" is taken by the exit, so the first block falls back to its index, which "B0" already has
        assertEquals(Arrays.asList("START", "B0_", "B1", "B0", "END"), names(cfg));
        assertEquals("B0->B0_:flow_edge", edges(cfg).get(4));
    }
}
