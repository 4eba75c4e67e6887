package io.github.eutro.pathprof.test;

import io.github.eutro.pathprof.ProfilerOptions;
import io.github.eutro.pathprof.ProfilingException;
import io.github.eutro.pathprof.cfg.ControlFlowGraph;
import io.github.eutro.pathprof.cfg.EdgeLabel;
import io.github.eutro.pathprof.cfg.ProfileGraph;
import io.github.eutro.pathprof.passes.*;
import io.github.eutro.pathprof.passes.misc.ChainedPass;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ChainedPassTest {
    private static class Explode implements IRPass<ProfileGraph, ProfileGraph> {
        @Override
        public ProfileGraph run(ProfileGraph graph) {
            throw new IllegalStateException("boom");
        }
    }

    @Test
    void testNames() {
        assertEquals("FindBackEdges", ChainedPass.nameOf(FindBackEdges.INSTANCE));
        assertEquals("FindBackEdges -> ReduceToDag -> CountPaths", Passes.REDUCE_AND_COUNT.toString());
        assertEquals("FindBackEdges -> ReduceToDag -> CountPaths -> DebugDisplay -> AssignEdgeWeights"
                        + " -> CopyWeights -> DebugDisplay",
                Passes.numberPaths(new ProfilerOptions().setOptimizeEventCounting(false)).toString());
    }

    @Test
    void testOtherExceptionsMarked() {
        IRPass<ControlFlowGraph, ProfileGraph> pass = FindBackEdges.INSTANCE
                .then(ReduceToDag.INSTANCE.then(new Explode()));
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> pass.run(Utils.getCfg("/diamond.ir")));
        // nested chains are flattened, so only one marker is added
        assertEquals(1, e.getSuppressed().length);
        assertEquals("in pass Explode (3 of 3)", e.getSuppressed()[0].getMessage());
    }

    @Test
    void testInnermostPassKept() {
        ControlFlowGraph.Builder cb = ControlFlowGraph.builder();
        cb.addBlock("A", 0, 0);
        cb.addBlock("END");
        cb.addEdge("A", "END", EdgeLabel.FLOW);
        ControlFlowGraph noEntry = cb.build();
        ProfilingException e = assertThrows(ProfilingException.class, () -> Passes.NUMBER_PATHS.run(noEntry));
        assertEquals(ProfilingException.Kind.MISSING_ENTRY_NODE, e.getKind());
        assertEquals("FindBackEdges", e.getPass());
        assertSame(e, e.inPass("Other"));
        assertEquals("FindBackEdges", e.getPass());
        assertEquals(0, e.getSuppressed().length);
    }
}
