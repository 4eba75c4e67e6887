package io.github.eutro.pathprof.test;

import io.github.eutro.pathprof.ProfilerOptions;
import io.github.eutro.pathprof.cfg.ProfileGraph;
import io.github.eutro.pathprof.instrument.InstrumentIR;
import io.github.eutro.pathprof.ir.*;
import io.github.eutro.pathprof.passes.BuildCfg;
import io.github.eutro.pathprof.passes.Passes;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InstrumentIRTest {
    private static final String R = ProfilerOptions.DEFAULT_REGISTER;
    private static final String[] PROGRAMS = {
            "/diamond.ir", "/loop.ir", "/fallthrough.ir", "/nested.ir", "/selfloop.ir", "/rotated.ir"
    };

    private static LinearIR instrument(LinearIR ir, ProfilerOptions options) {
        ProfileGraph graph = Passes.numberPaths(options).run(BuildCfg.INSTANCE.run(ir));
        return new InstrumentIR(graph, options).run(ir);
    }

    private static ProfilerOptions options(boolean optimize) {
        return new ProfilerOptions().setOptimizeEventCounting(optimize);
    }

    @Test
    void testDiamond() {
        LinearIR ir = Utils.getProgram("/diamond.ir");
        LinearIR instrumented = instrument(ir, options(true));
        List<IREntry> expected = new ArrayList<>();
        expected.add(IREntry.next(ProfileInsn.set(R, 0)));
        expected.add(ir.get(0).withOffset(3));
        expected.add(ir.get(1));
        expected.add(ir.get(2).withOffset(5));
        expected.add(ir.get(3));
        expected.add(IREntry.next(ProfileInsn.add(R, 1)));
        expected.add(new IREntry(ProfileInsn.jump(R), 2));
        expected.add(new IREntry(ProfileInsn.jump(R), 1));
        expected.add(IREntry.next(ProfileInsn.count(R)));
        expected.add(IREntry.next(ProfileInsn.dump(R)));
        assertEquals(expected, instrumented.entries());
        assertEquals("A", instrumented.label(1));
        assertEquals("C", instrumented.label(4));
    }

    @Test
    void testDiamondUnoptimized() {
        LinearIR ir = Utils.getProgram("/diamond.ir");
        LinearIR instrumented = instrument(ir, options(false));
        List<IREntry> expected = new ArrayList<>();
        expected.add(IREntry.next(ProfileInsn.set(R, 0)));
        expected.add(ir.get(0).withOffset(6));
        expected.add(ir.get(1));
        expected.add(ir.get(2).withOffset(6));
        expected.add(ir.get(3));
        expected.add(new IREntry(ProfileInsn.jump(R), 4));
        expected.add(new IREntry(ProfileInsn.jump(R), 3));
        expected.add(IREntry.next(ProfileInsn.add(R, 1)));
        expected.add(new IREntry(ProfileInsn.jump(R), -4));
        expected.add(IREntry.next(ProfileInsn.count(R)));
        expected.add(IREntry.next(ProfileInsn.dump(R)));
        assertEquals(expected, instrumented.entries());
    }

    @Test
    void testSelfLoop() {
        // the branch back to L is retargeted at the back edge trampoline
        LinearIR ir = Utils.getProgram("/selfloop.ir");
        LinearIR instrumented = instrument(ir, options(false));
        List<IREntry> expected = new ArrayList<>();
        expected.add(IREntry.next(ProfileInsn.set(R, 0)));
        expected.add(ir.get(0));
        expected.add(ir.get(1));
        expected.add(ir.get(2).withOffset(2));
        expected.add(new IREntry(ProfileInsn.jump(R), 5));
        expected.add(IREntry.next(ProfileInsn.add(R, 1)));
        expected.add(IREntry.next(ProfileInsn.count(R)));
        expected.add(IREntry.next(ProfileInsn.set(R, 2)));
        expected.add(new IREntry(ProfileInsn.jump(R), -6));
        expected.add(IREntry.next(ProfileInsn.count(R)));
        expected.add(IREntry.next(ProfileInsn.dump(R)));
        assertEquals(expected, instrumented.entries());
        assertEquals("L", instrumented.label(2));
    }

    @Test
    void testRotatedLoop() {
        // the back edge is the fallthrough of A's test, so a jump to its trampoline is inserted,
        // and the jump out of the loop goes through an increment before reaching the exit
        LinearIR ir = Utils.getProgram("/rotated.ir");
        LinearIR instrumented = instrument(ir, options(true));
        List<IREntry> expected = new ArrayList<>();
        expected.add(IREntry.next(ProfileInsn.set(R, 0)));
        expected.add(ir.get(0));
        expected.add(IREntry.next(ProfileInsn.add(R, -2)));
        expected.add(ir.get(1).withOffset(3));
        expected.add(ir.get(2).withOffset(10));
        expected.add(new IREntry(ProfileInsn.jump(R), 5));
        expected.add(ir.get(3));
        expected.add(IREntry.next(ProfileInsn.add(R, 3)));
        expected.add(ir.get(4).withOffset(-4));
        expected.add(new IREntry(ProfileInsn.jump(R), 7));
        expected.add(IREntry.next(ProfileInsn.add(R, 0)));
        expected.add(IREntry.next(ProfileInsn.count(R)));
        expected.add(IREntry.next(ProfileInsn.set(R, 0)));
        expected.add(new IREntry(ProfileInsn.jump(R), -7));
        expected.add(IREntry.next(ProfileInsn.add(R, -1)));
        expected.add(new IREntry(ProfileInsn.jump(R), 1));
        expected.add(IREntry.next(ProfileInsn.count(R)));
        expected.add(IREntry.next(ProfileInsn.dump(R)));
        assertEquals(expected, instrumented.entries());
        assertEquals("A", instrumented.label(4));
        assertEquals("H", instrumented.label(6));
    }

    @Test
    void testRotatedLoopUnoptimized() {
        LinearIR ir = Utils.getProgram("/rotated.ir");
        LinearIR instrumented = instrument(ir, options(false));
        List<IREntry> expected = new ArrayList<>();
        expected.add(IREntry.next(ProfileInsn.set(R, 0)));
        expected.add(ir.get(0));
        expected.add(ir.get(1).withOffset(3));
        expected.add(ir.get(2).withOffset(9));
        expected.add(new IREntry(ProfileInsn.jump(R), 4));
        expected.add(ir.get(3));
        expected.add(ir.get(4).withOffset(-3));
        expected.add(new IREntry(ProfileInsn.jump(R), 5));
        expected.add(IREntry.next(ProfileInsn.add(R, 1)));
        expected.add(IREntry.next(ProfileInsn.count(R)));
        expected.add(IREntry.next(ProfileInsn.set(R, 2)));
        expected.add(new IREntry(ProfileInsn.jump(R), -6));
        expected.add(IREntry.next(ProfileInsn.count(R)));
        expected.add(IREntry.next(ProfileInsn.dump(R)));
        assertEquals(expected, instrumented.entries());
    }

    @Test
    void testInputUnchanged() {
        for (String program : PROGRAMS) {
            LinearIR ir = Utils.getProgram(program);
            instrument(ir, options(true));
            assertEquals(Utils.getProgram(program), ir, program);
        }
    }

    /**
     * Skip over profiling instructions, following their jumps, to the next host instruction or the exit.
     */
    private static int resolve(LinearIR ir, int pc) {
        while (pc < ir.size() && ir.get(pc).insn instanceof ProfileInsn) {
            pc += ir.get(pc).offset;
        }
        return pc;
    }

    @Test
    void testControlFlowPreserved() {
        for (String program : PROGRAMS) {
            for (boolean optimize : new boolean[]{true, false}) {
                LinearIR ir = Utils.getProgram(program);
                LinearIR instrumented = instrument(ir, options(optimize));

                List<Integer> hostPositions = new ArrayList<>();
                for (int i = 0; i < instrumented.size(); i++) {
                    if (instrumented.get(i).insn instanceof HostInsn) hostPositions.add(i);
                }
                assertEquals(ir.size(), hostPositions.size(), program);
                hostPositions.add(instrumented.size());

                assertEquals(hostPositions.get(0).intValue(), resolve(instrumented, 0), program);
                for (int k = 0; k < ir.size(); k++) {
                    int at = hostPositions.get(k);
                    IREntry original = ir.get(k);
                    IREntry entry = instrumented.get(at);
                    assertEquals(original.insn, entry.insn, program);
                    if (original.isJump()) {
                        assertEquals(hostPositions.get(original.targetFrom(k)).intValue(),
                                resolve(instrumented, entry.targetFrom(at)),
                                program + ": jump at " + k);
                    }
                    if (original.insn.jumpKind() != JumpKind.ALWAYS) {
                        assertEquals(hostPositions.get(k + 1).intValue(),
                                resolve(instrumented, at + 1),
                                program + ": fallthrough at " + k);
                    }
                }
            }
        }
    }

    @Test
    void testKeepZeroIncrements() {
        LinearIR instrumented = instrument(Utils.getProgram("/diamond.ir"),
                options(false).setElideZeroIncrements(false));
        int adds = 0;
        for (IREntry entry : instrumented) {
            if (entry.insn instanceof ProfileInsn && ((ProfileInsn) entry.insn).kind == ProfileInsn.Kind.ADD) {
                adds++;
            }
        }
        assertEquals(5, adds);
    }

    @Test
    void testRegister() {
        LinearIR instrumented = instrument(Utils.getProgram("/nested.ir"), options(true).setRegister("pr"));
        int profiling = 0;
        for (IREntry entry : instrumented) {
            if (entry.insn instanceof ProfileInsn) {
                assertEquals("pr", ((ProfileInsn) entry.insn).register);
                profiling++;
            }
        }
        assertTrue(profiling > 0);
    }

    @Test
    void testUnnumbered() {
        ProfileGraph graph = ProfileGraph.of(Utils.getCfg("/diamond.ir"));
        assertThrows(IllegalArgumentException.class, () -> new InstrumentIR(graph, new ProfilerOptions()));
    }
}
