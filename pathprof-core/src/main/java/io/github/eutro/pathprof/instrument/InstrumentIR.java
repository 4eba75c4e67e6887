package io.github.eutro.pathprof.instrument;

import com.google.common.flogger.GoogleLogger;
import io.github.eutro.pathprof.ProfilerOptions;
import io.github.eutro.pathprof.cfg.BasicBlock;
import io.github.eutro.pathprof.cfg.ControlFlowGraph;
import io.github.eutro.pathprof.cfg.Edge;
import io.github.eutro.pathprof.cfg.EdgeLabel;
import io.github.eutro.pathprof.cfg.ProfileGraph;
import io.github.eutro.pathprof.instrument.OffsetRewriter.Binding;
import io.github.eutro.pathprof.ir.IREntry;
import io.github.eutro.pathprof.ir.Insn;
import io.github.eutro.pathprof.ir.JumpKind;
import io.github.eutro.pathprof.ir.LinearIR;
import io.github.eutro.pathprof.ir.ProfileInsn;
import io.github.eutro.pathprof.passes.IRPass;

import java.util.*;

/**
 * Rewrites a program so that the path register accumulates the id of the acyclic path
 * taken, according to the weights of a numbered {@link ProfileGraph}.
 * <p>
 * The register is zeroed on entry. Edges that fall through get their increment inserted
 * right after their source block. Conditional jumps are redirected to trampolines appended
 * at the end of the program, which add the increment and jump on to the original target.
 * Back edges are redirected to trampolines that finish the current path, record it, and
 * start a new one at the loop header. On exit, the last path is recorded and the counts dumped.
 * <p>
 * The input program is never modified.
 */
public class InstrumentIR implements IRPass<LinearIR, LinearIR> {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private final ProfileGraph graph;
    private final ProfilerOptions options;

    /**
     * Construct an instrumentation pass.
     *
     * @param graph   The numbered graph of the program that will be instrumented.
     * @param options The options.
     */
    public InstrumentIR(ProfileGraph graph, ProfilerOptions options) {
        if (!graph.hasNumPaths()) {
            throw new IllegalArgumentException("graph has not been numbered");
        }
        this.graph = graph;
        this.options = options;
    }

    @Override
    public LinearIR run(LinearIR ir) {
        LinearIR result = new Rewrite(ir).run();
        logger.atFinest().log("instrumented program:\n%s", result);
        logger.atFine().log("instrumented %d instructions into %d", ir.size(), result.size());
        return result;
    }

    private class Rewrite {
        private final ControlFlowGraph cfg = graph.cfg();
        private final String register = options.getRegister();
        private final int entry = graph.entry();
        private final int exit = graph.exit();
        private final int[] first;
        private final int[] last;
        private List<IREntry> entries;
        private Map<Integer, String> labels;

        Rewrite(LinearIR ir) {
            entries = ir.entries();
            labels = new HashMap<>(ir.labels());
            first = new int[graph.blockCount()];
            last = new int[graph.blockCount()];
            for (BasicBlock block : cfg.blocks()) {
                if (block.id == entry || block.id == exit) continue;
                if (block.isEmpty()) {
                    throw new IllegalArgumentException("block " + block.name + " owns no instructions");
                }
                if (block.lastIndex >= ir.size()) {
                    throw new IllegalArgumentException(String.format(
                            "block %s ends at %d, past the end of the program", block.name, block.lastIndex));
                }
                first[block.id] = block.firstIndex;
                last[block.id] = block.lastIndex;
            }
        }

        LinearIR run() {
            // the entry block owns the initialisation
            insert(0, ProfileInsn.set(register, 0), Binding.BEFORE_TARGETS);
            first[entry] = 0;
            last[entry] = 0;

            for (Edge edge : cfg.edges()) {
                if (graph.isBackEdge(edge.origin)) continue;
                if (edge.label != EdgeLabel.COND_FALSE) {
                    long weight = graph.realEdge(edge.origin).weight;
                    if (needsIncrement(weight)) {
                        if (terminalKind(edge.from) == JumpKind.ALWAYS) {
                            // the slot after an unconditional jump is never reached
                            insert(last[edge.from], ProfileInsn.add(register, weight), Binding.AT_TARGET);
                        } else {
                            insert(last[edge.from] + 1, ProfileInsn.add(register, weight), Binding.BEFORE_TARGETS);
                        }
                    }
                }
                if (edge.to == exit) {
                    // stops fallthrough into the trampolines appended below
                    insertJump(end(), ProfileInsn.jump(register), end(), Binding.BEFORE_TARGETS);
                }
            }

            for (Edge edge : cfg.edges()) {
                if (graph.isBackEdge(edge.origin)) {
                    instrumentBackEdge(edge);
                } else if (edge.label == EdgeLabel.COND_FALSE) {
                    long weight = graph.realEdge(edge.origin).weight;
                    if (needsIncrement(weight)) {
                        int trampoline = end();
                        insert(trampoline, ProfileInsn.add(register, weight), Binding.BEFORE_TARGETS);
                        redirect(edge, trampoline);
                        insertJump(end(), ProfileInsn.jump(register), firstOf(edge.to), Binding.BEFORE_TARGETS);
                    }
                }
            }

            // jumps to the exit now record the final path
            insert(end(), ProfileInsn.count(register), Binding.AT_TARGET);
            insert(end(), ProfileInsn.dump(register), Binding.BEFORE_TARGETS);
            return LinearIR.of(entries, labels);
        }

        private void instrumentBackEdge(Edge backEdge) {
            long exitWeight = graph.syntheticExitFor(backEdge).weight;
            long entryWeight = graph.syntheticEntryFor(backEdge).weight;
            int trampoline = end();
            insert(trampoline, ProfileInsn.add(register, exitWeight), Binding.BEFORE_TARGETS);
            trampoline = redirect(backEdge, trampoline);
            insert(end(), ProfileInsn.count(register), Binding.BEFORE_TARGETS);
            insert(end(), ProfileInsn.set(register, entryWeight), Binding.BEFORE_TARGETS);
            insertJump(end(), ProfileInsn.jump(register), firstOf(backEdge.to), Binding.BEFORE_TARGETS);
            logger.atFine().log("back edge %s -> %s: trampoline at %d",
                    graph.name(backEdge.from), graph.name(backEdge.to), trampoline);
        }

        /**
         * Make an edge lead to some position instead of its target.
         *
         * @return The position, which moves if a jump had to be inserted before it.
         */
        private int redirect(Edge edge, int target) {
            int terminal = last[edge.from];
            JumpKind kind = terminalKind(edge.from);
            boolean isJumpEdge = edge.label == EdgeLabel.COND_FALSE
                    || (edge.label == EdgeLabel.FLOW && kind == JumpKind.ALWAYS);
            if (isJumpEdge) {
                entries = OffsetRewriter.retarget(entries, terminal, target);
                verify();
                return target;
            }
            int at = terminal + 1;
            insertJump(at, ProfileInsn.jump(register), target, Binding.BEFORE_TARGETS);
            return OffsetRewriter.mapPosition(target, at);
        }

        private boolean needsIncrement(long weight) {
            return weight != 0 || !options.isElideZeroIncrements();
        }

        private JumpKind terminalKind(int block) {
            return entries.get(last[block]).insn.jumpKind();
        }

        private int firstOf(int block) {
            return block == exit ? end() : first[block];
        }

        private int end() {
            return entries.size();
        }

        private void insert(int at, Insn insn, Binding binding) {
            entries = OffsetRewriter.insert(entries, at, insn, binding);
            shift(at, binding);
        }

        private void insertJump(int at, Insn insn, int targetBefore, Binding binding) {
            entries = OffsetRewriter.insert(entries, at, insn, targetBefore, binding);
            shift(at, binding);
        }

        private void shift(int at, Binding binding) {
            for (int block = 0; block < first.length; block++) {
                if (block == exit) continue;
                first[block] = OffsetRewriter.mapTarget(first[block], at, binding);
                last[block] = OffsetRewriter.mapPosition(last[block], at);
            }
            Map<Integer, String> shifted = new HashMap<>();
            for (Map.Entry<Integer, String> label : labels.entrySet()) {
                shifted.put(OffsetRewriter.mapTarget(label.getKey(), at, binding), label.getValue());
            }
            labels = shifted;
            verify();
        }

        private void verify() {
            if (options.isVerifyOffsets()) {
                OffsetRewriter.validate(entries);
            }
        }
    }
}
