package io.github.eutro.pathprof.passes;

import com.google.common.flogger.GoogleLogger;
import io.github.eutro.pathprof.cfg.BasicBlock;
import io.github.eutro.pathprof.cfg.ControlFlowGraph;
import io.github.eutro.pathprof.cfg.Edge;
import io.github.eutro.pathprof.cfg.EdgeLabel;
import io.github.eutro.pathprof.ir.IREntry;
import io.github.eutro.pathprof.ir.JumpKind;
import io.github.eutro.pathprof.ir.LinearIR;
import io.github.eutro.pathprof.util.GraphWalker;

import java.util.*;

/**
 * Splits a {@link LinearIR} into basic blocks, and connects them in a {@link ControlFlowGraph}
 * between the {@code START} and {@code END} sentinels.
 * <p>
 * A block starts at index 0, at each jump target, and after each jump. Blocks take the name of
 * the label at their first instruction where there is one, and {@code B<index>} otherwise.
 * Edges are added in instruction order; a conditional's {@code Cond_True} fallthrough edge comes
 * before its {@code Cond_False} jump edge.
 */
public class BuildCfg implements IRPass<LinearIR, ControlFlowGraph> {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    public static final BuildCfg INSTANCE = new BuildCfg();

    @Override
    public ControlFlowGraph run(LinearIR ir) {
        int size = ir.size();
        TreeSet<Integer> leaders = new TreeSet<>();
        if (size > 0) leaders.add(0);
        for (int i = 0; i < size; i++) {
            IREntry entry = ir.get(i);
            if (entry.isJump()) {
                int target = entry.targetFrom(i);
                if (target < size) leaders.add(target);
                if (i + 1 < size) leaders.add(i + 1);
            }
        }

        List<String> names = blockNames(ir, leaders);
        ControlFlowGraph.Builder cb = ControlFlowGraph.builder();
        int start = cb.addBlock(ControlFlowGraph.ENTRY_NAME);
        Map<Integer, Integer> blockAt = new HashMap<>();
        int n = 0;
        for (int leader : leaders) {
            Integer next = leaders.higher(leader);
            int last = (next == null ? size : next) - 1;
            blockAt.put(leader, cb.addBlock(names.get(n++), leader, last));
        }
        int end = cb.addBlock(ControlFlowGraph.EXIT_NAME);
        blockAt.put(size, end);

        // an empty program goes straight to END
        cb.addEdge(start, blockAt.get(0), EdgeLabel.FLOW);
        for (int leader : leaders) {
            Integer next = leaders.higher(leader);
            int last = (next == null ? size : next) - 1;
            int block = blockAt.get(leader);
            IREntry terminal = ir.get(last);
            JumpKind kind = terminal.insn.jumpKind();
            switch (kind) {
                case CONDITIONAL:
                    cb.addEdge(block, blockAt.get(last + 1), EdgeLabel.COND_TRUE);
                    cb.addEdge(block, blockAt.get(terminal.targetFrom(last)), EdgeLabel.COND_FALSE);
                    break;
                case ALWAYS:
                    cb.addEdge(block, blockAt.get(terminal.targetFrom(last)), EdgeLabel.FLOW);
                    break;
                default:
                    cb.addEdge(block, blockAt.get(last + 1), EdgeLabel.FLOW);
                    break;
            }
        }
        ControlFlowGraph cfg = cb.build();
        logUnreachable(cfg);
        return cfg;
    }

    private static List<String> blockNames(LinearIR ir, Set<Integer> leaders) {
        Set<String> taken = new HashSet<>();
        taken.add(ControlFlowGraph.ENTRY_NAME);
        taken.add(ControlFlowGraph.EXIT_NAME);
        String[] names = new String[leaders.size()];
        int n = 0;
        for (int leader : leaders) {
            String label = ir.label(leader);
            if (label != null && taken.add(label)) names[n] = label;
            n++;
        }
        n = 0;
        for (int leader : leaders) {
            if (names[n] == null) {
                String name = "B" + leader;
                while (!taken.add(name)) name += "_";
                names[n] = name;
            }
            n++;
        }
        return Arrays.asList(names);
    }

    private static void logUnreachable(ControlFlowGraph cfg) {
        Set<BasicBlock> reachable = new GraphWalker<>(cfg.entry(), $ -> {
            List<BasicBlock> targets = new ArrayList<>();
            for (Edge edge : cfg.outEdges($.id)) {
                targets.add(cfg.block(edge.to));
            }
            return targets;
        }).preOrder().toSet();
        for (BasicBlock block : cfg.blocks()) {
            if (!reachable.contains(block)) {
                logger.atFine().log("block %s is unreachable from %s", block.name, ControlFlowGraph.ENTRY_NAME);
            }
        }
    }
}
