package io.github.eutro.pathprof.cfg;

import io.github.eutro.pathprof.ProfilingException;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A control flow graph over a linear IR, as supplied by a front end.
 * <p>
 * Blocks form an arena addressed by {@link BasicBlock#id}. Edges are kept in the order
 * they were added, which is the order every traversal of the graph follows.
 * <p>
 * The graph is immutable once {@link Builder#build() built}.
 */
public final class ControlFlowGraph {
    /**
     * The name of the entry block.
     */
    public static final String ENTRY_NAME = "START";
    /**
     * The name of the exit block.
     */
    public static final String EXIT_NAME = "END";

    private final List<BasicBlock> blocks;
    private final List<Edge> edges;
    private final Map<String, BasicBlock> byName;
    private final List<List<Edge>> outEdges;

    private ControlFlowGraph(List<BasicBlock> blocks, List<Edge> edges) {
        this.blocks = Collections.unmodifiableList(blocks);
        this.edges = Collections.unmodifiableList(edges);
        Map<String, BasicBlock> byName = new HashMap<>();
        for (BasicBlock block : blocks) {
            byName.put(block.name, block);
        }
        this.byName = byName;
        List<List<Edge>> outEdges = new ArrayList<>();
        for (int i = 0; i < blocks.size(); i++) {
            outEdges.add(new ArrayList<>());
        }
        for (Edge edge : edges) {
            outEdges.get(edge.from).add(edge);
        }
        this.outEdges = outEdges;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<BasicBlock> blocks() {
        return blocks;
    }

    public List<Edge> edges() {
        return edges;
    }

    public BasicBlock block(int id) {
        return blocks.get(id);
    }

    @Nullable
    public BasicBlock block(String name) {
        return byName.get(name);
    }

    /**
     * Get the entry block, named {@value ENTRY_NAME}.
     *
     * @return The entry block.
     * @throws ProfilingException If there is no such block.
     */
    public BasicBlock entry() {
        BasicBlock entry = byName.get(ENTRY_NAME);
        if (entry == null) {
            throw new ProfilingException(ProfilingException.Kind.MISSING_ENTRY_NODE,
                    "no block named " + ENTRY_NAME);
        }
        return entry;
    }

    /**
     * Get the exit block, named {@value EXIT_NAME}.
     *
     * @return The exit block.
     * @throws ProfilingException If there is no such block.
     */
    public BasicBlock exit() {
        BasicBlock exit = byName.get(EXIT_NAME);
        if (exit == null) {
            throw new ProfilingException(ProfilingException.Kind.MISSING_EXIT_NODE,
                    "no block named " + EXIT_NAME);
        }
        return exit;
    }

    /**
     * Get the edges leaving a block, in the order they were added.
     *
     * @param id The block id.
     * @return The out-edges.
     */
    public List<Edge> outEdges(int id) {
        return Collections.unmodifiableList(outEdges.get(id));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("cfg {\n");
        for (BasicBlock block : blocks) {
            sb.append(' ').append(block).append(" ->");
            for (Edge edge : outEdges.get(block.id)) {
                sb.append(' ').append(blocks.get(edge.to).name).append('(').append(edge.label).append(')');
            }
            sb.append('\n');
        }
        return sb.append('}').toString();
    }

    /**
     * A builder for {@link ControlFlowGraph}s.
     */
    public static class Builder {
        private final List<BasicBlock> blocks = new ArrayList<>();
        private final List<Edge> edges = new ArrayList<>();
        private final Map<String, Integer> ids = new HashMap<>();

        private Builder() {
        }

        /**
         * Add a block owning the instructions {@code firstIndex..lastIndex}, inclusive.
         *
         * @param name       The unique name of the block.
         * @param firstIndex The index of its first instruction.
         * @param lastIndex  The index of its last instruction.
         * @return The id of the new block.
         */
        public int addBlock(String name, int firstIndex, int lastIndex) {
            if (ids.containsKey(name)) {
                throw new IllegalArgumentException("duplicate block name: " + name);
            }
            if (firstIndex > lastIndex || (firstIndex < 0) != (lastIndex < 0)) {
                throw new IllegalArgumentException(String.format(
                        "invalid instruction range for %s: %d..%d", name, firstIndex, lastIndex));
            }
            int id = blocks.size();
            blocks.add(new BasicBlock(id, name, firstIndex, lastIndex));
            ids.put(name, id);
            return id;
        }

        /**
         * Add a block that owns no instructions, such as the entry and exit sentinels.
         *
         * @param name The unique name of the block.
         * @return The id of the new block.
         */
        public int addBlock(String name) {
            return addBlock(name, -1, -1);
        }

        public Builder addEdge(int from, int to, EdgeLabel label) {
            if (from < 0 || from >= blocks.size() || to < 0 || to >= blocks.size()) {
                throw new IllegalArgumentException(String.format("edge %d -> %d refers to a missing block", from, to));
            }
            edges.add(Edge.of(edges.size(), from, to, label));
            return this;
        }

        public Builder addEdge(String from, String to, EdgeLabel label) {
            return addEdge(idOf(from), idOf(to), label);
        }

        private int idOf(String name) {
            Integer id = ids.get(name);
            if (id == null) throw new IllegalArgumentException("no block named " + name);
            return id;
        }

        public ControlFlowGraph build() {
            return new ControlFlowGraph(new ArrayList<>(blocks), new ArrayList<>(edges));
        }
    }
}
