package io.github.eutro.pathprof.cfg;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * An immutable snapshot of the edges of a {@link ControlFlowGraph}, with the attributes
 * computed by the path numbering passes.
 * <p>
 * Blocks are shared with the underlying graph; edges are not. Every pass
 * returns a new snapshot rather than changing the one it was given.
 */
public final class ProfileGraph {
    private final ControlFlowGraph cfg;
    private final List<Edge> edges;
    private final List<Edge> backEdges;
    private final long @Nullable [] numPaths;
    private final int[][] outEdges;

    private ProfileGraph(ControlFlowGraph cfg, List<Edge> edges, List<Edge> backEdges, long @Nullable [] numPaths) {
        this.cfg = cfg;
        this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
        this.backEdges = Collections.unmodifiableList(new ArrayList<>(backEdges));
        this.numPaths = numPaths;

        int blockCount = cfg.blocks().size();
        int[] counts = new int[blockCount];
        for (Edge edge : this.edges) {
            counts[edge.from]++;
        }
        outEdges = new int[blockCount][];
        for (int i = 0; i < blockCount; i++) {
            outEdges[i] = new int[counts[i]];
            counts[i] = 0;
        }
        for (int i = 0; i < this.edges.size(); i++) {
            int from = this.edges.get(i).from;
            outEdges[from][counts[from]++] = i;
        }
    }

    /**
     * Take a snapshot of the edges of a graph, with no attributes computed.
     *
     * @param cfg The graph.
     * @return The snapshot.
     */
    public static ProfileGraph of(ControlFlowGraph cfg) {
        return new ProfileGraph(cfg, cfg.edges(), Collections.emptyList(), null);
    }

    /**
     * Get a snapshot with the given edges, and the same back edges and path counts as this one.
     *
     * @param edges The edges.
     * @return The new snapshot.
     */
    public ProfileGraph withEdges(List<Edge> edges) {
        return new ProfileGraph(cfg, edges, backEdges, numPaths);
    }

    public ProfileGraph withEdges(List<Edge> edges, List<Edge> backEdges) {
        return new ProfileGraph(cfg, edges, backEdges, numPaths);
    }

    public ProfileGraph withNumPaths(long[] numPaths) {
        if (numPaths.length != cfg.blocks().size()) {
            throw new IllegalArgumentException("expected a path count for each of " + cfg.blocks().size() + " blocks");
        }
        return new ProfileGraph(cfg, edges, backEdges, numPaths.clone());
    }

    public ControlFlowGraph cfg() {
        return cfg;
    }

    public int blockCount() {
        return cfg.blocks().size();
    }

    public String name(int block) {
        return cfg.block(block).name;
    }

    public int entry() {
        return cfg.entry().id;
    }

    public int exit() {
        return cfg.exit().id;
    }

    public List<Edge> edges() {
        return edges;
    }

    /**
     * Get the back edges of the graph. Once the graph is reduced, these are no longer among its {@link #edges()}.
     *
     * @return The back edges, in graph order.
     */
    public List<Edge> backEdges() {
        return backEdges;
    }

    /**
     * Get the indices into {@link #edges()} of the edges leaving a block, in edge order.
     *
     * @param block The block id.
     * @return The edge indices. Must not be modified.
     */
    public int[] outEdgeIndices(int block) {
        return outEdges[block];
    }

    public List<Edge> outEdges(int block) {
        int[] indices = outEdges[block];
        List<Edge> out = new ArrayList<>(indices.length);
        for (int index : indices) {
            out.add(edges.get(index));
        }
        return out;
    }

    public boolean hasNumPaths() {
        return numPaths != null;
    }

    /**
     * Get the number of distinct paths from a block to the exit.
     *
     * @param block The block id.
     * @return The number of paths.
     * @throws IllegalStateException If path counts have not been computed yet.
     */
    public long numPaths(int block) {
        if (numPaths == null) {
            throw new IllegalStateException("path counts have not been computed");
        }
        return numPaths[block];
    }

    /**
     * Check whether a CFG edge was classified as a back edge.
     *
     * @param origin The index of the edge in the CFG.
     * @return Whether it is a back edge.
     */
    public boolean isBackEdge(int origin) {
        for (Edge backEdge : backEdges) {
            if (backEdge.origin == origin) return true;
        }
        return false;
    }

    /**
     * Find the edge of this snapshot that corresponds to a CFG edge.
     *
     * @param origin The index of the edge in the CFG.
     * @return The edge.
     * @throws NoSuchElementException If it is not in this snapshot, such as if it is a removed back edge.
     */
    public Edge realEdge(int origin) {
        for (Edge edge : edges) {
            if (!edge.synthetic && edge.origin == origin) return edge;
        }
        throw new NoSuchElementException("no edge for CFG edge " + origin);
    }

    /**
     * Find the synthetic edge from the entry to the target of a removed back edge.
     *
     * @param backEdge The back edge.
     * @return The synthetic edge.
     */
    public Edge syntheticEntryFor(Edge backEdge) {
        return findSynthetic(backEdge, entry(), backEdge.to);
    }

    /**
     * Find the synthetic edge from the source of a removed back edge to the exit.
     *
     * @param backEdge The back edge.
     * @return The synthetic edge.
     */
    public Edge syntheticExitFor(Edge backEdge) {
        return findSynthetic(backEdge, backEdge.from, exit());
    }

    private Edge findSynthetic(Edge backEdge, int from, int to) {
        for (int index : outEdges[from]) {
            Edge edge = edges.get(index);
            if (edge.synthetic && edge.origin == backEdge.origin && edge.to == to) return edge;
        }
        throw new NoSuchElementException(String.format("no synthetic edge %s -> %s for back edge %s",
                name(from), name(to), backEdge));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("dag {\n");
        for (int block = 0; block < blockCount(); block++) {
            sb.append(' ').append(name(block));
            if (numPaths != null) sb.append(" (").append(numPaths[block]).append(')');
            sb.append('\n');
            for (Edge edge : outEdges(block)) {
                sb.append("   -> ").append(name(edge.to)).append(' ').append(edge).append('\n');
            }
        }
        return sb.append('}').toString();
    }
}
