package io.github.eutro.pathprof.cfg;

/**
 * An edge between two blocks, with the attributes the numbering phases derive for it.
 * <p>
 * Edges are immutable; the {@code with*} methods return modified copies.
 */
public final class Edge {
    /**
     * The source block id.
     */
    public final int from;
    /**
     * The target block id.
     */
    public final int to;
    public final EdgeLabel label;
    /**
     * The index of the {@link ControlFlowGraph#edges() CFG edge} this edge is, or, for a
     * synthetic edge, the index of the back edge it replaces.
     */
    public final int origin;
    /**
     * Whether this edge closes a cycle in a depth-first traversal from the entry.
     */
    public final boolean backEdge;
    /**
     * Whether this edge was added to stand in for a removed back edge.
     */
    public final boolean synthetic;
    /**
     * Whether this edge is part of the maximum spanning tree, and so needs no runtime update.
     */
    public final boolean treeEdge;
    /**
     * The amount added to the path register when this edge is taken.
     */
    public final long weight;
    /**
     * The weight this edge had before spanning tree optimisation, used to decode paths.
     */
    public final long weight2;

    private Edge(
            int from,
            int to,
            EdgeLabel label,
            int origin,
            boolean backEdge,
            boolean synthetic,
            boolean treeEdge,
            long weight,
            long weight2
    ) {
        this.from = from;
        this.to = to;
        this.label = label;
        this.origin = origin;
        this.backEdge = backEdge;
        this.synthetic = synthetic;
        this.treeEdge = treeEdge;
        this.weight = weight;
        this.weight2 = weight2;
    }

    /**
     * Create a plain CFG edge.
     *
     * @param origin The index of the edge in its graph.
     * @param from   The source block id.
     * @param to     The target block id.
     * @param label  The label.
     * @return The edge.
     */
    public static Edge of(int origin, int from, int to, EdgeLabel label) {
        return new Edge(from, to, label, origin, false, false, false, 0, 0);
    }

    /**
     * Create a synthetic edge standing in for a removed back edge.
     *
     * @param backEdge The back edge being replaced.
     * @param from     The source block id.
     * @param to       The target block id.
     * @return The edge.
     */
    public static Edge synthetic(Edge backEdge, int from, int to) {
        return new Edge(from, to, EdgeLabel.FLOW, backEdge.origin, false, true, false, 0, 0);
    }

    public Edge withBackEdge(boolean backEdge) {
        return new Edge(from, to, label, origin, backEdge, synthetic, treeEdge, weight, weight2);
    }

    public Edge withTreeEdge(boolean treeEdge) {
        return new Edge(from, to, label, origin, backEdge, synthetic, treeEdge, weight, weight2);
    }

    public Edge withWeight(long weight) {
        return new Edge(from, to, label, origin, backEdge, synthetic, treeEdge, weight, weight2);
    }

    public Edge withWeight2(long weight2) {
        return new Edge(from, to, label, origin, backEdge, synthetic, treeEdge, weight, weight2);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(from).append(" -> ").append(to).append(" [").append(label);
        if (backEdge) sb.append(", back");
        if (synthetic) sb.append(", synthetic");
        if (treeEdge) sb.append(", tree");
        sb.append(", w=").append(weight).append(", w2=").append(weight2).append(']');
        return sb.toString();
    }
}
