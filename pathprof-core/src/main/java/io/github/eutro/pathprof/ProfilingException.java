package io.github.eutro.pathprof;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when path numbering or instrumentation cannot produce a meaningful result.
 * <p>
 * All kinds are fatal: a profiling session that sees one of these aborts before
 * the instrumented program is executed, and the original IR is left untouched.
 */
public class ProfilingException extends RuntimeException {
    /**
     * The kind of failure.
     */
    public enum Kind {
        /**
         * The CFG has no block named {@code START}.
         */
        MISSING_ENTRY_NODE,
        /**
         * The CFG has no block named {@code END}.
         */
        MISSING_EXIT_NODE,
        /**
         * The graph left after removing back edges still has a cycle.
         */
        ACYCLICITY_VIOLATION,
        /**
         * A topological order was requested of a cyclic graph.
         */
        TOPOLOGICAL_ORDER_UNAVAILABLE,
        /**
         * The weights assigned to a node's out-edges do not add up to its path count.
         */
        EDGE_WEIGHT_INVARIANT_VIOLATION,
        /**
         * No path between the endpoints of a chord was found in the spanning tree.
         */
        SPANNING_TREE_PATH_NOT_FOUND,
        /**
         * A jump's target fell outside the instruction sequence after an insertion.
         */
        INVALID_OFFSET_STATE,
    }

    private final Kind kind;
    @Nullable
    private String pass;

    public ProfilingException(Kind kind, String message) {
        super(kind + ": " + message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Get the name of the pass this was thrown from, if it was thrown from a chain of passes.
     *
     * @return The pass name, or null.
     */
    @Nullable
    public String getPass() {
        return pass;
    }

    /**
     * Record the pass this was thrown from. The innermost pass is kept if there are several.
     *
     * @param pass The pass name.
     * @return This.
     */
    public ProfilingException inPass(String pass) {
        if (this.pass == null) this.pass = pass;
        return this;
    }

    @Override
    public String getMessage() {
        return pass == null ? super.getMessage() : super.getMessage() + " (in " + pass + ")";
    }
}
