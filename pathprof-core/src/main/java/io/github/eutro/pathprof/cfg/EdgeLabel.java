package io.github.eutro.pathprof.cfg;

/**
 * How control passes along an edge.
 */
public enum EdgeLabel {
    /**
     * Unconditional control flow, either falling through or taking an unconditional jump.
     */
    FLOW("flow_edge"),
    /**
     * The branch taken when a condition holds, which falls through to the next instruction.
     */
    COND_TRUE("Cond_True"),
    /**
     * The branch taken when a condition does not hold, which jumps by the instruction's offset.
     */
    COND_FALSE("Cond_False");

    private final String displayName;

    EdgeLabel(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
