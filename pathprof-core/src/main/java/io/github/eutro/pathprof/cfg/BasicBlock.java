package io.github.eutro.pathprof.cfg;

/**
 * A basic block of a {@link ControlFlowGraph}: a name, and the inclusive range of
 * instruction indices it owns.
 * <p>
 * Blocks are addressed by their {@link #id}, which is their index in the graph.
 */
public final class BasicBlock {
    /**
     * The index of this block in its graph.
     */
    public final int id;
    /**
     * The unique name of this block.
     */
    public final String name;
    /**
     * The index of the first instruction of this block, or -1 if it owns none.
     */
    public final int firstIndex;
    /**
     * The index of the last instruction of this block, or -1 if it owns none.
     */
    public final int lastIndex;

    BasicBlock(int id, String name, int firstIndex, int lastIndex) {
        this.id = id;
        this.name = name;
        this.firstIndex = firstIndex;
        this.lastIndex = lastIndex;
    }

    public boolean isEmpty() {
        return firstIndex < 0;
    }

    @Override
    public String toString() {
        return isEmpty() ? name : name + "[" + firstIndex + ".." + lastIndex + "]";
    }
}
