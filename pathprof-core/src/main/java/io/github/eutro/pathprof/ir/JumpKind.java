package io.github.eutro.pathprof.ir;

/**
 * Whether, and how, an instruction uses its relative offset.
 */
public enum JumpKind {
    /**
     * Not a jump. Execution always continues at the next instruction, and the offset is always 1.
     */
    NONE,
    /**
     * Falls through to the next instruction if its condition holds, otherwise jumps by the offset.
     */
    CONDITIONAL,
    /**
     * Always jumps by the offset.
     */
    ALWAYS;

    public boolean isJump() {
        return this != NONE;
    }
}
