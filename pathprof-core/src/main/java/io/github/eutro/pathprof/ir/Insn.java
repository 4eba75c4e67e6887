package io.github.eutro.pathprof.ir;

/**
 * An instruction in a {@link LinearIR}.
 * <p>
 * Instructions are otherwise opaque to the profiler, which only needs to know
 * which of them are jumps.
 */
public interface Insn {
    /**
     * Get how this instruction uses the offset it is paired with.
     *
     * @return The jump kind.
     */
    JumpKind jumpKind();
}
