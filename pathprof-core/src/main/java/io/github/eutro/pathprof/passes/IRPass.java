package io.github.eutro.pathprof.passes;

import io.github.eutro.pathprof.passes.misc.ChainedPass;

/**
 * A pass over some program representation, such as a {@link io.github.eutro.pathprof.cfg.ControlFlowGraph},
 * a {@link io.github.eutro.pathprof.cfg.ProfileGraph} or a {@link io.github.eutro.pathprof.ir.LinearIR},
 * which computes a new representation from it.
 * <p>
 * Passes never modify their input: each returns a fresh value, so the input
 * is still usable if the pass fails.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The input to run it on.
     * @return The result.
     */
    B run(A a);

    /**
     * Compose this pass with another.
     *
     * @param next The pass to run after this.
     * @return The composed pass.
     * @param <C> The result type.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
