package io.github.eutro.mir2cfim.core.passes;

import io.github.eutro.mir2cfim.core.passes.misc.ChainedPass;

/**
 * A pass to run on some part of the IR (e.g. a {@link io.github.eutro.mir2cfim.core.im.BlockGraph block graph},
 * a {@link io.github.eutro.mir2cfim.core.cfim.Expression structured body}, or a whole declaration),
 * which computes something from it or converts it to a different form.
 * <p>
 * The IR is immutable, so passes never modify their input.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The IR to run it on.
     * @return The result.
     */
    B run(A a);

    /**
     * Compose this pass with another.
     *
     * @param next The pass to run after this.
     * @param <C>  The result type.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
