package io.github.libra.core.passes;

/**
 * A step over the IR, converting some part of it (e.g. an adapter module, a
 * {@link io.github.libra.core.ir.Function}) into a result (e.g. a validated module, an analysis state).
 * <p>
 * Passes never modify their input.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The input.
     * @return The result.
     */
    B run(A a);

    /**
     * Feed the result of this pass into another.
     *
     * @param next The pass to run on the result of this one.
     * @return The composed pass.
     * @param <C> The result type of the next pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
