package io.github.libra.core.passes;

/**
 * Two passes run one after the other.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The result type.
 */
public final class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final IRPass<A, B> first;
    private final IRPass<B, C> next;

    public ChainedPass(IRPass<A, B> first, IRPass<B, C> next) {
        this.first = first;
        this.next = next;
    }

    @Override
    public C run(A a) {
        B intermediate = first.run(a);
        try {
            return next.run(intermediate);
        } catch (RuntimeException e) {
            e.addSuppressed(new RuntimeException("running pass " + next + " after " + first));
            throw e;
        }
    }
}
