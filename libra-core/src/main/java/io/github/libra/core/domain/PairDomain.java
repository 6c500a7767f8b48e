package io.github.libra.core.domain;

import java.util.Objects;

/**
 * The product of two domains, ordered component-wise.
 *
 * @param <A> The first component domain.
 * @param <B> The second component domain.
 */
public final class PairDomain<A extends AbstractDomain<A>, B extends AbstractDomain<B>>
        implements AbstractDomain<PairDomain<A, B>> {
    /**
     * The first component.
     */
    public final A first;
    /**
     * The second component.
     */
    public final B second;

    private PairDomain(A first, B second) {
        this.first = first;
        this.second = second;
    }

    /**
     * Create a pair.
     *
     * @param first The first component.
     * @param second The second component.
     * @return The pair.
     * @param <A> The first component domain.
     * @param <B> The second component domain.
     */
    public static <A extends AbstractDomain<A>, B extends AbstractDomain<B>> PairDomain<A, B> of(A first, B second) {
        return new PairDomain<>(first, second);
    }

    @Override
    public PairDomain<A, B> join(PairDomain<A, B> other) {
        return of(first.join(other.first), second.join(other.second));
    }

    @Override
    public PairDomain<A, B> widen(PairDomain<A, B> previous) {
        return of(first.widen(previous.first), second.widen(previous.second));
    }

    @Override
    public PairDomain<A, B> narrow(PairDomain<A, B> previous) {
        return of(first.narrow(previous.first), second.narrow(previous.second));
    }

    @Override
    public PartialOrder compare(PairDomain<A, B> other) {
        return first.compare(other.first).combine(second.compare(other.second));
    }

    @Override
    public PairDomain<A, B> bottom() {
        return of(first.bottom(), second.bottom());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PairDomain<?, ?> that = (PairDomain<?, ?>) o;
        return first.equals(that.first) && second.equals(that.second);
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
