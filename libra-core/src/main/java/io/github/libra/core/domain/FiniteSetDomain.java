package io.github.libra.core.domain;

import java.util.*;

/**
 * The powerset lattice over some element type, ordered by inclusion.
 * <p>
 * Widening is plain union, so an analysis only terminates with this domain if the
 * universe of elements it can produce is finite.
 *
 * @param <E> The element type.
 */
public final class FiniteSetDomain<E> implements AbstractDomain<FiniteSetDomain<E>> {
    private static final FiniteSetDomain<?> EMPTY = new FiniteSetDomain<>(Collections.emptySet());

    /**
     * The elements of this set, unmodifiable.
     */
    public final Set<E> elements;

    private FiniteSetDomain(Set<E> elements) {
        this.elements = elements;
    }

    /**
     * Get the empty set, which is the bottom element.
     *
     * @return The empty set.
     * @param <E> The element type.
     */
    @SuppressWarnings("unchecked")
    public static <E> FiniteSetDomain<E> empty() {
        return (FiniteSetDomain<E>) EMPTY;
    }

    /**
     * Create a set of the given elements.
     *
     * @param elements The elements.
     * @return The set.
     * @param <E> The element type.
     */
    public static <E> FiniteSetDomain<E> of(Collection<? extends E> elements) {
        if (elements.isEmpty()) return empty();
        return new FiniteSetDomain<>(Collections.unmodifiableSet(new LinkedHashSet<>(elements)));
    }

    /**
     * Create a set of the given elements.
     *
     * @param elements The elements.
     * @return The set.
     * @param <E> The element type.
     */
    @SafeVarargs
    public static <E> FiniteSetDomain<E> of(E... elements) {
        return of(Arrays.asList(elements));
    }

    public boolean contains(E element) {
        return elements.contains(element);
    }

    public FiniteSetDomain<E> with(E element) {
        if (elements.contains(element)) return this;
        Set<E> added = new LinkedHashSet<>(elements);
        added.add(element);
        return new FiniteSetDomain<>(Collections.unmodifiableSet(added));
    }

    @Override
    public FiniteSetDomain<E> join(FiniteSetDomain<E> other) {
        if (other.elements.containsAll(elements)) return other;
        if (elements.containsAll(other.elements)) return this;
        Set<E> union = new LinkedHashSet<>(elements);
        union.addAll(other.elements);
        return new FiniteSetDomain<>(Collections.unmodifiableSet(union));
    }

    /**
     * Plain union. Chains only stabilise if the element universe is finite; the engine may
     * not terminate for sets drawn from an unbounded universe.
     */
    @Override
    public FiniteSetDomain<E> widen(FiniteSetDomain<E> previous) {
        return join(previous);
    }

    @Override
    public FiniteSetDomain<E> narrow(FiniteSetDomain<E> previous) {
        Set<E> intersection = new LinkedHashSet<>(elements);
        intersection.retainAll(previous.elements);
        return of(intersection);
    }

    @Override
    public PartialOrder compare(FiniteSetDomain<E> other) {
        return PartialOrder.ofInclusion(other.elements.containsAll(elements), elements.containsAll(other.elements));
    }

    @Override
    public FiniteSetDomain<E> bottom() {
        return empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return elements.equals(((FiniteSetDomain<?>) o).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
