package io.github.libra.core.domain;

/**
 * An element of an abstract domain which forms a lattice.
 * <p>
 * Implementations are immutable values: every operation returns a new element
 * (or one of its operands), and {@link Object#equals(Object)} must agree with
 * {@link #compare(AbstractDomain)} returning {@link PartialOrder#EQUAL}.
 * <p>
 * Termination of the fixed-point engine depends on {@link #widen(AbstractDomain)}
 * eventually stabilising every ascending chain; the engine does not check this.
 *
 * @param <D> The domain type itself.
 * @see io.github.libra.core.flow.FixedPoint
 */
public interface AbstractDomain<D extends AbstractDomain<D>> {
    /**
     * Get the least upper bound of this and another element.
     *
     * @param other The other element.
     * @return The join.
     */
    D join(D other);

    /**
     * Widen this element against a previous one, so that repeated widening stabilises.
     *
     * @param previous The element this is replacing.
     * @return An element above both this and the previous element.
     */
    D widen(D previous);

    /**
     * Narrow this element against a previous one, regaining precision lost to widening.
     *
     * @param previous The element to refine with.
     * @return An element below or equal to this one.
     */
    D narrow(D previous);

    /**
     * Compare this element with another in the lattice order.
     *
     * @param other The other element.
     * @return The order of this relative to the other.
     */
    PartialOrder compare(D other);

    /**
     * Get the bottom element of this domain.
     *
     * @return The bottom element.
     */
    D bottom();
}
