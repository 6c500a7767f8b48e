package io.github.libra.core.domain;

/**
 * The result of comparing two elements of a lattice.
 * <p>
 * Unlike {@link Comparable}, two elements may be {@link #INCOMPARABLE}.
 */
public enum PartialOrder {
    LESS,
    EQUAL,
    GREATER,
    INCOMPARABLE,
    ;

    /**
     * Get whether the left operand was below or equal to the right operand.
     *
     * @return Whether this is {@link #LESS} or {@link #EQUAL}.
     */
    public boolean isLessOrEqual() {
        return this == LESS || this == EQUAL;
    }

    /**
     * Get whether the left operand was above or equal to the right operand.
     *
     * @return Whether this is {@link #GREATER} or {@link #EQUAL}.
     */
    public boolean isGreaterOrEqual() {
        return this == GREATER || this == EQUAL;
    }

    /**
     * Swap the operands of the comparison.
     *
     * @return The order of the right operand relative to the left.
     */
    public PartialOrder reverse() {
        switch (this) {
            case LESS:
                return GREATER;
            case GREATER:
                return LESS;
            default:
                return this;
        }
    }

    /**
     * Combine this with the order of another component, giving the product order.
     *
     * @param other The order of the other component.
     * @return The combined order.
     */
    public PartialOrder combine(PartialOrder other) {
        if (this == EQUAL) return other;
        if (other == EQUAL || other == this) return this;
        return INCOMPARABLE;
    }

    /**
     * Get the order between two subsets.
     *
     * @param leftInRight Whether every element of the left set is in the right set.
     * @param rightInLeft Whether every element of the right set is in the left set.
     * @return The order.
     */
    public static PartialOrder ofInclusion(boolean leftInRight, boolean rightInLeft) {
        if (leftInRight) return rightInLeft ? EQUAL : LESS;
        return rightInLeft ? GREATER : INCOMPARABLE;
    }
}
