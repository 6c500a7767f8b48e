package io.github.libra.analysis;

import io.github.libra.core.domain.AbstractDomain;
import io.github.libra.core.domain.PartialOrder;
import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Signed integer intervals. A missing bound is unbounded in that direction, and the empty
 * interval is bottom.
 */
public final class RangeDomain implements AbstractDomain<RangeDomain> {
    public static final RangeDomain BOTTOM = new RangeDomain(true, null, null);
    public static final RangeDomain TOP = new RangeDomain(false, null, null);

    private final boolean empty;
    private final @Nullable BigInteger lower;
    private final @Nullable BigInteger upper;

    private RangeDomain(boolean empty, @Nullable BigInteger lower, @Nullable BigInteger upper) {
        this.empty = empty;
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * Create an interval.
     *
     * @param lower The inclusive lower bound, or null if unbounded.
     * @param upper The inclusive upper bound, or null if unbounded.
     * @return The interval, which is bottom if the lower bound is above the upper one.
     */
    public static RangeDomain of(@Nullable BigInteger lower, @Nullable BigInteger upper) {
        if (lower != null && upper != null && lower.compareTo(upper) > 0) return BOTTOM;
        return new RangeDomain(false, lower, upper);
    }

    public static RangeDomain constant(BigInteger value) {
        return of(value, value);
    }

    public boolean isBottom() {
        return empty;
    }

    public @Nullable BigInteger getLower() {
        return lower;
    }

    public @Nullable BigInteger getUpper() {
        return upper;
    }

    private static @Nullable BigInteger min(@Nullable BigInteger a, @Nullable BigInteger b) {
        return a == null || b == null ? null : a.min(b);
    }

    private static @Nullable BigInteger max(@Nullable BigInteger a, @Nullable BigInteger b) {
        return a == null || b == null ? null : a.max(b);
    }

    /**
     * Check whether every value of another interval is in this one.
     *
     * @param other The other interval.
     * @return Whether this contains the other.
     */
    public boolean contains(RangeDomain other) {
        if (other.empty) return true;
        if (empty) return false;
        boolean lowerOk = lower == null || (other.lower != null && lower.compareTo(other.lower) <= 0);
        boolean upperOk = upper == null || (other.upper != null && upper.compareTo(other.upper) >= 0);
        return lowerOk && upperOk;
    }

    @Override
    public RangeDomain join(RangeDomain other) {
        if (empty) return other;
        if (other.empty) return this;
        return of(min(lower, other.lower), max(upper, other.upper));
    }

    /**
     * Widen against a previous interval: any bound which moved outwards jumps to unbounded.
     */
    @Override
    public RangeDomain widen(RangeDomain previous) {
        if (empty) return previous;
        if (previous.empty) return this;
        BigInteger newLower = previous.lower != null && lower != null && lower.compareTo(previous.lower) >= 0
                ? previous.lower
                : null;
        BigInteger newUpper = previous.upper != null && upper != null && upper.compareTo(previous.upper) <= 0
                ? previous.upper
                : null;
        return of(newLower, newUpper);
    }

    /**
     * Narrow against a previous interval: only unbounded ends are refined.
     */
    @Override
    public RangeDomain narrow(RangeDomain previous) {
        if (empty || previous.empty) return BOTTOM;
        return of(lower == null ? previous.lower : lower, upper == null ? previous.upper : upper);
    }

    @Override
    public PartialOrder compare(RangeDomain other) {
        return PartialOrder.ofInclusion(other.contains(this), contains(other));
    }

    @Override
    public RangeDomain bottom() {
        return BOTTOM;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RangeDomain that = (RangeDomain) o;
        return empty == that.empty && Objects.equals(lower, that.lower) && Objects.equals(upper, that.upper);
    }

    @Override
    public int hashCode() {
        return Objects.hash(empty, lower, upper);
    }

    @Override
    public String toString() {
        if (empty) return "[]";
        return "[" + (lower == null ? "-inf" : lower) + ", " + (upper == null ? "+inf" : upper) + "]";
    }
}
