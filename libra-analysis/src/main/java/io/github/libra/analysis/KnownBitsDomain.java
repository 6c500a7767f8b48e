package io.github.libra.analysis;

import io.github.libra.core.domain.AbstractDomain;
import io.github.libra.core.domain.PartialOrder;
import io.github.libra.core.ir.Type;
import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.Objects;

/**
 * The bits of an integer known to be zero and known to be one.
 * <p>
 * Knowing more bits is lower in the lattice. Top knows nothing, and bottom stands for
 * contradictory knowledge.
 */
public final class KnownBitsDomain implements AbstractDomain<KnownBitsDomain> {
    public static final KnownBitsDomain BOTTOM = new KnownBitsDomain(true, BigInteger.ZERO, BigInteger.ZERO);
    public static final KnownBitsDomain TOP = new KnownBitsDomain(false, BigInteger.ZERO, BigInteger.ZERO);

    private final boolean bottom;
    private final BigInteger zeros;
    private final BigInteger ones;

    private KnownBitsDomain(boolean bottom, BigInteger zeros, BigInteger ones) {
        this.bottom = bottom;
        this.zeros = zeros;
        this.ones = ones;
    }

    /**
     * Create an element from its masks.
     *
     * @param zeros The bits known to be zero.
     * @param ones The bits known to be one.
     * @return The element, or bottom if a bit is in both masks.
     */
    public static KnownBitsDomain of(BigInteger zeros, BigInteger ones) {
        if (zeros.and(ones).signum() != 0) return BOTTOM;
        return new KnownBitsDomain(false, zeros, ones);
    }

    public static KnownBitsDomain constant(int bits, BigInteger value) {
        BigInteger mask = new Type.Int(bits).mask();
        return of(value.not().and(mask), value.and(mask));
    }

    public boolean isBottom() {
        return bottom;
    }

    public BigInteger getZeros() {
        return zeros;
    }

    public BigInteger getOnes() {
        return ones;
    }

    /**
     * Get the value if every bit of the given width is known.
     *
     * @param bits The width.
     * @return The value, or null if some bit is unknown.
     */
    public @Nullable BigInteger constantValue(int bits) {
        if (bottom) return null;
        BigInteger mask = new Type.Int(bits).mask();
        return zeros.or(ones).and(mask).equals(mask) ? ones.and(mask) : null;
    }

    private static boolean covers(BigInteger mask, BigInteger sub) {
        return mask.and(sub).equals(sub);
    }

    @Override
    public KnownBitsDomain join(KnownBitsDomain other) {
        if (bottom) return other;
        if (other.bottom) return this;
        return of(zeros.and(other.zeros), ones.and(other.ones));
    }

    @Override
    public KnownBitsDomain widen(KnownBitsDomain previous) {
        return join(previous);
    }

    @Override
    public KnownBitsDomain narrow(KnownBitsDomain previous) {
        if (bottom || previous.bottom) return BOTTOM;
        return of(zeros.or(previous.zeros), ones.or(previous.ones));
    }

    @Override
    public PartialOrder compare(KnownBitsDomain other) {
        if (bottom || other.bottom) {
            return PartialOrder.ofInclusion(bottom, other.bottom);
        }
        boolean moreKnown = covers(zeros, other.zeros) && covers(ones, other.ones);
        boolean lessKnown = covers(other.zeros, zeros) && covers(other.ones, ones);
        return PartialOrder.ofInclusion(moreKnown, lessKnown);
    }

    @Override
    public KnownBitsDomain bottom() {
        return BOTTOM;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KnownBitsDomain that = (KnownBitsDomain) o;
        return bottom == that.bottom && zeros.equals(that.zeros) && ones.equals(that.ones);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bottom, zeros, ones);
    }

    @Override
    public String toString() {
        if (bottom) return "bottom";
        return "zeros=" + zeros.toString(2) + " ones=" + ones.toString(2);
    }
}
