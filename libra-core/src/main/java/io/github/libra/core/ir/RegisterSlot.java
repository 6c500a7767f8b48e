package io.github.libra.core.ir;

import io.github.libra.core.domain.AbstractDomain;
import io.github.libra.core.domain.PartialOrder;
import org.jetbrains.annotations.NotNull;

/**
 * The register an instruction writes its result to, identified by the instruction's index.
 * <p>
 * A register slot is also a degenerate {@link AbstractDomain}, describing "this exact value".
 * Its only elements are the slots themselves and a distinguished bottom; joining two
 * different slots is an error.
 */
public final class RegisterSlot implements Comparable<RegisterSlot>, AbstractDomain<RegisterSlot> {
    /**
     * The bottom element of the register slot domain, which is not a real register.
     */
    public static final RegisterSlot BOTTOM = new RegisterSlot(Integer.MAX_VALUE);

    public final int index;

    private RegisterSlot(int index) {
        this.index = index;
    }

    public static RegisterSlot of(int index) {
        if (index == BOTTOM.index) {
            throw new IllegalArgumentException("register index reserved: " + index);
        }
        return new RegisterSlot(index);
    }

    public boolean isBottom() {
        return index == BOTTOM.index;
    }

    @Override
    public RegisterSlot join(RegisterSlot other) {
        if (isBottom()) return other;
        if (other.isBottom() || equals(other)) return this;
        throw new IllegalArgumentException("cannot join distinct registers " + this + " and " + other);
    }

    @Override
    public RegisterSlot widen(RegisterSlot previous) {
        return join(previous);
    }

    @Override
    public RegisterSlot narrow(RegisterSlot previous) {
        if (isBottom() || previous.isBottom()) return BOTTOM;
        if (equals(previous)) return this;
        throw new IllegalArgumentException("cannot narrow distinct registers " + this + " and " + previous);
    }

    @Override
    public PartialOrder compare(RegisterSlot other) {
        if (equals(other)) return PartialOrder.EQUAL;
        if (isBottom()) return PartialOrder.LESS;
        if (other.isBottom()) return PartialOrder.GREATER;
        return PartialOrder.INCOMPARABLE;
    }

    @Override
    public RegisterSlot bottom() {
        return BOTTOM;
    }

    @Override
    public int compareTo(@NotNull RegisterSlot o) {
        return Integer.compare(index, o.index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return index == ((RegisterSlot) o).index;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(index);
    }

    @Override
    public String toString() {
        return isBottom() ? "%_|_" : "%" + index;
    }
}
