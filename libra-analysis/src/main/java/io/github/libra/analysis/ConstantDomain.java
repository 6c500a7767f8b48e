package io.github.libra.analysis;

import io.github.libra.core.domain.AbstractDomain;
import io.github.libra.core.domain.PartialOrder;
import io.github.libra.core.ir.Constant;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * The flat lattice of integer constants: bottom, below every constant, below top.
 */
public final class ConstantDomain implements AbstractDomain<ConstantDomain> {
    public static final ConstantDomain BOTTOM = new ConstantDomain(null, false);
    public static final ConstantDomain TOP = new ConstantDomain(null, true);

    private final @Nullable Constant.Int value;
    private final boolean top;

    private ConstantDomain(@Nullable Constant.Int value, boolean top) {
        this.value = value;
        this.top = top;
    }

    public static ConstantDomain of(Constant.Int value) {
        return new ConstantDomain(value, false);
    }

    /**
     * Get the constant this element stands for.
     *
     * @return The constant, or null if this is bottom or top.
     */
    public @Nullable Constant.Int getValue() {
        return value;
    }

    public boolean isBottom() {
        return value == null && !top;
    }

    public boolean isTop() {
        return top;
    }

    @Override
    public ConstantDomain join(ConstantDomain other) {
        if (isBottom()) return other;
        if (other.isBottom() || equals(other)) return this;
        return TOP;
    }

    @Override
    public ConstantDomain widen(ConstantDomain previous) {
        return join(previous);
    }

    @Override
    public ConstantDomain narrow(ConstantDomain previous) {
        if (isTop()) return previous;
        if (previous.isTop() || equals(previous)) return this;
        return BOTTOM;
    }

    @Override
    public PartialOrder compare(ConstantDomain other) {
        if (equals(other)) return PartialOrder.EQUAL;
        if (isBottom() || other.isTop()) return PartialOrder.LESS;
        if (isTop() || other.isBottom()) return PartialOrder.GREATER;
        return PartialOrder.INCOMPARABLE;
    }

    @Override
    public ConstantDomain bottom() {
        return BOTTOM;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConstantDomain that = (ConstantDomain) o;
        return top == that.top && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, top);
    }

    @Override
    public String toString() {
        if (isTop()) return "top";
        if (isBottom()) return "bottom";
        return String.valueOf(value);
    }
}
