package io.github.libra.analysis;

import io.github.libra.core.domain.AbstractDomain;
import io.github.libra.core.domain.PartialOrder;

import java.math.BigInteger;

/**
 * The sign of an integer: bottom, below each of negative, zero and positive, below top.
 */
public enum SignDomain implements AbstractDomain<SignDomain> {
    BOTTOM,
    NEGATIVE,
    ZERO,
    POSITIVE,
    TOP,
    ;

    public static SignDomain of(BigInteger value) {
        switch (value.signum()) {
            case -1:
                return NEGATIVE;
            case 0:
                return ZERO;
            default:
                return POSITIVE;
        }
    }

    @Override
    public SignDomain join(SignDomain other) {
        if (this == BOTTOM) return other;
        if (other == BOTTOM || this == other) return this;
        return TOP;
    }

    @Override
    public SignDomain widen(SignDomain previous) {
        return join(previous);
    }

    @Override
    public SignDomain narrow(SignDomain previous) {
        if (this == TOP) return previous;
        if (previous == TOP || this == previous) return this;
        return BOTTOM;
    }

    @Override
    public PartialOrder compare(SignDomain other) {
        if (this == other) return PartialOrder.EQUAL;
        if (this == BOTTOM || other == TOP) return PartialOrder.LESS;
        if (this == TOP || other == BOTTOM) return PartialOrder.GREATER;
        return PartialOrder.INCOMPARABLE;
    }

    @Override
    public SignDomain bottom() {
        return BOTTOM;
    }
}
