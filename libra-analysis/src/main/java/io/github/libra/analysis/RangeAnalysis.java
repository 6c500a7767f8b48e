package io.github.libra.analysis;

import io.github.libra.core.flow.CfgState;
import io.github.libra.core.flow.Direction;
import io.github.libra.core.flow.FixedPoint;
import io.github.libra.core.ir.Constant;
import io.github.libra.core.ir.Function;
import io.github.libra.core.ir.Instruction;
import io.github.libra.core.ir.Type;
import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;

/**
 * Forward analysis of the signed ranges of integer registers.
 * <p>
 * A result which may wrap around at its width is top.
 */
public final class RangeAnalysis extends ValueTransfer<RangeDomain> {
    public static final RangeAnalysis INSTANCE = new RangeAnalysis();

    public static final FixedPoint<RangeDomain> PASS = new FixedPoint<>(RangeDomain.BOTTOM, INSTANCE, Direction.FORWARD);

    private RangeAnalysis() {
    }

    public static CfgState<RangeDomain> execute(Function func) {
        return PASS.run(func);
    }

    @Override
    protected RangeDomain bottom() {
        return RangeDomain.BOTTOM;
    }

    @Override
    protected RangeDomain top() {
        return RangeDomain.TOP;
    }

    @Override
    protected RangeDomain constant(Constant.Int constant) {
        return RangeDomain.constant(constant.signedValue());
    }

    private static @Nullable BigInteger add(@Nullable BigInteger a, @Nullable BigInteger b) {
        return a == null || b == null ? null : a.add(b);
    }

    private static @Nullable BigInteger subtract(@Nullable BigInteger a, @Nullable BigInteger b) {
        return a == null || b == null ? null : a.subtract(b);
    }

    private static RangeDomain fit(RangeDomain range, int bits) {
        BigInteger min = BigInteger.ONE.shiftLeft(bits - 1).negate();
        BigInteger max = BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE);
        return RangeDomain.of(min, max).contains(range) ? range : RangeDomain.TOP;
    }

    @Override
    protected RangeDomain binary(Instruction.BinaryOperator operator, int bits, RangeDomain lhs, RangeDomain rhs) {
        switch (operator) {
            case ADD:
                return fit(RangeDomain.of(add(lhs.getLower(), rhs.getLower()), add(lhs.getUpper(), rhs.getUpper())), bits);
            case SUB:
                return fit(RangeDomain.of(subtract(lhs.getLower(), rhs.getUpper()), subtract(lhs.getUpper(), rhs.getLower())), bits);
            case MUL: {
                BigInteger[] bounds = {lhs.getLower(), lhs.getUpper(), rhs.getLower(), rhs.getUpper()};
                for (BigInteger bound : bounds) {
                    if (bound == null) return RangeDomain.TOP;
                }
                BigInteger a = bounds[0].multiply(bounds[2]);
                BigInteger b = bounds[0].multiply(bounds[3]);
                BigInteger c = bounds[1].multiply(bounds[2]);
                BigInteger d = bounds[1].multiply(bounds[3]);
                return fit(RangeDomain.of(a.min(b).min(c).min(d), a.max(b).max(c).max(d)), bits);
            }
            default:
                return RangeDomain.TOP;
        }
    }

    @Override
    protected RangeDomain cast(Instruction.Cast inst, RangeDomain operand) {
        if (!(inst.from instanceof Type.Int && inst.into instanceof Type.Int)) return RangeDomain.TOP;
        int from = ((Type.Int) inst.from).bits;
        int into = ((Type.Int) inst.into).bits;
        switch (inst.operator) {
            case SEXT:
                return operand;
            case ZEXT: {
                BigInteger lower = operand.getLower();
                if (lower != null && lower.signum() >= 0) return operand;
                return RangeDomain.of(BigInteger.ZERO, BigInteger.ONE.shiftLeft(from).subtract(BigInteger.ONE));
            }
            case TRUNC:
                return fit(operand, into);
            default:
                return RangeDomain.TOP;
        }
    }
}
