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
 * Forward constant propagation, folding integer arithmetic at the width of its operands.
 * <p>
 * Operations with undefined results (division by zero, signed overflow of division,
 * shifting by the width or more) give top.
 */
public final class ConstantAnalysis extends ValueTransfer<ConstantDomain> {
    public static final ConstantAnalysis INSTANCE = new ConstantAnalysis();

    public static final FixedPoint<ConstantDomain> PASS = new FixedPoint<>(ConstantDomain.BOTTOM, INSTANCE, Direction.FORWARD);

    private ConstantAnalysis() {
    }

    public static CfgState<ConstantDomain> execute(Function func) {
        return PASS.run(func);
    }

    @Override
    protected ConstantDomain bottom() {
        return ConstantDomain.BOTTOM;
    }

    @Override
    protected ConstantDomain top() {
        return ConstantDomain.TOP;
    }

    @Override
    protected ConstantDomain constant(Constant.Int constant) {
        return ConstantDomain.of(constant);
    }

    private static ConstantDomain wrap(@Nullable Constant.Int folded) {
        return folded == null ? ConstantDomain.TOP : ConstantDomain.of(folded);
    }

    @Override
    protected ConstantDomain binary(Instruction.BinaryOperator operator, int bits, ConstantDomain lhs, ConstantDomain rhs) {
        Constant.Int l = lhs.getValue();
        Constant.Int r = rhs.getValue();
        if (l == null || r == null) return ConstantDomain.TOP;
        return wrap(fold(operator, bits, l, r));
    }

    /**
     * Evaluate a binary operator on two constants.
     *
     * @param operator The operator.
     * @param bits The width of the operands and the result.
     * @param lhs The left operand.
     * @param rhs The right operand.
     * @return The result, or null if it is undefined.
     */
    public static @Nullable Constant.Int fold(Instruction.BinaryOperator operator, int bits, Constant.Int lhs, Constant.Int rhs) {
        BigInteger l = lhs.value;
        BigInteger r = rhs.value;
        switch (operator) {
            case ADD:
                return Constant.Int.of(bits, l.add(r));
            case SUB:
                return Constant.Int.of(bits, l.subtract(r));
            case MUL:
                return Constant.Int.of(bits, l.multiply(r));
            case UDIV:
                return r.signum() == 0 ? null : Constant.Int.of(bits, l.divide(r));
            case UREM:
                return r.signum() == 0 ? null : Constant.Int.of(bits, l.mod(r));
            case SDIV:
            case SREM: {
                BigInteger ls = lhs.signedValue();
                BigInteger rs = rhs.signedValue();
                if (rs.signum() == 0) return null;
                BigInteger min = BigInteger.ONE.shiftLeft(bits - 1).negate();
                if (ls.equals(min) && rs.equals(BigInteger.ONE.negate())) return null;
                // truncating division, remainder takes the sign of the dividend
                return Constant.Int.of(bits, operator == Instruction.BinaryOperator.SDIV ? ls.divide(rs) : ls.remainder(rs));
            }
            case SHL:
            case LSHR:
            case ASHR: {
                if (r.compareTo(BigInteger.valueOf(bits)) >= 0) return null;
                int amount = r.intValue();
                if (operator == Instruction.BinaryOperator.SHL) return Constant.Int.of(bits, l.shiftLeft(amount));
                if (operator == Instruction.BinaryOperator.LSHR) return Constant.Int.of(bits, l.shiftRight(amount));
                return Constant.Int.of(bits, lhs.signedValue().shiftRight(amount));
            }
            case AND:
                return Constant.Int.of(bits, l.and(r));
            case OR:
                return Constant.Int.of(bits, l.or(r));
            case XOR:
                return Constant.Int.of(bits, l.xor(r));
            default:
                throw new IllegalArgumentException("unknown operator " + operator);
        }
    }

    @Override
    protected ConstantDomain compare(Instruction.ComparePredicate predicate, ConstantDomain lhs, ConstantDomain rhs) {
        Constant.Int l = lhs.getValue();
        Constant.Int r = rhs.getValue();
        if (l == null || r == null) return ConstantDomain.TOP;
        int order = predicate.isSigned()
                ? l.signedValue().compareTo(r.signedValue())
                : l.value.compareTo(r.value);
        boolean holds;
        switch (predicate) {
            case EQ: holds = order == 0; break;
            case NE: holds = order != 0; break;
            case UGT: case SGT: holds = order > 0; break;
            case UGE: case SGE: holds = order >= 0; break;
            case ULT: case SLT: holds = order < 0; break;
            case ULE: case SLE: holds = order <= 0; break;
            default: throw new IllegalArgumentException("unknown predicate " + predicate);
        }
        return ConstantDomain.of(Constant.Int.of(1, holds ? 1 : 0));
    }

    @Override
    protected ConstantDomain cast(Instruction.Cast inst, ConstantDomain operand) {
        Constant.Int value = operand.getValue();
        if (value == null || !(inst.into instanceof Type.Int)) return ConstantDomain.TOP;
        int into = ((Type.Int) inst.into).bits;
        switch (inst.operator) {
            case TRUNC:
            case ZEXT:
                return ConstantDomain.of(Constant.Int.of(into, value.value));
            case SEXT:
                return ConstantDomain.of(Constant.Int.of(into, value.signedValue()));
            default:
                return ConstantDomain.TOP;
        }
    }
}
