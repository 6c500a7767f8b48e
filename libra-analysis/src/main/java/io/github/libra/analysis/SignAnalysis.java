package io.github.libra.analysis;

import io.github.libra.core.flow.CfgState;
import io.github.libra.core.flow.Direction;
import io.github.libra.core.flow.FixedPoint;
import io.github.libra.core.ir.Constant;
import io.github.libra.core.ir.Function;
import io.github.libra.core.ir.Instruction;

/**
 * Forward analysis of the sign of integer registers.
 * <p>
 * Arithmetic is treated as if it never overflows.
 */
public final class SignAnalysis extends ValueTransfer<SignDomain> {
    public static final SignAnalysis INSTANCE = new SignAnalysis();

    public static final FixedPoint<SignDomain> PASS = new FixedPoint<>(SignDomain.BOTTOM, INSTANCE, Direction.FORWARD);

    private SignAnalysis() {
    }

    public static CfgState<SignDomain> execute(Function func) {
        return PASS.run(func);
    }

    @Override
    protected SignDomain bottom() {
        return SignDomain.BOTTOM;
    }

    @Override
    protected SignDomain top() {
        return SignDomain.TOP;
    }

    @Override
    protected SignDomain constant(Constant.Int constant) {
        return SignDomain.of(constant.signedValue());
    }

    @Override
    protected SignDomain binary(Instruction.BinaryOperator operator, int bits, SignDomain lhs, SignDomain rhs) {
        switch (operator) {
            case ADD:
                return add(lhs, rhs);
            case SUB:
                return add(lhs, negate(rhs));
            case MUL:
                if (lhs == SignDomain.ZERO || rhs == SignDomain.ZERO) return SignDomain.ZERO;
                if (lhs == SignDomain.TOP || rhs == SignDomain.TOP) return SignDomain.TOP;
                return lhs == rhs ? SignDomain.POSITIVE : SignDomain.NEGATIVE;
            case SDIV:
            case UDIV:
            case SREM:
            case UREM:
            case AND:
            case SHL:
            case LSHR:
                // zero divided, masked or shifted stays zero
                return lhs == SignDomain.ZERO && rhs != SignDomain.ZERO ? SignDomain.ZERO : SignDomain.TOP;
            default:
                return SignDomain.TOP;
        }
    }

    private static SignDomain add(SignDomain lhs, SignDomain rhs) {
        if (lhs == SignDomain.ZERO) return rhs;
        if (rhs == SignDomain.ZERO) return lhs;
        return lhs == rhs ? lhs : SignDomain.TOP;
    }

    private static SignDomain negate(SignDomain sign) {
        switch (sign) {
            case NEGATIVE:
                return SignDomain.POSITIVE;
            case POSITIVE:
                return SignDomain.NEGATIVE;
            default:
                return sign;
        }
    }
}
