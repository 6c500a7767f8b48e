package io.github.libra.analysis;

import io.github.libra.core.flow.CfgState;
import io.github.libra.core.flow.Direction;
import io.github.libra.core.flow.FixedPoint;
import io.github.libra.core.ir.Constant;
import io.github.libra.core.ir.Function;
import io.github.libra.core.ir.Instruction;
import io.github.libra.core.ir.Type;

import java.math.BigInteger;

/**
 * Forward analysis of the known bits of integer registers, through bitwise operators,
 * shifts by a known amount and width changes.
 */
public final class KnownBitsAnalysis extends ValueTransfer<KnownBitsDomain> {
    public static final KnownBitsAnalysis INSTANCE = new KnownBitsAnalysis();

    public static final FixedPoint<KnownBitsDomain> PASS = new FixedPoint<>(KnownBitsDomain.BOTTOM, INSTANCE, Direction.FORWARD);

    private KnownBitsAnalysis() {
    }

    public static CfgState<KnownBitsDomain> execute(Function func) {
        return PASS.run(func);
    }

    @Override
    protected KnownBitsDomain bottom() {
        return KnownBitsDomain.BOTTOM;
    }

    @Override
    protected KnownBitsDomain top() {
        return KnownBitsDomain.TOP;
    }

    @Override
    protected KnownBitsDomain constant(Constant.Int constant) {
        return KnownBitsDomain.constant(constant.bits, constant.value);
    }

    @Override
    protected KnownBitsDomain binary(Instruction.BinaryOperator operator, int bits, KnownBitsDomain lhs, KnownBitsDomain rhs) {
        BigInteger mask = new Type.Int(bits).mask();
        BigInteger z1 = lhs.getZeros();
        BigInteger o1 = lhs.getOnes();
        BigInteger z2 = rhs.getZeros();
        BigInteger o2 = rhs.getOnes();
        switch (operator) {
            case AND:
                return KnownBitsDomain.of(z1.or(z2), o1.and(o2));
            case OR:
                return KnownBitsDomain.of(z1.and(z2), o1.or(o2));
            case XOR:
                return KnownBitsDomain.of(z1.and(z2).or(o1.and(o2)), o1.and(z2).or(z1.and(o2)));
            case SHL:
            case LSHR: {
                BigInteger amount = rhs.constantValue(bits);
                if (amount == null || amount.compareTo(BigInteger.valueOf(bits)) >= 0) return KnownBitsDomain.TOP;
                int k = amount.intValue();
                if (operator == Instruction.BinaryOperator.SHL) {
                    BigInteger vacated = BigInteger.ONE.shiftLeft(k).subtract(BigInteger.ONE);
                    return KnownBitsDomain.of(z1.shiftLeft(k).or(vacated).and(mask), o1.shiftLeft(k).and(mask));
                }
                BigInteger vacated = mask.andNot(mask.shiftRight(k));
                return KnownBitsDomain.of(z1.shiftRight(k).or(vacated), o1.shiftRight(k));
            }
            default: {
                BigInteger l = lhs.constantValue(bits);
                BigInteger r = rhs.constantValue(bits);
                if (l == null || r == null) return KnownBitsDomain.TOP;
                Constant.Int folded = ConstantAnalysis.fold(operator, bits, Constant.Int.of(bits, l), Constant.Int.of(bits, r));
                return folded == null ? KnownBitsDomain.TOP : KnownBitsDomain.constant(bits, folded.value);
            }
        }
    }

    @Override
    protected KnownBitsDomain cast(Instruction.Cast inst, KnownBitsDomain operand) {
        if (!(inst.from instanceof Type.Int && inst.into instanceof Type.Int)) return KnownBitsDomain.TOP;
        int from = ((Type.Int) inst.from).bits;
        int into = ((Type.Int) inst.into).bits;
        BigInteger fromMask = new Type.Int(from).mask();
        BigInteger intoMask = new Type.Int(into).mask();
        BigInteger extension = intoMask.andNot(fromMask);
        BigInteger zeros = operand.getZeros().and(fromMask);
        BigInteger ones = operand.getOnes().and(fromMask);
        switch (inst.operator) {
            case TRUNC:
                return KnownBitsDomain.of(zeros.and(intoMask), ones.and(intoMask));
            case ZEXT:
                return KnownBitsDomain.of(zeros.or(extension), ones);
            case SEXT:
                if (zeros.testBit(from - 1)) return KnownBitsDomain.of(zeros.or(extension), ones);
                if (ones.testBit(from - 1)) return KnownBitsDomain.of(zeros, ones.or(extension));
                return KnownBitsDomain.of(zeros, ones);
            default:
                return KnownBitsDomain.TOP;
        }
    }
}
