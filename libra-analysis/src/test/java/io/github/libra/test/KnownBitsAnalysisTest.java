package io.github.libra.test;

import io.github.libra.analysis.KnownBitsAnalysis;
import io.github.libra.analysis.KnownBitsDomain;
import io.github.libra.core.domain.PartialOrder;
import io.github.libra.core.flow.CfgState;
import io.github.libra.core.ir.Function;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;

import static io.github.libra.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class KnownBitsAnalysisTest {
    private static KnownBitsDomain bits(long zeros, long ones) {
        return KnownBitsDomain.of(BigInteger.valueOf(zeros), BigInteger.valueOf(ones));
    }

    @Test
    void testDomain() {
        KnownBitsDomain five = KnownBitsDomain.constant(8, BigInteger.valueOf(5));
        KnownBitsDomain seven = KnownBitsDomain.constant(8, BigInteger.valueOf(7));
        checkLaws(Arrays.asList(KnownBitsDomain.BOTTOM, KnownBitsDomain.TOP, five, seven,
                bits(0xF0, 0), bits(0, 0x01)));

        assertEquals(BigInteger.valueOf(5), five.constantValue(8));
        assertEquals(bits(0xF8, 0x05), five.join(seven));
        assertNull(five.join(seven).constantValue(8));
        assertSame(KnownBitsDomain.BOTTOM, bits(0x01, 0x01));
        assertEquals(PartialOrder.LESS, five.compare(five.join(seven)));
        assertEquals(five, five.join(seven).narrow(five));
        assertEquals(KnownBitsDomain.BOTTOM, five.narrow(seven));
    }

    @Test
    void testBitwise() {
        Function func = function("bits", fn(I32, I8), params(I8),
                block(0, inst(VOID, 7, ret(reg(I32, 6))),
                        inst(I8, 0, binary("and", arg(I8, 0), intConst(I8, 0x0F))),
                        inst(I8, 1, binary("shl", reg(I8, 0), intConst(I8, 4))),
                        inst(I8, 2, binary("or", reg(I8, 1), intConst(I8, 1))),
                        inst(I8, 3, binary("xor", reg(I8, 2), intConst(I8, 0x03))),
                        inst(I8, 4, binary("lshr", reg(I8, 1), intConst(I8, 4))),
                        inst(I8, 5, binary("add", intConst(I8, 3), intConst(I8, 4))),
                        inst(I32, 6, cast("zext", I8, I32, reg(I8, 4))))
        );
        CfgState<KnownBitsDomain> state = KnownBitsAnalysis.execute(func);
        assertEquals(bits(0xF0, 0x00), outgoing(state, 0, 0));
        assertEquals(bits(0x0F, 0x00), outgoing(state, 0, 1));
        assertEquals(bits(0x0E, 0x01), outgoing(state, 0, 2));
        assertEquals(bits(0x0D, 0x02), outgoing(state, 0, 3));
        assertEquals(bits(0xF0, 0x00), outgoing(state, 0, 4));
        assertEquals(KnownBitsDomain.constant(8, BigInteger.valueOf(7)), outgoing(state, 0, 5));
        assertEquals(bits(0xFFFFFFF0L, 0x00), outgoing(state, 0, 6));
    }

    @Test
    void testSignExtension() {
        Function func = function("sext", fn(I32), params(),
                block(0, inst(VOID, 2, ret(reg(I32, 1))),
                        inst(I8, 0, binary("or", intConst(I8, 0x80), intConst(I8, 0x00))),
                        inst(I32, 1, cast("sext", I8, I32, reg(I8, 0))))
        );
        CfgState<KnownBitsDomain> state = KnownBitsAnalysis.execute(func);
        assertEquals(BigInteger.valueOf(0xFFFFFF80L), outgoing(state, 0, 1).constantValue(32));
    }

    @Test
    void testDiamond() {
        CfgState<KnownBitsDomain> state = KnownBitsAnalysis.execute(diamond());
        // 1 and -1 agree only on the lowest bit
        assertEquals(bits(0, 0x01), incoming(state, 3, 0));
    }
}
