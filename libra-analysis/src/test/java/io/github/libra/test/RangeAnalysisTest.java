package io.github.libra.test;

import io.github.libra.analysis.RangeAnalysis;
import io.github.libra.analysis.RangeDomain;
import io.github.libra.core.flow.CfgState;
import io.github.libra.core.ir.Function;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;

import static io.github.libra.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class RangeAnalysisTest {
    private static RangeDomain range(long lower, long upper) {
        return RangeDomain.of(BigInteger.valueOf(lower), BigInteger.valueOf(upper));
    }

    @Test
    void testDomain() {
        RangeDomain atLeastZero = RangeDomain.of(BigInteger.ZERO, null);
        RangeDomain atMostTen = RangeDomain.of(null, BigInteger.TEN);
        checkLaws(Arrays.asList(RangeDomain.BOTTOM, RangeDomain.TOP, range(0, 0), range(-1, 1), range(5, 9),
                atLeastZero, atMostTen));

        assertSame(RangeDomain.BOTTOM, range(3, 2));
        assertEquals(range(-1, 9), range(-1, 1).join(range(5, 9)));
        assertTrue(range(-1, 9).contains(range(0, 0)));
        assertFalse(range(-1, 9).contains(atLeastZero));
    }

    @Test
    void testWidenAndNarrow() {
        assertEquals(atLeast(0), range(0, 2).widen(range(0, 1)));
        assertEquals(range(0, 1), range(0, 1).widen(range(0, 1)));
        assertEquals(RangeDomain.TOP, range(-1, 2).widen(range(0, 1)));
        // only the unbounded end is refined
        assertEquals(range(0, 100), atLeast(0).narrow(range(-5, 100)));
        assertEquals(range(0, 1), range(0, 1).narrow(range(-5, 100)));
    }

    private static RangeDomain atLeast(long lower) {
        return RangeDomain.of(BigInteger.valueOf(lower), null);
    }

    @Test
    void testDiamond() {
        CfgState<RangeDomain> state = RangeAnalysis.execute(diamond());
        assertEquals(range(-1, 1), incoming(state, 3, 0));
        assertEquals(range(-1, 1), outgoing(state, 3, 6));
    }

    @Test
    void testArithmetic() {
        Function func = function("arith", fn(I32, I8), params(I8),
                block(0, inst(VOID, 9, ret(reg(I32, 8))),
                        inst(PTR, 0, alloca(I8)),
                        inst(VOID, 1, store(I8, reg(PTR, 0), intConst(I8, -2))),
                        inst(I8, 2, load(I8, reg(PTR, 0))),
                        inst(I8, 3, binary("mul", reg(I8, 2), intConst(I8, 3))),
                        inst(I8, 4, binary("sub", reg(I8, 3), intConst(I8, 10))),
                        inst(I8, 5, binary("add", intConst(I8, 127), intConst(I8, 1))),
                        inst(I32, 6, cast("zext", I8, I32, reg(I8, 4))),
                        inst(I32, 7, cast("sext", I8, I32, reg(I8, 4))),
                        inst(I32, 8, cast("zext", I8, I32, arg(I8, 0))))
        );
        CfgState<RangeDomain> state = RangeAnalysis.execute(func);
        assertEquals(range(-6, -6), outgoing(state, 0, 3));
        assertEquals(range(-16, -16), outgoing(state, 0, 4));
        assertEquals(RangeDomain.TOP, outgoing(state, 0, 5));
        assertEquals(range(0, 255), outgoing(state, 0, 6));
        assertEquals(range(-16, -16), outgoing(state, 0, 7));
        assertEquals(range(0, 255), outgoing(state, 0, 8));
    }

    @Test
    void testLoopTerminates() {
        Function func = function("loop", fn(I32, I1), params(I1),
                block(0, inst(VOID, 2, jump(1)),
                        inst(PTR, 0, alloca(I32)),
                        inst(VOID, 1, store(I32, reg(PTR, 0), intConst(I32, 0)))),
                block(1, inst(VOID, 6, branch(arg(I1, 0), 1, 2)),
                        inst(I32, 3, load(I32, reg(PTR, 0))),
                        inst(I32, 4, binary("add", reg(I32, 3), intConst(I32, 1))),
                        inst(VOID, 5, store(I32, reg(PTR, 0), reg(I32, 4)))),
                block(2, inst(VOID, 8, ret(reg(I32, 7))),
                        inst(I32, 7, load(I32, reg(PTR, 0))))
        );
        CfgState<RangeDomain> state = RangeAnalysis.execute(func);
        assertEquals(range(0, 0), outgoing(state, 0, 0));
        // the counter may wrap, so nothing is known after the loop
        assertEquals(RangeDomain.TOP, outgoing(state, 2, 7));
    }
}
