package io.github.libra.test;

import io.github.libra.analysis.SignAnalysis;
import io.github.libra.analysis.SignDomain;
import io.github.libra.core.flow.CfgState;
import io.github.libra.core.ir.Function;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;

import static io.github.libra.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class SignAnalysisTest {
    @Test
    void testDomain() {
        checkLaws(Arrays.asList(SignDomain.values()));
        assertEquals(SignDomain.NEGATIVE, SignDomain.of(BigInteger.valueOf(-3)));
        assertEquals(SignDomain.ZERO, SignDomain.of(BigInteger.ZERO));
        assertEquals(SignDomain.TOP, SignDomain.NEGATIVE.join(SignDomain.POSITIVE));
        assertEquals(SignDomain.ZERO, SignDomain.TOP.narrow(SignDomain.ZERO));
    }

    @Test
    void testDiamond() {
        CfgState<SignDomain> state = SignAnalysis.execute(diamond());
        assertEquals(SignDomain.POSITIVE, outgoing(state, 1, 0));
        assertEquals(SignDomain.NEGATIVE, outgoing(state, 2, 0));
        assertEquals(SignDomain.TOP, incoming(state, 3, 0));
        assertEquals(SignDomain.TOP, outgoing(state, 3, 6));
        // nothing is stored in the slot before the branch
        assertEquals(SignDomain.BOTTOM, outgoing(state, 0, 0));
        assertEquals(4, state.getIterations());
    }

    @Test
    void testDeterministic() {
        Function func = diamond();
        CfgState<SignDomain> first = SignAnalysis.execute(func);
        CfgState<SignDomain> second = SignAnalysis.execute(func);
        assertEquals(first, second);
        assertEquals(first.getIterations(), second.getIterations());
    }

    @Test
    void testDeclaration() {
        Function declaration = new Function(io.github.libra.core.ir.Identifier.of("external"),
                java.util.Collections.emptyList(), null, false, null);
        CfgState<SignDomain> state = SignAnalysis.execute(declaration);
        assertTrue(state.getBlocks().isEmpty());
        assertEquals(0, state.getIterations());
    }

    @Test
    void testArithmetic() {
        Function func = function("arith", fn(I32, I32), params(I32),
                block(0, inst(VOID, 8, ret(reg(I32, 7))),
                        inst(PTR, 0, alloca(I32)),
                        inst(VOID, 1, store(I32, reg(PTR, 0), intConst(I32, 5))),
                        inst(I32, 2, load(I32, reg(PTR, 0))),
                        inst(I32, 3, binary("mul", reg(I32, 2), intConst(I32, -2))),
                        inst(I32, 4, binary("sub", reg(I32, 3), reg(I32, 2))),
                        inst(I32, 5, binary("add", reg(I32, 4), arg(I32, 0))),
                        inst(I32, 6, binary("sdiv", intConst(I32, 0), reg(I32, 2))),
                        inst(I32, 7, binary("mul", reg(I32, 6), arg(I32, 0))))
        );
        CfgState<SignDomain> state = SignAnalysis.execute(func);
        assertEquals(SignDomain.POSITIVE, outgoing(state, 0, 2));
        assertEquals(SignDomain.NEGATIVE, outgoing(state, 0, 3));
        assertEquals(SignDomain.NEGATIVE, outgoing(state, 0, 4));
        assertEquals(SignDomain.TOP, outgoing(state, 0, 5));
        assertEquals(SignDomain.ZERO, outgoing(state, 0, 6));
        assertEquals(SignDomain.ZERO, outgoing(state, 0, 7));
    }

    @Test
    void testStrictOperators() {
        // reading a slot before anything is stored yields bottom, and so does arithmetic on it
        Function func = function("uninit", fn(I32), params(),
                block(0, inst(VOID, 3, ret(reg(I32, 2))),
                        inst(PTR, 0, alloca(I32)),
                        inst(I32, 1, load(I32, reg(PTR, 0))),
                        inst(I32, 2, binary("add", reg(I32, 1), intConst(I32, 1))))
        );
        CfgState<SignDomain> state = SignAnalysis.execute(func);
        assertEquals(SignDomain.BOTTOM, outgoing(state, 0, 1));
        assertEquals(SignDomain.BOTTOM, outgoing(state, 0, 2));
        assertTrue(state.getBlock(io.github.libra.core.ir.BlockLabel.of(0)).getOutgoing().entries().isEmpty());
    }
}
