package io.github.libra.test;

import io.github.libra.core.adapter.AdaptedFunction;
import io.github.libra.core.domain.FiniteSetDomain;
import io.github.libra.core.flow.*;
import io.github.libra.core.ir.*;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static io.github.libra.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class FixedPointTest {
    private static final RegisterSlot P = RegisterSlot.of(0);

    /**
     * Tracks the integer constants that may have been stored to each stack slot.
     */
    private static final Transfer<FiniteSetDomain<BigInteger>> REACHING_CONSTANTS = (inst, store) -> {
        if (inst instanceof Instruction.Store) {
            Instruction.Store st = (Instruction.Store) inst;
            if (st.pointer instanceof Value.Register && st.value instanceof Value.Const) {
                Constant value = ((Value.Const) st.value).constant;
                if (value instanceof Constant.Int) {
                    store.set(((Value.Register) st.pointer).slot, FiniteSetDomain.of(((Constant.Int) value).signedValue()));
                }
            }
        } else if (inst instanceof Instruction.Load) {
            Instruction.Load load = (Instruction.Load) inst;
            if (inst.result != null && load.pointer instanceof Value.Register) {
                store.set(inst.result, store.get(((Value.Register) load.pointer).slot));
            }
        }
    };

    /**
     * Marks the stack slots that are read later, and forgets them at their allocation.
     */
    private static final Transfer<FiniteSetDomain<String>> READ_LATER = (inst, store) -> {
        if (inst instanceof Instruction.Load && ((Instruction.Load) inst).pointer instanceof Value.Register) {
            store.set(((Value.Register) ((Instruction.Load) inst).pointer).slot, FiniteSetDomain.of("read"));
        } else if (inst instanceof Instruction.Alloca) {
            store.set(inst.result, FiniteSetDomain.empty());
        }
    };

    private static FixedPoint<FiniteSetDomain<BigInteger>> forward() {
        return new FixedPoint<>(FiniteSetDomain.<BigInteger>empty(), REACHING_CONSTANTS, Direction.FORWARD);
    }

    static AdaptedFunction diamond() {
        return define("diamond", fn(I32, I1), params(I1),
                block(0, inst(VOID, 1, branch(arg(I1, 0), 1, 2)),
                        inst(PTR, 0, alloca(I32))),
                block(1, inst(VOID, 3, jump(3)),
                        inst(VOID, 2, store(I32, reg(PTR, 0), intConst(I32, 1)))),
                block(2, inst(VOID, 5, jump(3)),
                        inst(VOID, 4, store(I32, reg(PTR, 0), intConst(I32, -1)))),
                block(3, inst(VOID, 7, ret(reg(I32, 6))),
                        inst(I32, 6, load(I32, reg(PTR, 0))))
        );
    }

    @Test
    void testDiamond() {
        CfgState<FiniteSetDomain<BigInteger>> state = forward().run(convertFunction(diamond()));

        FiniteSetDomain<BigInteger> merged = FiniteSetDomain.of(BigInteger.ONE, BigInteger.ONE.negate());
        assertEquals(merged, state.getBlock(BlockLabel.of(3)).getIncoming().get(P));
        assertEquals(merged, state.getBlock(BlockLabel.of(3)).getOutgoing().get(RegisterSlot.of(6)));
        assertEquals(FiniteSetDomain.of(BigInteger.ONE), state.getBlock(BlockLabel.of(1)).getOutgoing().get(P));
        assertTrue(state.getBlock(BlockLabel.of(0)).getOutgoing().entries().isEmpty());
        assertEquals(4, state.getIterations());
    }

    @Test
    void testDeterministic() {
        Function func = convertFunction(diamond());
        assertEquals(forward().run(func), forward().run(func));
        assertEquals(forward().run(func).getIterations(), forward().run(func).getIterations());
    }

    @Test
    void testSelfLoop() {
        Function func = convertFunction(define("loop", fn(I32, I1), params(I1),
                block(0, inst(VOID, 2, jump(1)),
                        inst(PTR, 0, alloca(I32)),
                        inst(VOID, 1, store(I32, reg(PTR, 0), intConst(I32, 0)))),
                block(1, inst(VOID, 3, branch(arg(I1, 0), 1, 2))),
                block(2, inst(VOID, 5, ret(reg(I32, 4))),
                        inst(I32, 4, load(I32, reg(PTR, 0))))
        ));
        CfgState<FiniteSetDomain<BigInteger>> state = forward().run(func);
        assertEquals(FiniteSetDomain.of(BigInteger.ZERO), state.getBlock(BlockLabel.of(1)).getIncoming().get(P));
        assertEquals(FiniteSetDomain.of(BigInteger.ZERO), state.getBlock(BlockLabel.of(2)).getOutgoing().get(RegisterSlot.of(4)));
        assertEquals(4, state.getIterations());
    }

    @Test
    void testBackward() {
        FixedPoint<FiniteSetDomain<String>> pass = new FixedPoint<>(FiniteSetDomain.<String>empty(), READ_LATER, Direction.BACKWARD);
        CfgState<FiniteSetDomain<String>> state = pass.run(convertFunction(diamond()));

        FiniteSetDomain<String> read = FiniteSetDomain.of("read");
        assertEquals(read, state.getBlock(BlockLabel.of(3)).getIncoming().get(P));
        assertEquals(read, state.getBlock(BlockLabel.of(1)).getIncoming().get(P));
        assertEquals(read, state.getBlock(BlockLabel.of(0)).getOutgoing().get(P));
        assertEquals(FiniteSetDomain.<String>empty(), state.getBlock(BlockLabel.of(0)).getIncoming().get(P));
        assertEquals(8, state.getIterations());
    }

    @Test
    void testDeclarationHasNoBlocks() {
        Function declaration = convertFunction(declare("external", fn(VOID)));
        CfgState<FiniteSetDomain<BigInteger>> state = forward().run(declaration);
        assertTrue(state.getBlocks().isEmpty());
        assertEquals(0, state.getIterations());
    }

    @Test
    void testUnknownBlock() {
        CfgState<FiniteSetDomain<BigInteger>> state = forward().run(convertFunction(diamond()));
        assertThrows(io.github.libra.core.error.EngineException.class, () -> state.getBlock(BlockLabel.of(9)));
    }
}
