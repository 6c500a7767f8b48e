package io.github.libra.test;

import io.github.libra.core.adapter.*;
import io.github.libra.core.domain.AbstractDomain;
import io.github.libra.core.domain.PartialOrder;
import io.github.libra.core.flow.CfgState;
import io.github.libra.core.ir.BlockLabel;
import io.github.libra.core.ir.Function;
import io.github.libra.core.ir.Identifier;
import io.github.libra.core.ir.RegisterSlot;
import io.github.libra.core.passes.convert.AdapterToIr;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class Utils {
    public static final AdaptedType VOID = AdaptedType.Void.INSTANCE;
    public static final AdaptedType I1 = new AdaptedType.Int(1);
    public static final AdaptedType I8 = new AdaptedType.Int(8);
    public static final AdaptedType I32 = new AdaptedType.Int(32);
    public static final AdaptedType PTR = new AdaptedType.Pointer(0);

    public static AdaptedType fn(AdaptedType ret, AdaptedType... params) {
        return new AdaptedType.Function(Arrays.asList(params), false, ret);
    }

    public static AdaptedValue intConst(AdaptedType ty, long value) {
        return new AdaptedValue.Constant(new AdaptedConstant.Int(ty, Long.toString(value)));
    }

    public static AdaptedValue reg(AdaptedType ty, int index) {
        return new AdaptedValue.Instruction(ty, index);
    }

    public static AdaptedValue arg(AdaptedType ty, int index) {
        return new AdaptedValue.Argument(ty, index);
    }

    public static AdaptedInstruction inst(AdaptedType ty, int index, AdaptedInst repr) {
        return new AdaptedInstruction(null, ty, index, repr);
    }

    public static AdaptedInst alloca(AdaptedType allocated) {
        return new AdaptedInst.Alloca(allocated, null, 0);
    }

    public static AdaptedInst load(AdaptedType pointee, AdaptedValue pointer) {
        return new AdaptedInst.Load(pointee, pointer, AdaptedInst.NOT_ATOMIC, 0);
    }

    public static AdaptedInst store(AdaptedType pointee, AdaptedValue pointer, AdaptedValue value) {
        return new AdaptedInst.Store(pointee, pointer, value, AdaptedInst.NOT_ATOMIC, 0);
    }

    public static AdaptedInst binary(String opcode, AdaptedValue lhs, AdaptedValue rhs) {
        return new AdaptedInst.Binary(opcode, lhs, rhs);
    }

    public static AdaptedInst compare(String predicate, AdaptedType operandType, AdaptedValue lhs, AdaptedValue rhs) {
        return new AdaptedInst.Compare(predicate, operandType, lhs, rhs);
    }

    public static AdaptedInst cast(String opcode, AdaptedType from, AdaptedType into, AdaptedValue operand) {
        return new AdaptedInst.Cast(opcode, from, into, null, null, operand);
    }

    public static AdaptedInst ret(AdaptedValue value) {
        return new AdaptedInst.Return(value);
    }

    public static AdaptedInst jump(int target) {
        return new AdaptedInst.Branch(null, Collections.singletonList(target));
    }

    public static AdaptedInst branch(AdaptedValue cond, int then, int otherwise) {
        return new AdaptedInst.Branch(cond, Arrays.asList(then, otherwise));
    }

    public static AdaptedBlock block(int label, AdaptedInstruction terminator, AdaptedInstruction... body) {
        return new AdaptedBlock(label, null, Arrays.asList(body), terminator);
    }

    public static List<AdaptedParameter> params(AdaptedType... types) {
        AdaptedParameter[] params = new AdaptedParameter[types.length];
        for (int i = 0; i < types.length; i++) {
            params[i] = AdaptedParameter.plain(null, types[i]);
        }
        return Arrays.asList(params);
    }

    /**
     * Convert a single function defined in a module of its own.
     */
    public static Function function(String name, AdaptedType ty, List<AdaptedParameter> params, AdaptedBlock... blocks) {
        AdaptedFunction func = new AdaptedFunction(name, ty, true, true, false, params, Arrays.asList(blocks));
        AdaptedModule module = new AdaptedModule("test", "", Collections.emptyList(), Collections.emptyList(),
                Collections.singletonList(func));
        return AdapterToIr.INSTANCE.run(module).functions.get(Identifier.of(name));
    }

    /**
     * A stack slot (register 0) set to 1 on one branch and -1 on the other, then loaded into
     * register 6 at the join point (block 3).
     */
    public static Function diamond() {
        return function("diamond", fn(I32, I1), params(I1),
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

    public static <D extends AbstractDomain<D>> D incoming(CfgState<D> state, int block, int register) {
        return state.getBlock(BlockLabel.of(block)).getIncoming().get(RegisterSlot.of(register));
    }

    public static <D extends AbstractDomain<D>> D outgoing(CfgState<D> state, int block, int register) {
        return state.getBlock(BlockLabel.of(block)).getOutgoing().get(RegisterSlot.of(register));
    }

    /**
     * Check the lattice laws every domain must satisfy on all pairs of the given samples.
     */
    public static <D extends AbstractDomain<D>> void checkLaws(List<D> samples) {
        for (D a : samples) {
            assertEquals(PartialOrder.EQUAL, a.compare(a), a::toString);
            assertEquals(a, a.join(a));
            assertTrue(a.bottom().compare(a).isLessOrEqual(), a::toString);
            for (D b : samples) {
                String pair = a + ", " + b;
                D join = a.join(b);
                assertEquals(join, b.join(a), pair);
                assertTrue(a.compare(join).isLessOrEqual(), pair);
                assertTrue(b.compare(join).isLessOrEqual(), pair);
                assertEquals(a.compare(b).reverse(), b.compare(a), pair);
                assertEquals(a.equals(b), a.compare(b) == PartialOrder.EQUAL, pair);

                D widened = a.widen(b);
                assertTrue(a.compare(widened).isLessOrEqual(), pair);
                assertTrue(b.compare(widened).isLessOrEqual(), pair);
                for (D c : samples) {
                    assertTrue(widened.narrow(c).compare(widened).isLessOrEqual(), pair + ", " + c);
                }
            }
        }
    }
}
