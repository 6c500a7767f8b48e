package io.github.libra.analysis;

import io.github.libra.core.domain.AbstractDomain;
import io.github.libra.core.flow.Transfer;
import io.github.libra.core.flow.VariableStore;
import io.github.libra.core.ir.*;
import org.jetbrains.annotations.Nullable;

/**
 * A transfer function for analyses which abstract the values held by registers.
 * <p>
 * Memory is modelled through the registers holding pointers: a store through a register
 * overwrites that register's slot with the abstraction of the stored value, and a load
 * through it reads the slot back. This makes stack slots created by {@code alloca} behave
 * like variables, and ignores aliasing.
 * <p>
 * Operators are strict: if any operand is bottom, so is the result.
 *
 * @param <D> The abstract domain.
 */
public abstract class ValueTransfer<D extends AbstractDomain<D>>
        implements Transfer<D>, Instruction.Visitor<VariableStore<D>, Void> {

    /**
     * Get the bottom element, for values that are not (yet) known to exist.
     *
     * @return Bottom.
     */
    protected abstract D bottom();

    /**
     * Get the top element, for values nothing is known about.
     *
     * @return Top.
     */
    protected abstract D top();

    protected abstract D constant(Constant.Int constant);

    protected abstract D binary(Instruction.BinaryOperator operator, int bits, D lhs, D rhs);

    protected D compare(Instruction.ComparePredicate predicate, D lhs, D rhs) {
        return top();
    }

    protected D cast(Instruction.Cast inst, D operand) {
        return top();
    }

    /**
     * Abstract the value of an operand in the given store.
     *
     * @param value The operand.
     * @param store The store.
     * @return The abstract value.
     */
    protected D eval(Value value, VariableStore<D> store) {
        if (value instanceof Value.Register) {
            return store.get(((Value.Register) value).slot);
        }
        if (value instanceof Value.Const && ((Value.Const) value).constant instanceof Constant.Int) {
            return constant((Constant.Int) ((Value.Const) value).constant);
        }
        return top();
    }

    private boolean isBottom(D value) {
        return value.equals(bottom());
    }

    private Void assign(@Nullable RegisterSlot result, D value, VariableStore<D> store) {
        if (result != null) store.set(result, value);
        return null;
    }

    @Override
    public void transfer(Instruction inst, VariableStore<D> store) {
        inst.accept(this, store);
    }

    @Override
    public void transferTerminator(Terminator term, VariableStore<D> store) {
        assign(term.result(), top(), store);
    }

    @Override
    public Void visitAlloca(Instruction.Alloca inst, VariableStore<D> store) {
        // nothing has been stored yet
        return assign(inst.result, bottom(), store);
    }

    @Override
    public Void visitLoad(Instruction.Load inst, VariableStore<D> store) {
        if (inst.pointer instanceof Value.Register) {
            return assign(inst.result, store.get(((Value.Register) inst.pointer).slot), store);
        }
        return assign(inst.result, top(), store);
    }

    @Override
    public Void visitStore(Instruction.Store inst, VariableStore<D> store) {
        if (inst.pointer instanceof Value.Register) {
            store.set(((Value.Register) inst.pointer).slot, eval(inst.value, store));
        }
        return null;
    }

    @Override
    public Void visitCall(Instruction.Call inst, VariableStore<D> store) {
        return assign(inst.result, top(), store);
    }

    @Override
    public Void visitBinary(Instruction.Binary inst, VariableStore<D> store) {
        D lhs = eval(inst.lhs, store);
        D rhs = eval(inst.rhs, store);
        if (isBottom(lhs) || isBottom(rhs)) return assign(inst.result, bottom(), store);
        return assign(inst.result, binary(inst.operator, inst.bits, lhs, rhs), store);
    }

    @Override
    public Void visitCompare(Instruction.Compare inst, VariableStore<D> store) {
        D lhs = eval(inst.lhs, store);
        D rhs = eval(inst.rhs, store);
        if (isBottom(lhs) || isBottom(rhs)) return assign(inst.result, bottom(), store);
        return assign(inst.result, compare(inst.predicate, lhs, rhs), store);
    }

    @Override
    public Void visitCast(Instruction.Cast inst, VariableStore<D> store) {
        D operand = eval(inst.operand, store);
        if (isBottom(operand)) return assign(inst.result, bottom(), store);
        return assign(inst.result, cast(inst, operand), store);
    }

    @Override
    public Void visitFreeze(Instruction.Freeze inst, VariableStore<D> store) {
        return assign(inst.result, eval(inst.operand, store), store);
    }

    @Override
    public Void visitGEP(Instruction.GEP inst, VariableStore<D> store) {
        return assign(inst.result, top(), store);
    }

    @Override
    public Void visitITE(Instruction.ITE inst, VariableStore<D> store) {
        return assign(inst.result, eval(inst.thenValue, store).join(eval(inst.elseValue, store)), store);
    }

    @Override
    public Void visitPhi(Instruction.Phi inst, VariableStore<D> store) {
        D joined = bottom();
        for (Value option : inst.options.values()) {
            joined = joined.join(eval(option, store));
        }
        return assign(inst.result, joined, store);
    }

    @Override
    public Void visitGetValue(Instruction.GetValue inst, VariableStore<D> store) {
        return assign(inst.result, top(), store);
    }

    @Override
    public Void visitSetValue(Instruction.SetValue inst, VariableStore<D> store) {
        return assign(inst.result, top(), store);
    }

    @Override
    public Void visitLandingPad(Instruction.LandingPad inst, VariableStore<D> store) {
        return assign(inst.result, top(), store);
    }
}
