package io.github.libra.core.ir;

import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.*;

/**
 * The single instruction ending a {@link Block}, which decides where control goes next.
 */
public abstract class Terminator {
    Terminator() {
    }

    /**
     * Get the register this terminator writes to. Only an {@link Invoke} may have one.
     *
     * @return The result register, or null.
     */
    public @Nullable RegisterSlot result() {
        return null;
    }

    public abstract List<Value> operands();

    public abstract <P, R> R accept(Visitor<P, R> visitor, P param);

    /**
     * A visitor over the kinds of {@link Terminator}.
     *
     * @param <P> The parameter type.
     * @param <R> The result type.
     */
    public interface Visitor<P, R> {
        R visitReturn(Return term, P param);

        R visitGoto(Goto term, P param);

        R visitBranch(Branch term, P param);

        R visitSwitch(Switch term, P param);

        R visitIndirectJump(IndirectJump term, P param);

        R visitInvoke(Invoke term, P param);

        R visitResume(Resume term, P param);

        R visitUnreachable(Unreachable term, P param);
    }

    public static final class Return extends Terminator {
        public final @Nullable Value value;

        public Return(@Nullable Value value) {
            this.value = value;
        }

        @Override
        public List<Value> operands() {
            return value == null ? Collections.emptyList() : Collections.singletonList(value);
        }

        @Override
        public <P, R> R accept(Visitor<P, R> visitor, P param) {
            return visitor.visitReturn(this, param);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Return && Objects.equals(value, ((Return) o).value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Return.class, value);
        }

        @Override
        public String toString() {
            return value == null ? "ret" : "ret " + value;
        }
    }

    public static final class Goto extends Terminator {
        public final BlockLabel target;

        public Goto(BlockLabel target) {
            this.target = target;
        }

        @Override
        public List<Value> operands() {
            return Collections.emptyList();
        }

        @Override
        public <P, R> R accept(Visitor<P, R> visitor, P param) {
            return visitor.visitGoto(this, param);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Goto && target.equals(((Goto) o).target);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Goto.class, target);
        }

        @Override
        public String toString() {
            return "goto " + target;
        }
    }

    public static final class Branch extends Terminator {
        public final Value cond;
        public final BlockLabel thenTarget;
        public final BlockLabel elseTarget;

        public Branch(Value cond, BlockLabel thenTarget, BlockLabel elseTarget) {
            this.cond = cond;
            this.thenTarget = thenTarget;
            this.elseTarget = elseTarget;
        }

        @Override
        public List<Value> operands() {
            return Collections.singletonList(cond);
        }

        @Override
        public <P, R> R accept(Visitor<P, R> visitor, P param) {
            return visitor.visitBranch(this, param);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Branch)) return false;
            Branch that = (Branch) o;
            return cond.equals(that.cond) && thenTarget.equals(that.thenTarget) && elseTarget.equals(that.elseTarget);
        }

        @Override
        public int hashCode() {
            return Objects.hash(cond, thenTarget, elseTarget);
        }

        @Override
        public String toString() {
            return "br " + cond + ", " + thenTarget + ", " + elseTarget;
        }
    }

    public static final class Switch extends Terminator {
        public final Value cond;
        /**
         * The target of each case, keyed by the unsigned case value.
         */
        public final SortedMap<BigInteger, BlockLabel> cases;
        public final @Nullable BlockLabel defaultTarget;

        public Switch(Value cond, SortedMap<BigInteger, BlockLabel> cases, @Nullable BlockLabel defaultTarget) {
            this.cond = cond;
            this.cases = cases;
            this.defaultTarget = defaultTarget;
        }

        @Override
        public List<Value> operands() {
            return Collections.singletonList(cond);
        }

        @Override
        public <P, R> R accept(Visitor<P, R> visitor, P param) {
            return visitor.visitSwitch(this, param);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Switch)) return false;
            Switch that = (Switch) o;
            return cond.equals(that.cond) && cases.equals(that.cases) && Objects.equals(defaultTarget, that.defaultTarget);
        }

        @Override
        public int hashCode() {
            return Objects.hash(cond, cases, defaultTarget);
        }

        @Override
        public String toString() {
            return "switch " + cond + " " + cases + (defaultTarget == null ? "" : " default " + defaultTarget);
        }
    }

    /**
     * A jump to a computed address, which may be any of the listed targets.
     */
    public static final class IndirectJump extends Terminator {
        public final Value address;
        public final SortedSet<BlockLabel> targets;

        public IndirectJump(Value address, SortedSet<BlockLabel> targets) {
            this.address = address;
            this.targets = targets;
        }

        @Override
        public List<Value> operands() {
            return Collections.singletonList(address);
        }

        @Override
        public <P, R> R accept(Visitor<P, R> visitor, P param) {
            return visitor.visitIndirectJump(this, param);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof IndirectJump)) return false;
            IndirectJump that = (IndirectJump) o;
            return address.equals(that.address) && targets.equals(that.targets);
        }

        @Override
        public int hashCode() {
            return Objects.hash(address, targets);
        }

        @Override
        public String toString() {
            return "indirectbr " + address + " " + targets;
        }
    }

    /**
     * A call which continues at {@link #normal} on return, or at {@link #unwind} if it throws.
     */
    public static final class Invoke extends Terminator {
        public final @Nullable RegisterSlot result;
        public final Instruction.CallKind kind;
        public final Value callee;
        public final Type.Function signature;
        public final List<Value> args;
        public final BlockLabel normal;
        public final BlockLabel unwind;

        public Invoke(
                @Nullable RegisterSlot result,
                Instruction.CallKind kind,
                Value callee,
                Type.Function signature,
                List<Value> args,
                BlockLabel normal,
                BlockLabel unwind
        ) {
            this.result = result;
            this.kind = kind;
            this.callee = callee;
            this.signature = signature;
            this.args = args;
            this.normal = normal;
            this.unwind = unwind;
        }

        @Override
        public @Nullable RegisterSlot result() {
            return result;
        }

        @Override
        public List<Value> operands() {
            List<Value> operands = new ArrayList<>(args.size() + 1);
            operands.add(callee);
            operands.addAll(args);
            return operands;
        }

        @Override
        public <P, R> R accept(Visitor<P, R> visitor, P param) {
            return visitor.visitInvoke(this, param);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Invoke)) return false;
            Invoke that = (Invoke) o;
            return Objects.equals(result, that.result)
                    && kind == that.kind
                    && callee.equals(that.callee)
                    && signature.equals(that.signature)
                    && args.equals(that.args)
                    && normal.equals(that.normal)
                    && unwind.equals(that.unwind);
        }

        @Override
        public int hashCode() {
            return Objects.hash(result, kind, callee, signature, args, normal, unwind);
        }

        @Override
        public String toString() {
            return (result == null ? "" : result + " = ") + "invoke " + callee + args
                    + " to " + normal + " unwind " + unwind;
        }
    }

    public static final class Resume extends Terminator {
        public final Value value;

        public Resume(Value value) {
            this.value = value;
        }

        @Override
        public List<Value> operands() {
            return Collections.singletonList(value);
        }

        @Override
        public <P, R> R accept(Visitor<P, R> visitor, P param) {
            return visitor.visitResume(this, param);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Resume && value.equals(((Resume) o).value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Resume.class, value);
        }

        @Override
        public String toString() {
            return "resume " + value;
        }
    }

    public static final class Unreachable extends Terminator {
        public static final Unreachable INSTANCE = new Unreachable();

        private Unreachable() {
        }

        @Override
        public List<Value> operands() {
            return Collections.emptyList();
        }

        @Override
        public <P, R> R accept(Visitor<P, R> visitor, P param) {
            return visitor.visitUnreachable(this, param);
        }

        @Override
        public String toString() {
            return "unreachable";
        }
    }
}
