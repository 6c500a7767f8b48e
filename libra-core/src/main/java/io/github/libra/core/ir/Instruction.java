package io.github.libra.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A non-terminator instruction of a {@link Block}.
 * <p>
 * Each kind of instruction is a subclass, and code which depends on the kind of
 * instruction should go through {@link #accept(Visitor, Object)}, so that adding a
 * kind is a compile error in every {@link Visitor}.
 */
public abstract class Instruction {
    /**
     * The register this instruction writes to, or null if it has no result, or is
     * part of a constant expression.
     */
    public final @Nullable RegisterSlot result;

    Instruction(@Nullable RegisterSlot result) {
        this.result = result;
    }

    /**
     * Get the type of the result of this instruction.
     *
     * @return The result type, or null if the instruction produces no value.
     */
    public abstract @Nullable Type resultType();

    /**
     * Get the values this instruction reads, in order.
     *
     * @return The operands.
     */
    public abstract List<Value> operands();

    public abstract <P, R> R accept(Visitor<P, R> visitor, P param);

    /**
     * A visitor over the kinds of {@link Instruction}.
     *
     * @param <P> The parameter type.
     * @param <R> The result type.
     */
    public interface Visitor<P, R> {
        R visitAlloca(Alloca inst, P param);

        R visitLoad(Load inst, P param);

        R visitStore(Store inst, P param);

        R visitCall(Call inst, P param);

        R visitBinary(Binary inst, P param);

        R visitCompare(Compare inst, P param);

        R visitCast(Cast inst, P param);

        R visitFreeze(Freeze inst, P param);

        R visitGEP(GEP inst, P param);

        R visitITE(ITE inst, P param);

        R visitPhi(Phi inst, P param);

        R visitGetValue(GetValue inst, P param);

        R visitSetValue(SetValue inst, P param);

        R visitLandingPad(LandingPad inst, P param);
    }

    public enum BinaryOperator {
        ADD,
        SUB,
        MUL,
        UDIV,
        SDIV,
        UREM,
        SREM,
        SHL,
        LSHR,
        ASHR,
        AND,
        OR,
        XOR,
    }

    public enum ComparePredicate {
        EQ,
        NE,
        UGT,
        UGE,
        ULT,
        ULE,
        SGT,
        SGE,
        SLT,
        SLE,
        ;

        public boolean isSigned() {
            return this == SGT || this == SGE || this == SLT || this == SLE;
        }
    }

    public enum CastOperator {
        TRUNC,
        ZEXT,
        SEXT,
        PTR_TO_INT,
        INT_TO_PTR,
        BITCAST,
    }

    public enum CallKind {
        DIRECT,
        INDIRECT,
        INTRINSIC,
    }

    public static final class Alloca extends Instruction {
        public final Type allocatedType;
        public final @Nullable Value size;

        public Alloca(RegisterSlot result, Type allocatedType, @Nullable Value size) {
            super(result);
            this.allocatedType = allocatedType;
            this.size = size;
        }

        @Override
        public Type resultType() {
            return Type.Pointer.OPAQUE;
        }

        @Override
        public List<Value> operands() {
            return size == null ? Collections.emptyList() : Collections.singletonList(size);
        }

        @Override
        public <P, R> R accept(Visitor<P, R> visitor, P param) {
            return visitor.visitAlloca(this, param);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Alloca)) return false;
            Alloca that = (Alloca) o;
            return Objects.equals(result, that.result)
                    && allocatedType.equals(that.allocatedType)
                    && Objects.equals(size, that.size);
        }

        @Override
        public int hashCode() {
            return Objects.hash(result, allocatedType, size);
        }

        @Override
        public String toString() {
            return result + " = alloca " + allocatedType + (size == null ? "" : ", " + size);
        }
    }

    public static final class Load extends Instruction {
        public final Type pointeeType;
        public final Value pointer;

        public Load(@Nullable RegisterSlot result, Type pointeeType, Value pointer) {
            super(result);
            this.pointeeType = pointeeType;
            this.pointer = pointer;
        }

        @Override
        public Type resultType() {
            return pointeeType;
        }

        @Override
        public List<Value> operands() {
            return Collections.singletonList(pointer);
        }

        @Override
        public <P, R> R accept(Visitor<P, R> visitor, P param) {
            return visitor.visitLoad(this, param);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Load)) return false;
            Load that = (Load) o;
            return Objects.equals(result, that.result)
                    && pointeeType.equals(that.pointeeType)
                    && pointer.equals(that.pointer);
        }

        @Override
        public int hashCode() {
            return Objects.hash(result, pointeeType, pointer);
        }

        @Override
        public String toString() {
            return result + " = load " + pointeeType + ", " + pointer;
        }
    }

    public static final class Store extends Instruction {
        public final Type pointeeType;
        public final Value pointer;
        public final Value value;

        public Store(Type pointeeType, Value pointer, Value value) {
            super(null);
            this.pointeeType = pointeeType;
            this.pointer = pointer;
            this.value = value;
        }

        @Override
        public @Nullable Type resultType() {
            return null;
        }

        @Override
        public List<Value> operands() {
            return Arrays.asList(pointer, value);
        }

        @Override
        public <P, R> R accept(Visitor<P, R> visitor, P param) {
            return visitor.visitStore(this, param);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Store)) return false;
            Store that = (Store) o;
            return pointeeType.equals(that.pointeeType) && pointer.equals(that.pointer) && value.equals(that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(pointeeType, pointer, value);
        }

        @Override
        public String toString() {
            return "store " + value + ", " + pointer;
        }
    }

    public static final class Call extends Instruction {
        public final CallKind kind;
        public final Value callee;
        public final Type.Function signature;
        public final List<Value> args;

        public Call(@Nullable RegisterSlot result, CallKind kind, Value callee, Type.Function signature, List<Value> args) {
            super(result);
            this.kind = kind;
            this.callee = callee;
            this.signature = signature;
            this.args = args;
        }

        @Override
        public @Nullable Type resultType() {
            return signature.ret;
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
            return visitor.visitCall(this, param);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Call)) return false;
            Call that = (Call) o;
            return Objects.equals(result, that.result)
                    && kind == that.kind
                    && callee.equals(that.callee)
                    && signature.equals(that.signature)
                    && args.equals(that.args);
        }

        @Override
        public int hashCode() {
            return Objects.hash(result, kind, callee, signature, args);
        }

        @Override
        public String toString() {
            return (result == null ? "" : result + " = ") + "call " + callee + args;
        }
    }

    public static final class Binary extends Instruction {
        public final int bits;
        public final BinaryOperator operator;
        public final Value lhs;
        public final Value rhs;

        public Binary(@Nullable RegisterSlot result, int bits, BinaryOperator operator, Value lhs, Value rhs) {
            super(result);
            this.bits = bits;
            this.operator = operator;
            this.lhs = lhs;
            this.rhs = rhs;
        }

        @Override
        public Type resultType() {
            return new Type.Int(bits);
        }

        @Override
        public List<Value> operands() {
            return Arrays.asList(lhs, rhs);
        }

        @Override
        public <P, R> R accept(Visitor<P, R> visitor, P param) {
            return visitor.visitBinary(this, param);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Binary)) return false;
            Binary that = (Binary) o;
            return Objects.equals(result, that.result)
                    && bits == that.bits
                    && operator == that.operator
                    && lhs.equals(that.lhs)
                    && rhs.equals(that.rhs);
        }

        @Override
        public int hashCode() {
            return Objects.hash(result, bits, operator, lhs, rhs);
        }

        @Override
        public String toString() {
            return (result == null ? "" : result + " = ")
                    + operator.name().toLowerCase(Locale.ROOT) + " i" + bits + " " + lhs + ", " + rhs;
        }
    }

    public static final class Compare extends Instruction {
        public final Type operandType;
        public final ComparePredicate predicate;
        public final Value lhs;
        public final Value rhs;

        public Compare(@Nullable RegisterSlot result, Type operandType, ComparePredicate predicate, Value lhs, Value rhs) {
            super(result);
            this.operandType = operandType;
            this.predicate = predicate;
            this.lhs = lhs;
            this.rhs = rhs;
        }

        @Override
        public Type resultType() {
            return new Type.Int(1);
        }

        @Override
        public List<Value> operands() {
            return Arrays.asList(lhs, rhs);
        }

        @Override
        public <P, R> R accept(Visitor<P, R> visitor, P param) {
            return visitor.visitCompare(this, param);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Compare)) return false;
            Compare that = (Compare) o;
            return Objects.equals(result, that.result)
                    && operandType.equals(that.operandType)
                    && predicate == that.predicate
                    && lhs.equals(that.lhs)
                    && rhs.equals(that.rhs);
        }

        @Override
        public int hashCode() {
            return Objects.hash(result, operandType, predicate, lhs, rhs);
        }

        @Override
        public String toString() {
            return (result == null ? "" : result + " = ")
                    + "cmp " + predicate.name().toLowerCase(Locale.ROOT) + " " + lhs + ", " + rhs;
        }
    }

    public static final class Cast extends Instruction {
        public final CastOperator operator;
        public final Type from;
        public final Type into;
        public final Value operand;

        public Cast(@Nullable RegisterSlot result, CastOperator operator, Type from, Type into, Value operand) {
            super(result);
            this.operator = operator;
            this.from = from;
            this.into = into;
            this.operand = operand;
        }

        @Override
        public Type resultType() {
            return into;
        }

        @Override
        public List<Value> operands() {
            return Collections.singletonList(operand);
        }

        @Override
        public <P, R> R accept(Visitor<P, R> visitor, P param) {
            return visitor.visitCast(this, param);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Cast)) return false;
            Cast that = (Cast) o;
            return Objects.equals(result, that.result)
                    && operator == that.operator
                    && from.equals(that.from)
                    && into.equals(that.into)
                    && operand.equals(that.operand);
        }

        @Override
        public int hashCode() {
            return Objects.hash(result, operator, from, into, operand);
        }

        @Override
        public String toString() {
            return (result == null ? "" : result + " = ")
                    + operator.name().toLowerCase(Locale.ROOT) + " " + operand + " to " + into;
        }
    }

    public static final class Freeze extends Instruction {
        public final Value operand;

        public Freeze(@Nullable RegisterSlot result, Value operand) {
            super(result);
            this.operand = operand;
        }

        @Override
        public Type resultType() {
            return operand.type();
        }

        @Override
        public List<Value> operands() {
            return Collections.singletonList(operand);
        }

        @Override
        public <P, R> R accept(Visitor<P, R> visitor, P param) {
            return visitor.visitFreeze(this, param);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Freeze)) return false;
            Freeze that = (Freeze) o;
            return Objects.equals(result, that.result) && operand.equals(that.operand);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Freeze.class, result, operand);
        }

        @Override
        public String toString() {
            return (result == null ? "" : result + " = ") + "freeze " + operand;
        }
    }

    /**
     * Address computation into an aggregate.
     */
    public static final class GEP extends Instruction {
        public final Type srcPointeeType;
        public final Type dstPointeeType;
        public final Value pointer;
        public final List<Value> indices;

        public GEP(@Nullable RegisterSlot result, Type srcPointeeType, Type dstPointeeType, Value pointer, List<Value> indices) {
            super(result);
            this.srcPointeeType = srcPointeeType;
            this.dstPointeeType = dstPointeeType;
            this.pointer = pointer;
            this.indices = indices;
        }

        @Override
        public Type resultType() {
            return Type.Pointer.OPAQUE;
        }

        @Override
        public List<Value> operands() {
            List<Value> operands = new ArrayList<>(indices.size() + 1);
            operands.add(pointer);
            operands.addAll(indices);
            return operands;
        }

        @Override
        public <P, R> R accept(Visitor<P, R> visitor, P param) {
            return visitor.visitGEP(this, param);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof GEP)) return false;
            GEP that = (GEP) o;
            return Objects.equals(result, that.result)
                    && srcPointeeType.equals(that.srcPointeeType)
                    && dstPointeeType.equals(that.dstPointeeType)
                    && pointer.equals(that.pointer)
                    && indices.equals(that.indices);
        }

        @Override
        public int hashCode() {
            return Objects.hash(result, srcPointeeType, dstPointeeType, pointer, indices);
        }

        @Override
        public String toString() {
            return (result == null ? "" : result + " = ") + "gep " + srcPointeeType + ", " + pointer + indices;
        }
    }

    /**
     * If-then-else over values, selecting one of two operands.
     */
    public static final class ITE extends Instruction {
        public final Type type;
        public final Value cond;
        public final Value thenValue;
        public final Value elseValue;

        public ITE(@Nullable RegisterSlot result, Type type, Value cond, Value thenValue, Value elseValue) {
            super(result);
            this.type = type;
            this.cond = cond;
            this.thenValue = thenValue;
            this.elseValue = elseValue;
        }

        @Override
        public Type resultType() {
            return type;
        }

        @Override
        public List<Value> operands() {
            return Arrays.asList(cond, thenValue, elseValue);
        }

        @Override
        public <P, R> R accept(Visitor<P, R> visitor, P param) {
            return visitor.visitITE(this, param);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ITE)) return false;
            ITE that = (ITE) o;
            return Objects.equals(result, that.result)
                    && type.equals(that.type)
                    && cond.equals(that.cond)
                    && thenValue.equals(that.thenValue)
                    && elseValue.equals(that.elseValue);
        }

        @Override
        public int hashCode() {
            return Objects.hash(result, type, cond, thenValue, elseValue);
        }

        @Override
        public String toString() {
            return (result == null ? "" : result + " = ") + "ite " + cond + ", " + thenValue + ", " + elseValue;
        }
    }

    public static final class Phi extends Instruction {
        public final Type type;
        /**
         * The value to take for each incoming block.
         */
        public final SortedMap<BlockLabel, Value> options;

        public Phi(RegisterSlot result, Type type, SortedMap<BlockLabel, Value> options) {
            super(result);
            this.type = type;
            this.options = options;
        }

        @Override
        public Type resultType() {
            return type;
        }

        @Override
        public List<Value> operands() {
            return new ArrayList<>(options.values());
        }

        @Override
        public <P, R> R accept(Visitor<P, R> visitor, P param) {
            return visitor.visitPhi(this, param);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Phi)) return false;
            Phi that = (Phi) o;
            return Objects.equals(result, that.result) && type.equals(that.type) && options.equals(that.options);
        }

        @Override
        public int hashCode() {
            return Objects.hash(result, type, options);
        }

        @Override
        public String toString() {
            return result + " = phi " + options;
        }
    }

    public static final class GetValue extends Instruction {
        public final Type aggregateType;
        public final Value aggregate;
        public final List<Integer> indices;
        public final Type type;

        public GetValue(@Nullable RegisterSlot result, Type aggregateType, Value aggregate, List<Integer> indices, Type type) {
            super(result);
            this.aggregateType = aggregateType;
            this.aggregate = aggregate;
            this.indices = indices;
            this.type = type;
        }

        @Override
        public Type resultType() {
            return type;
        }

        @Override
        public List<Value> operands() {
            return Collections.singletonList(aggregate);
        }

        @Override
        public <P, R> R accept(Visitor<P, R> visitor, P param) {
            return visitor.visitGetValue(this, param);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof GetValue)) return false;
            GetValue that = (GetValue) o;
            return Objects.equals(result, that.result)
                    && aggregateType.equals(that.aggregateType)
                    && aggregate.equals(that.aggregate)
                    && indices.equals(that.indices)
                    && type.equals(that.type);
        }

        @Override
        public int hashCode() {
            return Objects.hash(result, aggregateType, aggregate, indices, type);
        }

        @Override
        public String toString() {
            return (result == null ? "" : result + " = ") + "getvalue " + aggregate + indices;
        }
    }

    public static final class SetValue extends Instruction {
        public final Type aggregateType;
        public final Value aggregate;
        public final Value value;
        public final List<Integer> indices;

        public SetValue(@Nullable RegisterSlot result, Type aggregateType, Value aggregate, Value value, List<Integer> indices) {
            super(result);
            this.aggregateType = aggregateType;
            this.aggregate = aggregate;
            this.value = value;
            this.indices = indices;
        }

        @Override
        public Type resultType() {
            return aggregateType;
        }

        @Override
        public List<Value> operands() {
            return Arrays.asList(aggregate, value);
        }

        @Override
        public <P, R> R accept(Visitor<P, R> visitor, P param) {
            return visitor.visitSetValue(this, param);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof SetValue)) return false;
            SetValue that = (SetValue) o;
            return Objects.equals(result, that.result)
                    && aggregateType.equals(that.aggregateType)
                    && aggregate.equals(that.aggregate)
                    && value.equals(that.value)
                    && indices.equals(that.indices);
        }

        @Override
        public int hashCode() {
            return Objects.hash(result, aggregateType, aggregate, value, indices);
        }

        @Override
        public String toString() {
            return (result == null ? "" : result + " = ") + "setvalue " + aggregate + indices + ", " + value;
        }
    }

    /**
     * The entry of an exception-unwind target.
     */
    public static final class LandingPad extends Instruction {
        /**
         * A catch or filter clause of a landing pad.
         */
        public static final class Clause {
            public final boolean filter;
            /**
             * The type infos matched by this clause; empty for a catch-all.
             */
            public final List<Identifier> typeInfos;

            public Clause(boolean filter, List<Identifier> typeInfos) {
                this.filter = filter;
                this.typeInfos = typeInfos;
            }

            @Override
            public boolean equals(Object o) {
                if (this == o) return true;
                if (!(o instanceof Clause)) return false;
                Clause that = (Clause) o;
                return filter == that.filter && typeInfos.equals(that.typeInfos);
            }

            @Override
            public int hashCode() {
                return Objects.hash(filter, typeInfos);
            }

            @Override
            public String toString() {
                return (filter ? "filter " : "catch ") + typeInfos;
            }
        }

        public final Type type;
        public final boolean cleanup;
        public final List<Clause> clauses;

        public LandingPad(RegisterSlot result, Type type, boolean cleanup, List<Clause> clauses) {
            super(result);
            this.type = type;
            this.cleanup = cleanup;
            this.clauses = clauses;
        }

        @Override
        public Type resultType() {
            return type;
        }

        @Override
        public List<Value> operands() {
            return Collections.emptyList();
        }

        @Override
        public <P, R> R accept(Visitor<P, R> visitor, P param) {
            return visitor.visitLandingPad(this, param);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof LandingPad)) return false;
            LandingPad that = (LandingPad) o;
            return Objects.equals(result, that.result)
                    && cleanup == that.cleanup
                    && type.equals(that.type)
                    && clauses.equals(that.clauses);
        }

        @Override
        public int hashCode() {
            return Objects.hash(result, type, cleanup, clauses);
        }

        @Override
        public String toString() {
            return result + " = landingpad " + type + (cleanup ? " cleanup " : " ") + clauses;
        }
    }
}
