package io.github.libra.core.adapter;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The opcode-specific part of an {@link AdaptedInstruction}.
 */
public abstract class AdaptedInst {
    /**
     * The memory ordering of plain, non-atomic memory accesses.
     */
    public static final String NOT_ATOMIC = "not_atomic";

    AdaptedInst() {
    }

    // memory

    public static final class Alloca extends AdaptedInst {
        public final AdaptedType allocatedType;
        public final @Nullable AdaptedValue size;
        public final int addressSpace;

        public Alloca(AdaptedType allocatedType, @Nullable AdaptedValue size, int addressSpace) {
            this.allocatedType = allocatedType;
            this.size = size;
            this.addressSpace = addressSpace;
        }
    }

    public static final class Load extends AdaptedInst {
        public final AdaptedType pointeeType;
        public final AdaptedValue pointer;
        public final String ordering;
        public final int addressSpace;

        public Load(AdaptedType pointeeType, AdaptedValue pointer, String ordering, int addressSpace) {
            this.pointeeType = pointeeType;
            this.pointer = pointer;
            this.ordering = ordering;
            this.addressSpace = addressSpace;
        }
    }

    public static final class Store extends AdaptedInst {
        public final AdaptedType pointeeType;
        public final AdaptedValue pointer;
        public final AdaptedValue value;
        public final String ordering;
        public final int addressSpace;

        public Store(AdaptedType pointeeType, AdaptedValue pointer, AdaptedValue value, String ordering, int addressSpace) {
            this.pointeeType = pointeeType;
            this.pointer = pointer;
            this.value = value;
            this.ordering = ordering;
            this.addressSpace = addressSpace;
        }
    }

    public static final class VAArg extends AdaptedInst {
        public final AdaptedValue pointer;

        public VAArg(AdaptedValue pointer) {
            this.pointer = pointer;
        }
    }

    // calls

    public enum CallKind {
        DIRECT,
        INDIRECT,
        INTRINSIC,
    }

    public static final class Call extends AdaptedInst {
        public final CallKind kind;
        public final AdaptedValue callee;
        public final AdaptedType targetType;
        public final List<AdaptedValue> args;

        public Call(CallKind kind, AdaptedValue callee, AdaptedType targetType, List<AdaptedValue> args) {
            this.kind = kind;
            this.callee = callee;
            this.targetType = targetType;
            this.args = args;
        }
    }

    public static final class CallAsm extends AdaptedInst {
        public final String asm;
        public final List<AdaptedValue> args;

        public CallAsm(String asm, List<AdaptedValue> args) {
            this.asm = asm;
            this.args = args;
        }
    }

    // arithmetic

    public static final class Unary extends AdaptedInst {
        public final String opcode;
        public final AdaptedValue operand;

        public Unary(String opcode, AdaptedValue operand) {
            this.opcode = opcode;
            this.operand = operand;
        }
    }

    public static final class Binary extends AdaptedInst {
        public final String opcode;
        public final AdaptedValue lhs;
        public final AdaptedValue rhs;

        public Binary(String opcode, AdaptedValue lhs, AdaptedValue rhs) {
            this.opcode = opcode;
            this.lhs = lhs;
            this.rhs = rhs;
        }
    }

    public static final class Compare extends AdaptedInst {
        public final String predicate;
        public final AdaptedType operandType;
        public final AdaptedValue lhs;
        public final AdaptedValue rhs;

        public Compare(String predicate, AdaptedType operandType, AdaptedValue lhs, AdaptedValue rhs) {
            this.predicate = predicate;
            this.operandType = operandType;
            this.lhs = lhs;
            this.rhs = rhs;
        }
    }

    public static final class Cast extends AdaptedInst {
        public final String opcode;
        public final AdaptedType srcTy;
        public final AdaptedType dstTy;
        public final @Nullable Integer srcAddressSpace;
        public final @Nullable Integer dstAddressSpace;
        public final AdaptedValue operand;

        public Cast(
                String opcode,
                AdaptedType srcTy,
                AdaptedType dstTy,
                @Nullable Integer srcAddressSpace,
                @Nullable Integer dstAddressSpace,
                AdaptedValue operand
        ) {
            this.opcode = opcode;
            this.srcTy = srcTy;
            this.dstTy = dstTy;
            this.srcAddressSpace = srcAddressSpace;
            this.dstAddressSpace = dstAddressSpace;
            this.operand = operand;
        }
    }

    public static final class Freeze extends AdaptedInst {
        public final AdaptedValue operand;

        public Freeze(AdaptedValue operand) {
            this.operand = operand;
        }
    }

    public static final class GEP extends AdaptedInst {
        public final AdaptedType srcPointeeTy;
        public final AdaptedType dstPointeeTy;
        public final AdaptedValue pointer;
        public final List<AdaptedValue> indices;
        public final int addressSpace;

        public GEP(AdaptedType srcPointeeTy, AdaptedType dstPointeeTy, AdaptedValue pointer, List<AdaptedValue> indices, int addressSpace) {
            this.srcPointeeTy = srcPointeeTy;
            this.dstPointeeTy = dstPointeeTy;
            this.pointer = pointer;
            this.indices = indices;
            this.addressSpace = addressSpace;
        }
    }

    // choice

    public static final class ITE extends AdaptedInst {
        public final AdaptedValue cond;
        public final AdaptedValue thenValue;
        public final AdaptedValue elseValue;

        public ITE(AdaptedValue cond, AdaptedValue thenValue, AdaptedValue elseValue) {
            this.cond = cond;
            this.thenValue = thenValue;
            this.elseValue = elseValue;
        }
    }

    public static final class PhiOption {
        public final int block;
        public final AdaptedValue value;

        public PhiOption(int block, AdaptedValue value) {
            this.block = block;
            this.value = value;
        }
    }

    public static final class Phi extends AdaptedInst {
        public final List<PhiOption> options;

        public Phi(List<PhiOption> options) {
            this.options = options;
        }
    }

    // aggregates

    public static final class GetValue extends AdaptedInst {
        public final AdaptedType fromTy;
        public final AdaptedValue aggregate;
        public final List<Integer> indices;

        public GetValue(AdaptedType fromTy, AdaptedValue aggregate, List<Integer> indices) {
            this.fromTy = fromTy;
            this.aggregate = aggregate;
            this.indices = indices;
        }
    }

    public static final class SetValue extends AdaptedInst {
        public final AdaptedValue aggregate;
        public final AdaptedValue value;
        public final List<Integer> indices;

        public SetValue(AdaptedValue aggregate, AdaptedValue value, List<Integer> indices) {
            this.aggregate = aggregate;
            this.value = value;
            this.indices = indices;
        }
    }

    public static final class GetElement extends AdaptedInst {
        public final AdaptedType vecTy;
        public final AdaptedValue vector;
        public final AdaptedValue slot;

        public GetElement(AdaptedType vecTy, AdaptedValue vector, AdaptedValue slot) {
            this.vecTy = vecTy;
            this.vector = vector;
            this.slot = slot;
        }
    }

    public static final class SetElement extends AdaptedInst {
        public final AdaptedValue vector;
        public final AdaptedValue value;
        public final AdaptedValue slot;

        public SetElement(AdaptedValue vector, AdaptedValue value, AdaptedValue slot) {
            this.vector = vector;
            this.value = value;
            this.slot = slot;
        }
    }

    public static final class ShuffleVector extends AdaptedInst {
        public final AdaptedValue lhs;
        public final AdaptedValue rhs;
        public final List<Long> mask;

        public ShuffleVector(AdaptedValue lhs, AdaptedValue rhs, List<Long> mask) {
            this.lhs = lhs;
            this.rhs = rhs;
            this.mask = mask;
        }
    }

    // concurrency

    public static final class Fence extends AdaptedInst {
        public final String ordering;
        public final String scope;

        public Fence(String ordering, String scope) {
            this.ordering = ordering;
            this.scope = scope;
        }
    }

    public static final class AtomicCmpXchg extends AdaptedInst {
        public final AdaptedType pointeeType;
        public final AdaptedValue pointer;
        public final AdaptedValue valueCmp;
        public final AdaptedValue valueXchg;

        public AtomicCmpXchg(AdaptedType pointeeType, AdaptedValue pointer, AdaptedValue valueCmp, AdaptedValue valueXchg) {
            this.pointeeType = pointeeType;
            this.pointer = pointer;
            this.valueCmp = valueCmp;
            this.valueXchg = valueXchg;
        }
    }

    public static final class AtomicRMW extends AdaptedInst {
        public final AdaptedType pointeeType;
        public final AdaptedValue pointer;
        public final AdaptedValue value;
        public final String opcode;

        public AtomicRMW(AdaptedType pointeeType, AdaptedValue pointer, AdaptedValue value, String opcode) {
            this.pointeeType = pointeeType;
            this.pointer = pointer;
            this.value = value;
            this.opcode = opcode;
        }
    }

    // exception handling

    /**
     * A clause of a landing pad. Either a catch of a single type info, or a filter of several.
     */
    public static final class ExceptionClause {
        public final boolean filter;
        /**
         * The names of the type info globals, or null for a catch-all.
         */
        public final @Nullable List<String> typeInfos;

        public ExceptionClause(boolean filter, @Nullable List<String> typeInfos) {
            this.filter = filter;
            this.typeInfos = typeInfos;
        }
    }

    public static final class LandingPad extends AdaptedInst {
        public final List<ExceptionClause> clauses;
        public final boolean isCleanup;

        public LandingPad(List<ExceptionClause> clauses, boolean isCleanup) {
            this.clauses = clauses;
            this.isCleanup = isCleanup;
        }
    }

    /**
     * One of the funclet pad instructions: catchpad, cleanuppad, catchswitch,
     * catchret, or cleanupret.
     */
    public static final class Funclet extends AdaptedInst {
        public final String opcode;

        public Funclet(String opcode) {
            this.opcode = opcode;
        }
    }

    // terminators

    public static final class Return extends AdaptedInst {
        public final @Nullable AdaptedValue value;

        public Return(@Nullable AdaptedValue value) {
            this.value = value;
        }
    }

    /**
     * A branch, unconditional if there is no condition and one target, or
     * conditional with a condition and two targets (then, else).
     */
    public static final class Branch extends AdaptedInst {
        public final @Nullable AdaptedValue cond;
        public final List<Integer> targets;

        public Branch(@Nullable AdaptedValue cond, List<Integer> targets) {
            this.cond = cond;
            this.targets = targets;
        }
    }

    public static final class SwitchCase {
        public final int block;
        public final AdaptedConstant value;

        public SwitchCase(int block, AdaptedConstant value) {
            this.block = block;
            this.value = value;
        }
    }

    public static final class Switch extends AdaptedInst {
        public final AdaptedValue cond;
        public final AdaptedType condTy;
        public final List<SwitchCase> cases;
        public final @Nullable Integer defaultTarget;

        public Switch(AdaptedValue cond, AdaptedType condTy, List<SwitchCase> cases, @Nullable Integer defaultTarget) {
            this.cond = cond;
            this.condTy = condTy;
            this.cases = cases;
            this.defaultTarget = defaultTarget;
        }
    }

    public static final class IndirectJump extends AdaptedInst {
        public final AdaptedValue address;
        public final List<Integer> targets;

        public IndirectJump(AdaptedValue address, List<Integer> targets) {
            this.address = address;
            this.targets = targets;
        }
    }

    public static final class Invoke extends AdaptedInst {
        public final boolean direct;
        public final AdaptedValue callee;
        public final AdaptedType targetType;
        public final List<AdaptedValue> args;
        public final int normal;
        public final int unwind;

        public Invoke(boolean direct, AdaptedValue callee, AdaptedType targetType, List<AdaptedValue> args, int normal, int unwind) {
            this.direct = direct;
            this.callee = callee;
            this.targetType = targetType;
            this.args = args;
            this.normal = normal;
            this.unwind = unwind;
        }
    }

    public static final class InvokeAsm extends AdaptedInst {
        public final String asm;
        public final List<AdaptedValue> args;
        public final int normal;
        public final int unwind;

        public InvokeAsm(String asm, List<AdaptedValue> args, int normal, int unwind) {
            this.asm = asm;
            this.args = args;
            this.normal = normal;
            this.unwind = unwind;
        }
    }

    public static final class Resume extends AdaptedInst {
        public final AdaptedValue value;

        public Resume(AdaptedValue value) {
            this.value = value;
        }
    }

    public static final class CallBranch extends AdaptedInst {
        public static final CallBranch INSTANCE = new CallBranch();

        private CallBranch() {
        }
    }

    public static final class Unreachable extends AdaptedInst {
        public static final Unreachable INSTANCE = new Unreachable();

        private Unreachable() {
        }
    }
}
