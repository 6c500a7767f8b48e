package io.github.libra.core.passes.convert;

import io.github.libra.core.adapter.AdaptedInst;
import io.github.libra.core.adapter.AdaptedInstruction;
import io.github.libra.core.adapter.AdaptedType;
import io.github.libra.core.adapter.AdaptedValue;
import io.github.libra.core.error.EngineException;
import io.github.libra.core.error.Unsupported;
import io.github.libra.core.ir.*;
import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.*;

/**
 * Tracks what is known while converting the instructions of one function (or one constant
 * expression), so that references to blocks, arguments and registers can be checked.
 */
public final class Context {
    private final TypeRegistry types;
    private final SymbolRegistry symbols;
    private final Set<BlockLabel> blocks;
    private final Map<Integer, Type> registers;
    private final List<Type> args;
    private final @Nullable Type ret;
    private final boolean constantExpression;

    Context(
            TypeRegistry types,
            SymbolRegistry symbols,
            Set<BlockLabel> blocks,
            Map<Integer, Type> registers,
            List<Type> args,
            @Nullable Type ret,
            boolean constantExpression
    ) {
        this.types = types;
        this.symbols = symbols;
        this.blocks = blocks;
        this.registers = registers;
        this.args = args;
        this.ret = ret;
        this.constantExpression = constantExpression;
    }

    /**
     * Create a context for a constant expression, which lives outside any function body.
     *
     * @param types The type registry.
     * @param symbols The symbol registry.
     * @return The context.
     */
    public static Context forConstantExpression(TypeRegistry types, SymbolRegistry symbols) {
        return new Context(types, symbols, Collections.emptySet(), Collections.emptyMap(),
                Collections.emptyList(), null, true);
    }

    public TypeRegistry getTypes() {
        return types;
    }

    public SymbolRegistry getSymbols() {
        return symbols;
    }

    private boolean sameType(Type lhs, Type rhs) {
        return types.sameType(lhs, rhs);
    }

    private BlockLabel label(int index) {
        BlockLabel label = BlockLabel.of(index);
        if (!blocks.contains(label)) {
            throw EngineException.invariant("unknown block label: %s", label);
        }
        return label;
    }

    private Type convertNonVoid(AdaptedType ty, String what) {
        if (ty instanceof AdaptedType.Void) {
            throw EngineException.invalidAssumption("%s should not have void type", what);
        }
        return types.convert(ty);
    }

    private void expectVoid(AdaptedType ty, String what) {
        if (!(ty instanceof AdaptedType.Void)) {
            throw EngineException.invalidAssumption("%s should have void type", what);
        }
    }

    private static void checkAddressSpace(int addressSpace) {
        if (addressSpace != 0) {
            throw EngineException.unsupported(Unsupported.POINTER_ADDRESS_SPACE);
        }
    }

    private static void checkOrdering(String ordering) {
        if (!AdaptedInst.NOT_ATOMIC.equals(ordering)) {
            throw EngineException.unsupported(Unsupported.ATOMICS);
        }
    }

    /**
     * Convert a value, checking it has the expected type.
     *
     * @param val The adapter value.
     * @param expected The type the value must have.
     * @return The converted value.
     */
    public Value parseValue(AdaptedValue val, Type expected) {
        if (val instanceof AdaptedValue.Constant) {
            Type unfolded = types.unfold(expected);
            return new Value.Const(unfolded, ConstantConverter.convert(((AdaptedValue.Constant) val).constant, unfolded, types, symbols));
        }
        if (val instanceof AdaptedValue.Argument) {
            AdaptedValue.Argument arg = (AdaptedValue.Argument) val;
            if (arg.index < 0 || arg.index >= args.size()) {
                throw EngineException.invariant("invalid argument index: %d", arg.index);
            }
            Type declared = args.get(arg.index);
            Type actual = types.convert(arg.ty);
            if (!sameType(expected, declared) || !sameType(actual, declared)) {
                throw EngineException.invariant("argument type mismatch: expect %s, found %s", expected, actual);
            }
            return new Value.Argument(arg.index, declared);
        }
        if (val instanceof AdaptedValue.Instruction) {
            AdaptedValue.Instruction inst = (AdaptedValue.Instruction) val;
            Type declared = registers.get(inst.index);
            if (declared == null) {
                throw EngineException.invariant("invalid instruction index: %d", inst.index);
            }
            Type actual = types.convert(inst.ty);
            if (!sameType(expected, declared) || !sameType(actual, declared)) {
                throw EngineException.invariant("instruction type mismatch: expect %s, found %s", expected, actual);
            }
            return new Value.Register(RegisterSlot.of(inst.index), declared);
        }
        throw new IllegalArgumentException("unknown adapter value " + val.getClass());
    }

    /**
     * Convert a value, taking its own declared type as the expected type.
     *
     * @param val The adapter value.
     * @return The converted value.
     */
    public Value parseOperand(AdaptedValue val) {
        return parseValue(val, convertNonVoid(val.type(), "operand"));
    }

    private Value parsePointer(AdaptedValue val) {
        Value value = parseOperand(val);
        if (!(value.type() instanceof Type.Pointer)) {
            throw EngineException.invalidAssumption("expect pointer operand, found %s", value.type());
        }
        return value;
    }

    private Value parseInteger(AdaptedValue val) {
        Value value = parseOperand(val);
        if (!(value.type() instanceof Type.Int)) {
            throw EngineException.invalidAssumption("expect integer operand, found %s", value.type());
        }
        return value;
    }

    private List<Value> parseArgs(Type.Function signature, List<AdaptedValue> args) {
        if (signature.params.size() != args.size()) {
            throw EngineException.invalidAssumption("number of arguments mismatch: expect %d, found %d",
                    signature.params.size(), args.size());
        }
        List<Value> converted = new ArrayList<>(args.size());
        for (int i = 0; i < args.size(); i++) {
            converted.add(parseValue(args.get(i), signature.params.get(i)));
        }
        return Collections.unmodifiableList(converted);
    }

    private Type.Function parseSignature(AdaptedType targetType) {
        Type ty = types.convert(targetType);
        if (!(ty instanceof Type.Function)) {
            throw EngineException.invalidAssumption("call to a non-function type: %s", ty);
        }
        if (((Type.Function) ty).variadic) {
            throw EngineException.unsupported(Unsupported.VARIADIC_ARGUMENTS);
        }
        return (Type.Function) ty;
    }

    private Value parseCallee(Instruction.CallKind kind, AdaptedValue callee) {
        Value converted = parsePointer(callee);
        if (kind == Instruction.CallKind.INDIRECT) return converted;
        if (!(converted instanceof Value.Const && ((Value.Const) converted).constant instanceof Constant.Function)) {
            throw EngineException.invalidAssumption("direct call to a non-function callee: %s", converted);
        }
        if (kind == Instruction.CallKind.INTRINSIC) {
            Intrinsics.filter(((Constant.Function) ((Value.Const) converted).constant).name.getName());
        }
        return converted;
    }

    private @Nullable RegisterSlot callResult(Type.Function signature, AdaptedInstruction inst, @Nullable RegisterSlot result) {
        if (signature.ret == null) {
            if (!(inst.ty instanceof AdaptedType.Void)) {
                throw EngineException.invalidAssumption("call return type mismatch: expect void");
            }
            return null;
        }
        Type instTy = convertNonVoid(inst.ty, "call with a result");
        if (!sameType(instTy, signature.ret)) {
            throw EngineException.invalidAssumption("call return type mismatch: expect %s, found %s", signature.ret, instTy);
        }
        return result;
    }

    private Type walkAggregate(Type aggregate, List<Integer> indices) {
        Type cur = aggregate;
        for (int index : indices) {
            cur = types.unfold(cur);
            if (cur instanceof Type.Array) {
                Type.Array array = (Type.Array) cur;
                if (index < 0 || index >= array.length) {
                    throw EngineException.invalidAssumption("aggregate index out of bound: %d for %s", index, array);
                }
                cur = array.element;
            } else if (cur instanceof Type.Struct) {
                Type.Struct struct = (Type.Struct) cur;
                if (index < 0 || index >= struct.fields.size()) {
                    throw EngineException.invalidAssumption("aggregate index out of bound: %d for %s", index, struct);
                }
                cur = struct.fields.get(index);
            } else {
                throw EngineException.invalidAssumption("indexing into a non-aggregate type: %s", cur);
            }
        }
        return types.unfold(cur);
    }

    /**
     * Convert a non-terminator instruction.
     *
     * @param inst The adapter instruction.
     * @return The converted instruction.
     */
    public Instruction parseInstruction(AdaptedInstruction inst) {
        AdaptedInst repr = inst.repr;
        RegisterSlot result = constantExpression || inst.index == AdaptedInstruction.NO_INDEX
                || inst.ty instanceof AdaptedType.Void
                ? null
                : RegisterSlot.of(inst.index);

        // memory
        if (repr instanceof AdaptedInst.Alloca) {
            AdaptedInst.Alloca alloca = (AdaptedInst.Alloca) repr;
            checkAddressSpace(alloca.addressSpace);
            if (!(convertNonVoid(inst.ty, "alloca") instanceof Type.Pointer)) {
                throw EngineException.invalidAssumption("alloca should return a pointer type");
            }
            if (result == null) {
                throw EngineException.invariant("alloca outside of a function body");
            }
            Type allocated = types.convert(alloca.allocatedType);
            Value size = alloca.size == null ? null : parseInteger(alloca.size);
            return new Instruction.Alloca(result, allocated, size);
        }
        if (repr instanceof AdaptedInst.Load) {
            AdaptedInst.Load load = (AdaptedInst.Load) repr;
            checkAddressSpace(load.addressSpace);
            checkOrdering(load.ordering);
            Type instTy = convertNonVoid(inst.ty, "load");
            Type pointee = types.convert(load.pointeeType);
            if (!sameType(instTy, pointee)) {
                throw EngineException.invalidAssumption("load mismatch between result type and pointee type");
            }
            return new Instruction.Load(result, pointee, parsePointer(load.pointer));
        }
        if (repr instanceof AdaptedInst.Store) {
            AdaptedInst.Store store = (AdaptedInst.Store) repr;
            checkAddressSpace(store.addressSpace);
            checkOrdering(store.ordering);
            expectVoid(inst.ty, "store");
            Type pointee = types.convert(store.pointeeType);
            Value pointer = parsePointer(store.pointer);
            return new Instruction.Store(pointee, pointer, parseValue(store.value, pointee));
        }
        if (repr instanceof AdaptedInst.VAArg) {
            throw EngineException.unsupported(Unsupported.VARIADIC_ARGUMENTS);
        }

        // calls
        if (repr instanceof AdaptedInst.Call) {
            AdaptedInst.Call call = (AdaptedInst.Call) repr;
            Instruction.CallKind kind = Instruction.CallKind.valueOf(call.kind.name());
            Type.Function signature = parseSignature(call.targetType);
            List<Value> args = parseArgs(signature, call.args);
            RegisterSlot callResult = callResult(signature, inst, result);
            return new Instruction.Call(callResult, kind, parseCallee(kind, call.callee), signature, args);
        }
        if (repr instanceof AdaptedInst.CallAsm) {
            throw EngineException.unsupported(Unsupported.INLINE_ASSEMBLY);
        }

        // arithmetic
        if (repr instanceof AdaptedInst.Unary) {
            String opcode = ((AdaptedInst.Unary) repr).opcode;
            if ("fneg".equals(opcode)) {
                throw EngineException.unsupported(Unsupported.FLOATING_POINT);
            }
            throw EngineException.invalidAssumption("unexpected unary opcode: %s", opcode);
        }
        if (repr instanceof AdaptedInst.Binary) {
            AdaptedInst.Binary binary = (AdaptedInst.Binary) repr;
            Instruction.BinaryOperator operator = Opcodes.parseBinary(binary.opcode);
            Type instTy = convertNonVoid(inst.ty, "binary operator");
            if (!(instTy instanceof Type.Int)) {
                throw EngineException.invalidAssumption("binary operator has non-integer type: %s", instTy);
            }
            return new Instruction.Binary(result, ((Type.Int) instTy).bits, operator,
                    parseValue(binary.lhs, instTy), parseValue(binary.rhs, instTy));
        }
        if (repr instanceof AdaptedInst.Compare) {
            AdaptedInst.Compare compare = (AdaptedInst.Compare) repr;
            Instruction.ComparePredicate predicate = Opcodes.parsePredicate(compare.predicate);
            if (!new Type.Int(1).equals(convertNonVoid(inst.ty, "compare"))) {
                throw EngineException.invalidAssumption("compare has non-boolean type");
            }
            Type operandTy = types.convert(compare.operandType);
            if (!(operandTy instanceof Type.Int || operandTy instanceof Type.Pointer)) {
                throw EngineException.invalidAssumption("compare on unexpected operand type: %s", operandTy);
            }
            return new Instruction.Compare(result, operandTy, predicate,
                    parseValue(compare.lhs, operandTy), parseValue(compare.rhs, operandTy));
        }
        if (repr instanceof AdaptedInst.Cast) {
            return parseCast(inst, (AdaptedInst.Cast) repr, result);
        }
        if (repr instanceof AdaptedInst.Freeze) {
            Type instTy = convertNonVoid(inst.ty, "freeze");
            return new Instruction.Freeze(result, parseValue(((AdaptedInst.Freeze) repr).operand, instTy));
        }
        if (repr instanceof AdaptedInst.GEP) {
            return parseGEP(inst, (AdaptedInst.GEP) repr, result);
        }

        // choice
        if (repr instanceof AdaptedInst.ITE) {
            AdaptedInst.ITE ite = (AdaptedInst.ITE) repr;
            Type instTy = convertNonVoid(inst.ty, "select");
            return new Instruction.ITE(result, instTy,
                    parseValue(ite.cond, new Type.Int(1)),
                    parseValue(ite.thenValue, instTy),
                    parseValue(ite.elseValue, instTy));
        }
        if (repr instanceof AdaptedInst.Phi) {
            Type instTy = convertNonVoid(inst.ty, "phi");
            if (result == null) {
                throw EngineException.invariant("phi outside of a function body");
            }
            SortedMap<BlockLabel, Value> options = new TreeMap<>();
            for (AdaptedInst.PhiOption option : ((AdaptedInst.Phi) repr).options) {
                BlockLabel from = label(option.block);
                Value value = parseValue(option.value, instTy);
                Value existing = options.putIfAbsent(from, value);
                if (existing != null && !existing.equals(value)) {
                    throw EngineException.invariant("conflicting phi values for block %s", from);
                }
            }
            return new Instruction.Phi(result, instTy, Collections.unmodifiableSortedMap(options));
        }

        // aggregates
        if (repr instanceof AdaptedInst.GetValue) {
            AdaptedInst.GetValue get = (AdaptedInst.GetValue) repr;
            Type instTy = convertNonVoid(inst.ty, "extractvalue");
            Type from = types.convert(get.fromTy);
            Type field = walkAggregate(from, get.indices);
            if (!sameType(field, instTy)) {
                throw EngineException.invalidAssumption("extractvalue type mismatch: expect %s, found %s", field, instTy);
            }
            return new Instruction.GetValue(result, from, parseValue(get.aggregate, from),
                    Collections.unmodifiableList(new ArrayList<>(get.indices)), instTy);
        }
        if (repr instanceof AdaptedInst.SetValue) {
            AdaptedInst.SetValue set = (AdaptedInst.SetValue) repr;
            Type instTy = convertNonVoid(inst.ty, "insertvalue");
            Type field = walkAggregate(instTy, set.indices);
            return new Instruction.SetValue(result, instTy, parseValue(set.aggregate, instTy),
                    parseValue(set.value, field), Collections.unmodifiableList(new ArrayList<>(set.indices)));
        }
        if (repr instanceof AdaptedInst.GetElement
                || repr instanceof AdaptedInst.SetElement
                || repr instanceof AdaptedInst.ShuffleVector) {
            throw EngineException.unsupported(Unsupported.VECTORIZATION);
        }

        // concurrency
        if (repr instanceof AdaptedInst.Fence
                || repr instanceof AdaptedInst.AtomicCmpXchg
                || repr instanceof AdaptedInst.AtomicRMW) {
            throw EngineException.unsupported(Unsupported.ATOMICS);
        }

        // exception handling
        if (repr instanceof AdaptedInst.LandingPad) {
            AdaptedInst.LandingPad pad = (AdaptedInst.LandingPad) repr;
            Type instTy = convertNonVoid(inst.ty, "landingpad");
            if (result == null) {
                throw EngineException.invariant("landingpad outside of a function body");
            }
            List<Instruction.LandingPad.Clause> clauses = new ArrayList<>();
            for (AdaptedInst.ExceptionClause clause : pad.clauses) {
                List<Identifier> typeInfos = new ArrayList<>();
                if (clause.typeInfos != null) {
                    for (String typeInfo : clause.typeInfos) {
                        Identifier ident = Identifier.of(typeInfo);
                        if (!symbols.hasGlobal(ident)) {
                            throw EngineException.invalidAssumption("reference to an unknown global variable: %s", ident);
                        }
                        typeInfos.add(ident);
                    }
                }
                clauses.add(new Instruction.LandingPad.Clause(clause.filter, Collections.unmodifiableList(typeInfos)));
            }
            return new Instruction.LandingPad(result, instTy, pad.isCleanup, Collections.unmodifiableList(clauses));
        }
        if (repr instanceof AdaptedInst.Funclet) {
            throw EngineException.unsupported(Unsupported.EXCEPTION_FUNCLET);
        }

        if (isTerminator(repr)) {
            throw EngineException.invariant("malformed block with terminator instruction in the body");
        }
        throw new IllegalArgumentException("unknown adapter instruction " + repr.getClass());
    }

    private static boolean isTerminator(AdaptedInst repr) {
        return repr instanceof AdaptedInst.Return
                || repr instanceof AdaptedInst.Branch
                || repr instanceof AdaptedInst.Switch
                || repr instanceof AdaptedInst.IndirectJump
                || repr instanceof AdaptedInst.Invoke
                || repr instanceof AdaptedInst.InvokeAsm
                || repr instanceof AdaptedInst.Resume
                || repr instanceof AdaptedInst.CallBranch
                || repr instanceof AdaptedInst.Unreachable;
    }

    private Instruction parseCast(AdaptedInstruction inst, AdaptedInst.Cast cast, @Nullable RegisterSlot result) {
        if (cast.srcAddressSpace != null) checkAddressSpace(cast.srcAddressSpace);
        if (cast.dstAddressSpace != null) checkAddressSpace(cast.dstAddressSpace);
        Instruction.CastOperator operator = Opcodes.parseCast(cast.opcode);
        Type instTy = convertNonVoid(inst.ty, "cast");
        Type from = types.convert(cast.srcTy);
        Type into = types.convert(cast.dstTy);
        if (!sameType(into, instTy)) {
            throw EngineException.invariant("type mismatch between dst type and inst type for cast");
        }
        Value operand = parseValue(cast.operand, from);
        switch (operator) {
            case TRUNC:
            case ZEXT:
            case SEXT: {
                if (!(from instanceof Type.Int && into instanceof Type.Int)) {
                    throw EngineException.invalidAssumption("expect integer types for %s", cast.opcode);
                }
                int bitsFrom = ((Type.Int) from).bits;
                int bitsInto = ((Type.Int) into).bits;
                if (operator == Instruction.CastOperator.TRUNC ? bitsFrom <= bitsInto : bitsFrom >= bitsInto) {
                    throw EngineException.invalidAssumption("invalid widths for %s: %d to %d", cast.opcode, bitsFrom, bitsInto);
                }
                break;
            }
            case PTR_TO_INT:
                if (!(from instanceof Type.Pointer && into instanceof Type.Int)) {
                    throw EngineException.invalidAssumption("expect (ptr, int) for ptr_to_int cast");
                }
                break;
            case INT_TO_PTR:
                if (!(from instanceof Type.Int && into instanceof Type.Pointer)) {
                    throw EngineException.invalidAssumption("expect (int, ptr) for int_to_ptr cast");
                }
                break;
            case BITCAST:
                if (!(from instanceof Type.Pointer && into instanceof Type.Pointer)) {
                    throw EngineException.invalidAssumption("expect ptr type for bitcast");
                }
                break;
        }
        return new Instruction.Cast(result, operator, from, into, operand);
    }

    private Instruction parseGEP(AdaptedInstruction inst, AdaptedInst.GEP gep, @Nullable RegisterSlot result) {
        checkAddressSpace(gep.addressSpace);
        if (!(convertNonVoid(inst.ty, "getelementptr") instanceof Type.Pointer)) {
            throw EngineException.invalidAssumption("getelementptr should return a pointer type");
        }
        Type src = types.convert(gep.srcPointeeTy);
        Type dst = types.convert(gep.dstPointeeTy);
        Value pointer = parsePointer(gep.pointer);
        if (gep.indices.isEmpty()) {
            throw EngineException.invalidAssumption("getelementptr without indices");
        }

        List<Value> indices = new ArrayList<>(gep.indices.size());
        Type cur = src;
        for (int i = 0; i < gep.indices.size(); i++) {
            Value index = parseInteger(gep.indices.get(i));
            indices.add(index);
            // the first index steps over the pointer itself
            if (i == 0) continue;

            cur = types.unfold(cur);
            BigInteger constant = index instanceof Value.Const && ((Value.Const) index).constant instanceof Constant.Int
                    ? ((Constant.Int) ((Value.Const) index).constant).signedValue()
                    : null;
            if (cur instanceof Type.Array) {
                Type.Array array = (Type.Array) cur;
                if (constantExpression && constant != null
                        && (constant.signum() < 0 || constant.compareTo(BigInteger.valueOf(array.length)) > 0)) {
                    throw EngineException.unsupported(Unsupported.OUT_OF_BOUND_CONSTANT_GEP);
                }
                cur = array.element;
            } else if (cur instanceof Type.Struct) {
                Type.Struct struct = (Type.Struct) cur;
                if (constant == null) {
                    throw EngineException.invalidAssumption("getelementptr into a struct with a non-constant index");
                }
                if (constant.signum() < 0 || constant.compareTo(BigInteger.valueOf(struct.fields.size())) >= 0) {
                    throw EngineException.invalidAssumption("getelementptr field index out of bound: %s for %s", constant, struct);
                }
                cur = struct.fields.get(constant.intValue());
            } else {
                throw EngineException.invalidAssumption("getelementptr into a non-aggregate type: %s", cur);
            }
        }
        if (!sameType(cur, dst)) {
            throw EngineException.invalidAssumption("getelementptr destination type mismatch: expect %s, found %s", dst, cur);
        }
        return new Instruction.GEP(result, src, dst, pointer, Collections.unmodifiableList(indices));
    }

    /**
     * Convert the terminator of a block.
     *
     * @param inst The adapter instruction.
     * @return The converted terminator.
     */
    public Terminator parseTerminator(AdaptedInstruction inst) {
        AdaptedInst repr = inst.repr;
        if (repr instanceof AdaptedInst.Invoke) {
            AdaptedInst.Invoke invoke = (AdaptedInst.Invoke) repr;
            Instruction.CallKind kind = invoke.direct ? Instruction.CallKind.DIRECT : Instruction.CallKind.INDIRECT;
            Type.Function signature = parseSignature(invoke.targetType);
            List<Value> args = parseArgs(signature, invoke.args);
            RegisterSlot result = callResult(signature, inst, RegisterSlot.of(inst.index));
            return new Terminator.Invoke(result, kind, parseCallee(kind, invoke.callee), signature, args,
                    label(invoke.normal), label(invoke.unwind));
        }

        // all other terminator instructions have a void type
        expectVoid(inst.ty, "terminator instruction");

        if (repr instanceof AdaptedInst.Return) {
            AdaptedValue value = ((AdaptedInst.Return) repr).value;
            if (value == null) {
                if (ret != null) throw EngineException.invariant("return type mismatch: expect %s", ret);
                return new Terminator.Return(null);
            }
            if (ret == null) throw EngineException.invariant("return type mismatch: expect void");
            return new Terminator.Return(parseValue(value, ret));
        }
        if (repr instanceof AdaptedInst.Branch) {
            AdaptedInst.Branch branch = (AdaptedInst.Branch) repr;
            if (branch.cond == null && branch.targets.size() == 1) {
                return new Terminator.Goto(label(branch.targets.get(0)));
            }
            if (branch.cond != null && branch.targets.size() == 2) {
                return new Terminator.Branch(parseValue(branch.cond, new Type.Int(1)),
                        label(branch.targets.get(0)), label(branch.targets.get(1)));
            }
            throw EngineException.invalidAssumption("malformed branch with %d targets", branch.targets.size());
        }
        if (repr instanceof AdaptedInst.Switch) {
            AdaptedInst.Switch sw = (AdaptedInst.Switch) repr;
            Type condTy = types.convert(sw.condTy);
            if (!(condTy instanceof Type.Int)) {
                throw EngineException.invalidAssumption("switch on a non-integer type: %s", condTy);
            }
            Value cond = parseValue(sw.cond, condTy);
            SortedMap<BigInteger, BlockLabel> cases = new TreeMap<>();
            for (AdaptedInst.SwitchCase c : sw.cases) {
                Constant value = ConstantConverter.convert(c.value, condTy, types, symbols);
                if (!(value instanceof Constant.Int)) {
                    throw EngineException.invalidAssumption("switch case is not an integer: %s", value);
                }
                BigInteger key = ((Constant.Int) value).value;
                if (cases.put(key, label(c.block)) != null) {
                    throw EngineException.invariant("duplicated switch case: %s", key);
                }
            }
            BlockLabel defaultTarget = sw.defaultTarget == null ? null : label(sw.defaultTarget);
            return new Terminator.Switch(cond, Collections.unmodifiableSortedMap(cases), defaultTarget);
        }
        if (repr instanceof AdaptedInst.IndirectJump) {
            AdaptedInst.IndirectJump jump = (AdaptedInst.IndirectJump) repr;
            Value address = parsePointer(jump.address);
            SortedSet<BlockLabel> targets = new TreeSet<>();
            for (int target : jump.targets) {
                targets.add(label(target));
            }
            return new Terminator.IndirectJump(address, Collections.unmodifiableSortedSet(targets));
        }
        if (repr instanceof AdaptedInst.Resume) {
            return new Terminator.Resume(parseOperand(((AdaptedInst.Resume) repr).value));
        }
        if (repr instanceof AdaptedInst.Unreachable) {
            return Terminator.Unreachable.INSTANCE;
        }
        if (repr instanceof AdaptedInst.InvokeAsm || repr instanceof AdaptedInst.CallBranch) {
            throw EngineException.unsupported(Unsupported.INLINE_ASSEMBLY);
        }
        if (repr instanceof AdaptedInst.Funclet) {
            throw EngineException.unsupported(Unsupported.EXCEPTION_FUNCLET);
        }
        throw EngineException.invariant("malformed block with non-terminator instruction");
    }
}
