package io.github.libra.core.passes.convert;

import io.github.libra.core.adapter.AdaptedConstant;
import io.github.libra.core.adapter.AdaptedInstruction;
import io.github.libra.core.error.EngineException;
import io.github.libra.core.error.Unsupported;
import io.github.libra.core.ir.*;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Converts adapter constants, checking each against the type it is expected to have.
 */
public final class ConstantConverter {
    private ConstantConverter() {
    }

    /**
     * Convert a constant.
     *
     * @param constant The adapter constant.
     * @param expected The type the constant must have.
     * @param types The type registry.
     * @param symbols The symbol registry.
     * @return The converted constant.
     * @throws EngineException If the constant is malformed, mistyped or unsupported.
     */
    public static Constant convert(AdaptedConstant constant, Type expected, TypeRegistry types, SymbolRegistry symbols) {
        expected = types.unfold(expected);

        // rejected regardless of their type
        if (constant instanceof AdaptedConstant.Marker) {
            return convert(((AdaptedConstant.Marker) constant).wrap, expected, types, symbols);
        }
        if (constant instanceof AdaptedConstant.PC) {
            throw EngineException.unsupported(Unsupported.BLOCK_ADDRESS);
        }
        if (constant instanceof AdaptedConstant.Alias) {
            throw EngineException.unsupported(Unsupported.GLOBAL_ALIAS);
        }
        if (constant instanceof AdaptedConstant.Interface) {
            throw EngineException.unsupported(Unsupported.INTERFACE_RESOLVER);
        }
        if (constant instanceof AdaptedConstant.Vector) {
            throw EngineException.unsupported(Unsupported.VECTORIZATION);
        }
        if (constant instanceof AdaptedConstant.Extension) {
            throw EngineException.unsupported(Unsupported.ARCH_SPECIFIC_EXTENSION);
        }
        if (constant instanceof AdaptedConstant.None) {
            throw EngineException.invalidAssumption("unexpected none constant");
        }

        Type actual = types.convert(constant.ty);
        if (!types.sameType(actual, expected)) {
            throw EngineException.invalidAssumption("constant type mismatch: expect %s, found %s", expected, actual);
        }

        if (constant instanceof AdaptedConstant.Int) {
            return parseInt(((AdaptedConstant.Int) constant).value, expected);
        }
        if (constant instanceof AdaptedConstant.Float) {
            if (!(expected instanceof Type.Float)) {
                throw EngineException.invalidAssumption("float constant of a non-float type: %s", expected);
            }
            return new Constant.Float(((Type.Float) expected).bits, parseFloat(((AdaptedConstant.Float) constant).value));
        }
        if (constant instanceof AdaptedConstant.Null) {
            if (!(expected instanceof Type.Pointer)) {
                throw EngineException.invalidAssumption("null constant of a non-pointer type: %s", expected);
            }
            return Constant.Null.INSTANCE;
        }
        if (constant instanceof AdaptedConstant.Default) {
            return zero(expected, types);
        }
        if (constant instanceof AdaptedConstant.Undef) {
            return undef(expected);
        }
        if (constant instanceof AdaptedConstant.Array) {
            List<AdaptedConstant> elements = ((AdaptedConstant.Array) constant).elements;
            if (!(expected instanceof Type.Array)) {
                throw EngineException.invalidAssumption("array constant of a non-array type: %s", expected);
            }
            Type.Array array = (Type.Array) expected;
            if (elements.size() != array.length) {
                throw EngineException.invalidAssumption("array length mismatch: expect %d, found %d",
                        array.length, elements.size());
            }
            List<Constant> converted = new ArrayList<>(elements.size());
            for (AdaptedConstant element : elements) {
                converted.add(convert(element, array.element, types, symbols));
            }
            return new Constant.Array(array.element, Collections.unmodifiableList(converted));
        }
        if (constant instanceof AdaptedConstant.Struct) {
            List<AdaptedConstant> elements = ((AdaptedConstant.Struct) constant).elements;
            if (!(expected instanceof Type.Struct)) {
                throw EngineException.invalidAssumption("struct constant of a non-struct type: %s", expected);
            }
            Type.Struct struct = (Type.Struct) expected;
            if (elements.size() != struct.fields.size()) {
                throw EngineException.invalidAssumption("struct field count mismatch: expect %d, found %d",
                        struct.fields.size(), elements.size());
            }
            List<Constant> converted = new ArrayList<>(elements.size());
            for (int i = 0; i < elements.size(); i++) {
                converted.add(convert(elements.get(i), struct.fields.get(i), types, symbols));
            }
            return new Constant.Struct(struct.name, Collections.unmodifiableList(converted));
        }
        if (constant instanceof AdaptedConstant.Variable) {
            expectPointer(expected, "global variable");
            Identifier name = checkName(((AdaptedConstant.Variable) constant).name, "global variable");
            if (!symbols.hasGlobal(name)) {
                throw EngineException.invalidAssumption("reference to an unknown global variable: %s", name);
            }
            if (symbols.isImmutableUninitialized(name)) {
                throw EngineException.invalidAssumption("reference to an immutable global variable without initializer: %s", name);
            }
            return new Constant.Variable(name);
        }
        if (constant instanceof AdaptedConstant.Function) {
            expectPointer(expected, "function");
            Identifier name = checkName(((AdaptedConstant.Function) constant).name, "function");
            if (!symbols.hasFunction(name)) {
                throw EngineException.invalidAssumption("reference to an unknown function: %s", name);
            }
            return new Constant.Function(name);
        }
        if (constant instanceof AdaptedConstant.Expr) {
            Context ctxt = Context.forConstantExpression(types, symbols);
            Instruction inst = ctxt.parseInstruction(new AdaptedInstruction(
                    null, constant.ty, AdaptedInstruction.NO_INDEX, ((AdaptedConstant.Expr) constant).inst));
            Type resultType = inst.resultType();
            if (resultType == null || !types.sameType(resultType, expected)) {
                throw EngineException.invalidAssumption("constant expression type mismatch: expect %s, found %s",
                        expected, resultType);
            }
            return new Constant.Expression(inst);
        }
        throw new IllegalArgumentException("unknown adapter constant " + constant.getClass());
    }

    private static Constant.Int parseInt(String repr, Type expected) {
        if (!(expected instanceof Type.Int)) {
            throw EngineException.invalidAssumption("integer constant of a non-integer type: %s", expected);
        }
        int bits = ((Type.Int) expected).bits;
        BigInteger value;
        try {
            value = new BigInteger(repr);
        } catch (NumberFormatException e) {
            throw EngineException.invalidAssumption("malformed integer constant: %s", repr);
        }
        BigInteger lower = BigInteger.ONE.shiftLeft(bits - 1).negate();
        BigInteger upper = BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
        if (value.compareTo(lower) < 0 || value.compareTo(upper) > 0) {
            throw EngineException.invalidAssumption("integer constant %s does not fit in %d bits", repr, bits);
        }
        return Constant.Int.of(bits, value);
    }

    private static @Nullable BigDecimal parseFloat(String repr) {
        try {
            return new BigDecimal(repr);
        } catch (NumberFormatException e) {
            double parsed;
            try {
                parsed = Double.parseDouble(repr);
            } catch (NumberFormatException e2) {
                throw EngineException.invalidAssumption("malformed float constant: %s", repr);
            }
            // infinities and NaNs have no exact decimal value
            return Double.isFinite(parsed) ? BigDecimal.valueOf(parsed) : null;
        }
    }

    private static void expectPointer(Type expected, String what) {
        if (!(expected instanceof Type.Pointer)) {
            throw EngineException.invalidAssumption("address of a %s with a non-pointer type: %s", what, expected);
        }
    }

    private static Identifier checkName(@Nullable String name, String what) {
        if (name == null) {
            throw EngineException.invalidAssumption("reference to an anonymous %s", what);
        }
        return Identifier.of(name);
    }

    private static Constant zero(Type ty, TypeRegistry types) {
        ty = types.unfold(ty);
        if (ty instanceof Type.Int) {
            return Constant.Int.of(((Type.Int) ty).bits, 0);
        }
        if (ty instanceof Type.Float) {
            return new Constant.Float(((Type.Float) ty).bits, BigDecimal.ZERO);
        }
        if (ty instanceof Type.Pointer) {
            return Constant.Null.INSTANCE;
        }
        if (ty instanceof Type.Array) {
            Type.Array array = (Type.Array) ty;
            Constant element = zero(array.element, types);
            return new Constant.Array(array.element, Collections.nCopies(array.length, element));
        }
        if (ty instanceof Type.Struct) {
            Type.Struct struct = (Type.Struct) ty;
            List<Constant> fields = new ArrayList<>(struct.fields.size());
            for (Type field : struct.fields) {
                fields.add(zero(field, types));
            }
            return new Constant.Struct(struct.name, Collections.unmodifiableList(fields));
        }
        throw EngineException.invalidAssumption("no zero value for type: %s", ty);
    }

    private static Constant undef(Type ty) {
        if (ty instanceof Type.Int) {
            return new Constant.UndefInt(((Type.Int) ty).bits);
        }
        if (ty instanceof Type.Float) {
            return new Constant.UndefFloat(((Type.Float) ty).bits);
        }
        if (ty instanceof Type.Pointer) {
            return new Constant.UndefPointer((Type.Pointer) ty);
        }
        if (ty instanceof Type.Array) {
            return new Constant.UndefArray((Type.Array) ty);
        }
        if (ty instanceof Type.Struct) {
            return new Constant.UndefStruct((Type.Struct) ty);
        }
        throw EngineException.invalidAssumption("no undefined value for type: %s", ty);
    }
}
