package io.github.libra.test;

import io.github.libra.core.adapter.AdaptedConstant;
import io.github.libra.core.adapter.AdaptedInst;
import io.github.libra.core.adapter.AdaptedType;
import io.github.libra.core.error.EngineException;
import io.github.libra.core.error.Unsupported;
import io.github.libra.core.ir.*;
import io.github.libra.core.passes.convert.ConstantConverter;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.*;

import static io.github.libra.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class ConstantTest {
    private final TypeRegistry types = TypeRegistry.populate(Collections.singletonList(
            defineStruct("pair", I32, PTR)
    ));
    private final SymbolRegistry symbols = new SymbolRegistry(
            new TreeSet<>(Arrays.asList(Identifier.of("table"), Identifier.of("missing_init"))),
            new TreeSet<>(Collections.singletonList(Identifier.of("main"))),
            new TreeSet<>(Collections.singletonList(Identifier.of("missing_init")))
    );

    private Constant convert(AdaptedConstant constant) {
        return ConstantConverter.convert(constant, types.convert(constant.ty), types, symbols);
    }

    private static AdaptedConstant.Int intOf(AdaptedType ty, String value) {
        return new AdaptedConstant.Int(ty, value);
    }

    private static List<AdaptedConstant> ints(int count) {
        List<AdaptedConstant> elements = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            elements.add(intOf(I32, Integer.toString(i)));
        }
        return elements;
    }

    @Test
    void testSelfReferentialStruct() {
        AdaptedType node = struct("node");
        AdaptedType nodePtr = new AdaptedType.TypedPointer(node, 0);
        TypeRegistry recursive = TypeRegistry.populate(Collections.singletonList(defineStruct("node", I32, nodePtr)));

        Type.Struct expected = (Type.Struct) recursive.convert(node);
        assertEquals(new Type.Pointer(new Type.StructRecursive(Identifier.of("node"))), expected.fields.get(1));
        assertTrue(recursive.sameType(expected.fields.get(1), recursive.convert(nodePtr)));

        Constant converted = ConstantConverter.convert(new AdaptedConstant.Struct(node, Arrays.asList(
                intOf(I32, "1"), new AdaptedConstant.Null(nodePtr))), expected, recursive, symbols);
        assertEquals(new Constant.Struct(Identifier.of("node"), Arrays.asList(Constant.Int.of(32, 1), Constant.Null.INSTANCE)),
                converted);

        // a different struct at the same depth is still a mismatch
        assertEquals(EngineException.Kind.INVALID_ASSUMPTION, failureKind(() -> ConstantConverter.convert(
                new AdaptedConstant.Struct(node, Arrays.asList(intOf(I32, "1"), new AdaptedConstant.Null(PTR))),
                expected, recursive, symbols)));
    }

    @Test
    void testArrayLengthMismatch() {
        AdaptedConstant literal = new AdaptedConstant.Array(new AdaptedType.Array(I32, 8), ints(8));
        Type expected = new Type.Array(new Type.Int(32), 4);
        assertEquals(EngineException.Kind.INVALID_ASSUMPTION,
                failureKind(() -> ConstantConverter.convert(literal, expected, types, symbols)));

        // a literal whose declared type lies about its length
        AdaptedConstant lying = new AdaptedConstant.Array(new AdaptedType.Array(I32, 4), ints(8));
        assertEquals(EngineException.Kind.INVALID_ASSUMPTION, failureKind(() -> convert(lying)));

        Constant converted = convert(new AdaptedConstant.Array(new AdaptedType.Array(I32, 4), ints(4)));
        assertEquals(4, ((Constant.Array) converted).elements.size());
    }

    @Test
    void testIntegerRange() {
        assertEquals(Constant.Int.of(8, 255), convert(intOf(I8, "255")));
        Constant.Int negative = (Constant.Int) convert(intOf(I8, "-128"));
        assertEquals(BigInteger.valueOf(128), negative.value);
        assertEquals(BigInteger.valueOf(-128), negative.signedValue());

        assertEquals(EngineException.Kind.INVALID_ASSUMPTION, failureKind(() -> convert(intOf(I8, "256"))));
        assertEquals(EngineException.Kind.INVALID_ASSUMPTION, failureKind(() -> convert(intOf(I8, "-129"))));
        assertEquals(EngineException.Kind.INVALID_ASSUMPTION, failureKind(() -> convert(intOf(I8, "twelve"))));
    }

    @Test
    void testTypeMismatch() {
        assertEquals(EngineException.Kind.INVALID_ASSUMPTION,
                failureKind(() -> ConstantConverter.convert(intOf(I32, "1"), new Type.Int(64), types, symbols)));
        assertEquals(EngineException.Kind.INVALID_ASSUMPTION,
                failureKind(() -> ConstantConverter.convert(new AdaptedConstant.Null(PTR), new Type.Int(64), types, symbols)));
    }

    @Test
    void testDefaultExpansion() {
        Type.Struct pair = types.lookup(Identifier.of("pair"));
        Constant zero = convert(new AdaptedConstant.Default(struct("pair")));
        assertEquals(new Constant.Struct(pair.name, Arrays.asList(Constant.Int.of(32, 0), Constant.Null.INSTANCE)), zero);

        Constant zeros = convert(new AdaptedConstant.Default(new AdaptedType.Array(I8, 3)));
        assertEquals(new Constant.Array(new Type.Int(8), Collections.nCopies(3, Constant.Int.of(8, 0))), zeros);
    }

    @Test
    void testUndef() {
        assertEquals(new Constant.UndefInt(32), convert(new AdaptedConstant.Undef(I32)));
        assertEquals(new Constant.UndefPointer(Type.Pointer.OPAQUE), convert(new AdaptedConstant.Undef(PTR)));
        assertEquals(new Constant.UndefStruct(types.lookup(Identifier.of("pair"))),
                convert(new AdaptedConstant.Undef(struct("pair"))));
    }

    @Test
    void testSymbolReferences() {
        assertEquals(new Constant.Variable(Identifier.of("table")),
                convert(new AdaptedConstant.Variable(PTR, "table")));
        assertEquals(new Constant.Function(Identifier.of("main")),
                convert(new AdaptedConstant.Function(PTR, "main")));
        assertEquals(new Constant.Variable(Identifier.of("table")),
                convert(new AdaptedConstant.Marker(PTR, new AdaptedConstant.Variable(PTR, "table"))));

        assertEquals(EngineException.Kind.INVALID_ASSUMPTION,
                failureKind(() -> convert(new AdaptedConstant.Variable(PTR, "nowhere"))));
        assertEquals(EngineException.Kind.INVALID_ASSUMPTION,
                failureKind(() -> convert(new AdaptedConstant.Variable(PTR, "missing_init"))));
        assertEquals(EngineException.Kind.INVALID_ASSUMPTION,
                failureKind(() -> convert(new AdaptedConstant.Function(PTR, null))));
    }

    @Test
    void testUnsupportedConstants() {
        assertUnsupported(Unsupported.BLOCK_ADDRESS, () -> convert(new AdaptedConstant.PC(PTR)));
        assertUnsupported(Unsupported.GLOBAL_ALIAS, () -> convert(new AdaptedConstant.Alias(PTR, "alias")));
        assertUnsupported(Unsupported.INTERFACE_RESOLVER, () -> convert(new AdaptedConstant.Interface(PTR, "ifunc")));
        assertEquals(EngineException.Kind.INVALID_ASSUMPTION,
                failureKind(() -> convert(new AdaptedConstant.None(I32))));
    }

    @Test
    void testFloat() {
        AdaptedType dbl = new AdaptedType.Float(64, "double");
        assertEquals(new Constant.Float(64, new java.math.BigDecimal("1.5")),
                convert(new AdaptedConstant.Float(dbl, "1.5")));
        assertEquals(new Constant.Float(64, null), convert(new AdaptedConstant.Float(dbl, "Infinity")));
    }

    private AdaptedConstant gep(long index) {
        AdaptedType array = new AdaptedType.Array(I32, 4);
        return new AdaptedConstant.Expr(PTR, new AdaptedInst.GEP(
                array, I32,
                constant(new AdaptedConstant.Variable(PTR, "table")),
                Arrays.asList(intConst(I64, 0), intConst(I64, index)),
                0
        ));
    }

    @Test
    void testConstantExpressions() {
        Constant inBounds = convert(gep(2));
        assertInstanceOf(Instruction.GEP.class, ((Constant.Expression) inBounds).instruction);
        assertNull(((Constant.Expression) inBounds).instruction.result);
        // one past the end is still a valid address
        convert(gep(4));
        assertUnsupported(Unsupported.OUT_OF_BOUND_CONSTANT_GEP, () -> convert(gep(5)));
        assertUnsupported(Unsupported.OUT_OF_BOUND_CONSTANT_GEP, () -> convert(gep(-1)));

        Constant cast = convert(new AdaptedConstant.Expr(I64, new AdaptedInst.Cast(
                "ptr_to_int", PTR, I64, null, null, constant(new AdaptedConstant.Variable(PTR, "table")))));
        assertEquals(new Type.Int(64), ((Constant.Expression) cast).instruction.resultType());
    }
}
