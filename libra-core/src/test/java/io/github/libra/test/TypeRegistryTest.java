package io.github.libra.test;

import io.github.libra.core.adapter.AdaptedType;
import io.github.libra.core.adapter.UserDefinedStruct;
import io.github.libra.core.error.EngineException;
import io.github.libra.core.error.Unsupported;
import io.github.libra.core.ir.Identifier;
import io.github.libra.core.ir.Type;
import io.github.libra.core.ir.TypeRegistry;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.TreeSet;

import static io.github.libra.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class TypeRegistryTest {
    private static AdaptedType pointerTo(AdaptedType pointee) {
        return new AdaptedType.TypedPointer(pointee, 0);
    }

    @Test
    void testSelfRecursive() {
        TypeRegistry types = TypeRegistry.populate(Collections.singletonList(
                defineStruct("node", I32, pointerTo(struct("node")))
        ));
        Identifier node = Identifier.of("node");
        Type expected = new Type.Struct(node, Arrays.asList(
                new Type.Int(32),
                new Type.Pointer(new Type.StructRecursive(node))
        ));
        assertEquals(expected, types.convert(struct("node")));
        assertEquals(Collections.singleton(node), types.recursiveGroup(node));
        assertEquals(expected, types.unfold(new Type.StructRecursive(node)));
    }

    @Test
    void testMutuallyRecursive() {
        TypeRegistry types = TypeRegistry.populate(Arrays.asList(
                defineStruct("a", pointerTo(struct("b"))),
                defineStruct("b", pointerTo(struct("a")), I8),
                defineStruct("c", struct("a"))
        ));
        Identifier a = Identifier.of("a");
        Identifier b = Identifier.of("b");
        Type.Struct structA = new Type.Struct(a, Collections.singletonList(
                new Type.Pointer(new Type.StructRecursive(b))
        ));
        Type.Struct structB = new Type.Struct(b, Arrays.asList(
                new Type.Pointer(new Type.StructRecursive(a)),
                new Type.Int(8)
        ));
        assertEquals(structA, types.convert(struct("a")));
        assertEquals(structB, types.convert(struct("b")));
        // c is outside the cycle, so a is inlined in full
        assertEquals(new Type.Struct(Identifier.of("c"), Collections.singletonList(structA)),
                types.convert(struct("c")));
        assertEquals(new TreeSet<>(Arrays.asList(a, b)), types.recursiveGroup(a));
        assertSame(types.recursiveGroup(a), types.recursiveGroup(b));
        assertNull(types.recursiveGroup(Identifier.of("c")));
    }

    @Test
    void testDagMirrorsDeclarations() {
        TypeRegistry types = TypeRegistry.populate(Arrays.asList(
                defineStruct("outer", I64, struct("inner"), new AdaptedType.Array(struct("inner"), 2)),
                defineStruct("inner", I8, I32)
        ));
        Type inner = new Type.Struct(Identifier.of("inner"), Arrays.asList(new Type.Int(8), new Type.Int(32)));
        Type outer = new Type.Struct(Identifier.of("outer"), Arrays.asList(
                new Type.Int(64),
                inner,
                new Type.Array(inner, 2)
        ));
        assertEquals(outer, types.convert(struct("outer")));
        assertNull(types.recursiveGroup(Identifier.of("outer")));
        assertEquals(new TreeSet<>(Arrays.asList(Identifier.of("inner"), Identifier.of("outer"))), types.names());
    }

    @Test
    void testOpaque() {
        assertUnsupported(Unsupported.OPAQUE_STRUCT_DEFINITION, () -> TypeRegistry.populate(
                Collections.singletonList(new UserDefinedStruct("opaque", null))));
        TypeRegistry types = TypeRegistry.populate(Collections.emptyList());
        assertUnsupported(Unsupported.OPAQUE_STRUCT_DEFINITION, () -> types.convert(struct("missing")));
        assertUnsupported(Unsupported.OPAQUE_POINTER_TYPE, () -> types.convert(pointerTo(struct("missing"))));
    }

    @Test
    void testMalformedDefinitions() {
        assertEquals(EngineException.Kind.INVALID_ASSUMPTION, failureKind(() -> TypeRegistry.populate(Arrays.asList(
                defineStruct("twice", I32),
                defineStruct("twice", I64)
        ))));
        assertEquals(EngineException.Kind.INVALID_ASSUMPTION, failureKind(() -> TypeRegistry.populate(
                Collections.singletonList(new UserDefinedStruct(null, Collections.singletonList(I32))))));
    }

    @Test
    void testUnsupportedTypes() {
        TypeRegistry types = TypeRegistry.populate(Collections.emptyList());
        assertUnsupported(Unsupported.VECTORIZATION, () -> types.convert(new AdaptedType.Vector(I32, true, 4)));
        assertEquals(new Type.Function(Collections.singletonList(Type.Pointer.OPAQUE), new Type.Int(32), true),
                types.convert(new AdaptedType.Function(Collections.singletonList(PTR), true, I32)));
        assertUnsupported(Unsupported.POINTER_ADDRESS_SPACE, () -> types.convert(new AdaptedType.Pointer(1)));
        assertUnsupported(Unsupported.ARCH_SPECIFIC_EXTENSION,
                () -> types.convert(new AdaptedType.Extension("target", Collections.emptyList())));
        assertEquals(EngineException.Kind.INVALID_ASSUMPTION, failureKind(() -> types.convert(AdaptedType.Label.INSTANCE)));
        assertEquals(EngineException.Kind.INVARIANT_VIOLATION, failureKind(() -> types.convert(VOID)));
        assertEquals(new Type.Float(64), types.convert(new AdaptedType.Float(64, "double")));
        assertEquals(new Type.Function(Collections.singletonList(Type.Pointer.OPAQUE), null), types.convert(fn(VOID, PTR)));
    }

    @Test
    void testMerge() {
        TypeRegistry left = TypeRegistry.populate(Collections.singletonList(defineStruct("s", I32)));
        TypeRegistry same = TypeRegistry.populate(Collections.singletonList(defineStruct("s", I32)));
        TypeRegistry other = TypeRegistry.populate(Collections.singletonList(defineStruct("t", I8)));
        TypeRegistry conflict = TypeRegistry.populate(Collections.singletonList(defineStruct("s", I64)));

        assertEquals(left, left.merge(same));
        TypeRegistry merged = left.merge(other);
        assertEquals(2, merged.names().size());
        assertEquals(new Type.Int(8), merged.lookup(Identifier.of("t")).fields.get(0));
        assertEquals(EngineException.Kind.INVALID_ASSUMPTION, failureKind(() -> left.merge(conflict)));
    }
}
