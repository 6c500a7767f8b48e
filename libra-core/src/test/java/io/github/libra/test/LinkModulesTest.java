package io.github.libra.test;

import io.github.libra.core.adapter.*;
import io.github.libra.core.error.EngineException;
import io.github.libra.core.ir.*;
import io.github.libra.core.ir.Module;
import io.github.libra.core.passes.convert.LinkModules;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static io.github.libra.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class LinkModulesTest {
    private static AdaptedGlobal declaredConst(String name, AdaptedType ty) {
        return new AdaptedGlobal(name, ty, false, true, true, false, false, 0, null);
    }

    private static AdaptedFunction returnsOne(String name) {
        return define(name, fn(I32), params(), block(0, inst(VOID, 0, ret(intConst(I32, 1)))));
    }

    @Test
    void testDeclarationMeetsDefinition() {
        Module user = convert(module(
                Collections.emptyList(),
                Collections.singletonList(declaredConst("table", I32)),
                Arrays.asList(declare("one", fn(I32)), define("main", fn(I32), params(),
                        block(0, inst(VOID, 1, ret(reg(I32, 0))),
                                inst(I32, 0, new AdaptedInst.Call(AdaptedInst.CallKind.DIRECT,
                                        constant(new AdaptedConstant.Function(PTR, "one")), fn(I32),
                                        Collections.emptyList())))))
        ));
        Module provider = convert(module(
                Collections.emptyList(),
                Collections.singletonList(new AdaptedGlobal("table", I32, true, true, true, false, false, 0,
                        new AdaptedConstant.Int(I32, "7"))),
                Collections.singletonList(returnsOne("one"))
        ));
        assertTrue(user.symbols.isImmutableUninitialized(Identifier.of("table")));

        Module linked = LinkModules.INSTANCE.run(Arrays.asList(user, provider));
        assertEquals(user.name, linked.name);
        assertEquals(Constant.Int.of(32, 7), linked.globals.get(Identifier.of("table")).initializer);
        assertFalse(linked.symbols.isImmutableUninitialized(Identifier.of("table")));
        assertTrue(linked.functions.get(Identifier.of("one")).isDefinition());
        assertTrue(linked.functions.get(Identifier.of("main")).isDefinition());
        assertEquals(Arrays.asList(Identifier.of("main"), Identifier.of("one")),
                Arrays.asList(linked.symbols.getFunctions().toArray()));
    }

    @Test
    void testConflictingGlobals() {
        Module a = convert(module(Collections.emptyList(),
                Collections.singletonList(global("g", I32, new AdaptedConstant.Int(I32, "1"))), Collections.emptyList()));
        Module b = convert(module(Collections.emptyList(),
                Collections.singletonList(global("g", I32, new AdaptedConstant.Int(I32, "1"))), Collections.emptyList()));
        assertEquals(EngineException.Kind.INVALID_ASSUMPTION, failureKind(() -> LinkModules.INSTANCE.run(Arrays.asList(a, b))));

        Module c = convert(module(Collections.emptyList(),
                Collections.singletonList(global("g", I64, new AdaptedConstant.Int(I64, "1"))), Collections.emptyList()));
        assertEquals(EngineException.Kind.INVALID_ASSUMPTION, failureKind(() -> LinkModules.INSTANCE.run(Arrays.asList(a, c))));
    }

    @Test
    void testConflictingStructs() {
        Module a = convert(module(Collections.singletonList(defineStruct("node", I32)),
                Collections.emptyList(), Collections.emptyList()));
        Module b = convert(module(Collections.singletonList(defineStruct("node", I64)),
                Collections.emptyList(), Collections.emptyList()));
        Module same = convert(module(Collections.singletonList(defineStruct("node", I32)),
                Collections.emptyList(), Collections.emptyList()));
        assertEquals(EngineException.Kind.INVALID_ASSUMPTION, failureKind(() -> LinkModules.INSTANCE.run(Arrays.asList(a, b))));
        assertEquals(a.types, LinkModules.INSTANCE.run(Arrays.asList(a, same)).types);
    }

    @Test
    void testFunctionConflicts() {
        Module a = convert(module(returnsOne("f")));
        Module b = convert(module(returnsOne("f")));
        assertEquals(EngineException.Kind.INVALID_ASSUMPTION, failureKind(() -> LinkModules.INSTANCE.run(Arrays.asList(a, b))));

        AdaptedFunction weak = new AdaptedFunction("f", fn(I32), true, false, false, params(),
                Collections.singletonList(block(0, inst(VOID, 0, ret(intConst(I32, 2))))));
        Module linked = LinkModules.INSTANCE.run(Arrays.asList(convert(module(weak)), a));
        assertSame(a.functions.get(Identifier.of("f")), linked.functions.get(Identifier.of("f")));

        assertThrows(IllegalArgumentException.class, () -> LinkModules.INSTANCE.run(Collections.emptyList()));
    }
}
