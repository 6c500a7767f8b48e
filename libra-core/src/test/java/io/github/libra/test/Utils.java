package io.github.libra.test;

import io.github.libra.core.adapter.*;
import io.github.libra.core.error.EngineException;
import io.github.libra.core.error.Unsupported;
import io.github.libra.core.ir.Function;
import io.github.libra.core.ir.Identifier;
import io.github.libra.core.ir.Module;
import io.github.libra.core.passes.convert.AdapterToIr;
import org.junit.jupiter.api.function.Executable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class Utils {
    public static final AdaptedType VOID = AdaptedType.Void.INSTANCE;
    public static final AdaptedType I1 = new AdaptedType.Int(1);
    public static final AdaptedType I8 = new AdaptedType.Int(8);
    public static final AdaptedType I32 = new AdaptedType.Int(32);
    public static final AdaptedType I64 = new AdaptedType.Int(64);
    public static final AdaptedType PTR = new AdaptedType.Pointer(0);

    public static AdaptedType struct(String name) {
        return new AdaptedType.Struct(name, null);
    }

    public static AdaptedType fn(AdaptedType ret, AdaptedType... params) {
        return new AdaptedType.Function(Arrays.asList(params), false, ret);
    }

    public static UserDefinedStruct defineStruct(String name, AdaptedType... fields) {
        return new UserDefinedStruct(name, Arrays.asList(fields));
    }

    public static AdaptedValue intConst(AdaptedType ty, long value) {
        return new AdaptedValue.Constant(new AdaptedConstant.Int(ty, Long.toString(value)));
    }

    public static AdaptedValue constant(AdaptedConstant constant) {
        return new AdaptedValue.Constant(constant);
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

    public static AdaptedInst ret(AdaptedValue value) {
        return new AdaptedInst.Return(value);
    }

    public static AdaptedInst retVoid() {
        return new AdaptedInst.Return(null);
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

    public static AdaptedFunction define(String name, AdaptedType ty, List<AdaptedParameter> params, AdaptedBlock... blocks) {
        return new AdaptedFunction(name, ty, true, true, false, params, Arrays.asList(blocks));
    }

    public static AdaptedFunction declare(String name, AdaptedType ty, AdaptedParameter... params) {
        return new AdaptedFunction(name, ty, false, true, false, Arrays.asList(params), Collections.emptyList());
    }

    public static List<AdaptedParameter> params(AdaptedType... types) {
        AdaptedParameter[] params = new AdaptedParameter[types.length];
        for (int i = 0; i < types.length; i++) {
            params[i] = AdaptedParameter.plain(null, types[i]);
        }
        return Arrays.asList(params);
    }

    public static AdaptedGlobal global(String name, AdaptedType ty, AdaptedConstant initializer) {
        return new AdaptedGlobal(name, ty, true, true, false, false, false, 0, initializer);
    }

    public static AdaptedModule module(
            List<UserDefinedStruct> structs,
            List<AdaptedGlobal> globals,
            List<AdaptedFunction> functions
    ) {
        return new AdaptedModule("test", "", structs, globals, functions);
    }

    public static AdaptedModule module(AdaptedFunction... functions) {
        return module(Collections.emptyList(), Collections.emptyList(), Arrays.asList(functions));
    }

    public static Module convert(AdaptedModule module) {
        return AdapterToIr.INSTANCE.run(module);
    }

    public static Function convertFunction(AdaptedFunction func) {
        return convert(module(func)).functions.get(Identifier.of(func.name));
    }

    public static EngineException.Kind failureKind(Executable executable) {
        return assertThrows(EngineException.class, executable).getKind();
    }

    public static void assertUnsupported(Unsupported expected, Executable executable) {
        EngineException e = assertThrows(EngineException.class, executable);
        assertEquals(EngineException.Kind.NOT_SUPPORTED, e.getKind());
        assertEquals(expected, e.getUnsupported());
    }
}
