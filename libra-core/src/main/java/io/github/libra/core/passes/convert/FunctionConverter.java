package io.github.libra.core.passes.convert;

import io.github.libra.core.adapter.AdaptedFunction;
import io.github.libra.core.adapter.AdaptedParameter;
import io.github.libra.core.adapter.AdaptedType;
import io.github.libra.core.error.EngineException;
import io.github.libra.core.ir.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Converts an adapter function into a {@link Function}.
 */
public final class FunctionConverter {
    private FunctionConverter() {
    }

    public static Function convert(AdaptedFunction func, TypeRegistry types, SymbolRegistry symbols) {
        if (func.name == null) {
            throw EngineException.invalidAssumption("unexpected anonymous function");
        }
        Identifier name = Identifier.of(func.name);

        Type ty = types.convert(func.ty);
        if (!(ty instanceof Type.Function)) {
            throw EngineException.invalidAssumption("function %s has a non-function type: %s", name, ty);
        }
        Type.Function signature = (Type.Function) ty;
        if (signature.params.size() != func.params.size()) {
            throw EngineException.invalidAssumption("parameter count mismatch for function %s: expect %d, found %d",
                    name, signature.params.size(), func.params.size());
        }

        List<Parameter> params = new ArrayList<>(func.params.size());
        for (int i = 0; i < func.params.size(); i++) {
            AdaptedParameter param = func.params.get(i);
            Type paramTy = types.convert(param.ty);
            if (!types.sameType(paramTy, signature.params.get(i))) {
                throw EngineException.invalidAssumption("parameter type mismatch for function %s at %d", name, i);
            }
            params.add(new Parameter(
                    param.name == null ? null : Identifier.of(param.name),
                    paramTy,
                    pointee(types, param)
            ));
        }

        ControlFlowGraph body = null;
        if (func.isDefined && !func.blocks.isEmpty() && !func.isIntrinsic) {
            body = CfgBuilder.build(types, symbols, signature.params, signature.ret, func.blocks);
        }
        return new Function(name, Collections.unmodifiableList(params), signature.ret, signature.variadic, !func.isExact, body);
    }

    private static @Nullable Type pointee(TypeRegistry types, AdaptedParameter param) {
        AdaptedType found = null;
        AdaptedType[] annotations = {
                param.byVal, param.byRef, param.inAlloca, param.structRet, param.preAllocated, param.elementType
        };
        for (AdaptedType annotation : annotations) {
            if (annotation == null) continue;
            if (found != null && !found.equals(annotation)) {
                throw EngineException.invalidAssumption("conflicting pointee types in parameter annotations");
            }
            found = annotation;
        }
        return found == null ? null : types.convert(found);
    }
}
