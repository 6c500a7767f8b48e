package io.github.libra.core.passes.convert;

import io.github.libra.core.adapter.AdaptedGlobal;
import io.github.libra.core.error.EngineException;
import io.github.libra.core.error.Unsupported;
import io.github.libra.core.ir.*;

/**
 * Converts an adapter global variable into a {@link GlobalVariable}.
 */
public final class GlobalConverter {
    private GlobalConverter() {
    }

    public static GlobalVariable convert(AdaptedGlobal global, TypeRegistry types, SymbolRegistry symbols) {
        if (global.name == null) {
            throw EngineException.invalidAssumption("unexpected anonymous global variable");
        }
        Identifier name = Identifier.of(global.name);
        if (global.isThreadLocal) {
            throw EngineException.unsupported(Unsupported.THREAD_LOCAL_STORAGE);
        }
        if (global.isExternallyInitialized) {
            throw EngineException.unsupported(Unsupported.EXTERNALLY_INITIALIZED);
        }
        if (global.addressSpace != 0) {
            throw EngineException.unsupported(Unsupported.POINTER_ADDRESS_SPACE);
        }
        if (!global.isExact) {
            throw EngineException.unsupported(Unsupported.WEAK_GLOBAL_VARIABLE);
        }

        Type ty = types.convert(global.ty);
        Constant initializer = null;
        if (global.isDefined) {
            if (global.initializer == null) {
                throw EngineException.invalidAssumption("defined global variable %s without initializer", name);
            }
            initializer = ConstantConverter.convert(global.initializer, ty, types, symbols);
        } else if (global.initializer != null) {
            throw EngineException.invalidAssumption("declared global variable %s with initializer", name);
        }
        return new GlobalVariable(name, ty, global.isConst, initializer);
    }
}
