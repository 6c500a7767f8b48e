package io.github.libra.core.passes.convert;

import io.github.libra.core.adapter.AdaptedFunction;
import io.github.libra.core.adapter.AdaptedGlobal;
import io.github.libra.core.adapter.AdaptedModule;
import io.github.libra.core.error.EngineException;
import io.github.libra.core.error.Unsupported;
import io.github.libra.core.ir.*;
import io.github.libra.core.ir.Module;
import io.github.libra.core.passes.IRPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A pass to validate an adapter module and convert it into a {@link Module}.
 */
public class AdapterToIr implements IRPass<AdaptedModule, Module> {
    private static final Logger LOGGER = LogManager.getLogger(AdapterToIr.class);

    public static final AdapterToIr INSTANCE = new AdapterToIr();

    @Override
    public Module run(AdaptedModule module) {
        if (!module.asm.isEmpty()) {
            throw EngineException.unsupported(Unsupported.MODULE_LEVEL_ASSEMBLY);
        }

        TypeRegistry types = TypeRegistry.populate(module.structs);
        SymbolRegistry symbols = collectSymbols(module);

        SortedMap<Identifier, GlobalVariable> globals = new TreeMap<>();
        for (AdaptedGlobal global : module.globals) {
            GlobalVariable converted = GlobalConverter.convert(global, types, symbols);
            globals.put(converted.name, converted);
        }

        SortedMap<Identifier, Function> functions = new TreeMap<>();
        for (AdaptedFunction function : module.functions) {
            Function converted;
            try {
                converted = FunctionConverter.convert(function, types, symbols);
            } catch (RuntimeException e) {
                e.addSuppressed(new RuntimeException("in function " + function.name));
                throw e;
            }
            functions.put(converted.name, converted);
        }

        LOGGER.debug("converted module {}: {} structs, {} globals, {} functions",
                module.name, module.structs.size(), globals.size(), functions.size());
        return new Module(Identifier.of(module.name), types, symbols, globals, functions);
    }

    private static SymbolRegistry collectSymbols(AdaptedModule module) {
        SortedSet<Identifier> globals = new TreeSet<>();
        SortedSet<Identifier> immutableUninitialized = new TreeSet<>();
        for (AdaptedGlobal global : module.globals) {
            if (global.name == null) {
                throw EngineException.invalidAssumption("unexpected anonymous global variable");
            }
            Identifier name = Identifier.of(global.name);
            if (!globals.add(name)) {
                throw EngineException.invalidAssumption("duplicated global variable: %s", name);
            }
            if (global.isConst && global.initializer == null) {
                immutableUninitialized.add(name);
            }
        }

        SortedSet<Identifier> functions = new TreeSet<>();
        for (AdaptedFunction function : module.functions) {
            if (function.name == null) {
                throw EngineException.invalidAssumption("unexpected anonymous function");
            }
            Identifier name = Identifier.of(function.name);
            if (globals.contains(name) || !functions.add(name)) {
                throw EngineException.invalidAssumption("duplicated symbol: %s", name);
            }
        }
        return new SymbolRegistry(globals, functions, immutableUninitialized);
    }
}
