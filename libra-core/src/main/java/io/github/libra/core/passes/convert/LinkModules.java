package io.github.libra.core.passes.convert;

import io.github.libra.core.error.EngineException;
import io.github.libra.core.ir.*;
import io.github.libra.core.ir.Module;
import io.github.libra.core.passes.IRPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * A pass to link the modules of several translation units into one.
 * <p>
 * Global variables may be defined at most once. Functions are resolved with
 * {@link Function#applyOdr(List)}.
 */
public class LinkModules implements IRPass<List<Module>, Module> {
    private static final Logger LOGGER = LogManager.getLogger(LinkModules.class);

    public static final LinkModules INSTANCE = new LinkModules();

    @Override
    public Module run(List<Module> modules) {
        if (modules.isEmpty()) {
            throw new IllegalArgumentException("no module to link");
        }
        Module first = modules.get(0);
        TypeRegistry types = first.types;
        SymbolRegistry symbols = first.symbols;
        SortedSet<Identifier> initialized = new TreeSet<>();
        SortedMap<Identifier, List<GlobalVariable>> globals = new TreeMap<>();
        SortedMap<Identifier, List<Function>> functions = new TreeMap<>();
        for (int i = 0; i < modules.size(); i++) {
            Module module = modules.get(i);
            if (i != 0) {
                types = types.merge(module.types);
            }
            for (GlobalVariable global : module.globals.values()) {
                globals.computeIfAbsent(global.name, k -> new ArrayList<>()).add(global);
                if (global.initializer != null) initialized.add(global.name);
            }
            for (Function function : module.functions.values()) {
                functions.computeIfAbsent(function.name, k -> new ArrayList<>()).add(function);
            }
        }
        for (int i = 1; i < modules.size(); i++) {
            symbols = symbols.merge(modules.get(i).symbols, initialized);
        }

        SortedMap<Identifier, GlobalVariable> linkedGlobals = new TreeMap<>();
        for (Map.Entry<Identifier, List<GlobalVariable>> entry : globals.entrySet()) {
            linkedGlobals.put(entry.getKey(), linkGlobal(entry.getKey(), entry.getValue()));
        }
        SortedMap<Identifier, Function> linkedFunctions = new TreeMap<>();
        for (Map.Entry<Identifier, List<Function>> entry : functions.entrySet()) {
            linkedFunctions.put(entry.getKey(), Function.applyOdr(entry.getValue()));
        }

        LOGGER.debug("linked {} modules into {}", modules.size(), first.name);
        return new Module(first.name, types, symbols, linkedGlobals, linkedFunctions);
    }

    private static GlobalVariable linkGlobal(Identifier name, List<GlobalVariable> candidates) {
        GlobalVariable definition = null;
        for (GlobalVariable candidate : candidates) {
            if (!candidate.type.equals(candidates.get(0).type)) {
                throw EngineException.invalidAssumption("conflicting types for global variable: %s", name);
            }
            if (candidate.initializer == null) continue;
            if (definition != null) {
                throw EngineException.invalidAssumption("multiple definitions of global variable: %s", name);
            }
            definition = candidate;
        }
        return definition != null ? definition : candidates.get(0);
    }
}
