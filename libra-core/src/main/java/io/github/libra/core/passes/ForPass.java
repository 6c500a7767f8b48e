package io.github.libra.core.passes;

import io.github.libra.core.ir.Function;
import io.github.libra.core.ir.Identifier;
import io.github.libra.core.ir.Module;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Lifts passes over smaller IR parts into passes over bigger ones.
 */
public final class ForPass {
    private ForPass() {
    }

    /**
     * Lift a function pass to run on every function defined in a module.
     * Declarations are skipped.
     *
     * @param pass The function pass.
     * @return The module pass, giving the result for each function by name.
     * @param <B> The result type of the function pass.
     */
    public static <B> IRPass<Module, SortedMap<Identifier, B>> liftFunctions(IRPass<Function, B> pass) {
        return module -> {
            SortedMap<Identifier, B> results = new TreeMap<>();
            for (Map.Entry<Identifier, Function> entry : module.functions.entrySet()) {
                if (!entry.getValue().isDefinition()) continue;
                try {
                    results.put(entry.getKey(), pass.run(entry.getValue()));
                } catch (RuntimeException e) {
                    e.addSuppressed(new RuntimeException("in function " + entry.getKey()));
                    throw e;
                }
            }
            return Collections.unmodifiableSortedMap(results);
        };
    }
}
