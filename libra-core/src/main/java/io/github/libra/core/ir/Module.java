package io.github.libra.core.ir;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;

/**
 * A validated module: its types, symbols, global variables and functions.
 */
public final class Module {
    public final Identifier name;
    public final TypeRegistry types;
    public final SymbolRegistry symbols;
    public final SortedMap<Identifier, GlobalVariable> globals;
    public final SortedMap<Identifier, Function> functions;

    public Module(
            Identifier name,
            TypeRegistry types,
            SymbolRegistry symbols,
            SortedMap<Identifier, GlobalVariable> globals,
            SortedMap<Identifier, Function> functions
    ) {
        this.name = name;
        this.types = types;
        this.symbols = symbols;
        this.globals = Collections.unmodifiableSortedMap(globals);
        this.functions = Collections.unmodifiableSortedMap(functions);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Module module = (Module) o;
        return name.equals(module.name)
                && types.equals(module.types)
                && symbols.equals(module.symbols)
                && globals.equals(module.globals)
                && functions.equals(module.functions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, globals.keySet(), functions.keySet());
    }
}
