package io.github.libra.core.ir;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The names of the global variables and functions of a module, used to check
 * references to them while bridging.
 */
public final class SymbolRegistry {
    private final SortedSet<Identifier> globals;
    private final SortedSet<Identifier> functions;
    private final SortedSet<Identifier> immutableUninitialized;

    /**
     * Construct a symbol registry.
     *
     * @param globals The names of all global variables.
     * @param functions The names of all functions.
     * @param immutableUninitialized The names of the global variables which are declared
     *                               immutable but have no initializer.
     */
    public SymbolRegistry(
            SortedSet<Identifier> globals,
            SortedSet<Identifier> functions,
            SortedSet<Identifier> immutableUninitialized
    ) {
        this.globals = Collections.unmodifiableSortedSet(new TreeSet<>(globals));
        this.functions = Collections.unmodifiableSortedSet(new TreeSet<>(functions));
        this.immutableUninitialized = Collections.unmodifiableSortedSet(new TreeSet<>(immutableUninitialized));
    }

    public boolean hasGlobal(Identifier name) {
        return globals.contains(name);
    }

    public boolean hasFunction(Identifier name) {
        return functions.contains(name);
    }

    public boolean isImmutableUninitialized(Identifier name) {
        return immutableUninitialized.contains(name);
    }

    public SortedSet<Identifier> getGlobals() {
        return globals;
    }

    public SortedSet<Identifier> getFunctions() {
        return functions;
    }

    /**
     * Combine this registry with that of another translation unit.
     * <p>
     * A global stays immutable-uninitialized only if no unit provides an initializer for it.
     *
     * @param other The other registry.
     * @param initialized The names of globals with an initializer in either unit.
     * @return The combined registry.
     */
    public SymbolRegistry merge(SymbolRegistry other, SortedSet<Identifier> initialized) {
        SortedSet<Identifier> mergedGlobals = new TreeSet<>(globals);
        mergedGlobals.addAll(other.globals);
        SortedSet<Identifier> mergedFunctions = new TreeSet<>(functions);
        mergedFunctions.addAll(other.functions);
        SortedSet<Identifier> mergedUninitialized = new TreeSet<>(immutableUninitialized);
        mergedUninitialized.addAll(other.immutableUninitialized);
        mergedUninitialized.removeAll(initialized);
        return new SymbolRegistry(mergedGlobals, mergedFunctions, mergedUninitialized);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SymbolRegistry that = (SymbolRegistry) o;
        return globals.equals(that.globals)
                && functions.equals(that.functions)
                && immutableUninitialized.equals(that.immutableUninitialized);
    }

    @Override
    public int hashCode() {
        return globals.hashCode() * 31 + functions.hashCode();
    }
}
