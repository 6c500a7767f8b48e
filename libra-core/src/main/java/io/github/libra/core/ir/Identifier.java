package io.github.libra.core.ir;

import org.jetbrains.annotations.NotNull;

/**
 * A name of a symbol or type in a module.
 * <p>
 * Identifiers are ordered by their name, so maps keyed by identifiers iterate deterministically.
 */
public final class Identifier implements Comparable<Identifier> {
    private final String name;

    private Identifier(String name) {
        this.name = name;
    }

    /**
     * Create an identifier.
     *
     * @param name The name.
     * @return The identifier.
     */
    public static Identifier of(@NotNull String name) {
        return new Identifier(name.intern());
    }

    public String getName() {
        return name;
    }

    @Override
    public int compareTo(@NotNull Identifier o) {
        return name.compareTo(o.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((Identifier) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
