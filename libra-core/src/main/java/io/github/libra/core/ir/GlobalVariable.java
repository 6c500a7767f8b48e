package io.github.libra.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

public final class GlobalVariable {
    public final Identifier name;
    public final Type type;
    public final boolean isConstant;
    /**
     * The initial value, or null if the variable is only declared.
     */
    public final @Nullable Constant initializer;

    public GlobalVariable(Identifier name, Type type, boolean isConstant, @Nullable Constant initializer) {
        this.name = name;
        this.type = type;
        this.isConstant = isConstant;
        this.initializer = initializer;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GlobalVariable that = (GlobalVariable) o;
        return isConstant == that.isConstant
                && name.equals(that.name)
                && type.equals(that.type)
                && Objects.equals(initializer, that.initializer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, isConstant, initializer);
    }

    @Override
    public String toString() {
        return "@" + name + ": " + (isConstant ? "const " : "") + type
                + (initializer == null ? "" : " = " + initializer);
    }
}
