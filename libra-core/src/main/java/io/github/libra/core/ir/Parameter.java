package io.github.libra.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

public final class Parameter {
    public final @Nullable Identifier name;
    public final Type type;
    /**
     * The pointee type given by the parameter's attributes, if any.
     */
    public final @Nullable Type pointee;

    public Parameter(@Nullable Identifier name, Type type, @Nullable Type pointee) {
        this.name = name;
        this.type = type;
        this.pointee = pointee;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Parameter that = (Parameter) o;
        return Objects.equals(name, that.name) && type.equals(that.type) && Objects.equals(pointee, that.pointee);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, pointee);
    }

    @Override
    public String toString() {
        return type + (name == null ? "" : " " + name);
    }
}
