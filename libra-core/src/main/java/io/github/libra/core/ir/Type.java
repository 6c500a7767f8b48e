package io.github.libra.core.ir;

import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A validated type of a value in the IR.
 * <p>
 * There is no void type: a function without a result has a null {@link Function#ret}.
 * Structs that belong to a recursive group refer to other members of the group through
 * {@link StructRecursive} back-references, which are resolved through the
 * {@link TypeRegistry}.
 */
public abstract class Type {
    Type() {
    }

    /**
     * A bit-vector, used for integers of any width.
     */
    public static final class Int extends Type {
        public final int bits;

        public Int(int bits) {
            if (bits <= 0) throw new IllegalArgumentException("non-positive width: " + bits);
            this.bits = bits;
        }

        /**
         * Get the mask covering every bit of a value of this type.
         *
         * @return The mask.
         */
        public BigInteger mask() {
            return BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Int && bits == ((Int) o).bits;
        }

        @Override
        public int hashCode() {
            return Objects.hash(Int.class, bits);
        }

        @Override
        public String toString() {
            return "int" + bits;
        }
    }

    /**
     * A floating point type. Only constants of this type are representable.
     */
    public static final class Float extends Type {
        public final int bits;

        public Float(int bits) {
            this.bits = bits;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Float && bits == ((Float) o).bits;
        }

        @Override
        public int hashCode() {
            return Objects.hash(Float.class, bits);
        }

        @Override
        public String toString() {
            return "float" + bits;
        }
    }

    public static final class Array extends Type {
        public final Type element;
        public final int length;

        public Array(Type element, int length) {
            this.element = element;
            this.length = length;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Array)) return false;
            Array array = (Array) o;
            return length == array.length && element.equals(array.element);
        }

        @Override
        public int hashCode() {
            return Objects.hash(element, length);
        }

        @Override
        public String toString() {
            return element + "[" + length + "]";
        }
    }

    /**
     * A struct whose fields are known.
     */
    public static final class Struct extends Type {
        /**
         * The name of the struct, or null if it is anonymous.
         */
        public final @Nullable Identifier name;
        public final List<Type> fields;

        public Struct(@Nullable Identifier name, List<Type> fields) {
            this.name = name;
            this.fields = fields;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Struct)) return false;
            Struct struct = (Struct) o;
            return Objects.equals(name, struct.name) && fields.equals(struct.fields);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, fields);
        }

        @Override
        public String toString() {
            return (name == null ? "<anonymous>" : name.toString())
                    + fields.stream().map(Type::toString).collect(Collectors.joining(",", "{", "}"));
        }
    }

    /**
     * A reference to a struct of a recursive group, from within the same group.
     */
    public static final class StructRecursive extends Type {
        public final Identifier name;

        public StructRecursive(Identifier name) {
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof StructRecursive && name.equals(((StructRecursive) o).name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(StructRecursive.class, name);
        }

        @Override
        public String toString() {
            return "&" + name;
        }
    }

    public static final class Function extends Type {
        public final List<Type> params;
        public final @Nullable Type ret;
        /**
         * Whether further arguments may follow the declared parameters.
         */
        public final boolean variadic;

        public Function(List<Type> params, @Nullable Type ret, boolean variadic) {
            this.params = params;
            this.ret = ret;
            this.variadic = variadic;
        }

        public Function(List<Type> params, @Nullable Type ret) {
            this(params, ret, false);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Function)) return false;
            Function function = (Function) o;
            return variadic == function.variadic
                    && params.equals(function.params)
                    && Objects.equals(ret, function.ret);
        }

        @Override
        public int hashCode() {
            return Objects.hash(params, ret, variadic);
        }

        @Override
        public String toString() {
            return params.stream().map(Type::toString)
                    .collect(Collectors.joining(",", "(", variadic ? ",...)" : ")"))
                    + "->" + (ret == null ? "void" : ret.toString());
        }
    }

    public static final class Pointer extends Type {
        /**
         * An opaque pointer, with no pointee type.
         */
        public static final Pointer OPAQUE = new Pointer(null);

        /**
         * The pointee type, or null if the pointer is opaque.
         */
        public final @Nullable Type pointee;

        public Pointer(@Nullable Type pointee) {
            this.pointee = pointee;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Pointer && Objects.equals(pointee, ((Pointer) o).pointee);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Pointer.class, pointee);
        }

        @Override
        public String toString() {
            return pointee == null ? "ptr" : pointee + "*";
        }
    }
}
