package io.github.libra.core.adapter;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

public abstract class AdaptedType {
    AdaptedType() {
    }

    public static final class Void extends AdaptedType {
        public static final Void INSTANCE = new Void();

        private Void() {
        }

        @Override
        public String toString() {
            return "void";
        }
    }

    public static final class Int extends AdaptedType {
        public final int width;

        public Int(int width) {
            this.width = width;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Int && width == ((Int) o).width;
        }

        @Override
        public int hashCode() {
            return Objects.hash(Int.class, width);
        }

        @Override
        public String toString() {
            return "i" + width;
        }
    }

    public static final class Float extends AdaptedType {
        public final int width;
        public final String name;

        public Float(int width, String name) {
            this.width = width;
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Float)) return false;
            Float that = (Float) o;
            return width == that.width && name.equals(that.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(width, name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class Array extends AdaptedType {
        public final AdaptedType element;
        public final int length;

        public Array(AdaptedType element, int length) {
            this.element = element;
            this.length = length;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Array)) return false;
            Array that = (Array) o;
            return length == that.length && element.equals(that.element);
        }

        @Override
        public int hashCode() {
            return Objects.hash(element, length);
        }

        @Override
        public String toString() {
            return "[" + length + " x " + element + "]";
        }
    }

    /**
     * A struct, which may be anonymous (no name) and/or opaque (no fields).
     */
    public static final class Struct extends AdaptedType {
        public final @Nullable String name;
        public final @Nullable List<AdaptedType> fields;

        public Struct(@Nullable String name, @Nullable List<AdaptedType> fields) {
            this.name = name;
            this.fields = fields;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Struct)) return false;
            Struct that = (Struct) o;
            return Objects.equals(name, that.name) && Objects.equals(fields, that.fields);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, fields);
        }

        @Override
        public String toString() {
            return name == null ? "{" + fields + "}" : "%" + name;
        }
    }

    public static final class Function extends AdaptedType {
        public final List<AdaptedType> params;
        public final boolean variadic;
        public final AdaptedType ret;

        public Function(List<AdaptedType> params, boolean variadic, AdaptedType ret) {
            this.params = params;
            this.variadic = variadic;
            this.ret = ret;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Function)) return false;
            Function that = (Function) o;
            return variadic == that.variadic && params.equals(that.params) && ret.equals(that.ret);
        }

        @Override
        public int hashCode() {
            return Objects.hash(params, variadic, ret);
        }

        @Override
        public String toString() {
            return ret + " " + params + (variadic ? "..." : "");
        }
    }

    /**
     * An opaque pointer.
     */
    public static final class Pointer extends AdaptedType {
        public final int addressSpace;

        public Pointer(int addressSpace) {
            this.addressSpace = addressSpace;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Pointer && addressSpace == ((Pointer) o).addressSpace;
        }

        @Override
        public int hashCode() {
            return Objects.hash(Pointer.class, addressSpace);
        }

        @Override
        public String toString() {
            return addressSpace == 0 ? "ptr" : "ptr addrspace(" + addressSpace + ")";
        }
    }

    public static final class TypedPointer extends AdaptedType {
        public final AdaptedType pointee;
        public final int addressSpace;

        public TypedPointer(AdaptedType pointee, int addressSpace) {
            this.pointee = pointee;
            this.addressSpace = addressSpace;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof TypedPointer)) return false;
            TypedPointer that = (TypedPointer) o;
            return addressSpace == that.addressSpace && pointee.equals(that.pointee);
        }

        @Override
        public int hashCode() {
            return Objects.hash(pointee, addressSpace);
        }

        @Override
        public String toString() {
            return pointee + "*";
        }
    }

    public static final class Vector extends AdaptedType {
        public final AdaptedType element;
        public final boolean fixed;
        public final int length;

        public Vector(AdaptedType element, boolean fixed, int length) {
            this.element = element;
            this.fixed = fixed;
            this.length = length;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Vector)) return false;
            Vector that = (Vector) o;
            return fixed == that.fixed && length == that.length && element.equals(that.element);
        }

        @Override
        public int hashCode() {
            return Objects.hash(element, fixed, length);
        }
    }

    /**
     * A target extension type.
     */
    public static final class Extension extends AdaptedType {
        public final String name;
        public final List<AdaptedType> params;

        public Extension(String name, List<AdaptedType> params) {
            this.name = name;
            this.params = params;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Extension)) return false;
            Extension that = (Extension) o;
            return name.equals(that.name) && params.equals(that.params);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, params);
        }
    }

    public static final class Label extends AdaptedType {
        public static final Label INSTANCE = new Label();

        private Label() {
        }
    }

    public static final class Token extends AdaptedType {
        public static final Token INSTANCE = new Token();

        private Token() {
        }
    }

    public static final class Metadata extends AdaptedType {
        public static final Metadata INSTANCE = new Metadata();

        private Metadata() {
        }
    }
}
