package io.github.libra.core.adapter;

import org.jetbrains.annotations.Nullable;

import java.util.List;

public abstract class AdaptedConstant {
    public final AdaptedType ty;

    AdaptedConstant(AdaptedType ty) {
        this.ty = ty;
    }

    public static final class Int extends AdaptedConstant {
        /**
         * The value, in decimal.
         */
        public final String value;

        public Int(AdaptedType ty, String value) {
            super(ty);
            this.value = value;
        }
    }

    public static final class Float extends AdaptedConstant {
        public final String value;

        public Float(AdaptedType ty, String value) {
            super(ty);
            this.value = value;
        }
    }

    public static final class Null extends AdaptedConstant {
        public Null(AdaptedType ty) {
            super(ty);
        }
    }

    /**
     * The {@code none} token.
     */
    public static final class None extends AdaptedConstant {
        public None(AdaptedType ty) {
            super(ty);
        }
    }

    public static final class Extension extends AdaptedConstant {
        public Extension(AdaptedType ty) {
            super(ty);
        }
    }

    public static final class Undef extends AdaptedConstant {
        public Undef(AdaptedType ty) {
            super(ty);
        }
    }

    /**
     * The zero initializer of a type.
     */
    public static final class Default extends AdaptedConstant {
        public Default(AdaptedType ty) {
            super(ty);
        }
    }

    public static final class Vector extends AdaptedConstant {
        public final List<AdaptedConstant> elements;

        public Vector(AdaptedType ty, List<AdaptedConstant> elements) {
            super(ty);
            this.elements = elements;
        }
    }

    public static final class Array extends AdaptedConstant {
        public final List<AdaptedConstant> elements;

        public Array(AdaptedType ty, List<AdaptedConstant> elements) {
            super(ty);
            this.elements = elements;
        }
    }

    public static final class Struct extends AdaptedConstant {
        public final List<AdaptedConstant> elements;

        public Struct(AdaptedType ty, List<AdaptedConstant> elements) {
            super(ty);
            this.elements = elements;
        }
    }

    /**
     * The address of a global variable.
     */
    public static final class Variable extends AdaptedConstant {
        public final @Nullable String name;

        public Variable(AdaptedType ty, @Nullable String name) {
            super(ty);
            this.name = name;
        }
    }

    /**
     * The address of a function.
     */
    public static final class Function extends AdaptedConstant {
        public final @Nullable String name;

        public Function(AdaptedType ty, @Nullable String name) {
            super(ty);
            this.name = name;
        }
    }

    public static final class Alias extends AdaptedConstant {
        public final @Nullable String name;

        public Alias(AdaptedType ty, @Nullable String name) {
            super(ty);
            this.name = name;
        }
    }

    /**
     * An indirect function resolved at load time.
     */
    public static final class Interface extends AdaptedConstant {
        public final @Nullable String name;

        public Interface(AdaptedType ty, @Nullable String name) {
            super(ty);
            this.name = name;
        }
    }

    /**
     * A marker wrapping another constant without changing its value.
     */
    public static final class Marker extends AdaptedConstant {
        public final AdaptedConstant wrap;

        public Marker(AdaptedType ty, AdaptedConstant wrap) {
            super(ty);
            this.wrap = wrap;
        }
    }

    /**
     * The address of a basic block.
     */
    public static final class PC extends AdaptedConstant {
        public PC(AdaptedType ty) {
            super(ty);
        }
    }

    /**
     * A constant computed by an instruction.
     */
    public static final class Expr extends AdaptedConstant {
        public final AdaptedInst inst;

        public Expr(AdaptedType ty, AdaptedInst inst) {
            super(ty);
            this.inst = inst;
        }
    }
}
