package io.github.libra.core.ir;

import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * A constant value, checked against its type when it was converted.
 */
public abstract class Constant {
    Constant() {
    }

    /**
     * An integer constant, stored as the unsigned value of its bits.
     */
    public static final class Int extends Constant {
        public final int bits;
        public final BigInteger value;

        private Int(int bits, BigInteger value) {
            this.bits = bits;
            this.value = value;
        }

        /**
         * Create an integer constant, wrapping the value to the given width.
         *
         * @param bits The width.
         * @param value The value, which may be negative.
         * @return The constant.
         */
        public static Int of(int bits, BigInteger value) {
            return new Int(bits, value.and(new Type.Int(bits).mask()));
        }

        public static Int of(int bits, long value) {
            return of(bits, BigInteger.valueOf(value));
        }

        /**
         * Get the value interpreted as a two's complement signed integer.
         *
         * @return The signed value.
         */
        public BigInteger signedValue() {
            return value.testBit(bits - 1) ? value.subtract(BigInteger.ONE.shiftLeft(bits)) : value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Int)) return false;
            Int that = (Int) o;
            return bits == that.bits && value.equals(that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(bits, value);
        }

        @Override
        public String toString() {
            return "i" + bits + " " + signedValue();
        }
    }

    public static final class Float extends Constant {
        public final int bits;
        /**
         * The value, or null if it is not finite.
         */
        public final @Nullable BigDecimal value;

        public Float(int bits, @Nullable BigDecimal value) {
            this.bits = bits;
            this.value = value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Float)) return false;
            Float that = (Float) o;
            return bits == that.bits && Objects.equals(value, that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(bits, value);
        }

        @Override
        public String toString() {
            return "f" + bits + " " + (value == null ? "inf" : value.toString());
        }
    }

    public static final class Null extends Constant {
        public static final Null INSTANCE = new Null();

        private Null() {
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    public static final class Array extends Constant {
        public final Type element;
        public final List<Constant> elements;

        public Array(Type element, List<Constant> elements) {
            this.element = element;
            this.elements = elements;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Array)) return false;
            Array that = (Array) o;
            return element.equals(that.element) && elements.equals(that.elements);
        }

        @Override
        public int hashCode() {
            return Objects.hash(element, elements);
        }

        @Override
        public String toString() {
            return elements.toString();
        }
    }

    public static final class Struct extends Constant {
        public final @Nullable Identifier name;
        public final List<Constant> fields;

        public Struct(@Nullable Identifier name, List<Constant> fields) {
            this.name = name;
            this.fields = fields;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Struct)) return false;
            Struct that = (Struct) o;
            return Objects.equals(name, that.name) && fields.equals(that.fields);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, fields);
        }

        @Override
        public String toString() {
            return (name == null ? "" : name.toString()) + "{" + fields + "}";
        }
    }

    /**
     * The address of a global variable.
     */
    public static final class Variable extends Constant {
        public final Identifier name;

        public Variable(Identifier name) {
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Variable && name.equals(((Variable) o).name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Variable.class, name);
        }

        @Override
        public String toString() {
            return "@" + name;
        }
    }

    /**
     * The address of a function.
     */
    public static final class Function extends Constant {
        public final Identifier name;

        public Function(Identifier name) {
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Function && name.equals(((Function) o).name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Function.class, name);
        }

        @Override
        public String toString() {
            return "@" + name + "()";
        }
    }

    public static final class UndefInt extends Constant {
        public final int bits;

        public UndefInt(int bits) {
            this.bits = bits;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof UndefInt && bits == ((UndefInt) o).bits;
        }

        @Override
        public int hashCode() {
            return Objects.hash(UndefInt.class, bits);
        }

        @Override
        public String toString() {
            return "i" + bits + " undef";
        }
    }

    public static final class UndefFloat extends Constant {
        public final int bits;

        public UndefFloat(int bits) {
            this.bits = bits;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof UndefFloat && bits == ((UndefFloat) o).bits;
        }

        @Override
        public int hashCode() {
            return Objects.hash(UndefFloat.class, bits);
        }

        @Override
        public String toString() {
            return "f" + bits + " undef";
        }
    }

    public static final class UndefPointer extends Constant {
        public final Type.Pointer type;

        public UndefPointer(Type.Pointer type) {
            this.type = type;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof UndefPointer && type.equals(((UndefPointer) o).type);
        }

        @Override
        public int hashCode() {
            return Objects.hash(UndefPointer.class, type);
        }

        @Override
        public String toString() {
            return type + " undef";
        }
    }

    public static final class UndefArray extends Constant {
        public final Type.Array type;

        public UndefArray(Type.Array type) {
            this.type = type;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof UndefArray && type.equals(((UndefArray) o).type);
        }

        @Override
        public int hashCode() {
            return Objects.hash(UndefArray.class, type);
        }

        @Override
        public String toString() {
            return type + " undef";
        }
    }

    public static final class UndefStruct extends Constant {
        public final Type.Struct type;

        public UndefStruct(Type.Struct type) {
            this.type = type;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof UndefStruct && type.equals(((UndefStruct) o).type);
        }

        @Override
        public int hashCode() {
            return Objects.hash(UndefStruct.class, type);
        }

        @Override
        public String toString() {
            return type + " undef";
        }
    }

    /**
     * A constant computed by an instruction, which has no result register.
     */
    public static final class Expression extends Constant {
        public final Instruction instruction;

        public Expression(Instruction instruction) {
            this.instruction = instruction;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Expression && instruction.equals(((Expression) o).instruction);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Expression.class, instruction);
        }

        @Override
        public String toString() {
            return "(" + instruction + ")";
        }
    }
}
