package io.github.libra.core.ir;

import java.util.Objects;

/**
 * An operand of an instruction.
 * <p>
 * Arguments and registers are distinct namespaces: argument {@code 0} and
 * register {@code 0} are unrelated.
 */
public abstract class Value {
    Value() {
    }

    /**
     * Get the type of this value.
     *
     * @return The type.
     */
    public abstract Type type();

    public static final class Const extends Value {
        public final Type type;
        public final Constant constant;

        public Const(Type type, Constant constant) {
            this.type = type;
            this.constant = constant;
        }

        @Override
        public Type type() {
            return type;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Const)) return false;
            Const that = (Const) o;
            return type.equals(that.type) && constant.equals(that.constant);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, constant);
        }

        @Override
        public String toString() {
            return constant.toString();
        }
    }

    public static final class Argument extends Value {
        public final int index;
        public final Type type;

        public Argument(int index, Type type) {
            this.index = index;
            this.type = type;
        }

        @Override
        public Type type() {
            return type;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Argument)) return false;
            Argument that = (Argument) o;
            return index == that.index && type.equals(that.type);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Argument.class, index, type);
        }

        @Override
        public String toString() {
            return "$" + index;
        }
    }

    /**
     * The result of an instruction.
     */
    public static final class Register extends Value {
        public final RegisterSlot slot;
        public final Type type;

        public Register(RegisterSlot slot, Type type) {
            this.slot = slot;
            this.type = type;
        }

        @Override
        public Type type() {
            return type;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Register)) return false;
            Register that = (Register) o;
            return slot.equals(that.slot) && type.equals(that.type);
        }

        @Override
        public int hashCode() {
            return Objects.hash(slot, type);
        }

        @Override
        public String toString() {
            return slot.toString();
        }
    }
}
