package io.github.libra.core.adapter;

public abstract class AdaptedValue {
    AdaptedValue() {
    }

    /**
     * Get the declared type of this value.
     *
     * @return The type.
     */
    public abstract AdaptedType type();

    public static final class Argument extends AdaptedValue {
        public final AdaptedType ty;
        public final int index;

        public Argument(AdaptedType ty, int index) {
            this.ty = ty;
            this.index = index;
        }

        @Override
        public AdaptedType type() {
            return ty;
        }
    }

    public static final class Constant extends AdaptedValue {
        public final AdaptedConstant constant;

        public Constant(AdaptedConstant constant) {
            this.constant = constant;
        }

        @Override
        public AdaptedType type() {
            return constant.ty;
        }
    }

    /**
     * The result of another instruction.
     */
    public static final class Instruction extends AdaptedValue {
        public final AdaptedType ty;
        public final int index;

        public Instruction(AdaptedType ty, int index) {
            this.ty = ty;
            this.index = index;
        }

        @Override
        public AdaptedType type() {
            return ty;
        }
    }
}
