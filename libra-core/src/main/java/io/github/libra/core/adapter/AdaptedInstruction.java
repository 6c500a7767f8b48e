package io.github.libra.core.adapter;

import org.jetbrains.annotations.Nullable;

public final class AdaptedInstruction {
    /**
     * The index given to instructions which are not part of a function body,
     * such as those of constant expressions.
     */
    public static final int NO_INDEX = -1;

    public final @Nullable String name;
    public final AdaptedType ty;
    /**
     * The index of this instruction, unique within its function.
     */
    public final int index;
    public final AdaptedInst repr;

    public AdaptedInstruction(@Nullable String name, AdaptedType ty, int index, AdaptedInst repr) {
        this.name = name;
        this.ty = ty;
        this.index = index;
        this.repr = repr;
    }
}
