package io.github.libra.core.adapter;

import org.jetbrains.annotations.Nullable;

import java.util.List;

public final class AdaptedFunction {
    public final @Nullable String name;
    public final AdaptedType ty;
    /**
     * Whether this is a definition rather than just a declaration.
     */
    public final boolean isDefined;
    /**
     * Whether the definition is exact, i.e. cannot be replaced at link time.
     */
    public final boolean isExact;
    public final boolean isIntrinsic;
    public final List<AdaptedParameter> params;
    public final List<AdaptedBlock> blocks;

    public AdaptedFunction(
            @Nullable String name,
            AdaptedType ty,
            boolean isDefined,
            boolean isExact,
            boolean isIntrinsic,
            List<AdaptedParameter> params,
            List<AdaptedBlock> blocks
    ) {
        this.name = name;
        this.ty = ty;
        this.isDefined = isDefined;
        this.isExact = isExact;
        this.isIntrinsic = isIntrinsic;
        this.params = params;
        this.blocks = blocks;
    }
}
