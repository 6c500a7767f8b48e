package io.github.libra.core.adapter;

import org.jetbrains.annotations.Nullable;

public final class AdaptedGlobal {
    public final @Nullable String name;
    public final AdaptedType ty;
    public final boolean isDefined;
    public final boolean isExact;
    public final boolean isConst;
    public final boolean isThreadLocal;
    public final boolean isExternallyInitialized;
    public final int addressSpace;
    public final @Nullable AdaptedConstant initializer;

    public AdaptedGlobal(
            @Nullable String name,
            AdaptedType ty,
            boolean isDefined,
            boolean isExact,
            boolean isConst,
            boolean isThreadLocal,
            boolean isExternallyInitialized,
            int addressSpace,
            @Nullable AdaptedConstant initializer
    ) {
        this.name = name;
        this.ty = ty;
        this.isDefined = isDefined;
        this.isExact = isExact;
        this.isConst = isConst;
        this.isThreadLocal = isThreadLocal;
        this.isExternallyInitialized = isExternallyInitialized;
        this.addressSpace = addressSpace;
        this.initializer = initializer;
    }
}
