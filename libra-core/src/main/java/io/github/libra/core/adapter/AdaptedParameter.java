package io.github.libra.core.adapter;

import org.jetbrains.annotations.Nullable;

/**
 * A function parameter, with the attributes which may carry a pointee type.
 */
public final class AdaptedParameter {
    public final @Nullable String name;
    public final AdaptedType ty;
    public final @Nullable AdaptedType byVal;
    public final @Nullable AdaptedType byRef;
    public final @Nullable AdaptedType inAlloca;
    public final @Nullable AdaptedType structRet;
    public final @Nullable AdaptedType preAllocated;
    public final @Nullable AdaptedType elementType;

    public AdaptedParameter(
            @Nullable String name,
            AdaptedType ty,
            @Nullable AdaptedType byVal,
            @Nullable AdaptedType byRef,
            @Nullable AdaptedType inAlloca,
            @Nullable AdaptedType structRet,
            @Nullable AdaptedType preAllocated,
            @Nullable AdaptedType elementType
    ) {
        this.name = name;
        this.ty = ty;
        this.byVal = byVal;
        this.byRef = byRef;
        this.inAlloca = inAlloca;
        this.structRet = structRet;
        this.preAllocated = preAllocated;
        this.elementType = elementType;
    }

    /**
     * Create a parameter with no attributes.
     *
     * @param name The name.
     * @param ty The type.
     * @return The parameter.
     */
    public static AdaptedParameter plain(@Nullable String name, AdaptedType ty) {
        return new AdaptedParameter(name, ty, null, null, null, null, null, null);
    }
}
