package io.github.libra.core.adapter;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A named struct type declared by the module.
 */
public final class UserDefinedStruct {
    public final @Nullable String name;
    /**
     * The fields of the struct, or null if it is opaque.
     */
    public final @Nullable List<AdaptedType> fields;

    public UserDefinedStruct(@Nullable String name, @Nullable List<AdaptedType> fields) {
        this.name = name;
        this.fields = fields;
    }
}
