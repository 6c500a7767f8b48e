package io.github.libra.core.adapter;

import org.jetbrains.annotations.Nullable;

import java.util.List;

public final class AdaptedBlock {
    public final int label;
    public final @Nullable String name;
    public final List<AdaptedInstruction> body;
    public final AdaptedInstruction terminator;

    public AdaptedBlock(int label, @Nullable String name, List<AdaptedInstruction> body, AdaptedInstruction terminator) {
        this.label = label;
        this.name = name;
        this.body = body;
        this.terminator = terminator;
    }
}
