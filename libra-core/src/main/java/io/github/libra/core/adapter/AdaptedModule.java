package io.github.libra.core.adapter;

import java.util.List;

public final class AdaptedModule {
    public final String name;
    /**
     * Module-level inline assembly, empty if there is none.
     */
    public final String asm;
    public final List<UserDefinedStruct> structs;
    public final List<AdaptedGlobal> globals;
    public final List<AdaptedFunction> functions;

    public AdaptedModule(
            String name,
            String asm,
            List<UserDefinedStruct> structs,
            List<AdaptedGlobal> globals,
            List<AdaptedFunction> functions
    ) {
        this.name = name;
        this.asm = asm;
        this.structs = structs;
        this.globals = globals;
        this.functions = functions;
    }
}
