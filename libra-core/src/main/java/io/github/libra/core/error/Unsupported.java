package io.github.libra.core.error;

/**
 * IR features which are known, but deliberately not handled by the bridge.
 * <p>
 * Meeting one of these is reported with {@link EngineException.Kind#NOT_SUPPORTED},
 * so callers can tell "not handled" apart from "malformed".
 */
public enum Unsupported {
    MODULE_LEVEL_ASSEMBLY("module-level assembly"),
    INLINE_ASSEMBLY("inline assembly"),
    GLOBAL_ALIAS("global alias"),
    FLOATING_POINT("floating point"),
    VECTORIZATION("SIMD vectorization"),
    VARIADIC_ARGUMENTS("variadic arguments"),
    ARCH_SPECIFIC_EXTENSION("architecture-specific extension"),
    THREAD_LOCAL_STORAGE("thread-local storage"),
    WEAK_GLOBAL_VARIABLE("weak global variable"),
    EXTERNALLY_INITIALIZED("externally initialized global variable"),
    POINTER_ADDRESS_SPACE("address space of a pointer"),
    OUT_OF_BOUND_CONSTANT_GEP("intentional out-of-bound GEP on constant"),
    INTERFACE_RESOLVER("interface resolver"),
    BLOCK_ADDRESS("address of a basic block"),
    ATOMICS("atomic instructions"),
    OPAQUE_STRUCT_DEFINITION("opaque struct definition"),
    OPAQUE_POINTER_TYPE("opaque pointer type"),
    INTRINSICS_PRE_ALLOCATED("intrinsics: pre-allocated calls"),
    INTRINSICS_CONVERGENCE("intrinsics: convergence control"),
    INTRINSICS_GC("intrinsics: garbage collection"),
    EXCEPTION_FUNCLET("funclet-based exception handling"),
    ;

    private final String description;

    Unsupported(String description) {
        this.description = description;
    }

    /**
     * Get a human-readable description of the feature.
     *
     * @return The description.
     */
    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return description;
    }
}
