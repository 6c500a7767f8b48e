package io.github.libra.core.passes.convert;

import io.github.libra.core.error.EngineException;
import io.github.libra.core.error.Unsupported;

/**
 * Rejects calls to the families of intrinsics the analyses cannot model.
 */
public final class Intrinsics {
    private Intrinsics() {
    }

    /**
     * Check a call to an intrinsic.
     *
     * @param name The name of the intrinsic function.
     * @throws EngineException If the intrinsic is not supported.
     */
    public static void filter(String name) {
        // these involve the token type
        if (name.startsWith("llvm.call.preallocated.")) {
            throw EngineException.unsupported(Unsupported.INTRINSICS_PRE_ALLOCATED);
        }
        if (name.startsWith("llvm.experimental.convergence.")) {
            throw EngineException.unsupported(Unsupported.INTRINSICS_CONVERGENCE);
        }
        if (name.startsWith("llvm.experimental.gc.")) {
            throw EngineException.unsupported(Unsupported.INTRINSICS_GC);
        }
    }
}
