package io.github.libra.core.error;

import org.jetbrains.annotations.Nullable;

/**
 * The single error type raised by the engine.
 * <p>
 * Bridging never recovers from one of these: the first violation aborts the conversion
 * of the enclosing module.
 */
public class EngineException extends RuntimeException {
    /**
     * The category of an {@link EngineException}.
     */
    public enum Kind {
        /**
         * Failure in the external compilation pipeline.
         */
        COMPILATION("compilation"),
        /**
         * Failure while loading a compiled module.
         */
        LOADING("loading"),
        /**
         * The input breaks a precondition assumed for well-formed compiler output.
         */
        INVALID_ASSUMPTION("assumption"),
        /**
         * The input uses a feature listed in {@link Unsupported}.
         */
        NOT_SUPPORTED("unsupported"),
        /**
         * An internal consistency check failed.
         */
        INVARIANT_VIOLATION("invariant"),
        ;

        private final String tag;

        Kind(String tag) {
            this.tag = tag;
        }

        /**
         * Get the tag used when rendering messages of this kind.
         *
         * @return The tag.
         */
        public String getTag() {
            return tag;
        }
    }

    private final Kind kind;
    private final @Nullable Unsupported unsupported;

    private EngineException(Kind kind, @Nullable Unsupported unsupported, String message, @Nullable Throwable cause) {
        super("[libra::" + kind.getTag() + "] " + message, cause);
        this.kind = kind;
        this.unsupported = unsupported;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Get the unsupported feature this error reports, if it is of kind {@link Kind#NOT_SUPPORTED}.
     *
     * @return The feature, or null.
     */
    public @Nullable Unsupported getUnsupported() {
        return unsupported;
    }

    public static EngineException compilation(String message, @Nullable Throwable cause) {
        return new EngineException(Kind.COMPILATION, null, message, cause);
    }

    public static EngineException loading(String message, @Nullable Throwable cause) {
        return new EngineException(Kind.LOADING, null, message, cause);
    }

    public static EngineException invalidAssumption(String format, Object... args) {
        return new EngineException(Kind.INVALID_ASSUMPTION, null, String.format(format, args), null);
    }

    public static EngineException unsupported(Unsupported item) {
        return new EngineException(Kind.NOT_SUPPORTED, item, item.getDescription(), null);
    }

    public static EngineException invariant(String format, Object... args) {
        return new EngineException(Kind.INVARIANT_VIOLATION, null, String.format(format, args), null);
    }
}
