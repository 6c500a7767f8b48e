package io.github.libra.core.ir;

import io.github.libra.core.error.EngineException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A function, either a declaration (no body) or a definition.
 */
public final class Function {
    private static final Logger LOGGER = LogManager.getLogger(Function.class);

    public final Identifier name;
    public final List<Parameter> params;
    public final @Nullable Type ret;
    public final boolean variadic;
    /**
     * Whether this definition may be replaced by another at link time.
     */
    public final boolean weak;
    /**
     * The body of the function, or null if this is a declaration.
     */
    public final @Nullable ControlFlowGraph body;

    public Function(
            Identifier name,
            List<Parameter> params,
            @Nullable Type ret,
            boolean variadic,
            boolean weak,
            @Nullable ControlFlowGraph body
    ) {
        this.name = name;
        this.params = params;
        this.ret = ret;
        this.variadic = variadic;
        this.weak = weak;
        this.body = body;
    }

    public Function(Identifier name, List<Parameter> params, @Nullable Type ret, boolean weak, @Nullable ControlFlowGraph body) {
        this(name, params, ret, false, weak, body);
    }

    public boolean isDefinition() {
        return body != null;
    }

    /**
     * Get the signature of this function.
     *
     * @return The function type.
     */
    public Type.Function signature() {
        List<Type> types = new ArrayList<>(params.size());
        for (Parameter param : params) {
            types.add(param.type);
        }
        return new Type.Function(types, ret, variadic);
    }

    /**
     * Resolve the same-named functions of several translation units into one, following
     * the one-definition rule.
     * <ul>
     *     <li>If there is no definition, the first declaration is taken.</li>
     *     <li>A single strong definition wins over any number of weak ones.</li>
     *     <li>More than one strong definition is an error.</li>
     *     <li>Otherwise, all weak definitions must be structurally identical.</li>
     * </ul>
     *
     * @param candidates The functions, all with the same name.
     * @return The resolved function.
     * @throws EngineException If the candidates cannot be reconciled.
     */
    public static Function applyOdr(List<Function> candidates) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("no function to resolve");
        }
        Function first = candidates.get(0);
        Function strong = null;
        List<Function> weaks = new ArrayList<>();
        for (Function candidate : candidates) {
            if (!candidate.name.equals(first.name)) {
                throw new IllegalArgumentException("resolving functions of different names: "
                        + first.name + " and " + candidate.name);
            }
            if (!candidate.signature().equals(first.signature())) {
                throw EngineException.invalidAssumption("conflicting signatures for function: %s", first.name);
            }
            if (!candidate.isDefinition()) continue;
            if (candidate.weak) {
                weaks.add(candidate);
            } else if (strong == null) {
                strong = candidate;
            } else {
                throw EngineException.invalidAssumption("multiple strong definitions of function: %s", first.name);
            }
        }
        if (strong != null) {
            LOGGER.debug("resolved {} to its strong definition", first.name);
            return strong;
        }
        if (!weaks.isEmpty()) {
            Function chosen = weaks.get(0);
            for (Function other : weaks) {
                if (!chosen.equals(other)) {
                    LOGGER.warn("weak definitions of {} differ", first.name);
                    throw EngineException.invalidAssumption("weak function conflict: %s", first.name);
                }
            }
            LOGGER.debug("resolved {} to a weak definition", first.name);
            return chosen;
        }
        return first;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Function that = (Function) o;
        return weak == that.weak
                && variadic == that.variadic
                && name.equals(that.name)
                && params.equals(that.params)
                && Objects.equals(ret, that.ret)
                && Objects.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, params, ret, variadic, weak);
    }

    @Override
    public String toString() {
        return "fn " + name + params + (variadic ? "..." : "") + " -> " + (ret == null ? "void" : ret)
                + (body == null ? ";" : " {\n" + body + "}");
    }
}
