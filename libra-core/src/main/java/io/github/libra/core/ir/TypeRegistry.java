package io.github.libra.core.ir;

import io.github.libra.core.adapter.AdaptedType;
import io.github.libra.core.adapter.UserDefinedStruct;
import io.github.libra.core.error.EngineException;
import io.github.libra.core.error.Unsupported;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jgrapht.Graph;
import org.jgrapht.alg.connectivity.KosarajuStrongConnectivityInspector;
import org.jgrapht.alg.interfaces.StrongConnectivityAlgorithm;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

import java.util.*;

/**
 * Holds the named struct types of a module, and converts adapter types into {@link Type}s.
 * <p>
 * Named structs are split by strongly connected components of their reference graph.
 * A struct in a singleton component without a self-reference is <i>simple</i>, and its
 * fields are inlined wherever it is used. All other structs belong to a <i>recursive group</i>,
 * and references to a member from within the same group become {@link Type.StructRecursive}
 * back-references instead.
 */
public final class TypeRegistry {
    private static final Logger LOGGER = LogManager.getLogger(TypeRegistry.class);

    private final SortedMap<Identifier, List<AdaptedType>> declarations;
    private final Map<Identifier, SortedSet<Identifier>> groups = new HashMap<>();
    private final SortedMap<Identifier, Type.Struct> definitions = new TreeMap<>();
    private final Set<Identifier> resolving = new HashSet<>();

    private TypeRegistry(SortedMap<Identifier, List<AdaptedType>> declarations) {
        this.declarations = declarations;
    }

    /**
     * Build a registry from the named struct definitions of a module.
     *
     * @param structs The struct definitions.
     * @return The registry.
     * @throws EngineException If a struct is anonymous, opaque, or defined twice,
     *                         or if any field type cannot be converted.
     */
    public static TypeRegistry populate(List<UserDefinedStruct> structs) {
        SortedMap<Identifier, List<AdaptedType>> declarations = new TreeMap<>();
        for (UserDefinedStruct struct : structs) {
            if (struct.name == null) {
                throw EngineException.invalidAssumption("user-defined struct type cannot be anonymous");
            }
            if (struct.fields == null) {
                throw EngineException.unsupported(Unsupported.OPAQUE_STRUCT_DEFINITION);
            }
            if (declarations.put(Identifier.of(struct.name), struct.fields) != null) {
                throw EngineException.invalidAssumption("no duplicated definition of struct: %s", struct.name);
            }
        }
        return build(declarations);
    }

    private static TypeRegistry build(SortedMap<Identifier, List<AdaptedType>> declarations) {
        TypeRegistry registry = new TypeRegistry(declarations);

        Graph<Identifier, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
        for (Identifier name : declarations.keySet()) {
            graph.addVertex(name);
        }
        for (Map.Entry<Identifier, List<AdaptedType>> entry : declarations.entrySet()) {
            Set<Identifier> deps = new TreeSet<>();
            for (AdaptedType field : entry.getValue()) {
                collectReferences(field, deps);
            }
            for (Identifier dep : deps) {
                if (declarations.containsKey(dep)) {
                    graph.addEdge(entry.getKey(), dep);
                }
            }
        }

        StrongConnectivityAlgorithm<Identifier, DefaultEdge> scc = new KosarajuStrongConnectivityInspector<>(graph);
        for (Set<Identifier> component : scc.stronglyConnectedSets()) {
            if (component.size() == 1) {
                Identifier only = component.iterator().next();
                if (!graph.containsEdge(only, only)) continue;
            }
            SortedSet<Identifier> group = Collections.unmodifiableSortedSet(new TreeSet<>(component));
            for (Identifier member : group) {
                registry.groups.put(member, group);
            }
            LOGGER.debug("recursive struct group {}", group);
        }

        for (Identifier name : declarations.keySet()) {
            registry.resolve(name);
        }
        return registry;
    }

    private static void collectReferences(AdaptedType ty, Set<Identifier> into) {
        if (ty instanceof AdaptedType.Struct) {
            AdaptedType.Struct struct = (AdaptedType.Struct) ty;
            if (struct.name != null) {
                into.add(Identifier.of(struct.name));
            } else if (struct.fields != null) {
                for (AdaptedType field : struct.fields) {
                    collectReferences(field, into);
                }
            }
        } else if (ty instanceof AdaptedType.Array) {
            collectReferences(((AdaptedType.Array) ty).element, into);
        } else if (ty instanceof AdaptedType.Vector) {
            collectReferences(((AdaptedType.Vector) ty).element, into);
        } else if (ty instanceof AdaptedType.TypedPointer) {
            collectReferences(((AdaptedType.TypedPointer) ty).pointee, into);
        } else if (ty instanceof AdaptedType.Function) {
            AdaptedType.Function func = (AdaptedType.Function) ty;
            for (AdaptedType param : func.params) {
                collectReferences(param, into);
            }
            collectReferences(func.ret, into);
        }
    }

    private Type.Struct resolve(Identifier name) {
        Type.Struct resolved = definitions.get(name);
        if (resolved != null) return resolved;
        if (!resolving.add(name)) {
            throw EngineException.invariant("unresolved type reference: %s", name);
        }
        Set<Identifier> group = groups.getOrDefault(name, Collections.emptySortedSet());
        List<Type> fields = new ArrayList<>();
        for (AdaptedType field : declarations.get(name)) {
            fields.add(convert(field, group));
        }
        resolving.remove(name);
        resolved = new Type.Struct(name, Collections.unmodifiableList(fields));
        definitions.put(name, resolved);
        return resolved;
    }

    /**
     * Convert an adapter type.
     * <p>
     * A named struct converts to its full definition; if it belongs to a recursive group,
     * references back into that group within the definition are {@link Type.StructRecursive}.
     *
     * @param ty The adapter type.
     * @return The converted type.
     * @throws EngineException If the type is void or not supported.
     */
    public Type convert(AdaptedType ty) {
        return convert(ty, Collections.emptySet());
    }

    private Type convert(AdaptedType ty, Set<Identifier> group) {
        if (ty instanceof AdaptedType.Int) {
            return new Type.Int(((AdaptedType.Int) ty).width);
        }
        if (ty instanceof AdaptedType.Float) {
            return new Type.Float(((AdaptedType.Float) ty).width);
        }
        if (ty instanceof AdaptedType.Array) {
            AdaptedType.Array array = (AdaptedType.Array) ty;
            return new Type.Array(convert(array.element, group), array.length);
        }
        if (ty instanceof AdaptedType.Struct) {
            return convertStruct((AdaptedType.Struct) ty, group);
        }
        if (ty instanceof AdaptedType.Function) {
            AdaptedType.Function func = (AdaptedType.Function) ty;
            List<Type> params = new ArrayList<>();
            for (AdaptedType param : func.params) {
                params.add(convert(param, group));
            }
            Type ret = func.ret instanceof AdaptedType.Void ? null : convert(func.ret, group);
            return new Type.Function(Collections.unmodifiableList(params), ret, func.variadic);
        }
        if (ty instanceof AdaptedType.Pointer) {
            if (((AdaptedType.Pointer) ty).addressSpace != 0) {
                throw EngineException.unsupported(Unsupported.POINTER_ADDRESS_SPACE);
            }
            return Type.Pointer.OPAQUE;
        }
        if (ty instanceof AdaptedType.TypedPointer) {
            AdaptedType.TypedPointer pointer = (AdaptedType.TypedPointer) ty;
            if (pointer.addressSpace != 0) {
                throw EngineException.unsupported(Unsupported.POINTER_ADDRESS_SPACE);
            }
            if (pointer.pointee instanceof AdaptedType.Void) {
                return Type.Pointer.OPAQUE;
            }
            if (pointer.pointee instanceof AdaptedType.Struct) {
                AdaptedType.Struct pointee = (AdaptedType.Struct) pointer.pointee;
                if (pointee.name != null && pointee.fields == null
                        && !declarations.containsKey(Identifier.of(pointee.name))) {
                    throw EngineException.unsupported(Unsupported.OPAQUE_POINTER_TYPE);
                }
            }
            return new Type.Pointer(convert(pointer.pointee, group));
        }
        if (ty instanceof AdaptedType.Void) {
            throw EngineException.invariant("unexpected void type");
        }
        if (ty instanceof AdaptedType.Vector) {
            throw EngineException.unsupported(Unsupported.VECTORIZATION);
        }
        if (ty instanceof AdaptedType.Extension) {
            throw EngineException.unsupported(Unsupported.ARCH_SPECIFIC_EXTENSION);
        }
        if (ty instanceof AdaptedType.Label) {
            throw EngineException.invalidAssumption("unexpected llvm primitive type: label");
        }
        if (ty instanceof AdaptedType.Token) {
            throw EngineException.invalidAssumption("unexpected llvm primitive type: token");
        }
        if (ty instanceof AdaptedType.Metadata) {
            throw EngineException.invalidAssumption("unexpected llvm primitive type: metadata");
        }
        throw new IllegalArgumentException("unknown adapter type " + ty.getClass());
    }

    private Type convertStruct(AdaptedType.Struct struct, Set<Identifier> group) {
        if (struct.name == null) {
            if (struct.fields == null) {
                throw EngineException.invalidAssumption("anonymous struct type must have fields");
            }
            List<Type> fields = new ArrayList<>();
            for (AdaptedType field : struct.fields) {
                fields.add(convert(field, group));
            }
            return new Type.Struct(null, Collections.unmodifiableList(fields));
        }

        Identifier name = Identifier.of(struct.name);
        List<AdaptedType> declared = declarations.get(name);
        if (declared == null) {
            if (struct.fields == null) {
                throw EngineException.unsupported(Unsupported.OPAQUE_STRUCT_DEFINITION);
            }
            throw EngineException.invalidAssumption("reference to undefined named struct: %s", name);
        }
        if (struct.fields != null && !struct.fields.equals(declared)) {
            throw EngineException.invalidAssumption("conflicting definition of named struct: %s", name);
        }
        if (group.contains(name)) {
            return new Type.StructRecursive(name);
        }
        return resolve(name);
    }

    /**
     * Get the definition of a named struct.
     *
     * @param name The name of the struct.
     * @return The definition.
     * @throws EngineException If there is no such struct.
     */
    public Type.Struct lookup(Identifier name) {
        Type.Struct definition = definitions.get(name);
        if (definition == null) {
            throw EngineException.invariant("unresolved type reference: %s", name);
        }
        return definition;
    }

    /**
     * Replace a {@link Type.StructRecursive} back-reference with the definition it refers to.
     *
     * @param ty The type.
     * @return The type, or the definition it refers to.
     */
    public Type unfold(Type ty) {
        if (ty instanceof Type.StructRecursive) {
            return lookup(((Type.StructRecursive) ty).name);
        }
        return ty;
    }

    /**
     * Check whether two types are the same, at any depth.
     * <p>
     * Named structs are compared by name, since a registry holds one definition per name.
     * This makes a {@link Type.StructRecursive} back-reference the same type as the
     * definition it refers to, wherever either occurs.
     *
     * @param lhs The first type.
     * @param rhs The second type.
     * @return Whether the types are the same.
     */
    public boolean sameType(Type lhs, Type rhs) {
        if (lhs == rhs) return true;
        Identifier lhsName = structName(lhs);
        Identifier rhsName = structName(rhs);
        if (lhsName != null || rhsName != null) {
            return Objects.equals(lhsName, rhsName);
        }
        if (lhs instanceof Type.Struct && rhs instanceof Type.Struct) {
            return sameTypes(((Type.Struct) lhs).fields, ((Type.Struct) rhs).fields);
        }
        if (lhs instanceof Type.Array && rhs instanceof Type.Array) {
            Type.Array l = (Type.Array) lhs;
            Type.Array r = (Type.Array) rhs;
            return l.length == r.length && sameType(l.element, r.element);
        }
        if (lhs instanceof Type.Pointer && rhs instanceof Type.Pointer) {
            Type l = ((Type.Pointer) lhs).pointee;
            Type r = ((Type.Pointer) rhs).pointee;
            return l == null || r == null ? l == r : sameType(l, r);
        }
        if (lhs instanceof Type.Function && rhs instanceof Type.Function) {
            Type.Function l = (Type.Function) lhs;
            Type.Function r = (Type.Function) rhs;
            if (l.variadic != r.variadic || !sameTypes(l.params, r.params)) return false;
            return l.ret == null || r.ret == null ? l.ret == r.ret : sameType(l.ret, r.ret);
        }
        return lhs.equals(rhs);
    }

    private boolean sameTypes(List<Type> lhs, List<Type> rhs) {
        if (lhs.size() != rhs.size()) return false;
        for (int i = 0; i < lhs.size(); i++) {
            if (!sameType(lhs.get(i), rhs.get(i))) return false;
        }
        return true;
    }

    private static @Nullable Identifier structName(Type ty) {
        if (ty instanceof Type.StructRecursive) return ((Type.StructRecursive) ty).name;
        if (ty instanceof Type.Struct) return ((Type.Struct) ty).name;
        return null;
    }

    /**
     * Get the recursive group a named struct belongs to.
     *
     * @param name The name of the struct.
     * @return The members of the group, or null if the struct is simple.
     */
    public @Nullable SortedSet<Identifier> recursiveGroup(Identifier name) {
        return groups.get(name);
    }

    public SortedSet<Identifier> names() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(definitions.keySet()));
    }

    /**
     * Combine the struct definitions of this registry with those of another.
     *
     * @param other The other registry.
     * @return The combined registry.
     * @throws EngineException If a struct is defined differently in both.
     */
    public TypeRegistry merge(TypeRegistry other) {
        SortedMap<Identifier, List<AdaptedType>> merged = new TreeMap<>(declarations);
        for (Map.Entry<Identifier, List<AdaptedType>> entry : other.declarations.entrySet()) {
            List<AdaptedType> existing = merged.putIfAbsent(entry.getKey(), entry.getValue());
            if (existing != null && !existing.equals(entry.getValue())) {
                throw EngineException.invalidAssumption("conflicting definition of named struct: %s", entry.getKey());
            }
        }
        return build(merged);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return declarations.equals(((TypeRegistry) o).declarations);
    }

    @Override
    public int hashCode() {
        return declarations.hashCode();
    }
}
