package io.github.libra.core.ir;

import org.jgrapht.graph.DefaultEdge;

import java.math.BigInteger;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * An edge of a {@link ControlFlowGraph}, tagged with the kind of terminator that produced it.
 * <p>
 * Edges are compared by identity, as the graph requires; use {@link #matches(Edge)} for
 * structural comparison.
 */
public abstract class Edge extends DefaultEdge {
    Edge() {
    }

    public BlockLabel source() {
        return (BlockLabel) getSource();
    }

    public BlockLabel target() {
        return (BlockLabel) getTarget();
    }

    /**
     * Check whether this edge carries the same kind and payload as another.
     *
     * @param other The other edge.
     * @return Whether they match.
     */
    public abstract boolean matches(Edge other);

    public static final class Goto extends Edge {
        @Override
        public boolean matches(Edge other) {
            return other instanceof Goto;
        }

        @Override
        public String toString() {
            return "goto";
        }
    }

    public static final class Branch extends Edge {
        public final boolean condition;

        public Branch(boolean condition) {
            this.condition = condition;
        }

        @Override
        public boolean matches(Edge other) {
            return other instanceof Branch && condition == ((Branch) other).condition;
        }

        @Override
        public String toString() {
            return "branch " + condition;
        }
    }

    /**
     * All the switch cases from one block leading to the same target.
     */
    public static final class Switch extends Edge {
        private final SortedSet<BigInteger> cases = new TreeSet<>();
        private boolean includesDefault;

        /**
         * Add a case to this edge.
         *
         * @param value The case value, or null for the default case.
         * @return Whether the case was not already present.
         */
        boolean add(BigInteger value) {
            if (value == null) {
                if (includesDefault) return false;
                includesDefault = true;
                return true;
            }
            return cases.add(value);
        }

        public SortedSet<BigInteger> cases() {
            return Collections.unmodifiableSortedSet(cases);
        }

        public boolean includesDefault() {
            return includesDefault;
        }

        @Override
        public boolean matches(Edge other) {
            if (!(other instanceof Switch)) return false;
            Switch that = (Switch) other;
            return includesDefault == that.includesDefault && cases.equals(that.cases);
        }

        @Override
        public String toString() {
            return "switch " + cases + (includesDefault ? " default" : "");
        }
    }

    public static final class Indirect extends Edge {
        @Override
        public boolean matches(Edge other) {
            return other instanceof Indirect;
        }

        @Override
        public String toString() {
            return "indirect";
        }
    }

    public static final class Invoke extends Edge {
        /**
         * Whether this is the normal return edge, rather than the unwind edge.
         */
        public final boolean normal;

        public Invoke(boolean normal) {
            this.normal = normal;
        }

        @Override
        public boolean matches(Edge other) {
            return other instanceof Invoke && normal == ((Invoke) other).normal;
        }

        @Override
        public String toString() {
            return normal ? "invoke normal" : "invoke unwind";
        }
    }
}
