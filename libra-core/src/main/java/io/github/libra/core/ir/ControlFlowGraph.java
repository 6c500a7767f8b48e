package io.github.libra.core.ir;

import io.github.libra.core.error.EngineException;
import org.jetbrains.annotations.Nullable;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.alg.isomorphism.VF2GraphIsomorphismInspector;
import org.jgrapht.graph.builder.GraphTypeBuilder;

import java.math.BigInteger;
import java.util.*;

/**
 * The control-flow graph of a function body: its {@link Block}s, and the classified {@link Edge}s between them.
 * <p>
 * A graph is validated when it is {@link Builder#build() built}, and never changes afterwards:
 * <ul>
 *     <li>between two blocks there is at most one edge, and it has a single kind;</li>
 *     <li>every unwind target starts with a landing pad, after any phis, and has no other landing pad.</li>
 * </ul>
 */
public final class ControlFlowGraph {
    private final Graph<BlockLabel, Edge> graph;
    private final SortedMap<BlockLabel, Block> blocks;
    private final BlockLabel entry;

    private ControlFlowGraph(Graph<BlockLabel, Edge> graph, SortedMap<BlockLabel, Block> blocks, BlockLabel entry) {
        this.graph = graph;
        this.blocks = blocks;
        this.entry = entry;
    }

    public BlockLabel getEntry() {
        return entry;
    }

    public SortedMap<BlockLabel, Block> getBlocks() {
        return blocks;
    }

    public Block getBlock(BlockLabel label) {
        Block block = blocks.get(label);
        if (block == null) {
            throw EngineException.invariant("unknown block label: %s", label);
        }
        return block;
    }

    public SortedSet<BlockLabel> predecessors(BlockLabel label) {
        return new TreeSet<>(Graphs.predecessorListOf(graph, label));
    }

    public SortedSet<BlockLabel> successors(BlockLabel label) {
        return new TreeSet<>(Graphs.successorListOf(graph, label));
    }

    /**
     * Get the edge between two blocks.
     *
     * @param source The source block.
     * @param target The target block.
     * @return The edge, or null if there is none.
     */
    public @Nullable Edge edge(BlockLabel source, BlockLabel target) {
        return graph.getEdge(source, target);
    }

    public Set<Edge> edges() {
        return Collections.unmodifiableSet(graph.edgeSet());
    }

    /**
     * Collect every register written by an instruction or terminator in this graph.
     *
     * @return The registers.
     */
    public SortedSet<RegisterSlot> collectVariables() {
        SortedSet<RegisterSlot> variables = new TreeSet<>();
        for (Block block : blocks.values()) {
            for (Instruction inst : block.body) {
                if (inst.result != null) variables.add(inst.result);
            }
            RegisterSlot result = block.terminator.result();
            if (result != null) variables.add(result);
        }
        return variables;
    }

    /**
     * Check whether two graphs are isomorphic, with matching blocks and edges.
     *
     * @param o The other graph.
     * @return Whether they are equal.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ControlFlowGraph that = (ControlFlowGraph) o;
        if (!entry.equals(that.entry)
                || blocks.size() != that.blocks.size()
                || graph.edgeSet().size() != that.graph.edgeSet().size()) {
            return false;
        }
        VF2GraphIsomorphismInspector<BlockLabel, Edge> inspector = new VF2GraphIsomorphismInspector<>(
                graph,
                that.graph,
                (l, r) -> blocks.get(l).equals(that.blocks.get(r)) ? 0 : 1,
                (l, r) -> l.matches(r) ? 0 : 1
        );
        return inspector.isomorphismExists();
    }

    @Override
    public int hashCode() {
        return blocks.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Block block : blocks.values()) {
            sb.append(block).append('\n');
        }
        return sb.toString();
    }

    /**
     * Incrementally builds a {@link ControlFlowGraph}.
     * <p>
     * All blocks must be added before any edges. Inserting an edge between two blocks that
     * are already connected fails, unless both edges are switch cases (which are merged),
     * or both are indirect (which are deduplicated).
     */
    public static final class Builder {
        private final Graph<BlockLabel, Edge> graph = GraphTypeBuilder.<BlockLabel, Edge>directed()
                .allowingMultipleEdges(false)
                .allowingSelfLoops(true)
                .weighted(false)
                .buildGraph();
        private final SortedMap<BlockLabel, Block> blocks = new TreeMap<>();
        private @Nullable BlockLabel entry;

        /**
         * Add a block. The first block added is the entry.
         *
         * @param block The block.
         * @return This builder.
         */
        public Builder addBlock(Block block) {
            if (blocks.putIfAbsent(block.label, block) != null) {
                throw EngineException.invariant("duplicated block label: %s", block.label);
            }
            graph.addVertex(block.label);
            if (entry == null) entry = block.label;
            return this;
        }

        private void checkKnown(BlockLabel label) {
            if (!blocks.containsKey(label)) {
                throw EngineException.invariant("unknown block label: %s", label);
            }
        }

        private void insert(BlockLabel source, BlockLabel target, Edge edge) {
            checkKnown(source);
            checkKnown(target);
            Edge existing = graph.getEdge(source, target);
            if (existing != null) {
                throw EngineException.invariant("duplicated edge from %s to %s: %s and %s",
                        source, target, existing, edge);
            }
            graph.addEdge(source, target, edge);
        }

        public Builder addGoto(BlockLabel source, BlockLabel target) {
            insert(source, target, new Edge.Goto());
            return this;
        }

        public Builder addBranch(BlockLabel source, BlockLabel target, boolean condition) {
            insert(source, target, new Edge.Branch(condition));
            return this;
        }

        /**
         * Add a switch case, merging it into an existing switch edge to the same target.
         *
         * @param source The block with the switch.
         * @param target The target of the case.
         * @param value The case value, or null for the default case.
         * @return This builder.
         */
        public Builder addSwitchCase(BlockLabel source, BlockLabel target, @Nullable BigInteger value) {
            Edge existing = graph.getEdge(source, target);
            Edge.Switch edge;
            if (existing == null) {
                edge = new Edge.Switch();
                insert(source, target, edge);
            } else if (existing instanceof Edge.Switch) {
                edge = (Edge.Switch) existing;
            } else {
                throw EngineException.invariant("duplicated edge from %s to %s: %s and switch",
                        source, target, existing);
            }
            if (!edge.add(value)) {
                throw EngineException.invariant("duplicated switch case from %s to %s: %s",
                        source, target, value == null ? "default" : value);
            }
            return this;
        }

        public Builder addIndirect(BlockLabel source, BlockLabel target) {
            Edge existing = graph.getEdge(source, target);
            if (existing == null) {
                insert(source, target, new Edge.Indirect());
            } else if (!(existing instanceof Edge.Indirect)) {
                throw EngineException.invariant("duplicated edge from %s to %s: %s and indirect",
                        source, target, existing);
            }
            return this;
        }

        public Builder addInvoke(BlockLabel source, BlockLabel target, boolean normal) {
            insert(source, target, new Edge.Invoke(normal));
            return this;
        }

        /**
         * Add the edges implied by the terminator of a block that was already added.
         *
         * @param label The label of the block.
         * @return This builder.
         */
        public Builder addEdgesOf(BlockLabel label) {
            checkKnown(label);
            blocks.get(label).terminator.accept(EdgeClassifier.INSTANCE, new Site(this, label));
            return this;
        }

        /**
         * Validate and build the graph.
         *
         * @return The graph.
         */
        public ControlFlowGraph build() {
            if (entry == null) {
                throw EngineException.invariant("control-flow graph without blocks");
            }
            for (Edge edge : graph.edgeSet()) {
                if (edge instanceof Edge.Invoke && !((Edge.Invoke) edge).normal) {
                    checkLandingPad(blocks.get(graph.getEdgeTarget(edge)));
                }
            }
            return new ControlFlowGraph(graph, Collections.unmodifiableSortedMap(blocks), entry);
        }

        private static void checkLandingPad(Block block) {
            Iterator<Instruction> it = block.body.iterator();
            Instruction first = null;
            while (it.hasNext()) {
                Instruction inst = it.next();
                if (!(inst instanceof Instruction.Phi)) {
                    first = inst;
                    break;
                }
            }
            if (!(first instanceof Instruction.LandingPad)) {
                throw EngineException.invariant("no landing pad in unwind target: %s", block.label);
            }
            while (it.hasNext()) {
                if (it.next() instanceof Instruction.LandingPad) {
                    throw EngineException.invariant("more than one landing pad in unwind target: %s", block.label);
                }
            }
        }
    }

    private static final class Site {
        final Builder builder;
        final BlockLabel source;

        Site(Builder builder, BlockLabel source) {
            this.builder = builder;
            this.source = source;
        }
    }

    private static final class EdgeClassifier implements Terminator.Visitor<Site, Void> {
        static final EdgeClassifier INSTANCE = new EdgeClassifier();

        @Override
        public Void visitReturn(Terminator.Return term, Site at) {
            return null;
        }

        @Override
        public Void visitGoto(Terminator.Goto term, Site at) {
            at.builder.addGoto(at.source, term.target);
            return null;
        }

        @Override
        public Void visitBranch(Terminator.Branch term, Site at) {
            if (term.thenTarget.equals(term.elseTarget)) {
                at.builder.addGoto(at.source, term.thenTarget);
            } else {
                at.builder.addBranch(at.source, term.thenTarget, true);
                at.builder.addBranch(at.source, term.elseTarget, false);
            }
            return null;
        }

        @Override
        public Void visitSwitch(Terminator.Switch term, Site at) {
            for (Map.Entry<BigInteger, BlockLabel> entry : term.cases.entrySet()) {
                at.builder.addSwitchCase(at.source, entry.getValue(), entry.getKey());
            }
            if (term.defaultTarget != null) {
                at.builder.addSwitchCase(at.source, term.defaultTarget, null);
            }
            return null;
        }

        @Override
        public Void visitIndirectJump(Terminator.IndirectJump term, Site at) {
            for (BlockLabel target : term.targets) {
                at.builder.addIndirect(at.source, target);
            }
            return null;
        }

        @Override
        public Void visitInvoke(Terminator.Invoke term, Site at) {
            at.builder.addInvoke(at.source, term.normal, true);
            at.builder.addInvoke(at.source, term.unwind, false);
            return null;
        }

        @Override
        public Void visitResume(Terminator.Resume term, Site at) {
            return null;
        }

        @Override
        public Void visitUnreachable(Terminator.Unreachable term, Site at) {
            return null;
        }
    }
}
