package io.github.libra.core.passes.convert;

import io.github.libra.core.adapter.AdaptedBlock;
import io.github.libra.core.adapter.AdaptedInstruction;
import io.github.libra.core.adapter.AdaptedType;
import io.github.libra.core.error.EngineException;
import io.github.libra.core.ir.*;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Converts the blocks of a function body into a {@link ControlFlowGraph}.
 */
public final class CfgBuilder {
    private CfgBuilder() {
    }

    /**
     * Build the control-flow graph of a function body.
     *
     * @param types The type registry.
     * @param symbols The symbol registry.
     * @param params The parameter types of the function.
     * @param ret The return type of the function, or null if it returns void.
     * @param blocks The blocks, the first of which is the entry.
     * @return The graph.
     * @throws EngineException If the body is malformed or uses unsupported features.
     */
    public static ControlFlowGraph build(
            TypeRegistry types,
            SymbolRegistry symbols,
            List<Type> params,
            @Nullable Type ret,
            List<AdaptedBlock> blocks
    ) {
        Set<BlockLabel> labels = new HashSet<>();
        Set<Integer> indices = new HashSet<>();
        Map<Integer, Type> registers = new HashMap<>();
        for (AdaptedBlock block : blocks) {
            if (!labels.add(BlockLabel.of(block.label))) {
                throw EngineException.invariant("duplicated block label: %d", block.label);
            }
            for (AdaptedInstruction inst : block.body) {
                declare(types, inst, indices, registers);
            }
            declare(types, block.terminator, indices, registers);
        }

        Context ctxt = new Context(types, symbols, labels, registers, params, ret, false);
        ControlFlowGraph.Builder builder = new ControlFlowGraph.Builder();
        for (AdaptedBlock block : blocks) {
            List<Instruction> body = new ArrayList<>(block.body.size());
            for (AdaptedInstruction inst : block.body) {
                body.add(ctxt.parseInstruction(inst));
            }
            Terminator terminator = ctxt.parseTerminator(block.terminator);
            builder.addBlock(new Block(BlockLabel.of(block.label), Collections.unmodifiableList(body), terminator));
        }
        // edges can only be added once all their targets exist
        for (AdaptedBlock block : blocks) {
            builder.addEdgesOf(BlockLabel.of(block.label));
        }
        return builder.build();
    }

    private static void declare(TypeRegistry types, AdaptedInstruction inst, Set<Integer> indices, Map<Integer, Type> registers) {
        if (inst.index == AdaptedInstruction.NO_INDEX) {
            throw EngineException.invariant("instruction without an index in a function body");
        }
        if (!indices.add(inst.index)) {
            throw EngineException.invariant("duplicated instruction index: %d", inst.index);
        }
        if (!(inst.ty instanceof AdaptedType.Void)) {
            registers.put(inst.index, types.convert(inst.ty));
        }
    }
}
