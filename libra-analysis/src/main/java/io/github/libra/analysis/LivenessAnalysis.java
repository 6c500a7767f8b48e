package io.github.libra.analysis;

import io.github.libra.core.domain.FiniteSetDomain;
import io.github.libra.core.domain.MapDomain;
import io.github.libra.core.flow.*;
import io.github.libra.core.ir.*;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Backward liveness analysis. Each register maps to the set of blocks which may still read
 * the value it holds; a register is live where that set is non-empty.
 * <p>
 * Uses in a phi are attributed to the phi's own block rather than to the incoming edge, so
 * a phi operand is live on every path into that block.
 */
public final class LivenessAnalysis implements Transfer<FiniteSetDomain<BlockLabel>> {
    private final Map<Object, BlockLabel> owners = new IdentityHashMap<>();

    private LivenessAnalysis(ControlFlowGraph cfg) {
        for (Block block : cfg.getBlocks().values()) {
            for (Instruction inst : block.body) {
                owners.put(inst, block.label);
            }
            owners.put(block.terminator, block.label);
        }
    }

    /**
     * Run liveness analysis on a function.
     *
     * @param func The function.
     * @return The state of every block, empty for a declaration.
     */
    public static CfgState<FiniteSetDomain<BlockLabel>> execute(Function func) {
        if (func.body == null) return CfgState.empty();
        return new FixedPoint<>(FiniteSetDomain.<BlockLabel>empty(), new LivenessAnalysis(func.body), Direction.BACKWARD)
                .run(func);
    }

    /**
     * Collect the registers live at the entry of each block.
     *
     * @param state The result of {@link #execute(Function)}.
     * @return The live registers, by block.
     */
    public static MapDomain<BlockLabel, FiniteSetDomain<RegisterSlot>> liveIn(CfgState<FiniteSetDomain<BlockLabel>> state) {
        Map<BlockLabel, FiniteSetDomain<RegisterSlot>> live = new LinkedHashMap<>();
        for (Map.Entry<BlockLabel, BlockState<FiniteSetDomain<BlockLabel>>> entry : state.getBlocks().entrySet()) {
            live.put(entry.getKey(), FiniteSetDomain.of(entry.getValue().getIncoming().entries().keySet()));
        }
        return MapDomain.of(live);
    }

    private void update(@Nullable RegisterSlot defined, List<Value> operands, Object site, VariableStore<FiniteSetDomain<BlockLabel>> store) {
        BlockLabel owner = owners.get(site);
        if (owner == null) {
            throw new IllegalArgumentException("instruction is not part of the analyzed function: " + site);
        }
        // the definition kills before the operands are read
        if (defined != null) store.set(defined, FiniteSetDomain.<BlockLabel>empty());
        for (Value operand : operands) {
            if (operand instanceof Value.Register) {
                RegisterSlot slot = ((Value.Register) operand).slot;
                store.set(slot, store.get(slot).with(owner));
            }
        }
    }

    @Override
    public void transfer(Instruction inst, VariableStore<FiniteSetDomain<BlockLabel>> store) {
        update(inst.result, inst.operands(), inst, store);
    }

    @Override
    public void transferTerminator(Terminator term, VariableStore<FiniteSetDomain<BlockLabel>> store) {
        update(term.result(), term.operands(), term, store);
    }
}
