package io.github.libra.core.flow;

import io.github.libra.core.domain.AbstractDomain;
import io.github.libra.core.ir.*;
import io.github.libra.core.passes.IRPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A pass to compute the fixed point of a data-flow analysis over the body of a function.
 * <p>
 * All blocks start at bottom and are initially on the worklist, which always yields the block
 * with the lowest label first. When a block is taken off the worklist, the states of its
 * neighbours (predecessors going forward, successors going backward) are joined into its
 * input, the transfer function is applied to a copy, and the result is widened against the
 * previous output. If the output changed it is committed, and the neighbours on the other
 * side are put back on the worklist.
 * <p>
 * Widening is applied to the transferred output, not to the joined input.
 * <p>
 * A declaration has no blocks, and its result is {@link CfgState#empty()}.
 * <p>
 * Termination depends entirely on the domain's widening; nothing here bounds the number of
 * iterations.
 *
 * @param <D> The abstract domain.
 */
public class FixedPoint<D extends AbstractDomain<D>> implements IRPass<Function, CfgState<D>> {
    private static final Logger LOGGER = LogManager.getLogger(FixedPoint.class);

    /**
     * Whether to check that every committed state is above the one it replaces.
     */
    public static boolean CHECK_MONOTONE = System.getenv("LIBRA_CHECK_MONOTONE") != null;

    private final D bottom;
    private final Transfer<D> transfer;
    private final Direction direction;

    /**
     * Construct a fixed-point pass.
     *
     * @param bottom The bottom element of the domain, which every register starts at.
     * @param transfer The transfer function.
     * @param direction The direction of the analysis.
     */
    public FixedPoint(D bottom, Transfer<D> transfer, Direction direction) {
        this.bottom = bottom;
        this.transfer = transfer;
        this.direction = direction;
    }

    @Override
    public CfgState<D> run(Function func) {
        ControlFlowGraph cfg = func.body;
        if (cfg == null) {
            LOGGER.debug("{} is a declaration, nothing to analyze", func.name);
            return CfgState.empty();
        }

        SortedMap<BlockLabel, BlockState<D>> states = new TreeMap<>();
        for (BlockLabel label : cfg.getBlocks().keySet()) {
            states.put(label, new BlockState<>(new VariableStore<>(bottom), new VariableStore<>(bottom)));
        }

        TreeSet<BlockLabel> workList = new TreeSet<>(cfg.getBlocks().keySet());
        int iterations = 0;
        while (!workList.isEmpty()) {
            BlockLabel label = workList.pollFirst();
            iterations++;
            LOGGER.trace("visiting {} of {}", label, func.name);
            Block block = cfg.getBlock(label);
            BlockState<D> state = states.get(label);

            if (direction == Direction.FORWARD) {
                for (BlockLabel pred : cfg.predecessors(label)) {
                    state.getIncoming().joinWith(states.get(pred).getOutgoing());
                }
                VariableStore<D> store = state.getIncoming().copy();
                for (Instruction inst : block.body) {
                    transfer.transfer(inst, store);
                }
                transfer.transferTerminator(block.terminator, store);

                VariableStore<D> previous = state.getOutgoing();
                VariableStore<D> next = store.widen(previous);
                if (next.equals(previous)) continue;
                checkMonotone(func, label, previous, next);
                state.setOutgoing(next);
                workList.addAll(cfg.successors(label));
            } else {
                for (BlockLabel succ : cfg.successors(label)) {
                    state.getOutgoing().joinWith(states.get(succ).getIncoming());
                }
                VariableStore<D> store = state.getOutgoing().copy();
                transfer.transferTerminator(block.terminator, store);
                List<Instruction> body = block.body;
                for (int i = body.size() - 1; i >= 0; i--) {
                    transfer.transfer(body.get(i), store);
                }

                VariableStore<D> previous = state.getIncoming();
                VariableStore<D> next = store.widen(previous);
                if (next.equals(previous)) continue;
                checkMonotone(func, label, previous, next);
                state.setIncoming(next);
                workList.addAll(cfg.predecessors(label));
            }
        }

        LOGGER.debug("{} analysis of {} stabilised after {} iterations",
                direction.name().toLowerCase(), func.name, iterations);
        return new CfgState<>(states, iterations);
    }

    private void checkMonotone(Function func, BlockLabel label, VariableStore<D> previous, VariableStore<D> next) {
        if (CHECK_MONOTONE && !next.compare(previous).isGreaterOrEqual()) {
            LOGGER.warn("non-monotone update of {} in {}: {} replaced by {}", label, func.name, previous, next);
        }
    }
}
