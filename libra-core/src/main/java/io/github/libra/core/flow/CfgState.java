package io.github.libra.core.flow;

import io.github.libra.core.domain.AbstractDomain;
import io.github.libra.core.error.EngineException;
import io.github.libra.core.ir.BlockLabel;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The result of a fixed-point computation: the state of every block of a function.
 *
 * @param <D> The abstract domain.
 */
public final class CfgState<D extends AbstractDomain<D>> {
    private final SortedMap<BlockLabel, BlockState<D>> blocks;
    private final int iterations;

    CfgState(SortedMap<BlockLabel, BlockState<D>> blocks, int iterations) {
        this.blocks = Collections.unmodifiableSortedMap(blocks);
        this.iterations = iterations;
    }

    /**
     * Get the state of a function without a body, which has no blocks.
     *
     * @return The empty state.
     * @param <D> The abstract domain.
     */
    public static <D extends AbstractDomain<D>> CfgState<D> empty() {
        return new CfgState<>(new TreeMap<>(), 0);
    }

    public SortedMap<BlockLabel, BlockState<D>> getBlocks() {
        return blocks;
    }

    public BlockState<D> getBlock(BlockLabel label) {
        BlockState<D> state = blocks.get(label);
        if (state == null) {
            throw EngineException.invariant("no state for block %s", label);
        }
        return state;
    }

    /**
     * Get the number of blocks taken off the worklist before the fixed point was reached.
     *
     * @return The number of iterations.
     */
    public int getIterations() {
        return iterations;
    }

    // the iteration count is a property of the run, not of the result
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return blocks.equals(((CfgState<?>) o).blocks);
    }

    @Override
    public int hashCode() {
        return blocks.hashCode();
    }

    @Override
    public String toString() {
        return blocks.toString();
    }
}
