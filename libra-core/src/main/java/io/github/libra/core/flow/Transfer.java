package io.github.libra.core.flow;

import io.github.libra.core.domain.AbstractDomain;
import io.github.libra.core.ir.Instruction;
import io.github.libra.core.ir.Terminator;

/**
 * The effect of a single instruction on a {@link VariableStore}.
 *
 * @param <D> The abstract domain.
 */
@FunctionalInterface
public interface Transfer<D extends AbstractDomain<D>> {
    /**
     * Update the store in place with the effect of an instruction.
     *
     * @param inst The instruction.
     * @param store The store.
     */
    void transfer(Instruction inst, VariableStore<D> store);

    /**
     * Update the store in place with the effect of a terminator. Does nothing by default.
     *
     * @param term The terminator.
     * @param store The store.
     */
    default void transferTerminator(Terminator term, VariableStore<D> store) {
    }
}
