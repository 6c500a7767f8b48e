package io.github.libra.core.flow;

import io.github.libra.core.domain.AbstractDomain;

import java.util.Objects;

/**
 * The abstract states at the entry and exit of a block.
 *
 * @param <D> The abstract domain.
 */
public final class BlockState<D extends AbstractDomain<D>> {
    private VariableStore<D> incoming;
    private VariableStore<D> outgoing;

    BlockState(VariableStore<D> incoming, VariableStore<D> outgoing) {
        this.incoming = incoming;
        this.outgoing = outgoing;
    }

    public VariableStore<D> getIncoming() {
        return incoming;
    }

    public VariableStore<D> getOutgoing() {
        return outgoing;
    }

    void setIncoming(VariableStore<D> incoming) {
        this.incoming = incoming;
    }

    void setOutgoing(VariableStore<D> outgoing) {
        this.outgoing = outgoing;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BlockState<?> that = (BlockState<?>) o;
        return incoming.equals(that.incoming) && outgoing.equals(that.outgoing);
    }

    @Override
    public int hashCode() {
        return Objects.hash(incoming, outgoing);
    }

    @Override
    public String toString() {
        return incoming + " -> " + outgoing;
    }
}
