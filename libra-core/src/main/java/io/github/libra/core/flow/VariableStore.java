package io.github.libra.core.flow;

import io.github.libra.core.domain.AbstractDomain;
import io.github.libra.core.domain.PartialOrder;
import io.github.libra.core.ir.RegisterSlot;

import java.util.*;

/**
 * A mutable mapping from registers to abstract values, where absent registers are bottom.
 * <p>
 * Bottom values are never stored, so two stores are equal iff they map every register
 * to equal values.
 *
 * @param <D> The abstract domain.
 */
public final class VariableStore<D extends AbstractDomain<D>> {
    private final D bottom;
    private final SortedMap<RegisterSlot, D> values;

    public VariableStore(D bottom) {
        this(bottom, new TreeMap<>());
    }

    private VariableStore(D bottom, SortedMap<RegisterSlot, D> values) {
        this.bottom = bottom;
        this.values = values;
    }

    public D get(RegisterSlot slot) {
        D value = values.get(slot);
        return value == null ? bottom : value;
    }

    public void set(RegisterSlot slot, D value) {
        if (value.equals(bottom)) {
            values.remove(slot);
        } else {
            values.put(slot, value);
        }
    }

    /**
     * Join every value of another store into this one.
     *
     * @param other The other store.
     */
    public void joinWith(VariableStore<D> other) {
        for (Map.Entry<RegisterSlot, D> entry : other.values.entrySet()) {
            set(entry.getKey(), get(entry.getKey()).join(entry.getValue()));
        }
    }

    /**
     * Widen every value of this store against the same register in a previous one.
     *
     * @param previous The previous store.
     * @return The widened store.
     */
    public VariableStore<D> widen(VariableStore<D> previous) {
        VariableStore<D> widened = new VariableStore<>(bottom);
        SortedSet<RegisterSlot> keys = new TreeSet<>(values.keySet());
        keys.addAll(previous.values.keySet());
        for (RegisterSlot slot : keys) {
            widened.set(slot, get(slot).widen(previous.get(slot)));
        }
        return widened;
    }

    /**
     * Compare two stores register by register.
     *
     * @param other The other store.
     * @return The combined order over all registers.
     */
    public PartialOrder compare(VariableStore<D> other) {
        SortedSet<RegisterSlot> keys = new TreeSet<>(values.keySet());
        keys.addAll(other.values.keySet());
        PartialOrder order = PartialOrder.EQUAL;
        for (RegisterSlot slot : keys) {
            order = order.combine(get(slot).compare(other.get(slot)));
            if (order == PartialOrder.INCOMPARABLE) break;
        }
        return order;
    }

    public VariableStore<D> copy() {
        return new VariableStore<>(bottom, new TreeMap<>(values));
    }

    /**
     * Get the registers with a non-bottom value.
     *
     * @return The entries, unmodifiable.
     */
    public SortedMap<RegisterSlot, D> entries() {
        return Collections.unmodifiableSortedMap(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((VariableStore<?>) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
