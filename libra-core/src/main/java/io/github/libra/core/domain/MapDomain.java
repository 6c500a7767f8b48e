package io.github.libra.core.domain;

import java.util.*;
import java.util.function.BinaryOperator;

/**
 * A map from keys to elements of another domain, lifted point-wise.
 * <p>
 * A key present on only one side is treated as being above the (implicit) missing entry,
 * so a map missing a key the other has is strictly smaller at that key.
 *
 * @param <K> The key type.
 * @param <V> The value domain.
 */
public final class MapDomain<K, V extends AbstractDomain<V>> implements AbstractDomain<MapDomain<K, V>> {
    /**
     * The entries of this map, unmodifiable.
     */
    public final Map<K, V> map;

    private MapDomain(Map<K, V> map) {
        this.map = map;
    }

    public static <K, V extends AbstractDomain<V>> MapDomain<K, V> empty() {
        return new MapDomain<K, V>(Collections.<K, V>emptyMap());
    }

    /**
     * Create a map domain element with the given entries.
     *
     * @param entries The entries.
     * @return The map.
     * @param <K> The key type.
     * @param <V> The value domain.
     */
    public static <K, V extends AbstractDomain<V>> MapDomain<K, V> of(Map<? extends K, ? extends V> entries) {
        if (entries.isEmpty()) return empty();
        return new MapDomain<>(Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
    }

    public V get(K key) {
        return map.get(key);
    }

    public MapDomain<K, V> with(K key, V value) {
        Map<K, V> copy = new LinkedHashMap<>(map);
        copy.put(key, value);
        return new MapDomain<>(Collections.unmodifiableMap(copy));
    }

    private MapDomain<K, V> merge(MapDomain<K, V> other, BinaryOperator<V> op) {
        Map<K, V> merged = new LinkedHashMap<>(map);
        for (Map.Entry<K, V> entry : other.map.entrySet()) {
            V mine = merged.get(entry.getKey());
            merged.put(entry.getKey(), mine == null ? entry.getValue() : op.apply(mine, entry.getValue()));
        }
        return of(merged);
    }

    @Override
    public MapDomain<K, V> join(MapDomain<K, V> other) {
        return merge(other, V::join);
    }

    @Override
    public MapDomain<K, V> widen(MapDomain<K, V> previous) {
        return merge(previous, V::widen);
    }

    @Override
    public MapDomain<K, V> narrow(MapDomain<K, V> previous) {
        Map<K, V> narrowed = new LinkedHashMap<>();
        for (Map.Entry<K, V> entry : map.entrySet()) {
            V theirs = previous.map.get(entry.getKey());
            if (theirs != null) {
                narrowed.put(entry.getKey(), entry.getValue().narrow(theirs));
            }
        }
        return of(narrowed);
    }

    @Override
    public PartialOrder compare(MapDomain<K, V> other) {
        PartialOrder order = PartialOrder.EQUAL;
        for (Map.Entry<K, V> entry : map.entrySet()) {
            V theirs = other.map.get(entry.getKey());
            order = order.combine(theirs == null ? PartialOrder.GREATER : entry.getValue().compare(theirs));
            if (order == PartialOrder.INCOMPARABLE) return order;
        }
        for (K key : other.map.keySet()) {
            if (!map.containsKey(key)) {
                order = order.combine(PartialOrder.LESS);
                if (order == PartialOrder.INCOMPARABLE) return order;
            }
        }
        return order;
    }

    @Override
    public MapDomain<K, V> bottom() {
        return empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return map.equals(((MapDomain<?, ?>) o).map);
    }

    @Override
    public int hashCode() {
        return map.hashCode();
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
