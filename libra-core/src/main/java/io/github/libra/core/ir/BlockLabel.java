package io.github.libra.core.ir;

import org.jetbrains.annotations.NotNull;

/**
 * The unique label of a {@link Block} within its function.
 */
public final class BlockLabel implements Comparable<BlockLabel> {
    public final int index;

    private BlockLabel(int index) {
        this.index = index;
    }

    public static BlockLabel of(int index) {
        return new BlockLabel(index);
    }

    @Override
    public int compareTo(@NotNull BlockLabel o) {
        return Integer.compare(index, o.index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return index == ((BlockLabel) o).index;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(index);
    }

    @Override
    public String toString() {
        return "@" + index;
    }
}
