package io.github.eutro.mir2cfim.core.im;

import org.jetbrains.annotations.NotNull;

/**
 * The identifier of a {@link Block} in a {@link BlockGraph}.
 */
public final class BlockId implements Comparable<BlockId> {
    private final int index;

    private BlockId(int index) {
        this.index = index;
    }

    /**
     * Get the block id with the given index.
     *
     * @param index The index, non-negative.
     * @return The block id.
     */
    public static BlockId of(int index) {
        if (index < 0) throw new IllegalArgumentException("negative block index " + index);
        return new BlockId(index);
    }

    public int getIndex() {
        return index;
    }

    @Override
    public int compareTo(@NotNull BlockId o) {
        return Integer.compare(index, o.index);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof BlockId && index == ((BlockId) o).index;
    }

    @Override
    public int hashCode() {
        return index;
    }

    @Override
    public String toString() {
        return "bb" + index;
    }
}
