package io.github.eutro.mir2cfim.core.values;

/**
 * The index of a variant in an enumeration.
 */
public final class VariantId {
    private final int index;

    private VariantId(int index) {
        this.index = index;
    }

    public static VariantId of(int index) {
        if (index < 0) throw new IllegalArgumentException("negative variant index " + index);
        return new VariantId(index);
    }

    public int getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof VariantId && index == ((VariantId) o).index;
    }

    @Override
    public int hashCode() {
        return index;
    }

    @Override
    public String toString() {
        return Integer.toString(index);
    }
}
