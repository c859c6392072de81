package io.github.eutro.mir2cfim.core.cfg;

import io.github.eutro.mir2cfim.core.im.BlockId;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A control flow edge between two blocks.
 */
public final class Edge {
    public final BlockId from;
    public final BlockId to;

    public Edge(@NotNull BlockId from, @NotNull BlockId to) {
        this.from = Objects.requireNonNull(from);
        this.to = Objects.requireNonNull(to);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Edge edge = (Edge) o;
        return from.equals(edge.from) && to.equals(edge.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
