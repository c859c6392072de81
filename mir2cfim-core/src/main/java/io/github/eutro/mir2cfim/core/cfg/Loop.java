package io.github.eutro.mir2cfim.core.cfg;

import io.github.eutro.mir2cfim.core.im.BlockId;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A natural loop: a header which dominates the rest of the body, and every back-edge to it.
 * <p>
 * All collections are in reverse post-order of their source block.
 */
public final class Loop {
    private final BlockId header;
    private final Set<BlockId> body;
    private final List<Edge> backEdges;
    private final List<Edge> exitEdges;
    @Nullable
    private Loop parent;

    /**
     * Construct a loop. Its parent is set once the whole {@link LoopForest} is known.
     *
     * @param header    The header.
     * @param body      The body, including the header.
     * @param backEdges The back-edges.
     * @param exitEdges The exit edges.
     */
    public Loop(BlockId header, Set<BlockId> body, List<Edge> backEdges, List<Edge> exitEdges) {
        this.header = header;
        this.body = Collections.unmodifiableSet(body);
        this.backEdges = Collections.unmodifiableList(backEdges);
        this.exitEdges = Collections.unmodifiableList(exitEdges);
    }

    void setParent(@Nullable Loop parent) {
        this.parent = parent;
    }

    public BlockId getHeader() {
        return header;
    }

    /**
     * Get the blocks of this loop, including the header and the blocks of nested loops.
     *
     * @return The body.
     */
    public Set<BlockId> getBody() {
        return body;
    }

    public boolean contains(BlockId block) {
        return body.contains(block);
    }

    /**
     * Get the edges from the body back to the header.
     *
     * @return The back-edges.
     */
    public List<Edge> getBackEdges() {
        return backEdges;
    }

    /**
     * Get the edges from the body to blocks outside it.
     *
     * @return The exit edges.
     */
    public List<Edge> getExitEdges() {
        return exitEdges;
    }

    /**
     * Get the distinct targets of the {@link #getExitEdges() exit edges}, in order of first appearance.
     *
     * @return The exit targets.
     */
    public List<BlockId> getExitTargets() {
        Set<BlockId> targets = new LinkedHashSet<>();
        for (Edge edge : exitEdges) {
            targets.add(edge.to);
        }
        return new ArrayList<>(targets);
    }

    /**
     * Get the innermost loop strictly containing this one.
     *
     * @return The parent loop, or null if this is an outermost loop.
     */
    @Nullable
    public Loop getParent() {
        return parent;
    }

    @Override
    public String toString() {
        return "loop " + header + " " + body;
    }
}
