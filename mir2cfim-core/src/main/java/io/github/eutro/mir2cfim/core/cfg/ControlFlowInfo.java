package io.github.eutro.mir2cfim.core.cfg;

import io.github.eutro.mir2cfim.core.im.BlockGraph;
import io.github.eutro.mir2cfim.core.im.BlockId;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * The result of analysing the control flow of a {@link BlockGraph}: everything
 * needed to structure it.
 *
 * @see io.github.eutro.mir2cfim.core.passes.meta.AnalyzeControlFlow
 */
public final class ControlFlowInfo {
    @NotNull
    public final BlockGraph graph;
    /**
     * The blocks reachable from the entry, in reverse post-order.
     */
    @NotNull
    public final List<BlockId> order;
    @NotNull
    public final DomTree doms;
    @NotNull
    public final DomTree postDoms;
    @NotNull
    public final LoopForest loops;
    @NotNull
    public final JoinPoints joins;

    public ControlFlowInfo(
            @NotNull BlockGraph graph,
            @NotNull List<BlockId> order,
            @NotNull DomTree doms,
            @NotNull DomTree postDoms,
            @NotNull LoopForest loops,
            @NotNull Set<BlockId> doomed
    ) {
        this.graph = graph;
        this.order = Collections.unmodifiableList(order);
        this.doms = doms;
        this.postDoms = postDoms;
        this.loops = loops;
        this.joins = new JoinPoints(graph, this.order, postDoms, doomed);
    }
}
