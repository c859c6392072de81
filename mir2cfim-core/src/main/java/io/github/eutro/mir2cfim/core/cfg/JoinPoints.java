package io.github.eutro.mir2cfim.core.cfg;

import io.github.eutro.mir2cfim.core.im.BlockGraph;
import io.github.eutro.mir2cfim.core.im.BlockId;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the points where diverging control flow is guaranteed to reunite.
 * <p>
 * Branches into {@link #isDoomed(BlockId) doomed} blocks are skipped when the branching block
 * itself can still return, and if the remaining branches only meet at the exit, the ones that
 * return or panic straight away are dropped as well. A join always comes after its origin in
 * reverse post-order.
 * <p>
 * Queries are memoized, so an instance should not outlive the structuring run it was created for.
 */
public final class JoinPoints {
    private final BlockGraph graph;
    private final DomTree postDoms;
    private final Set<BlockId> doomed;
    private final Map<BlockId, Integer> index = new HashMap<>();
    private final Map<BlockId, Optional<BlockId>> joins = new HashMap<>();
    private final Map<BlockId, Optional<BlockId>> loopFollows = new HashMap<>();

    /**
     * Construct a join point resolver.
     *
     * @param graph    The graph.
     * @param order    The reachable blocks, in reverse post-order.
     * @param postDoms The post-dominator tree of the graph.
     * @param doomed   The blocks from which every path panics.
     */
    public JoinPoints(
            @NotNull BlockGraph graph,
            @NotNull List<BlockId> order,
            @NotNull DomTree postDoms,
            @NotNull Set<BlockId> doomed
    ) {
        this.graph = graph;
        this.postDoms = postDoms;
        this.doomed = doomed;
        for (int i = 0; i < order.size(); i++) {
            index.put(order.get(i), i);
        }
    }

    /**
     * Get whether every path from a block ends in a panic.
     *
     * @param block The block.
     * @return Whether it is doomed.
     */
    public boolean isDoomed(BlockId block) {
        return doomed.contains(block);
    }

    /**
     * Find where the branches of the terminator of {@code origin} reunite.
     *
     * @param origin The branching block.
     * @return The join, or null if its branches never reunite.
     */
    @Nullable
    public BlockId joinOf(@NotNull BlockId origin) {
        return joins.computeIfAbsent(origin,
                $ -> Optional.ofNullable(reunion(origin, graph.successors(origin)))).orElse(null);
    }

    /**
     * Find where control leaving a loop reunites.
     *
     * @param loop The loop.
     * @return The join of the loop's exit targets, or null if they never reunite.
     */
    @Nullable
    public BlockId joinOfExits(@NotNull Loop loop) {
        return loopFollows.computeIfAbsent(loop.getHeader(),
                $ -> Optional.ofNullable(reunion(loop.getHeader(), loop.getExitTargets()))).orElse(null);
    }

    /**
     * Find the nearest block that every path from every one of the given blocks goes through.
     * A block counts as going through itself.
     *
     * @param blocks The blocks.
     * @return The nearest common post-dominator, or null if there is none.
     */
    @Nullable
    public BlockId commonPostDominator(@NotNull Collection<BlockId> blocks) {
        BlockId acc = null;
        boolean first = true;
        for (BlockId block : new LinkedHashSet<>(blocks)) {
            if (!postDoms.contains(block)) return null;
            acc = first ? block : postDoms.nearestCommonAncestor(acc, block);
            first = false;
            if (acc == null) return null;
        }
        return acc;
    }

    @Nullable
    private BlockId reunion(BlockId origin, Collection<BlockId> targets) {
        List<BlockId> candidates = new ArrayList<>();
        for (BlockId target : new LinkedHashSet<>(targets)) {
            if (isDoomed(origin) || !isDoomed(target)) candidates.add(target);
        }
        if (candidates.isEmpty()) candidates.addAll(new LinkedHashSet<>(targets));
        if (candidates.isEmpty()) return null;

        BlockId join = commonPostDominator(candidates);
        if (join == null) {
            List<BlockId> continuing = new ArrayList<>();
            for (BlockId candidate : candidates) {
                if (!graph.successors(candidate).isEmpty()) continuing.add(candidate);
            }
            join = continuing.isEmpty() ? null : commonPostDominator(continuing);
        }
        return join != null && comesAfter(join, origin) ? join : null;
    }

    private boolean comesAfter(BlockId block, BlockId origin) {
        Integer blockIndex = index.get(block);
        Integer originIndex = index.get(origin);
        return blockIndex != null && originIndex != null && blockIndex > originIndex;
    }
}
