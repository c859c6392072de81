package io.github.eutro.mir2cfim.core.cfg;

import io.github.eutro.mir2cfim.core.im.BlockId;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * A (post-)dominator tree over some of the blocks of a graph.
 * <p>
 * Blocks whose immediate dominator is the root of the walk have no parent. For dominators that is only
 * the entry block. For post-dominators the root is a virtual exit, so every block that
 * returns directly, or whose paths only reunite at the exit, has no parent. Blocks the walk never
 * reached are not {@link #contains(BlockId) contained} in the tree at all.
 */
public final class DomTree {
    private final Map<BlockId, BlockId> idoms;
    private final Map<BlockId, Integer> depths = new HashMap<>();

    /**
     * Construct a dominator tree from immediate dominators.
     *
     * @param idoms The immediate dominator of each block in the tree, or null for children of the root.
     *              Parents must come before their children in iteration order.
     */
    public DomTree(@NotNull Map<BlockId, BlockId> idoms) {
        this.idoms = Collections.unmodifiableMap(idoms);
        for (Map.Entry<BlockId, BlockId> entry : idoms.entrySet()) {
            BlockId parent = entry.getValue();
            if (parent == null) {
                depths.put(entry.getKey(), 0);
            } else {
                Integer parentDepth = depths.get(parent);
                if (parentDepth == null) {
                    throw new IllegalArgumentException(parent + " listed after its child " + entry.getKey());
                }
                depths.put(entry.getKey(), parentDepth + 1);
            }
        }
    }

    /**
     * Get whether the block is part of this tree.
     *
     * @param block The block.
     * @return Whether it is in the tree.
     */
    public boolean contains(BlockId block) {
        return idoms.containsKey(block);
    }

    /**
     * Get the blocks in this tree, parents first.
     *
     * @return The blocks.
     */
    public Set<BlockId> blocks() {
        return idoms.keySet();
    }

    /**
     * Get the immediate dominator of a block.
     *
     * @param block The block.
     * @return The immediate dominator, or null if the block is a child of the root or not in the tree.
     */
    @Nullable
    public BlockId idom(BlockId block) {
        return idoms.get(block);
    }

    /**
     * Get whether {@code a} dominates {@code b}. Every block in the tree dominates itself.
     *
     * @param a The potential dominator.
     * @param b The potential dominee.
     * @return Whether {@code a} dominates {@code b}.
     */
    public boolean dominates(BlockId a, BlockId b) {
        if (!contains(a) || !contains(b)) return false;
        int aDepth = depths.get(a);
        BlockId runner = b;
        while (runner != null && depths.get(runner) > aDepth) {
            runner = idoms.get(runner);
        }
        return a.equals(runner);
    }

    /**
     * Find the nearest block dominating both blocks.
     *
     * @param a The first block.
     * @param b The second block.
     * @return The nearest common dominator, or null if only the root dominates both,
     * or either block is not in the tree.
     */
    @Nullable
    public BlockId nearestCommonAncestor(BlockId a, BlockId b) {
        if (!contains(a) || !contains(b)) return null;
        while (a != null && b != null && !a.equals(b)) {
            int aDepth = depths.get(a);
            int bDepth = depths.get(b);
            if (aDepth >= bDepth) a = idoms.get(a);
            if (bDepth >= aDepth) b = idoms.get(b);
        }
        return a != null && a.equals(b) ? a : null;
    }

    @Override
    public String toString() {
        return idoms.toString();
    }
}
