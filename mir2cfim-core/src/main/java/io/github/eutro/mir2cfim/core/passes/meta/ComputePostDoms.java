package io.github.eutro.mir2cfim.core.passes.meta;

import io.github.eutro.mir2cfim.core.cfg.DomTree;
import io.github.eutro.mir2cfim.core.im.BlockGraph;
import io.github.eutro.mir2cfim.core.im.BlockId;
import io.github.eutro.mir2cfim.core.im.Terminator;
import io.github.eutro.mir2cfim.core.passes.IRPass;
import io.github.eutro.mir2cfim.core.util.GraphWalker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the post-dominator tree of the blocks reachable from the entry.
 * <p>
 * The tree is rooted at a virtual exit. Blocks without successors (returns and panics) flow into it,
 * and so does the latest block of every region that never leaves on its own, so every reachable block
 * is in the tree.
 * <p>
 * Edges from a block that can still return into a {@link #computeDoomed(BlockGraph, List) doomed} block
 * are ignored, so a panicking branch never stops the other branches from joining.
 */
public class ComputePostDoms implements IRPass<BlockGraph, DomTree> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePostDoms INSTANCE = new ComputePostDoms();

    private static final int EXIT = -1;

    @Override
    public DomTree run(BlockGraph graph) {
        List<BlockId> order = GraphWalker.blockWalker(graph).reversePostOrder();
        return computePostDoms(graph, order, computeDoomed(graph, order));
    }

    /**
     * Find the blocks from which every path ends in a panic.
     * <p>
     * A block is doomed if it panics, or if it has successors and all of them are doomed.
     * Blocks in a loop that can only go around forever are not doomed.
     *
     * @param graph The graph.
     * @param order The reachable blocks, in reverse post-order.
     * @return The doomed blocks.
     */
    public static Set<BlockId> computeDoomed(BlockGraph graph, List<BlockId> order) {
        Set<BlockId> doomed = new HashSet<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = order.size() - 1; i >= 0; i--) {
                BlockId block = order.get(i);
                if (doomed.contains(block)) continue;
                if (graph.get(block).getTerminator() instanceof Terminator.Abort || allDoomed(graph, block, doomed)) {
                    doomed.add(block);
                    changed = true;
                }
            }
        }
        return Collections.unmodifiableSet(doomed);
    }

    private static boolean allDoomed(BlockGraph graph, BlockId block, Set<BlockId> doomed) {
        List<BlockId> succs = graph.successors(block);
        if (succs.isEmpty()) return false;
        for (BlockId succ : succs) {
            if (!doomed.contains(succ)) return false;
        }
        return true;
    }

    /**
     * Compute the post-dominator tree, given an already computed order and doomed blocks.
     *
     * @param graph  The graph.
     * @param order  The reachable blocks, in reverse post-order.
     * @param doomed The {@link #computeDoomed(BlockGraph, List) doomed} blocks.
     * @return The post-dominator tree.
     */
    public static DomTree computePostDoms(
            BlockGraph graph,
            List<BlockId> order,
            Set<BlockId> doomed
    ) {
        Map<BlockId, Integer> index = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            index.put(order.get(i), i);
        }
        List<List<Integer>> succs = new ArrayList<>();
        List<List<Integer>> reversed = new ArrayList<>();
        for (int i = 0; i < order.size(); i++) {
            succs.add(new ArrayList<>());
            reversed.add(new ArrayList<>());
        }
        List<Integer> exits = new ArrayList<>();
        for (int i = 0; i < order.size(); i++) {
            BlockId block = order.get(i);
            boolean blockDoomed = doomed.contains(block);
            for (BlockId succ : new LinkedHashSet<>(graph.successors(block))) {
                if (!blockDoomed && doomed.contains(succ)) continue;
                int j = index.get(succ);
                succs.get(i).add(j);
                reversed.get(j).add(i);
            }
            if (graph.successors(block).isEmpty()) {
                exits.add(i);
            }
        }

        // regions that never reach an exit get one at their latest block, until everything is covered
        List<Integer> reverseOrder;
        while (true) {
            GraphWalker<Integer> walker = new GraphWalker<>(EXIT, node -> node == EXIT ? exits : reversed.get(node));
            reverseOrder = walker.reversePostOrder();
            if (reverseOrder.size() == order.size() + 1) break;
            Set<Integer> seen = new HashSet<>(reverseOrder);
            int latest = order.size() - 1;
            while (seen.contains(latest)) latest--;
            exits.add(latest);
        }

        Map<Integer, Integer> number = new HashMap<>();
        for (int i = 0; i < reverseOrder.size(); i++) {
            number.put(reverseOrder.get(i), i);
        }
        Set<Integer> exitSet = new HashSet<>(exits);
        int[][] reversePreds = new int[reverseOrder.size()][];
        reversePreds[0] = new int[0];
        for (int i = 1; i < reverseOrder.size(); i++) {
            int node = reverseOrder.get(i);
            List<Integer> nodePreds = new ArrayList<>();
            if (exitSet.contains(node)) {
                nodePreds.add(0);
            }
            for (int succ : succs.get(node)) {
                nodePreds.add(number.get(succ));
            }
            reversePreds[i] = nodePreds.stream().mapToInt(Integer::intValue).toArray();
        }

        int[] idoms = ComputeDoms.computeIdoms(reversePreds);
        Map<BlockId, BlockId> tree = new LinkedHashMap<>();
        for (int i = 1; i < reverseOrder.size(); i++) {
            BlockId block = order.get(reverseOrder.get(i));
            tree.put(block, idoms[i] == 0 ? null : order.get(reverseOrder.get(idoms[i])));
        }
        return new DomTree(Collections.unmodifiableMap(tree));
    }
}
