package io.github.eutro.mir2cfim.core.passes.meta;

import io.github.eutro.mir2cfim.core.cfg.DomTree;
import io.github.eutro.mir2cfim.core.im.BlockGraph;
import io.github.eutro.mir2cfim.core.im.BlockId;
import io.github.eutro.mir2cfim.core.passes.IRPass;
import io.github.eutro.mir2cfim.core.util.GraphWalker;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the dominator tree of the blocks reachable from the entry.
 */
public class ComputeDoms implements IRPass<BlockGraph, DomTree> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeDoms INSTANCE = new ComputeDoms();

    @Override
    public DomTree run(BlockGraph graph) {
        List<BlockId> order = GraphWalker.blockWalker(graph).reversePostOrder();
        return computeDoms(order, ComputePreds.computePreds(graph, order));
    }

    /**
     * Compute the dominator tree, given an already computed order and predecessors.
     *
     * @param order The reachable blocks, in reverse post-order.
     * @param preds The predecessors of each reachable block.
     * @return The dominator tree.
     */
    public static DomTree computeDoms(List<BlockId> order, Map<BlockId, List<BlockId>> preds) {
        Map<BlockId, Integer> index = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            index.put(order.get(i), i);
        }
        int[][] predIdx = new int[order.size()][];
        for (int i = 0; i < order.size(); i++) {
            List<BlockId> blockPreds = preds.get(order.get(i));
            predIdx[i] = new int[blockPreds.size()];
            for (int j = 0; j < blockPreds.size(); j++) {
                predIdx[i][j] = index.get(blockPreds.get(j));
            }
        }
        int[] idoms = computeIdoms(predIdx);
        Map<BlockId, BlockId> tree = new LinkedHashMap<>();
        tree.put(order.get(0), null);
        for (int i = 1; i < order.size(); i++) {
            tree.put(order.get(i), order.get(idoms[i]));
        }
        return new DomTree(tree);
    }

    /**
     * Compute immediate dominators of a graph whose nodes are numbered in reverse post-order,
     * with the root numbered 0.
     * <p>
     * Cooper, Keith D.; Harvey, Timothy J.; Kennedy, Ken (2001). "A Simple, Fast Dominance Algorithm"
     *
     * @param preds The predecessors of each node.
     * @return The immediate dominator of each node. The root is its own immediate dominator.
     */
    static int[] computeIdoms(int[][] preds) {
        int n = preds.length;
        int[] doms = new int[n];
        for (int i = 1; i < n; i++) {
            doms[i] = -1;
        }
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int b = 1; b < n; b++) {
                int newIdom = -1;
                for (int p : preds[b]) {
                    if (doms[p] == -1) continue;
                    newIdom = newIdom == -1 ? p : intersect(doms, p, newIdom);
                }
                if (newIdom != -1 && doms[b] != newIdom) {
                    doms[b] = newIdom;
                    changed = true;
                }
            }
        }
        for (int b = 1; b < n; b++) {
            if (doms[b] == -1) {
                throw new IllegalStateException("node " + b + " not reachable from the root");
            }
        }
        return doms;
    }

    private static int intersect(int[] doms, int b1, int b2) {
        int finger1 = b1;
        int finger2 = b2;
        while (finger1 != finger2) {
            while (finger1 > finger2) {
                finger1 = doms[finger1];
            }
            while (finger2 > finger1) {
                finger2 = doms[finger2];
            }
        }
        return finger1;
    }
}
