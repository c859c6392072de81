package io.github.eutro.mir2cfim.core.passes.meta;

import io.github.eutro.mir2cfim.core.im.BlockGraph;
import io.github.eutro.mir2cfim.core.im.BlockId;
import io.github.eutro.mir2cfim.core.passes.IRPass;
import io.github.eutro.mir2cfim.core.util.GraphWalker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the predecessors of each block reachable from the entry.
 * <p>
 * Blocks are keyed in reverse post-order, and each list of predecessors is in reverse post-order,
 * without duplicates. Unreachable blocks are neither keys nor predecessors.
 */
public class ComputePreds implements IRPass<BlockGraph, Map<BlockId, List<BlockId>>> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public Map<BlockId, List<BlockId>> run(BlockGraph graph) {
        return computePreds(graph, GraphWalker.blockWalker(graph).reversePostOrder());
    }

    /**
     * Compute predecessors, given an already computed reverse post-order.
     *
     * @param graph The graph.
     * @param order The reachable blocks, in reverse post-order.
     * @return The predecessors.
     */
    public static Map<BlockId, List<BlockId>> computePreds(BlockGraph graph, List<BlockId> order) {
        Map<BlockId, List<BlockId>> preds = new LinkedHashMap<>();
        for (BlockId block : order) {
            preds.put(block, new ArrayList<>());
        }
        for (BlockId block : order) {
            for (BlockId succ : graph.successors(block)) {
                List<BlockId> succPreds = preds.get(succ);
                if (!succPreds.contains(block)) {
                    succPreds.add(block);
                }
            }
        }
        return preds;
    }
}
