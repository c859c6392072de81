package io.github.eutro.mir2cfim.core.passes.meta;

import com.google.common.flogger.GoogleLogger;
import io.github.eutro.mir2cfim.core.cfg.ControlFlowInfo;
import io.github.eutro.mir2cfim.core.cfg.DomTree;
import io.github.eutro.mir2cfim.core.cfg.LoopForest;
import io.github.eutro.mir2cfim.core.im.BlockGraph;
import io.github.eutro.mir2cfim.core.im.BlockId;
import io.github.eutro.mir2cfim.core.passes.IRPass;
import io.github.eutro.mir2cfim.core.util.GraphWalker;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes everything structuring needs to know about a graph: its order, dominators,
 * post-dominators and loops.
 * <p>
 * Fails with an {@link io.github.eutro.mir2cfim.core.cfg.IrreducibleControlFlowException} if the graph
 * is not reducible.
 */
public class AnalyzeControlFlow implements IRPass<BlockGraph, ControlFlowInfo> {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    /**
     * A singleton instance of this pass.
     */
    public static final AnalyzeControlFlow INSTANCE = new AnalyzeControlFlow();

    @Override
    public ControlFlowInfo run(BlockGraph graph) {
        List<BlockId> order = GraphWalker.blockWalker(graph).reversePostOrder();
        if (order.size() != graph.size()) {
            logger.atFine().log("ignoring %d unreachable block(s)", graph.size() - order.size());
        }
        Map<BlockId, List<BlockId>> preds = ComputePreds.computePreds(graph, order);
        DomTree doms = ComputeDoms.computeDoms(order, preds);
        LoopForest loops = ComputeLoops.computeLoops(graph, order, preds, doms);
        Set<BlockId> doomed = ComputePostDoms.computeDoomed(graph, order);
        DomTree postDoms = ComputePostDoms.computePostDoms(graph, order, doomed);
        logger.atFinest().log("dominators %s, post-dominators %s, loops %s, doomed %s", doms, postDoms, loops, doomed);
        return new ControlFlowInfo(graph, order, doms, postDoms, loops, doomed);
    }
}
