package io.github.eutro.mir2cfim.core.passes.meta;

import io.github.eutro.mir2cfim.core.cfg.DomTree;
import io.github.eutro.mir2cfim.core.cfg.Edge;
import io.github.eutro.mir2cfim.core.cfg.IrreducibleControlFlowException;
import io.github.eutro.mir2cfim.core.cfg.Loop;
import io.github.eutro.mir2cfim.core.cfg.LoopForest;
import io.github.eutro.mir2cfim.core.im.BlockGraph;
import io.github.eutro.mir2cfim.core.im.BlockId;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the natural loops of a graph, checking that it is reducible.
 */
public final class ComputeLoops {
    private ComputeLoops() {
    }

    /**
     * Compute the loops of a graph.
     *
     * @param graph The graph.
     * @param order The reachable blocks, in reverse post-order.
     * @param preds The predecessors of each reachable block.
     * @param doms  The dominator tree.
     * @return The loops.
     * @throws IrreducibleControlFlowException If the graph is not reducible.
     */
    public static LoopForest computeLoops(
            BlockGraph graph,
            List<BlockId> order,
            Map<BlockId, List<BlockId>> preds,
            DomTree doms
    ) {
        Map<BlockId, List<Edge>> backEdges = new LinkedHashMap<>();
        for (BlockId block : order) {
            backEdges.put(block, new ArrayList<>());
        }
        for (BlockId block : order) {
            for (BlockId succ : new LinkedHashSet<>(graph.successors(block))) {
                if (doms.dominates(succ, block)) {
                    backEdges.get(succ).add(new Edge(block, succ));
                }
            }
        }
        checkReducible(graph, order, backEdges);

        LinkedHashMap<BlockId, Loop> loops = new LinkedHashMap<>();
        for (Map.Entry<BlockId, List<Edge>> entry : backEdges.entrySet()) {
            if (entry.getValue().isEmpty()) continue;
            BlockId header = entry.getKey();
            Set<BlockId> unordered = new HashSet<>();
            unordered.add(header);
            Deque<BlockId> worklist = new ArrayDeque<>();
            for (Edge edge : entry.getValue()) {
                worklist.add(edge.from);
            }
            while (!worklist.isEmpty()) {
                BlockId block = worklist.pop();
                if (unordered.add(block)) {
                    worklist.addAll(preds.get(block));
                }
            }
            Set<BlockId> body = new LinkedHashSet<>();
            for (BlockId block : order) {
                if (unordered.contains(block)) body.add(block);
            }
            List<Edge> exits = new ArrayList<>();
            for (BlockId block : body) {
                for (BlockId succ : new LinkedHashSet<>(graph.successors(block))) {
                    if (!body.contains(succ)) {
                        exits.add(new Edge(block, succ));
                    }
                }
            }
            loops.put(header, new Loop(header, body, entry.getValue(), exits));
        }
        return new LoopForest(loops);
    }

    /**
     * A graph is reducible iff it is acyclic once every back-edge (an edge to a block which dominates its source)
     * is removed. Check this with a topological sort.
     */
    private static void checkReducible(BlockGraph graph, List<BlockId> order, Map<BlockId, List<Edge>> backEdges) {
        Set<Edge> removed = new HashSet<>();
        for (List<Edge> edges : backEdges.values()) {
            removed.addAll(edges);
        }
        Map<BlockId, Integer> inDegree = new HashMap<>();
        for (BlockId block : order) {
            inDegree.putIfAbsent(block, 0);
            for (BlockId succ : new LinkedHashSet<>(graph.successors(block))) {
                if (!removed.contains(new Edge(block, succ))) {
                    inDegree.merge(succ, 1, Integer::sum);
                }
            }
        }
        Deque<BlockId> ready = new ArrayDeque<>();
        for (BlockId block : order) {
            if (inDegree.get(block) == 0) ready.add(block);
        }
        int sorted = 0;
        while (!ready.isEmpty()) {
            BlockId block = ready.pop();
            sorted++;
            for (BlockId succ : new LinkedHashSet<>(graph.successors(block))) {
                if (!removed.contains(new Edge(block, succ)) && inDegree.merge(succ, -1, Integer::sum) == 0) {
                    ready.add(succ);
                }
            }
        }
        if (sorted != order.size()) {
            for (BlockId block : order) {
                if (inDegree.get(block) > 0) {
                    throw new IrreducibleControlFlowException(block);
                }
            }
        }
    }
}
