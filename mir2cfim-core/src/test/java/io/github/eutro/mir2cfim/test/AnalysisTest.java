package io.github.eutro.mir2cfim.test;

import io.github.eutro.mir2cfim.core.cfg.ControlFlowInfo;
import io.github.eutro.mir2cfim.core.cfg.DomTree;
import io.github.eutro.mir2cfim.core.cfg.Edge;
import io.github.eutro.mir2cfim.core.cfg.Loop;
import io.github.eutro.mir2cfim.core.im.BlockGraph;
import io.github.eutro.mir2cfim.core.im.BlockId;
import io.github.eutro.mir2cfim.core.im.Terminator;
import io.github.eutro.mir2cfim.core.passes.meta.AnalyzeControlFlow;
import io.github.eutro.mir2cfim.core.passes.meta.ComputeDoms;
import io.github.eutro.mir2cfim.core.passes.meta.ComputePostDoms;
import io.github.eutro.mir2cfim.core.passes.meta.ComputePreds;
import io.github.eutro.mir2cfim.core.util.GraphWalker;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static io.github.eutro.mir2cfim.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class AnalysisTest {
    private static BlockGraph diamond() {
        return BlockGraph.builder()
                .add(0, Terminator.goTo(bb(1)))
                .add(1, Terminator.ifThenElse(cond(1), bb(2), bb(3)))
                .add(2, Terminator.goTo(bb(4)))
                .add(3, Terminator.goTo(bb(4)))
                .add(4, Terminator.ret())
                .build();
    }

    private static BlockGraph nestedLoops() {
        return BlockGraph.builder()
                .add(0, Terminator.goTo(bb(1)))
                .add(1, Terminator.ifThenElse(cond(1), bb(2), bb(5)))
                .add(2, Terminator.ifThenElse(cond(2), bb(3), bb(4)))
                .add(3, Terminator.goTo(bb(2)))
                .add(4, Terminator.ifThenElse(cond(4), bb(1), bb(5)))
                .add(5, Terminator.ret())
                .build();
    }

    private static HashSet<BlockId> blocks(int... indices) {
        HashSet<BlockId> set = new HashSet<>();
        for (int index : indices) {
            set.add(bb(index));
        }
        return set;
    }

    @Test
    void testWalkOrders() {
        GraphWalker<BlockId> walker = GraphWalker.blockWalker(diamond());
        assertEquals(Arrays.asList(bb(0), bb(1), bb(2), bb(4), bb(3)), walker.preOrder().toList());
        assertEquals(Arrays.asList(bb(4), bb(2), bb(3), bb(1), bb(0)), walker.postOrder().toList());
        assertEquals(Arrays.asList(bb(0), bb(1), bb(3), bb(2), bb(4)), walker.reversePostOrder());
    }

    @Test
    void testPreds() {
        Map<BlockId, List<BlockId>> preds = ComputePreds.INSTANCE.run(diamond());
        assertEquals(Collections.emptyList(), preds.get(bb(0)));
        assertEquals(Arrays.asList(bb(3), bb(2)), preds.get(bb(4)));
    }

    @Test
    void testDominators() {
        DomTree doms = ComputeDoms.INSTANCE.run(diamond());
        assertNull(doms.idom(bb(0)));
        assertEquals(bb(0), doms.idom(bb(1)));
        assertEquals(bb(1), doms.idom(bb(2)));
        assertEquals(bb(1), doms.idom(bb(3)));
        assertEquals(bb(1), doms.idom(bb(4)));
        assertTrue(doms.dominates(bb(1), bb(4)));
        assertTrue(doms.dominates(bb(4), bb(4)));
        assertFalse(doms.dominates(bb(2), bb(4)));
        assertEquals(bb(1), doms.nearestCommonAncestor(bb(2), bb(3)));
    }

    @Test
    void testPostDominators() {
        DomTree postDoms = ComputePostDoms.INSTANCE.run(diamond());
        assertEquals(bb(1), postDoms.idom(bb(0)));
        assertEquals(bb(4), postDoms.idom(bb(1)));
        assertEquals(bb(4), postDoms.idom(bb(2)));
        assertEquals(bb(4), postDoms.idom(bb(3)));
        assertNull(postDoms.idom(bb(4)));
        assertTrue(postDoms.dominates(bb(4), bb(0)));
    }

    @Test
    void testPanickingBranchesAreSkipped() {
        BlockGraph graph = BlockGraph.builder()
                .add(0, Terminator.ifThenElse(cond(0), bb(1), bb(2)))
                .add(1, Terminator.abort())
                .add(2, Terminator.ret())
                .add(3, Terminator.abort())
                .build();
        ControlFlowInfo info = AnalyzeControlFlow.INSTANCE.run(graph);
        assertTrue(info.postDoms.contains(bb(1)));
        assertFalse(info.postDoms.contains(bb(3)));
        assertTrue(info.joins.isDoomed(bb(1)));
        assertFalse(info.joins.isDoomed(bb(0)));
        assertFalse(info.joins.isDoomed(bb(2)));
        assertEquals(bb(2), info.joins.joinOf(bb(0)));
        assertNull(info.joins.commonPostDominator(Arrays.asList(bb(1), bb(2))));
        assertEquals(bb(1), info.joins.commonPostDominator(Arrays.asList(bb(1), bb(1))));
        assertNull(info.joins.commonPostDominator(Arrays.asList(bb(1), bb(3))));
        assertEquals(Arrays.asList(bb(0), bb(2), bb(1)), info.order);
    }

    @Test
    void testDoomedPropagatesBackwards() {
        BlockGraph graph = BlockGraph.builder()
                .add(0, Terminator.ifThenElse(cond(0), bb(1), bb(4)))
                .add(1, Terminator.ifThenElse(cond(1), bb(2), bb(3)))
                .add(2, Terminator.goTo(bb(3)))
                .add(3, Terminator.abort())
                .add(4, Terminator.ret())
                .build();
        ControlFlowInfo info = AnalyzeControlFlow.INSTANCE.run(graph);
        assertTrue(info.joins.isDoomed(bb(1)));
        assertTrue(info.joins.isDoomed(bb(2)));
        assertFalse(info.joins.isDoomed(bb(0)));
        assertEquals(bb(4), info.joins.joinOf(bb(0)));
        assertEquals(bb(3), info.joins.joinOf(bb(1)));
        assertEquals(bb(3), info.postDoms.idom(bb(1)));
    }

    @Test
    void testEarlyReturnJoinsWithFallthrough() {
        BlockGraph graph = BlockGraph.builder()
                .add(0, Terminator.ifThenElse(cond(0), bb(1), bb(2)))
                .add(1, Terminator.ret())
                .add(2, Terminator.goTo(bb(3)))
                .add(3, Terminator.ret())
                .build();
        ControlFlowInfo info = AnalyzeControlFlow.INSTANCE.run(graph);
        assertNull(info.postDoms.idom(bb(0)));
        assertEquals(bb(2), info.joins.joinOf(bb(0)));
    }

    @Test
    void testEndlessRegionsArePostDominated() {
        BlockGraph graph = BlockGraph.builder()
                .add(0, Terminator.goTo(bb(1)))
                .add(1, Terminator.ifThenElse(cond(1), bb(2), bb(3)))
                .add(2, Terminator.goTo(bb(4)))
                .add(3, Terminator.goTo(bb(4)))
                .add(4, Terminator.goTo(bb(1)))
                .build();
        ControlFlowInfo info = AnalyzeControlFlow.INSTANCE.run(graph);
        for (int i = 0; i <= 4; i++) {
            assertTrue(info.postDoms.contains(bb(i)));
        }
        assertEquals(bb(4), info.postDoms.idom(bb(1)));
        assertEquals(bb(4), info.joins.joinOf(bb(1)));
        assertNull(info.joins.joinOfExits(info.loops.loopAt(bb(1))));
    }

    @Test
    void testBranchesThatNeverJoin() {
        BlockGraph graph = BlockGraph.builder()
                .add(0, Terminator.ifThenElse(cond(0), bb(1), bb(2)))
                .add(1, Terminator.ret())
                .add(2, Terminator.ret())
                .build();
        ControlFlowInfo info = AnalyzeControlFlow.INSTANCE.run(graph);
        assertNull(info.joins.joinOf(bb(0)));
    }

    @Test
    void testLoops() {
        ControlFlowInfo info = AnalyzeControlFlow.INSTANCE.run(nestedLoops());
        assertEquals(2, info.loops.getLoops().size());

        Loop outer = info.loops.loopAt(bb(1));
        Loop inner = info.loops.loopAt(bb(2));
        assertNotNull(outer);
        assertNotNull(inner);
        assertNull(info.loops.loopAt(bb(3)));
        assertTrue(info.loops.isHeader(bb(2)));

        assertEquals(blocks(1, 2, 3, 4), new HashSet<>(outer.getBody()));
        assertEquals(Collections.singletonList(new Edge(bb(4), bb(1))), outer.getBackEdges());
        assertEquals(Collections.singletonList(bb(5)), outer.getExitTargets());
        assertNull(outer.getParent());

        assertEquals(blocks(2, 3), new HashSet<>(inner.getBody()));
        assertEquals(Collections.singletonList(new Edge(bb(3), bb(2))), inner.getBackEdges());
        assertEquals(Collections.singletonList(new Edge(bb(2), bb(4))), inner.getExitEdges());
        assertSame(outer, inner.getParent());

        assertSame(inner, info.loops.innermostLoopOf(bb(3)));
        assertSame(outer, info.loops.innermostLoopOf(bb(4)));
        assertNull(info.loops.innermostLoopOf(bb(5)));

        assertEquals(bb(4), info.joins.joinOfExits(inner));
        assertEquals(bb(5), info.joins.joinOfExits(outer));
    }

    @Test
    void testSelfLoop() {
        BlockGraph graph = BlockGraph.builder()
                .add(0, Terminator.ifThenElse(cond(0), bb(0), bb(1)))
                .add(1, Terminator.ret())
                .build();
        ControlFlowInfo info = AnalyzeControlFlow.INSTANCE.run(graph);
        Loop loop = info.loops.loopAt(bb(0));
        assertNotNull(loop);
        assertEquals(blocks(0), new HashSet<>(loop.getBody()));
        assertEquals(Collections.singletonList(new Edge(bb(0), bb(0))), loop.getBackEdges());
    }
}
