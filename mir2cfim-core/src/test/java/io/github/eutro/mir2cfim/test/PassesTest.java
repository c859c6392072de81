package io.github.eutro.mir2cfim.test;

import io.github.eutro.mir2cfim.core.cfg.DomTree;
import io.github.eutro.mir2cfim.core.cfg.Edge;
import io.github.eutro.mir2cfim.core.cfim.Expression;
import io.github.eutro.mir2cfim.core.cfim.Statement;
import io.github.eutro.mir2cfim.core.im.BlockGraph;
import io.github.eutro.mir2cfim.core.im.BlockId;
import io.github.eutro.mir2cfim.core.im.FunDecl;
import io.github.eutro.mir2cfim.core.im.Terminator;
import io.github.eutro.mir2cfim.core.passes.IRPass;
import io.github.eutro.mir2cfim.core.passes.Passes;
import io.github.eutro.mir2cfim.core.passes.misc.ForPass;
import io.github.eutro.mir2cfim.core.passes.opts.ReconstructAsserts;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.github.eutro.mir2cfim.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class PassesTest {
    static class Failing implements IRPass<Expression, Expression> {
        @Override
        public Expression run(Expression expression) {
            throw new IllegalStateException("failing");
        }
    }

    @Test
    void testChainReportsFailingPass() {
        IRPass<Expression, Expression> chain = ReconstructAsserts.INSTANCE.then(new Failing());
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> chain.run(Expression.nop()));
        assertEquals(1, e.getSuppressed().length);
        assertEquals("running pass 1 (Failing) in chain", e.getSuppressed()[0].getMessage());
    }

    private static FunDecl loopDecl() {
        return new FunDecl(0, "spin", 0, BlockGraph.builder()
                .add(0, Terminator.goTo(bb(0)))
                .build());
    }

    private static FunDecl assertDecl() {
        return new FunDecl(1, "check", 1, BlockGraph.builder()
                .add(0, Terminator.ifThenElse(cond(0), bb(1), bb(2)))
                .add(1, Terminator.abort())
                .add(2, Terminator.ret())
                .build());
    }

    @Test
    void testStructureDecl() {
        io.github.eutro.mir2cfim.core.cfim.FunDecl spin = Passes.STRUCTURE_DECL.run(loopDecl());
        assertTrue(spin.divergent);
        assertEquals(Expression.loop(Expression.leaf(Statement.cont(0))), spin.body);

        io.github.eutro.mir2cfim.core.cfim.FunDecl check = Passes.STRUCTURE_DECL.run(assertDecl());
        assertFalse(check.divergent);
        assertEquals("check", check.name);
        assertEquals(1, check.argCount);
        assertEquals(Expression.seq(
                Expression.leaf(Statement.assertThat(cond(0), false)),
                Expression.leaf(Statement.ret())
        ), check.body);
    }

    @Test
    void testLiftedPasses() {
        List<io.github.eutro.mir2cfim.core.cfim.FunDecl> raw = ForPass.liftList(ForPass.liftBodies(
                io.github.eutro.mir2cfim.core.passes.convert.ImToCfim.INSTANCE
        )).run(Arrays.asList(assertDecl(), loopDecl()));
        assertEquals(2, raw.size());
        assertEquals("check", raw.get(0).name);

        io.github.eutro.mir2cfim.core.cfim.FunDecl canon =
                ForPass.liftStructuredBodies(ReconstructAsserts.INSTANCE).run(raw.get(0));
        assertNotEquals(raw.get(0).body, canon.body);
        assertEquals(Passes.STRUCTURE_DECL.run(assertDecl()).body, canon.body);
        assertTrue(raw.get(1).divergent);
        assertTrue(canon.withDivergent(true).divergent);
    }

    @Test
    void testDomTree() {
        Map<BlockId, BlockId> idoms = new LinkedHashMap<>();
        idoms.put(bb(0), null);
        idoms.put(bb(1), bb(0));
        idoms.put(bb(2), bb(1));
        idoms.put(bb(3), bb(1));
        idoms.put(bb(9), null);
        DomTree tree = new DomTree(idoms);
        assertEquals(bb(1), tree.nearestCommonAncestor(bb(2), bb(3)));
        assertEquals(bb(1), tree.nearestCommonAncestor(bb(1), bb(3)));
        assertNull(tree.nearestCommonAncestor(bb(2), bb(9)));
        assertNull(tree.nearestCommonAncestor(bb(2), bb(5)));
        assertTrue(tree.dominates(bb(0), bb(3)));
        assertFalse(tree.dominates(bb(2), bb(3)));

        Map<BlockId, BlockId> misordered = new LinkedHashMap<>();
        misordered.put(bb(1), bb(0));
        misordered.put(bb(0), null);
        assertThrows(IllegalArgumentException.class, () -> new DomTree(misordered));

        assertEquals(new Edge(bb(1), bb(2)), new Edge(bb(1), bb(2)));
        assertNotEquals(new Edge(bb(2), bb(1)), new Edge(bb(1), bb(2)));
    }
}
