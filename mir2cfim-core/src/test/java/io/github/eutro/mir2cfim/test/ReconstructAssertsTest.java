package io.github.eutro.mir2cfim.test;

import io.github.eutro.mir2cfim.core.cfim.Expression;
import io.github.eutro.mir2cfim.core.cfim.Statement;
import io.github.eutro.mir2cfim.core.cfim.SwitchTargets;
import io.github.eutro.mir2cfim.core.passes.opts.ReconstructAsserts;
import io.github.eutro.mir2cfim.core.values.IntegerTy;
import io.github.eutro.mir2cfim.core.values.ScalarValue;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static io.github.eutro.mir2cfim.test.Utils.cond;
import static io.github.eutro.mir2cfim.test.Utils.markLeaf;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class ReconstructAssertsTest {
    private static Expression panic() {
        return Expression.leaf(Statement.panic());
    }

    private static Expression ret() {
        return Expression.leaf(Statement.ret());
    }

    private static Expression assertFalse(int cond) {
        return Expression.leaf(Statement.assertThat(cond(cond), false));
    }

    private static Expression canon(Expression expr) {
        return ReconstructAsserts.INSTANCE.run(expr);
    }

    @Test
    void testFold() {
        Expression expr = Expression.ifThenElse(cond(0), panic(), Expression.seq(markLeaf(1), ret()));
        assertEquals(Expression.seq(assertFalse(0), markLeaf(1), ret()), canon(expr));
    }

    @Test
    void testMirroredKept() {
        Expression expr = Expression.ifThenElse(cond(0), ret(), panic());
        assertEquals(expr, canon(expr));
    }

    @Test
    void testChained() {
        Expression expr = Expression.seq(
                markLeaf(0),
                Expression.ifThenElse(cond(0), panic(),
                        Expression.ifThenElse(cond(1), panic(), ret()))
        );
        assertEquals(Expression.seq(markLeaf(0), assertFalse(0), assertFalse(1), ret()), canon(expr));
    }

    @Test
    void testInsideLoop() {
        Expression expr = Expression.seq(
                Expression.loop(Expression.seq(
                        markLeaf(1),
                        Expression.ifThenElse(cond(1), panic(), Expression.ifThenElse(
                                cond(2),
                                Expression.leaf(Statement.cont(0)),
                                Expression.leaf(Statement.brk(0))
                        ))
                )),
                ret()
        );
        Expression expected = Expression.seq(
                Expression.loop(Expression.seq(
                        markLeaf(1),
                        assertFalse(1),
                        Expression.ifThenElse(
                                cond(2),
                                Expression.leaf(Statement.cont(0)),
                                Expression.leaf(Statement.brk(0))
                        )
                )),
                ret()
        );
        assertEquals(expected, canon(expr));
    }

    @Test
    void testInsideSwitch() {
        Map<ScalarValue, Expression> branches = new LinkedHashMap<>();
        branches.put(ScalarValue.of(IntegerTy.U8, 0), panic());
        branches.put(ScalarValue.of(IntegerTy.U8, 1), Expression.ifThenElse(cond(1), panic(), ret()));
        Expression expr = Expression.switchOn(cond(0), SwitchTargets.switchInt(IntegerTy.U8, branches, panic()));

        Map<ScalarValue, Expression> expectedBranches = new LinkedHashMap<>();
        expectedBranches.put(ScalarValue.of(IntegerTy.U8, 0), panic());
        expectedBranches.put(ScalarValue.of(IntegerTy.U8, 1), Expression.seq(assertFalse(1), ret()));
        Expression expected = Expression.switchOn(cond(0),
                SwitchTargets.switchInt(IntegerTy.U8, expectedBranches, panic()));
        assertEquals(expected, canon(expr));
    }

    @Test
    void testIdempotent() {
        Expression expr = Expression.seq(
                Expression.ifThenElse(cond(0), panic(), markLeaf(1)),
                Expression.ifThenElse(cond(1), ret(), panic())
        );
        Expression once = canon(expr);
        assertEquals(once, canon(once));
    }
}
