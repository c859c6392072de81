package io.github.eutro.mir2cfim.api;

import io.github.eutro.mir2cfim.core.cfim.Expression;
import io.github.eutro.mir2cfim.core.cfim.FunDecl;
import io.github.eutro.mir2cfim.core.cfim.Statement;
import io.github.eutro.mir2cfim.core.values.AssumedFunId;
import io.github.eutro.mir2cfim.core.values.FunId;
import io.github.eutro.mir2cfim.core.values.Operand;
import io.github.eutro.mir2cfim.core.values.Place;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class DivergenceAnalysisTest {
    private static Expression call(FunId callee) {
        return Expression.leaf(Statement.call(callee, Collections.<Operand>emptyList(), Place.of(0)));
    }

    private static FunDecl decl(int defId, Expression... body) {
        return new FunDecl(defId, "f" + defId, 0, false,
                Expression.seq(Expression.seq(body), Expression.leaf(Statement.ret())));
    }

    @Test
    void testLoopsAndCallers() {
        assertEquals(new HashSet<>(Arrays.asList(1, 2, 3)), DivergenceAnalysis.divergent(Arrays.asList(
                decl(0),
                decl(1, Expression.loop(Expression.leaf(Statement.brk(0)))),
                decl(2, call(FunId.local(1))),
                decl(3, call(FunId.local(0)), call(FunId.local(2))),
                decl(4, call(FunId.local(0)))
        )));
    }

    @Test
    void testRecursion() {
        assertEquals(new HashSet<>(Arrays.asList(0, 1, 2, 3)), DivergenceAnalysis.divergent(Arrays.asList(
                decl(0, call(FunId.local(0))),
                decl(1, call(FunId.local(2))),
                decl(2, call(FunId.local(1))),
                decl(3, call(FunId.local(2))),
                decl(4)
        )));
    }

    @Test
    void testCalleesOutsideCrate() {
        assertEquals(Collections.emptySet(), DivergenceAnalysis.divergent(Arrays.asList(
                decl(0, call(FunId.local(7))),
                decl(1, call(FunId.assumed(AssumedFunId.BOX_FREE)), call(FunId.local(0)))
        )));
    }

    @Test
    void testMarkedDivergent() {
        FunDecl marked = decl(0).withDivergent(true);
        assertEquals(new HashSet<>(Arrays.asList(0, 1)), DivergenceAnalysis.divergent(Arrays.asList(
                marked,
                decl(1, call(FunId.local(0)))
        )));
    }
}
