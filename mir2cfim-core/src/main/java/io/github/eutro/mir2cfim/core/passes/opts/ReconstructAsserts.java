package io.github.eutro.mir2cfim.core.passes.opts;

import io.github.eutro.mir2cfim.core.cfim.Expression;
import io.github.eutro.mir2cfim.core.cfim.Statement;
import io.github.eutro.mir2cfim.core.cfim.SwitchTargets;
import io.github.eutro.mir2cfim.core.passes.IRPass;
import io.github.eutro.mir2cfim.core.values.ScalarValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Replaces {@code if c { panic } else { rest }} with {@code assert(c == false); rest}.
 * <p>
 * This is the shape the {@code assert!} macro lowers to. The mirrored shape, with the panic in the
 * else branch, is left alone.
 */
public class ReconstructAsserts implements IRPass<Expression, Expression> {
    /**
     * A singleton instance of this pass.
     */
    public static final ReconstructAsserts INSTANCE = new ReconstructAsserts();

    @Override
    public Expression run(Expression expr) {
        return expr.accept(new Expression.Visitor<Expression>() {
            @Override
            public Expression visitLeaf(Expression.Leaf leaf) {
                return leaf;
            }

            @Override
            public Expression visitSequence(Expression.Sequence sequence) {
                return Expression.seq(run(sequence.first), run(sequence.rest));
            }

            @Override
            public Expression visitSwitch(Expression.Switch sw) {
                return sw.targets.accept(new SwitchTargets.Visitor<Expression>() {
                    @Override
                    public Expression visitIf(SwitchTargets.If targets) {
                        Expression elseExpr = run(targets.elseExpr);
                        if (isPanic(targets.thenExpr)) {
                            return Expression.seq(Expression.leaf(Statement.assertThat(sw.discr, false)), elseExpr);
                        }
                        return Expression.ifThenElse(sw.discr, run(targets.thenExpr), elseExpr);
                    }

                    @Override
                    public Expression visitSwitchInt(SwitchTargets.SwitchInt targets) {
                        Map<ScalarValue, Expression> branches = new LinkedHashMap<>();
                        for (Map.Entry<ScalarValue, Expression> entry : targets.branches.entrySet()) {
                            branches.put(entry.getKey(), run(entry.getValue()));
                        }
                        return Expression.switchOn(sw.discr,
                                SwitchTargets.switchInt(targets.ty, branches, run(targets.otherwise)));
                    }
                });
            }

            @Override
            public Expression visitLoop(Expression.Loop loop) {
                return Expression.loop(run(loop.body));
            }
        });
    }

    private static boolean isPanic(Expression expr) {
        while (expr instanceof Expression.Sequence && ((Expression.Sequence) expr).first.isNop()) {
            expr = ((Expression.Sequence) expr).rest;
        }
        return expr.isPanic();
    }
}
