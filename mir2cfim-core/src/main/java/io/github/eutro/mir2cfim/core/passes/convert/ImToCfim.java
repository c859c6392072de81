package io.github.eutro.mir2cfim.core.passes.convert;

import com.google.common.flogger.GoogleLogger;
import io.github.eutro.mir2cfim.core.cfg.ControlFlowInfo;
import io.github.eutro.mir2cfim.core.cfg.Loop;
import io.github.eutro.mir2cfim.core.cfim.Expression;
import io.github.eutro.mir2cfim.core.cfim.Expressions;
import io.github.eutro.mir2cfim.core.cfim.Statement;
import io.github.eutro.mir2cfim.core.cfim.SwitchTargets;
import io.github.eutro.mir2cfim.core.im.Block;
import io.github.eutro.mir2cfim.core.im.BlockGraph;
import io.github.eutro.mir2cfim.core.im.BlockId;
import io.github.eutro.mir2cfim.core.im.Terminator;
import io.github.eutro.mir2cfim.core.passes.IRPass;
import io.github.eutro.mir2cfim.core.passes.meta.AnalyzeControlFlow;
import io.github.eutro.mir2cfim.core.values.ScalarValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts a block graph into a structured expression.
 * <p>
 * Each block is structured at the point control first reaches it. Branches continue up to the block
 * where they reunite (the immediate post-dominator of the branching block), which is then structured once,
 * after the branch. A loop header wraps the rest of its loop in a {@link Expression.Loop loop}: jumps back to the
 * header become {@code continue}s, jumps to the block where the loop's exits reunite become {@code break}s,
 * and that block follows the loop. Any other jump out of a loop has its target structured in place; such code
 * never falls through, since it only ends in a {@code return}, a panic, or a jump out of another loop.
 * <p>
 * Statement leaves appear in the same order as the blocks would execute them, and branches keep the order
 * of the terminator's targets, so the result only depends on the graph.
 *
 * @see AnalyzeControlFlow
 */
public class ImToCfim implements IRPass<BlockGraph, Expression> {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    /**
     * A singleton instance of this pass.
     */
    public static final ImToCfim INSTANCE = new ImToCfim();

    @Override
    public Expression run(BlockGraph graph) {
        return structure(AnalyzeControlFlow.INSTANCE.run(graph));
    }

    /**
     * Structure an already analysed graph.
     *
     * @param info The analysis of the graph.
     * @return The structured expression.
     */
    public Expression structure(@NotNull ControlFlowInfo info) {
        Ctx ctx = new Ctx(info);
        Expression expr = ctx.build(info.graph.getEntry(), null);
        Expressions.verifyDepths(expr);
        return expr;
    }

    /**
     * A loop being structured.
     */
    private static class Scope {
        final Loop loop;
        @Nullable
        final BlockId follow;

        Scope(Loop loop, @Nullable BlockId follow) {
            this.loop = loop;
            this.follow = follow;
        }
    }

    private static class Ctx {
        private final ControlFlowInfo info;
        // innermost last
        private final List<Scope> scopes = new ArrayList<>();

        Ctx(ControlFlowInfo info) {
            this.info = info;
        }

        private boolean inScope(BlockId block) {
            for (Scope scope : scopes) {
                if (scope.loop.getHeader().equals(block)) return true;
            }
            return false;
        }

        /**
         * Whether control can continue at a block after some construct, without leaving the current loop.
         */
        private boolean isContinuation(@Nullable BlockId block) {
            if (block == null || inScope(block)) return false;
            return scopes.isEmpty() || scopes.get(scopes.size() - 1).loop.contains(block);
        }

        Expression build(BlockId id, @Nullable BlockId stopAt) {
            if (id.equals(stopAt)) return Expression.nop();
            Loop loop = info.loops.loopAt(id);
            if (loop != null && !inScope(id)) {
                return buildLoop(loop, stopAt);
            }
            return buildBlock(id, stopAt);
        }

        private Expression buildLoop(Loop loop, @Nullable BlockId stopAt) {
            BlockId follow = info.joins.joinOfExits(loop);
            if (!isContinuation(follow) || loop.contains(follow)) {
                follow = null;
            }
            logger.atFinest().log("structuring %s with follow %s", loop, follow);

            scopes.add(new Scope(loop, follow));
            Expression body;
            try {
                body = buildBlock(loop.getHeader(), null);
            } finally {
                scopes.remove(scopes.size() - 1);
            }
            Expression result = Expression.loop(body);
            if (follow != null) {
                result = Expression.seq(result, build(follow, stopAt));
            }
            return result;
        }

        private Expression buildBlock(BlockId id, @Nullable BlockId stopAt) {
            Block block = info.graph.get(id);
            List<Expression> exprs = new ArrayList<>();
            for (io.github.eutro.mir2cfim.core.im.Statement stmt : block.getStatements()) {
                exprs.add(Expression.leaf(convertStatement(stmt)));
            }
            exprs.add(block.getTerminator().accept(new TerminatorConverter(id, stopAt)));
            return Expression.seq(exprs.toArray(new Expression[0]));
        }

        /**
         * Structure control transferring to {@code target}.
         */
        Expression jump(BlockId target, @Nullable BlockId stopAt) {
            if (target.equals(stopAt)) return Expression.nop();
            for (int i = scopes.size() - 1; i >= 0; i--) {
                if (scopes.get(i).loop.getHeader().equals(target)) {
                    return Expression.leaf(Statement.cont(depthOf(i)));
                }
            }
            for (int i = scopes.size() - 1; i >= 0; i--) {
                if (target.equals(scopes.get(i).follow)) {
                    return Expression.leaf(Statement.brk(depthOf(i)));
                }
            }
            return build(target, stopAt);
        }

        private int depthOf(int scopeIndex) {
            int depth = scopes.size() - 1 - scopeIndex;
            if (depth < 0 || depth >= scopes.size()) {
                throw new IllegalStateException("loop depth " + depth + " out of range");
            }
            return depth;
        }

        /**
         * The block a branch at {@code origin} should stop at, or null if the branches never reunite
         * before leaving the current loop.
         */
        @Nullable
        private BlockId branchJoin(BlockId origin) {
            BlockId join = info.joins.joinOf(origin);
            return isContinuation(join) ? join : null;
        }

        private class TerminatorConverter implements Terminator.Visitor<Expression> {
            private final BlockId origin;
            @Nullable
            private final BlockId stopAt;

            TerminatorConverter(BlockId origin, @Nullable BlockId stopAt) {
                this.origin = origin;
                this.stopAt = stopAt;
            }

            private Expression then(Statement leaf, BlockId target) {
                return Expression.seq(Expression.leaf(leaf), jump(target, stopAt));
            }

            @Override
            public Expression visitGoto(Terminator.Goto term) {
                return jump(term.target, stopAt);
            }

            @Override
            public Expression visitIf(Terminator.If term) {
                BlockId join = branchJoin(origin);
                BlockId branchStop = join == null ? stopAt : join;
                Expression sw = Expression.ifThenElse(
                        term.cond,
                        jump(term.thenTarget, branchStop),
                        jump(term.elseTarget, branchStop)
                );
                return join == null ? sw : Expression.seq(sw, build(join, stopAt));
            }

            @Override
            public Expression visitSwitchInt(Terminator.SwitchInt term) {
                BlockId join = branchJoin(origin);
                BlockId branchStop = join == null ? stopAt : join;
                Map<ScalarValue, Expression> branches = new LinkedHashMap<>();
                for (Map.Entry<ScalarValue, BlockId> entry : term.cases.entrySet()) {
                    branches.put(entry.getKey(), jump(entry.getValue(), branchStop));
                }
                Expression otherwise = jump(term.otherwise, branchStop);
                Expression sw = Expression.switchOn(term.discr, SwitchTargets.switchInt(term.ty, branches, otherwise));
                return join == null ? sw : Expression.seq(sw, build(join, stopAt));
            }

            @Override
            public Expression visitCall(Terminator.Call term) {
                return then(Statement.call(term.func, term.args, term.dest), term.target);
            }

            @Override
            public Expression visitDrop(Terminator.Drop term) {
                return then(Statement.drop(term.place), term.target);
            }

            @Override
            public Expression visitAssert(Terminator.Assert term) {
                return then(Statement.assertThat(term.cond, term.expected), term.target);
            }

            @Override
            public Expression visitReturn(Terminator.Return term) {
                return Expression.leaf(Statement.ret());
            }

            @Override
            public Expression visitAbort(Terminator.Abort term) {
                return Expression.leaf(Statement.panic());
            }

            @Override
            public Expression visitNop(Terminator.Nop term) {
                return Expression.nop();
            }
        }
    }

    static Statement convertStatement(io.github.eutro.mir2cfim.core.im.Statement stmt) {
        return stmt.accept(new io.github.eutro.mir2cfim.core.im.Statement.Visitor<Statement>() {
            @Override
            public Statement visitAssign(io.github.eutro.mir2cfim.core.im.Statement.Assign assign) {
                return Statement.assign(assign.place, assign.rvalue);
            }

            @Override
            public Statement visitFakeRead(io.github.eutro.mir2cfim.core.im.Statement.FakeRead fakeRead) {
                return Statement.fakeRead(fakeRead.place);
            }

            @Override
            public Statement visitSetDiscriminant(io.github.eutro.mir2cfim.core.im.Statement.SetDiscriminant sd) {
                return Statement.setDiscriminant(sd.place, sd.variant);
            }

            @Override
            public Statement visitDrop(io.github.eutro.mir2cfim.core.im.Statement.Drop drop) {
                return Statement.drop(drop.place);
            }

            @Override
            public Statement visitNop(io.github.eutro.mir2cfim.core.im.Statement.Nop nop) {
                return Statement.nop();
            }
        });
    }
}
