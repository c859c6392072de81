package io.github.eutro.mir2cfim.core.cfim;

import io.github.eutro.mir2cfim.core.values.FunId;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Traversals over structured expressions.
 */
public final class Expressions {
    private Expressions() {
    }

    /**
     * Visit every leaf of an expression, in program order, with the number of loops enclosing it.
     */
    @FunctionalInterface
    public interface LeafVisitor {
        void visit(Statement statement, int loopDepth);
    }

    /**
     * Visit every leaf of an expression, in program order.
     *
     * @param expr    The expression.
     * @param visitor The visitor, called with each leaf and the number of {@link Expression.Loop loops} around it.
     */
    public static void forEachLeaf(@NotNull Expression expr, @NotNull LeafVisitor visitor) {
        walk(expr, 0, visitor);
    }

    /**
     * Visit every leaf of an expression, in program order.
     *
     * @param expr     The expression.
     * @param consumer The consumer of each leaf.
     */
    public static void forEachLeaf(@NotNull Expression expr, @NotNull Consumer<Statement> consumer) {
        walk(expr, 0, (st, $) -> consumer.accept(st));
    }

    private static void walk(Expression expr, int depth, LeafVisitor visitor) {
        expr.accept(new Expression.Visitor<Void>() {
            @Override
            public Void visitLeaf(Expression.Leaf leaf) {
                visitor.visit(leaf.statement, depth);
                return null;
            }

            @Override
            public Void visitSequence(Expression.Sequence sequence) {
                walk(sequence.first, depth, visitor);
                walk(sequence.rest, depth, visitor);
                return null;
            }

            @Override
            public Void visitSwitch(Expression.Switch sw) {
                sw.targets.accept(new SwitchTargets.Visitor<Void>() {
                    @Override
                    public Void visitIf(SwitchTargets.If targets) {
                        walk(targets.thenExpr, depth, visitor);
                        walk(targets.elseExpr, depth, visitor);
                        return null;
                    }

                    @Override
                    public Void visitSwitchInt(SwitchTargets.SwitchInt targets) {
                        for (Expression branch : targets.branches.values()) {
                            walk(branch, depth, visitor);
                        }
                        walk(targets.otherwise, depth, visitor);
                        return null;
                    }
                });
                return null;
            }

            @Override
            public Void visitLoop(Expression.Loop loop) {
                walk(loop.body, depth + 1, visitor);
                return null;
            }
        });
    }

    /**
     * Collect the callees of every {@link Statement.Call call} in an expression.
     *
     * @param expr The expression.
     * @return The callees, in order of first appearance.
     */
    public static Set<FunId> collectCallees(@NotNull Expression expr) {
        Set<FunId> callees = new LinkedHashSet<>();
        forEachLeaf(expr, (Consumer<Statement>) st -> {
            if (st instanceof Statement.Call) {
                callees.add(((Statement.Call) st).func);
            }
        });
        return callees;
    }

    /**
     * Get whether an expression contains a {@link Expression.Loop loop}.
     *
     * @param expr The expression.
     * @return Whether it contains a loop.
     */
    public static boolean containsLoop(@NotNull Expression expr) {
        return expr.accept(new Expression.Visitor<Boolean>() {
            @Override
            public Boolean visitLeaf(Expression.Leaf leaf) {
                return false;
            }

            @Override
            public Boolean visitSequence(Expression.Sequence sequence) {
                return sequence.first.accept(this) || sequence.rest.accept(this);
            }

            @Override
            public Boolean visitSwitch(Expression.Switch sw) {
                Expression.Visitor<Boolean> self = this;
                return sw.targets.accept(new SwitchTargets.Visitor<Boolean>() {
                    @Override
                    public Boolean visitIf(SwitchTargets.If targets) {
                        return targets.thenExpr.accept(self) || targets.elseExpr.accept(self);
                    }

                    @Override
                    public Boolean visitSwitchInt(SwitchTargets.SwitchInt targets) {
                        for (Expression branch : targets.branches.values()) {
                            if (branch.accept(self)) return true;
                        }
                        return targets.otherwise.accept(self);
                    }
                });
            }

            @Override
            public Boolean visitLoop(Expression.Loop loop) {
                return true;
            }
        });
    }

    /**
     * Check that every {@code break} and {@code continue} in an expression refers to a loop that encloses it.
     *
     * @param expr The expression.
     * @throws IllegalStateException If a depth is out of range.
     */
    public static void verifyDepths(@NotNull Expression expr) {
        forEachLeaf(expr, (st, loops) -> {
            int depth;
            if (st instanceof Statement.Break) {
                depth = ((Statement.Break) st).depth;
            } else if (st instanceof Statement.Continue) {
                depth = ((Statement.Continue) st).depth;
            } else {
                return;
            }
            if (depth >= loops) {
                throw new IllegalStateException(String.format("%s inside only %d loop(s)", st, loops));
            }
        });
    }
}
