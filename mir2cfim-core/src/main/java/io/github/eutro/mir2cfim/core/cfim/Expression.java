package io.github.eutro.mir2cfim.core.cfim;

import io.github.eutro.mir2cfim.core.values.Operand;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A node of a structured control-flow tree.
 * <p>
 * Trees are immutable and compared structurally. The set of node kinds is closed;
 * use a {@link Visitor} to dispatch on them.
 * <p>
 * Trees built with {@link #seq(Expression, Expression)} are in <i>sequence normal form</i>: the first
 * element of a {@link Sequence} is never itself a sequence, and no {@link Statement.Nop nop} leaf
 * appears inside a sequence. The passes in this code base produce and preserve this form.
 */
public abstract class Expression {
    private Expression() {
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * A visitor over the kinds of expressions.
     *
     * @param <R> The result type.
     */
    public interface Visitor<R> {
        R visitLeaf(Leaf leaf);

        R visitSequence(Sequence sequence);

        R visitSwitch(Switch sw);

        R visitLoop(Loop loop);
    }

    /**
     * Wrap a statement.
     *
     * @param statement The statement.
     * @return The leaf expression.
     */
    public static Leaf leaf(@NotNull Statement statement) {
        return new Leaf(statement);
    }

    /**
     * Get the expression that does nothing.
     *
     * @return A {@link Statement.Nop nop} leaf.
     */
    public static Leaf nop() {
        return NOP;
    }

    /**
     * Sequence two expressions, keeping the result in sequence normal form.
     * <p>
     * Nop leaves are dropped, and a sequence in first position is re-associated to the right.
     *
     * @param first The expression to run first.
     * @param rest  The expression to run after.
     * @return The sequenced expression.
     */
    @Contract(pure = true)
    public static Expression seq(@NotNull Expression first, @NotNull Expression rest) {
        if (first.isNop()) return rest;
        if (rest.isNop()) return first;
        if (first instanceof Sequence) {
            Sequence fs = (Sequence) first;
            return new Sequence(fs.first, seq(fs.rest, rest));
        }
        return new Sequence(first, rest);
    }

    /**
     * Sequence several expressions, in order, keeping the result in sequence normal form.
     *
     * @param exprs The expressions.
     * @return The sequenced expression, or a nop if there are none.
     */
    @Contract(pure = true)
    public static Expression seq(@NotNull Expression... exprs) {
        Expression acc = nop();
        for (int i = exprs.length - 1; i >= 0; i--) {
            acc = seq(exprs[i], acc);
        }
        return acc;
    }

    public static Switch ifThenElse(@NotNull Operand cond, @NotNull Expression thenExpr, @NotNull Expression elseExpr) {
        return new Switch(cond, SwitchTargets.ifThenElse(thenExpr, elseExpr));
    }

    public static Switch switchOn(@NotNull Operand discr, @NotNull SwitchTargets targets) {
        return new Switch(discr, targets);
    }

    public static Loop loop(@NotNull Expression body) {
        return new Loop(body);
    }

    /**
     * Get whether this expression is a {@link Statement.Nop nop} leaf.
     *
     * @return Whether this is a nop.
     */
    public boolean isNop() {
        return this instanceof Leaf && ((Leaf) this).statement instanceof Statement.Nop;
    }

    /**
     * Get whether this expression is a {@link Statement.Panic panic} leaf.
     *
     * @return Whether this is a panic.
     */
    public boolean isPanic() {
        return this instanceof Leaf && ((Leaf) this).statement instanceof Statement.Panic;
    }

    @Override
    public String toString() {
        return CfimFormatter.DEFAULT.format(this);
    }

    private static final Leaf NOP = new Leaf(Statement.nop());

    public static final class Leaf extends Expression {
        public final Statement statement;

        Leaf(Statement statement) {
            this.statement = Objects.requireNonNull(statement);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLeaf(this);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Leaf && statement.equals(((Leaf) o).statement);
        }

        @Override
        public int hashCode() {
            return statement.hashCode();
        }
    }

    /**
     * Run {@link #first}, then {@link #rest}.
     */
    public static final class Sequence extends Expression {
        public final Expression first;
        public final Expression rest;

        Sequence(Expression first, Expression rest) {
            this.first = Objects.requireNonNull(first);
            this.rest = Objects.requireNonNull(rest);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSequence(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Sequence)) return false;
            Sequence that = (Sequence) o;
            return first.equals(that.first) && rest.equals(that.rest);
        }

        @Override
        public int hashCode() {
            return Objects.hash(first, rest);
        }
    }

    /**
     * Branch on {@link #discr}.
     */
    public static final class Switch extends Expression {
        public final Operand discr;
        public final SwitchTargets targets;

        Switch(Operand discr, SwitchTargets targets) {
            this.discr = Objects.requireNonNull(discr);
            this.targets = Objects.requireNonNull(targets);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSwitch(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Switch)) return false;
            Switch that = (Switch) o;
            return discr.equals(that.discr) && targets.equals(that.targets);
        }

        @Override
        public int hashCode() {
            return Objects.hash(discr, targets);
        }
    }

    /**
     * Run {@link #body} forever, until it breaks out of this loop.
     */
    public static final class Loop extends Expression {
        public final Expression body;

        Loop(Expression body) {
            this.body = Objects.requireNonNull(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLoop(this);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Loop && body.equals(((Loop) o).body);
        }

        @Override
        public int hashCode() {
            return 31 * body.hashCode() + 7;
        }
    }
}
