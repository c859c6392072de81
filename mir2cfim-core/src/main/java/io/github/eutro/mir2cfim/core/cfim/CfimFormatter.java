package io.github.eutro.mir2cfim.core.cfim;

import io.github.eutro.mir2cfim.core.values.Operand;
import io.github.eutro.mir2cfim.core.values.ScalarValue;
import org.jetbrains.annotations.NotNull;

import java.util.Map;

/**
 * Renders structured expressions as nested, human-readable text.
 */
public class CfimFormatter {
    /**
     * A formatter indenting with four spaces.
     */
    public static final CfimFormatter DEFAULT = new CfimFormatter("    ");

    private final String indentUnit;

    /**
     * Construct a formatter.
     *
     * @param indentUnit The string to indent each nesting level with.
     */
    public CfimFormatter(@NotNull String indentUnit) {
        this.indentUnit = indentUnit;
    }

    /**
     * Format a statement, without indentation or a trailing semicolon.
     *
     * @param statement The statement.
     * @return The text.
     */
    public String format(@NotNull Statement statement) {
        return statement.accept(STATEMENT_FORMATTER);
    }

    /**
     * Format an expression, one statement per line.
     *
     * @param expr The expression.
     * @return The text.
     */
    public String format(@NotNull Expression expr) {
        StringBuilder sb = new StringBuilder();
        new Printer(sb).print(expr, "");
        return sb.toString();
    }

    private class Printer implements Expression.Visitor<Void> {
        private final StringBuilder sb;
        private String tab;

        Printer(StringBuilder sb) {
            this.sb = sb;
        }

        void print(Expression expr, String tab) {
            String oldTab = this.tab;
            this.tab = tab;
            expr.accept(this);
            this.tab = oldTab;
        }

        private void block(Expression body) {
            sb.append("{\n");
            print(body, tab + indentUnit);
            sb.append('\n').append(tab).append('}');
        }

        @Override
        public Void visitLeaf(Expression.Leaf leaf) {
            sb.append(tab).append(format(leaf.statement)).append(';');
            return null;
        }

        @Override
        public Void visitSequence(Expression.Sequence sequence) {
            print(sequence.first, tab);
            sb.append('\n');
            print(sequence.rest, tab);
            return null;
        }

        @Override
        public Void visitSwitch(Expression.Switch sw) {
            Operand discr = sw.discr;
            sw.targets.accept(new SwitchTargets.Visitor<Void>() {
                @Override
                public Void visitIf(SwitchTargets.If targets) {
                    sb.append(tab).append("if ").append(discr).append(' ');
                    block(targets.thenExpr);
                    sb.append('\n').append(tab).append("else ");
                    block(targets.elseExpr);
                    return null;
                }

                @Override
                public Void visitSwitchInt(SwitchTargets.SwitchInt targets) {
                    sb.append(tab).append("switch ").append(discr).append(" {\n");
                    String outer = tab;
                    tab = tab + indentUnit;
                    for (Map.Entry<ScalarValue, Expression> branch : targets.branches.entrySet()) {
                        sb.append(tab).append(branch.getKey()).append(" => ");
                        block(branch.getValue());
                        sb.append(",\n");
                    }
                    sb.append(tab).append("_ => ");
                    block(targets.otherwise);
                    tab = outer;
                    sb.append('\n').append(tab).append('}');
                    return null;
                }
            });
            return null;
        }

        @Override
        public Void visitLoop(Expression.Loop loop) {
            sb.append(tab).append("loop ");
            block(loop.body);
            return null;
        }
    }

    private static final Statement.Visitor<String> STATEMENT_FORMATTER = new Statement.Visitor<String>() {
        @Override
        public String visitAssign(Statement.Assign assign) {
            return assign.place + " := " + assign.rvalue;
        }

        @Override
        public String visitFakeRead(Statement.FakeRead fakeRead) {
            return "@fake_read(" + fakeRead.place + ")";
        }

        @Override
        public String visitSetDiscriminant(Statement.SetDiscriminant setDiscriminant) {
            return "@discriminant(" + setDiscriminant.place + ") := " + setDiscriminant.variant;
        }

        @Override
        public String visitDrop(Statement.Drop drop) {
            return "drop " + drop.place;
        }

        @Override
        public String visitAssert(Statement.Assert anAssert) {
            return "assert(" + anAssert.cond + " == " + anAssert.expected + ")";
        }

        @Override
        public String visitCall(Statement.Call call) {
            StringBuilder sb = new StringBuilder();
            sb.append(call.dest).append(" := ").append(call.func).append('(');
            for (int i = 0; i < call.args.size(); i++) {
                if (i != 0) sb.append(", ");
                sb.append(call.args.get(i));
            }
            return sb.append(')').toString();
        }

        @Override
        public String visitPanic(Statement.Panic panic) {
            return "panic";
        }

        @Override
        public String visitReturn(Statement.Return ret) {
            return "return";
        }

        @Override
        public String visitBreak(Statement.Break brk) {
            return "break " + brk.depth;
        }

        @Override
        public String visitContinue(Statement.Continue cont) {
            return "continue " + cont.depth;
        }

        @Override
        public String visitNop(Statement.Nop nop) {
            return "nop";
        }
    };
}
