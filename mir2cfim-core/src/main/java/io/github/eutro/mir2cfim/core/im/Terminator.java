package io.github.eutro.mir2cfim.core.im;

import io.github.eutro.mir2cfim.core.values.FunId;
import io.github.eutro.mir2cfim.core.values.IntegerTy;
import io.github.eutro.mir2cfim.core.values.Operand;
import io.github.eutro.mir2cfim.core.values.Place;
import io.github.eutro.mir2cfim.core.values.ScalarValue;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The control instruction at the end of a {@link Block}.
 * <p>
 * The set of terminators is closed; use a {@link Visitor} to dispatch on them.
 * The jump targets of every terminator are available through {@link #getTargets()},
 * in a stable order documented on each kind.
 */
public abstract class Terminator {
    private final List<BlockId> targets;

    private Terminator(List<BlockId> targets) {
        this.targets = Collections.unmodifiableList(targets);
    }

    /**
     * Get the jump targets of this terminator. The order depends on the kind of terminator.
     *
     * @return The targets.
     */
    public List<BlockId> getTargets() {
        return targets;
    }

    /**
     * Dispatch on the kind of this terminator.
     *
     * @param visitor The visitor.
     * @param <R>     The result type.
     * @return The result of the visitor.
     */
    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * A visitor over the kinds of terminators.
     *
     * @param <R> The result type.
     */
    public interface Visitor<R> {
        R visitGoto(Goto term);

        R visitIf(If term);

        R visitSwitchInt(SwitchInt term);

        R visitCall(Call term);

        R visitDrop(Drop term);

        R visitAssert(Assert term);

        R visitReturn(Return term);

        R visitAbort(Abort term);

        R visitNop(Nop term);
    }

    public static Goto goTo(@NotNull BlockId target) {
        return new Goto(target);
    }

    public static If ifThenElse(@NotNull Operand cond, @NotNull BlockId thenTarget, @NotNull BlockId elseTarget) {
        return new If(cond, thenTarget, elseTarget);
    }

    /**
     * Create an integer switch.
     *
     * @param ty        The type of the scrutinee.
     * @param discr     The scrutinee.
     * @param cases     The cases, in the order they should be tested and displayed.
     * @param otherwise The default target.
     * @return The terminator.
     */
    public static SwitchInt switchInt(
            @NotNull IntegerTy ty,
            @NotNull Operand discr,
            @NotNull Map<ScalarValue, BlockId> cases,
            @NotNull BlockId otherwise
    ) {
        return new SwitchInt(ty, discr, new LinkedHashMap<>(cases), otherwise);
    }

    public static Call call(@NotNull FunId func, @NotNull List<Operand> args, @NotNull Place dest, @NotNull BlockId target) {
        return new Call(func, args, dest, target);
    }

    public static Drop drop(@NotNull Place place, @NotNull BlockId target) {
        return new Drop(place, target);
    }

    public static Assert assertThat(@NotNull Operand cond, boolean expected, @NotNull BlockId target) {
        return new Assert(cond, expected, target);
    }

    public static Return ret() {
        return Return.INSTANCE;
    }

    public static Abort abort() {
        return Abort.INSTANCE;
    }

    public static Nop nop() {
        return Nop.INSTANCE;
    }

    /**
     * An unconditional jump. Targets: {@code [target]}.
     */
    public static final class Goto extends Terminator {
        public final BlockId target;

        Goto(BlockId target) {
            super(Collections.singletonList(Objects.requireNonNull(target)));
            this.target = target;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGoto(this);
        }

        @Override
        public String toString() {
            return "goto " + target;
        }
    }

    /**
     * A two-way test. Targets: {@code [thenTarget, elseTarget]}.
     */
    public static final class If extends Terminator {
        public final Operand cond;
        public final BlockId thenTarget;
        public final BlockId elseTarget;

        If(Operand cond, BlockId thenTarget, BlockId elseTarget) {
            super(Arrays.asList(Objects.requireNonNull(thenTarget), Objects.requireNonNull(elseTarget)));
            this.cond = Objects.requireNonNull(cond);
            this.thenTarget = thenTarget;
            this.elseTarget = elseTarget;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }

        @Override
        public String toString() {
            return "if " + cond + " -> " + thenTarget + " else -> " + elseTarget;
        }
    }

    /**
     * A multi-way integer dispatch. Targets: each case target in declared order, then the default.
     */
    public static final class SwitchInt extends Terminator {
        public final IntegerTy ty;
        public final Operand discr;
        /**
         * The cases, in declared order.
         */
        public final Map<ScalarValue, BlockId> cases;
        public final BlockId otherwise;

        SwitchInt(IntegerTy ty, Operand discr, LinkedHashMap<ScalarValue, BlockId> cases, BlockId otherwise) {
            super(targetsOf(cases, otherwise));
            for (ScalarValue value : cases.keySet()) {
                if (value.getTy() != ty) {
                    throw new IllegalArgumentException(String.format("case %s in a switch over %s", value, ty));
                }
            }
            this.ty = Objects.requireNonNull(ty);
            this.discr = Objects.requireNonNull(discr);
            this.cases = Collections.unmodifiableMap(cases);
            this.otherwise = otherwise;
        }

        private static List<BlockId> targetsOf(Map<ScalarValue, BlockId> cases, BlockId otherwise) {
            List<BlockId> targets = new ArrayList<>(cases.values());
            targets.add(Objects.requireNonNull(otherwise));
            return targets;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSwitchInt(this);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("switch ").append(discr).append(" ->");
            cases.forEach((v, t) -> sb.append(' ').append(v).append(": ").append(t).append(','));
            return sb.append(" _: ").append(otherwise).toString();
        }
    }

    /**
     * A function call, which always continues at its single target. Targets: {@code [target]}.
     */
    public static final class Call extends Terminator {
        public final FunId func;
        public final List<Operand> args;
        public final Place dest;
        public final BlockId target;

        Call(FunId func, List<Operand> args, Place dest, BlockId target) {
            super(Collections.singletonList(Objects.requireNonNull(target)));
            this.func = Objects.requireNonNull(func);
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
            this.dest = Objects.requireNonNull(dest);
            this.target = target;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public String toString() {
            return dest + " := " + func + args + " -> " + target;
        }
    }

    /**
     * Drop a place, then continue. Targets: {@code [target]}.
     */
    public static final class Drop extends Terminator {
        public final Place place;
        public final BlockId target;

        Drop(Place place, BlockId target) {
            super(Collections.singletonList(Objects.requireNonNull(target)));
            this.place = Objects.requireNonNull(place);
            this.target = target;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDrop(this);
        }

        @Override
        public String toString() {
            return "drop " + place + " -> " + target;
        }
    }

    /**
     * Check that {@code cond == expected}, panicking otherwise, then continue. Targets: {@code [target]}.
     */
    public static final class Assert extends Terminator {
        public final Operand cond;
        public final boolean expected;
        public final BlockId target;

        Assert(Operand cond, boolean expected, BlockId target) {
            super(Collections.singletonList(Objects.requireNonNull(target)));
            this.cond = Objects.requireNonNull(cond);
            this.expected = expected;
            this.target = target;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssert(this);
        }

        @Override
        public String toString() {
            return "assert(" + cond + " == " + expected + ") -> " + target;
        }
    }

    public static final class Return extends Terminator {
        static final Return INSTANCE = new Return();

        private Return() {
            super(Collections.emptyList());
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturn(this);
        }

        @Override
        public String toString() {
            return "return";
        }
    }

    /**
     * A panic, or unreachable code.
     */
    public static final class Abort extends Terminator {
        static final Abort INSTANCE = new Abort();

        private Abort() {
            super(Collections.emptyList());
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAbort(this);
        }

        @Override
        public String toString() {
            return "panic";
        }
    }

    /**
     * Ends a body that does nothing. Only allowed on an entry block that is never jumped to.
     */
    public static final class Nop extends Terminator {
        static final Nop INSTANCE = new Nop();

        private Nop() {
            super(Collections.emptyList());
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNop(this);
        }

        @Override
        public String toString() {
            return "nop";
        }
    }
}
