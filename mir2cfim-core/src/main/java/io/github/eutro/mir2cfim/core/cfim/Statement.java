package io.github.eutro.mir2cfim.core.cfim;

import io.github.eutro.mir2cfim.core.values.FunId;
import io.github.eutro.mir2cfim.core.values.Operand;
import io.github.eutro.mir2cfim.core.values.Place;
import io.github.eutro.mir2cfim.core.values.Rvalue;
import io.github.eutro.mir2cfim.core.values.VariantId;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A leaf of a structured {@link Expression}.
 * <p>
 * Unlike {@link io.github.eutro.mir2cfim.core.im.Statement block statements}, these may transfer control:
 * {@link Return}, {@link Panic}, {@link Break} and {@link Continue} never fall through.
 * The set of statements is closed; use a {@link Visitor} to dispatch on them.
 */
public abstract class Statement {
    private Statement() {
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Get whether control never continues past this statement.
     *
     * @return Whether this statement is terminal.
     */
    public boolean isTerminal() {
        return false;
    }

    /**
     * A visitor over the kinds of statements.
     *
     * @param <R> The result type.
     */
    public interface Visitor<R> {
        R visitAssign(Assign assign);

        R visitFakeRead(FakeRead fakeRead);

        R visitSetDiscriminant(SetDiscriminant setDiscriminant);

        R visitDrop(Drop drop);

        R visitAssert(Assert anAssert);

        R visitCall(Call call);

        R visitPanic(Panic panic);

        R visitReturn(Return ret);

        R visitBreak(Break brk);

        R visitContinue(Continue cont);

        R visitNop(Nop nop);
    }

    public static Assign assign(@NotNull Place place, @NotNull Rvalue rvalue) {
        return new Assign(place, rvalue);
    }

    public static FakeRead fakeRead(@NotNull Place place) {
        return new FakeRead(place);
    }

    public static SetDiscriminant setDiscriminant(@NotNull Place place, @NotNull VariantId variant) {
        return new SetDiscriminant(place, variant);
    }

    public static Drop drop(@NotNull Place place) {
        return new Drop(place);
    }

    public static Assert assertThat(@NotNull Operand cond, boolean expected) {
        return new Assert(cond, expected);
    }

    public static Call call(@NotNull FunId func, @NotNull List<Operand> args, @NotNull Place dest) {
        return new Call(func, args, dest);
    }

    public static Panic panic() {
        return Panic.INSTANCE;
    }

    public static Return ret() {
        return Return.INSTANCE;
    }

    /**
     * Break out of an enclosing loop.
     *
     * @param depth The loop to break out of, 0 being the innermost.
     * @return The statement.
     */
    public static Break brk(int depth) {
        return new Break(depth);
    }

    /**
     * Continue an enclosing loop.
     *
     * @param depth The loop to continue, 0 being the innermost.
     * @return The statement.
     */
    public static Continue cont(int depth) {
        return new Continue(depth);
    }

    public static Nop nop() {
        return Nop.INSTANCE;
    }

    public static final class Assign extends Statement {
        public final Place place;
        public final Rvalue rvalue;

        Assign(Place place, Rvalue rvalue) {
            this.place = Objects.requireNonNull(place);
            this.rvalue = Objects.requireNonNull(rvalue);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssign(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Assign)) return false;
            Assign that = (Assign) o;
            return place.equals(that.place) && rvalue.equals(that.rvalue);
        }

        @Override
        public int hashCode() {
            return Objects.hash(place, rvalue);
        }
    }

    public static final class FakeRead extends Statement {
        public final Place place;

        FakeRead(Place place) {
            this.place = Objects.requireNonNull(place);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFakeRead(this);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof FakeRead && place.equals(((FakeRead) o).place);
        }

        @Override
        public int hashCode() {
            return place.hashCode();
        }
    }

    public static final class SetDiscriminant extends Statement {
        public final Place place;
        public final VariantId variant;

        SetDiscriminant(Place place, VariantId variant) {
            this.place = Objects.requireNonNull(place);
            this.variant = Objects.requireNonNull(variant);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSetDiscriminant(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof SetDiscriminant)) return false;
            SetDiscriminant that = (SetDiscriminant) o;
            return place.equals(that.place) && variant.equals(that.variant);
        }

        @Override
        public int hashCode() {
            return Objects.hash(place, variant);
        }
    }

    public static final class Drop extends Statement {
        public final Place place;

        Drop(Place place) {
            this.place = Objects.requireNonNull(place);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDrop(this);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Drop && place.equals(((Drop) o).place);
        }

        @Override
        public int hashCode() {
            return place.hashCode();
        }
    }

    /**
     * Check that {@code cond == expected}, panicking otherwise.
     */
    public static final class Assert extends Statement {
        public final Operand cond;
        public final boolean expected;

        Assert(Operand cond, boolean expected) {
            this.cond = Objects.requireNonNull(cond);
            this.expected = expected;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssert(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Assert)) return false;
            Assert that = (Assert) o;
            return expected == that.expected && cond.equals(that.cond);
        }

        @Override
        public int hashCode() {
            return Objects.hash(cond, expected);
        }
    }

    /**
     * {@code dest := func(args)}
     */
    public static final class Call extends Statement {
        public final FunId func;
        public final List<Operand> args;
        public final Place dest;

        Call(FunId func, List<Operand> args, Place dest) {
            this.func = Objects.requireNonNull(func);
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
            this.dest = Objects.requireNonNull(dest);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Call)) return false;
            Call that = (Call) o;
            return func.equals(that.func) && args.equals(that.args) && dest.equals(that.dest);
        }

        @Override
        public int hashCode() {
            return Objects.hash(func, args, dest);
        }
    }

    /**
     * A panic. Also used for unreachable code.
     */
    public static final class Panic extends Statement {
        static final Panic INSTANCE = new Panic();

        private Panic() {
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPanic(this);
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    public static final class Return extends Statement {
        static final Return INSTANCE = new Return();

        private Return() {
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturn(this);
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    public static final class Break extends Statement {
        public final int depth;

        Break(int depth) {
            if (depth < 0) throw new IllegalArgumentException("negative break depth " + depth);
            this.depth = depth;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBreak(this);
        }

        @Override
        public boolean isTerminal() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Break && depth == ((Break) o).depth;
        }

        @Override
        public int hashCode() {
            return depth;
        }
    }

    public static final class Continue extends Statement {
        public final int depth;

        Continue(int depth) {
            if (depth < 0) throw new IllegalArgumentException("negative continue depth " + depth);
            this.depth = depth;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitContinue(this);
        }

        @Override
        public boolean isTerminal() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Continue && depth == ((Continue) o).depth;
        }

        @Override
        public int hashCode() {
            return ~depth;
        }
    }

    public static final class Nop extends Statement {
        static final Nop INSTANCE = new Nop();

        private Nop() {
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNop(this);
        }
    }

    @Override
    public String toString() {
        return CfimFormatter.DEFAULT.format(this);
    }
}
