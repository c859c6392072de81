package io.github.eutro.mir2cfim.core.im;

import io.github.eutro.mir2cfim.core.values.Place;
import io.github.eutro.mir2cfim.core.values.Rvalue;
import io.github.eutro.mir2cfim.core.values.VariantId;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A straight-line statement in a {@link Block}. Statements never transfer control.
 * <p>
 * The set of statements is closed; use a {@link Visitor} to dispatch on them.
 */
public abstract class Statement {
    private Statement() {
    }

    /**
     * Dispatch on the kind of this statement.
     *
     * @param visitor The visitor.
     * @param <R>     The result type.
     * @return The result of the visitor.
     */
    public abstract <R> R accept(Visitor<R> visitor);

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

    public static Nop nop() {
        return Nop.INSTANCE;
    }

    /**
     * {@code place := rvalue}
     */
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

        @Override
        public String toString() {
            return place + " := " + rvalue;
        }
    }

    /**
     * A read introduced by the borrow checker, with no runtime effect.
     */
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

        @Override
        public String toString() {
            return "@fake_read(" + place + ")";
        }
    }

    /**
     * Write the discriminant of the enumeration stored at {@code place}.
     */
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

        @Override
        public String toString() {
            return "@discriminant(" + place + ") := " + variant;
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

        @Override
        public String toString() {
            return "drop " + place;
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

        @Override
        public String toString() {
            return "nop";
        }
    }
}
