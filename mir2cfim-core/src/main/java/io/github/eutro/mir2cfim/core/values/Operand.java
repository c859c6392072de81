package io.github.eutro.mir2cfim.core.values;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * An operand: a copy or move out of a {@link Place}, or a constant.
 */
public final class Operand {
    /**
     * The kind of an operand.
     */
    public enum Kind {
        COPY,
        MOVE,
        CONSTANT,
    }

    private final Kind kind;
    @Nullable
    private final Place place;
    @Nullable
    private final String constant;

    private Operand(Kind kind, @Nullable Place place, @Nullable String constant) {
        this.kind = kind;
        this.place = place;
        this.constant = constant;
    }

    public static Operand copy(@NotNull Place place) {
        return new Operand(Kind.COPY, place, null);
    }

    public static Operand move(@NotNull Place place) {
        return new Operand(Kind.MOVE, place, null);
    }

    /**
     * Create a constant operand.
     *
     * @param constant The rendered constant.
     * @return The operand.
     */
    public static Operand constant(@NotNull String constant) {
        return new Operand(Kind.CONSTANT, null, constant);
    }

    /**
     * Create a constant operand from a scalar value.
     *
     * @param value The value.
     * @return The operand.
     */
    public static Operand constant(@NotNull ScalarValue value) {
        return constant(value.toString());
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Get the place this operand reads, or null for constants.
     *
     * @return The place.
     */
    @Nullable
    public Place getPlace() {
        return place;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Operand operand = (Operand) o;
        return kind == operand.kind
                && Objects.equals(place, operand.place)
                && Objects.equals(constant, operand.constant);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, place, constant);
    }

    @Override
    public String toString() {
        switch (kind) {
            case COPY:
                return "copy " + place;
            case MOVE:
                return "move " + place;
            default:
                return "const (" + constant + ")";
        }
    }
}
