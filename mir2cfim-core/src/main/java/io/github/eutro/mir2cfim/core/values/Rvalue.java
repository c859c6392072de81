package io.github.eutro.mir2cfim.core.values;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The right-hand side of an assignment.
 * <p>
 * Rvalues are opaque to structuring: they are an operator name applied to some operands,
 * optionally naming a place directly (references and discriminant reads).
 */
public final class Rvalue {
    private final String op;
    private final List<Operand> operands;
    private final Place place;

    private Rvalue(String op, List<Operand> operands, Place place) {
        this.op = op;
        this.operands = operands;
        this.place = place;
    }

    /**
     * Use an operand as-is.
     *
     * @param operand The operand.
     * @return The rvalue.
     */
    public static Rvalue use(@NotNull Operand operand) {
        return new Rvalue("use", Collections.singletonList(operand), null);
    }

    /**
     * Apply an operator to some operands.
     *
     * @param op       The operator, e.g. {@code "+"} or {@code "<"}.
     * @param operands The operands.
     * @return The rvalue.
     */
    public static Rvalue apply(@NotNull String op, Operand... operands) {
        return new Rvalue(op, Collections.unmodifiableList(new ArrayList<>(Arrays.asList(operands))), null);
    }

    /**
     * Take a reference to a place.
     *
     * @param place   The place.
     * @param mutable Whether the borrow is mutable.
     * @return The rvalue.
     */
    public static Rvalue ref(@NotNull Place place, boolean mutable) {
        return new Rvalue(mutable ? "&mut" : "&", Collections.emptyList(), place);
    }

    /**
     * Read the discriminant of an enumeration.
     *
     * @param place The place holding the enumeration.
     * @return The rvalue.
     */
    public static Rvalue discriminant(@NotNull Place place) {
        return new Rvalue("@discriminant", Collections.emptyList(), place);
    }

    public String getOp() {
        return op;
    }

    public List<Operand> getOperands() {
        return operands;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Rvalue rvalue = (Rvalue) o;
        return op.equals(rvalue.op) && operands.equals(rvalue.operands) && Objects.equals(place, rvalue.place);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, operands, place);
    }

    @Override
    public String toString() {
        if (place != null) {
            return op.startsWith("&") ? op + " " + place : op + "(" + place + ")";
        }
        if (op.equals("use")) {
            return operands.get(0).toString();
        }
        if (operands.size() == 2) {
            return operands.get(0) + " " + op + " " + operands.get(1);
        }
        StringBuilder sb = new StringBuilder(op);
        for (Operand operand : operands) {
            sb.append(' ').append(operand);
        }
        return sb.toString();
    }
}
