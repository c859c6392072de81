package io.github.eutro.mir2cfim.core.values;

import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;
import java.util.Objects;

/**
 * An integer constant of a given {@link IntegerTy}.
 */
public final class ScalarValue {
    private final IntegerTy ty;
    private final BigInteger value;

    private ScalarValue(IntegerTy ty, BigInteger value) {
        this.ty = ty;
        this.value = value;
    }

    /**
     * Create a scalar value.
     *
     * @param ty    The integer type.
     * @param value The value, which must fit in {@code ty}.
     * @return The scalar value.
     * @throws IllegalArgumentException If the value is out of range.
     */
    public static ScalarValue of(@NotNull IntegerTy ty, @NotNull BigInteger value) {
        if (!ty.fits(value)) {
            throw new IllegalArgumentException(String.format("%s does not fit in %s", value, ty));
        }
        return new ScalarValue(ty, value);
    }

    /**
     * Create a scalar value.
     *
     * @param ty    The integer type.
     * @param value The value, which must fit in {@code ty}.
     * @return The scalar value.
     */
    public static ScalarValue of(@NotNull IntegerTy ty, long value) {
        return of(ty, BigInteger.valueOf(value));
    }

    public IntegerTy getTy() {
        return ty;
    }

    public BigInteger getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScalarValue that = (ScalarValue) o;
        return ty == that.ty && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ty, value);
    }

    @Override
    public String toString() {
        return value + " : " + ty;
    }
}
