package io.github.eutro.mir2cfim.core.values;

import java.math.BigInteger;

/**
 * A machine integer type, as used by integer switches and scalar constants.
 */
public enum IntegerTy {
    ISIZE("isize", true, 64),
    I8("i8", true, 8),
    I16("i16", true, 16),
    I32("i32", true, 32),
    I64("i64", true, 64),
    I128("i128", true, 128),
    USIZE("usize", false, 64),
    U8("u8", false, 8),
    U16("u16", false, 16),
    U32("u32", false, 32),
    U64("u64", false, 64),
    U128("u128", false, 128),
    ;

    private final String name;
    private final boolean signed;
    private final int bits;

    IntegerTy(String name, boolean signed, int bits) {
        this.name = name;
        this.signed = signed;
        this.bits = bits;
    }

    /**
     * Get whether this type is signed.
     *
     * @return Whether this type is signed.
     */
    public boolean isSigned() {
        return signed;
    }

    /**
     * Get the width of this type, in bits. Pointer-sized types are assumed to be 64 bits wide.
     *
     * @return The width.
     */
    public int getBits() {
        return bits;
    }

    /**
     * Get the smallest value of this type.
     *
     * @return The minimum value.
     */
    public BigInteger min() {
        return signed ? BigInteger.ONE.shiftLeft(bits - 1).negate() : BigInteger.ZERO;
    }

    /**
     * Get the largest value of this type.
     *
     * @return The maximum value.
     */
    public BigInteger max() {
        return BigInteger.ONE.shiftLeft(signed ? bits - 1 : bits).subtract(BigInteger.ONE);
    }

    /**
     * Check whether a value fits in this type.
     *
     * @param value The value.
     * @return Whether {@code min() <= value <= max()}.
     */
    public boolean fits(BigInteger value) {
        return value.compareTo(min()) >= 0 && value.compareTo(max()) <= 0;
    }

    @Override
    public String toString() {
        return name;
    }
}
