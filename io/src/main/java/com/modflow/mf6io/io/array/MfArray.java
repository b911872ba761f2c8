package com.modflow.mf6io.io.array;

import java.util.Arrays;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * A grid array read from or written to an input file. Values are exposed flattened in row-major
 * order. Subclasses keep the representation the array was written in ({@link #how()}), so that an
 * encoder can write a constant back as {@code CONSTANT} and an external array back as a file
 * reference.
 *
 * <p>Arrays are immutable; the elementwise operations return new values. Two arrays are equal when
 * their shapes and materialized values are equal, whatever their representation.
 */
public abstract class MfArray {
    private final int[] shape;

    protected MfArray(int[] shape) {
        for (int extent : shape) {
            if (extent < 0) {
                throw new ArrayShapeException("Negative extent in shape " + Arrays.toString(shape));
            }
        }
        this.shape = shape.clone();
    }

    public final int[] shape() {
        return shape.clone();
    }

    public final int rank() {
        return shape.length;
    }

    /** Number of elements: the product of the extents, 1 for rank 0. */
    public final int size() {
        return sizeOf(shape);
    }

    /** A fresh copy of the materialized values in row-major order. */
    public abstract double[] values();

    public abstract ArrayHow how();

    public abstract MfArray map(DoubleUnaryOperator op);

    public abstract MfArray combine(MfArray other, DoubleBinaryOperator op);

    public MfArray scale(double factor) {
        return map(value -> value * factor);
    }

    public MfArray add(double amount) {
        return map(value -> value + amount);
    }

    /** Value at a row-major flat index. */
    public double get(int flatIndex) {
        return values()[flatIndex];
    }

    static int sizeOf(int[] shape) {
        int size = 1;
        for (int extent : shape) {
            size = Math.multiplyExact(size, extent);
        }
        return size;
    }

    void requireSameShape(MfArray other) {
        if (!Arrays.equals(shape, other.shape)) {
            throw new ArrayShapeException(
                    "Shapes differ: " + Arrays.toString(shape) + " and " + Arrays.toString(other.shape));
        }
    }

    @Override
    public final boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MfArray)) {
            return false;
        }
        MfArray other = (MfArray) obj;
        return Arrays.equals(shape, other.shape) && Arrays.equals(values(), other.values());
    }

    @Override
    public final int hashCode() {
        return 31 * Arrays.hashCode(shape) + Arrays.hashCode(values());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + Arrays.toString(shape) + " " + how();
    }
}
