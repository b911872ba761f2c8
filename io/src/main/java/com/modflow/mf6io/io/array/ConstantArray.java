package com.modflow.mf6io.io.array;

import java.util.Arrays;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * An array holding the same value in every cell, stored as that single value. Operations keep the
 * array constant or fail with {@link RepresentationViolationException}; they never expand it into
 * a full buffer.
 */
public final class ConstantArray extends MfArray {
    private final double value;

    public ConstantArray(int[] shape, double value) {
        super(shape);
        this.value = value;
    }

    /**
     * Builds a constant array from a buffer whose elements are all equal.
     *
     * An empty shape gets the value {@code 0.0}.
     *
     * @throws ArrayShapeException if the buffer length does not match the shape
     * @throws RepresentationViolationException if the buffer holds more than one distinct value
     */
    public static ConstantArray of(double[] values, int[] shape) {
        if (values.length != sizeOf(shape)) {
            throw new ArrayShapeException(
                    values.length + " values do not fill shape " + Arrays.toString(shape));
        }
        if (values.length == 0) {
            return new ConstantArray(shape, 0.0);
        }
        double first = values[0];
        for (double v : values) {
            if (Double.compare(v, first) != 0) {
                throw new RepresentationViolationException("Values are not constant: " + first + " and " + v);
            }
        }
        return new ConstantArray(shape, first);
    }

    public double value() {
        return value;
    }

    @Override
    public double[] values() {
        double[] values = new double[size()];
        Arrays.fill(values, value);
        return values;
    }

    @Override
    public double get(int flatIndex) {
        if (flatIndex < 0 || flatIndex >= size()) {
            throw new IndexOutOfBoundsException(flatIndex);
        }
        return value;
    }

    @Override
    public ArrayHow how() {
        return ArrayHow.CONSTANT;
    }

    @Override
    public ConstantArray map(DoubleUnaryOperator op) {
        return new ConstantArray(shape(), op.applyAsDouble(value));
    }

    @Override
    public ConstantArray combine(MfArray other, DoubleBinaryOperator op) {
        requireSameShape(other);
        if (other instanceof ConstantArray) {
            return new ConstantArray(shape(), op.applyAsDouble(value, ((ConstantArray) other).value));
        }
        double[] others = other.values();
        if (others.length == 0) {
            return new ConstantArray(shape(), value);
        }
        double result = op.applyAsDouble(value, others[0]);
        for (int i = 1; i < others.length; i++) {
            if (Double.compare(op.applyAsDouble(value, others[i]), result) != 0) {
                throw new RepresentationViolationException(
                        "Combining a constant array with a varying array does not give a constant");
            }
        }
        return new ConstantArray(shape(), result);
    }

    @Override
    public String toString() {
        return "ConstantArray" + Arrays.toString(shape()) + " " + value;
    }
}
