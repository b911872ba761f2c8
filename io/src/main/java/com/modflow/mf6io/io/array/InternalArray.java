package com.modflow.mf6io.io.array;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * An array with one stored value per cell. The buffer is kept as read together with the
 * {@code FACTOR} it was scaled by; the values are {@code raw * factor}. When the array was read
 * from an {@code OPEN/CLOSE} file the path is kept as written and {@link #how()} is
 * {@link ArrayHow#EXTERNAL}.
 */
public final class InternalArray extends MfArray {
    private final double[] raw;
    private final double factor;
    private final Path externalPath;

    public InternalArray(int[] shape, double[] raw, double factor, Path externalPath) {
        super(shape);
        if (raw.length != sizeOf(shape)) {
            throw new ArrayShapeException(raw.length + " values do not fill shape " + Arrays.toString(shape));
        }
        this.raw = raw.clone();
        this.factor = factor;
        this.externalPath = externalPath;
    }

    public static InternalArray of(int[] shape, double... values) {
        return new InternalArray(shape, values, 1.0, null);
    }

    public static InternalArray external(int[] shape, double[] raw, double factor, Path path) {
        return new InternalArray(shape, raw, factor, path);
    }

    /** The buffer before the factor is applied. */
    public double[] raw() {
        return raw.clone();
    }

    public double factor() {
        return factor;
    }

    /** Path as written after {@code OPEN/CLOSE}, or {@code null} for internal arrays. */
    public Path externalPath() {
        return externalPath;
    }

    @Override
    public double[] values() {
        double[] values = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            values[i] = raw[i] * factor;
        }
        return values;
    }

    @Override
    public double get(int flatIndex) {
        return raw[flatIndex] * factor;
    }

    @Override
    public ArrayHow how() {
        return externalPath == null ? ArrayHow.INTERNAL : ArrayHow.EXTERNAL;
    }

    @Override
    public InternalArray map(DoubleUnaryOperator op) {
        double[] values = values();
        for (int i = 0; i < values.length; i++) {
            values[i] = op.applyAsDouble(values[i]);
        }
        return new InternalArray(shape(), values, 1.0, null);
    }

    /** Scales by adjusting the factor, so an external array keeps referring to its file. */
    @Override
    public InternalArray scale(double by) {
        return new InternalArray(shape(), raw, factor * by, externalPath);
    }

    @Override
    public InternalArray combine(MfArray other, DoubleBinaryOperator op) {
        requireSameShape(other);
        double[] values = values();
        double[] others = other.values();
        for (int i = 0; i < values.length; i++) {
            values[i] = op.applyAsDouble(values[i], others[i]);
        }
        return new InternalArray(shape(), values, 1.0, null);
    }

    @Override
    public String toString() {
        String base = "InternalArray" + Arrays.toString(shape()) + " factor " + factor;
        return externalPath == null ? base : base + " from " + externalPath;
    }
}
