package com.modflow.mf6io.io.array;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * An array read layer by layer ({@code NAME LAYERED}), where every layer has its own
 * representation. All layers share one shape of rank 0, 1 or 2; the array's shape is the layer
 * count followed by the layer shape.
 */
public final class LayeredArray extends MfArray {
    private final List<MfArray> layers;

    public LayeredArray(List<? extends MfArray> layers) {
        super(shapeOf(layers));
        this.layers = List.copyOf(layers);
    }

    private static int[] shapeOf(List<? extends MfArray> layers) {
        if (layers == null || layers.isEmpty()) {
            throw new ArrayShapeException("A layered array needs at least one layer");
        }
        int[] layerShape = layers.get(0).shape();
        if (layerShape.length > 2) {
            throw new ArrayShapeException("Layers may have at most two dimensions, got " + Arrays.toString(layerShape));
        }
        for (int i = 1; i < layers.size(); i++) {
            if (!Arrays.equals(layerShape, layers.get(i).shape())) {
                throw new ArrayShapeException(
                        "Layer " + (i + 1) + " has shape " + Arrays.toString(layers.get(i).shape())
                                + ", layer 1 has " + Arrays.toString(layerShape));
            }
        }
        int[] shape = new int[layerShape.length + 1];
        shape[0] = layers.size();
        System.arraycopy(layerShape, 0, shape, 1, layerShape.length);
        return shape;
    }

    public List<MfArray> layers() {
        return layers;
    }

    public MfArray layer(int index) {
        return layers.get(index);
    }

    public int layerCount() {
        return layers.size();
    }

    public int[] layerShape() {
        return layers.get(0).shape();
    }

    @Override
    public double[] values() {
        int layerSize = layers.get(0).size();
        double[] values = new double[layerSize * layers.size()];
        for (int i = 0; i < layers.size(); i++) {
            System.arraycopy(layers.get(i).values(), 0, values, i * layerSize, layerSize);
        }
        return values;
    }

    /** The representation shared by all layers; {@link ArrayHow#INTERNAL} when they differ. */
    @Override
    public ArrayHow how() {
        ArrayHow first = layers.get(0).how();
        for (MfArray layer : layers) {
            if (layer.how() != first) {
                return ArrayHow.INTERNAL;
            }
        }
        return first;
    }

    @Override
    public LayeredArray map(DoubleUnaryOperator op) {
        List<MfArray> mapped = new ArrayList<>(layers.size());
        for (MfArray layer : layers) {
            mapped.add(checked(layer, layer.map(op)));
        }
        return new LayeredArray(mapped);
    }

    @Override
    public LayeredArray scale(double factor) {
        List<MfArray> scaled = new ArrayList<>(layers.size());
        for (MfArray layer : layers) {
            scaled.add(checked(layer, layer.scale(factor)));
        }
        return new LayeredArray(scaled);
    }

    @Override
    public LayeredArray combine(MfArray other, DoubleBinaryOperator op) {
        requireSameShape(other);
        int[] layerShape = layerShape();
        int layerSize = layers.get(0).size();
        double[] others = other.values();
        List<MfArray> combined = new ArrayList<>(layers.size());
        for (int i = 0; i < layers.size(); i++) {
            MfArray layer = layers.get(i);
            MfArray operand = other instanceof LayeredArray
                    ? ((LayeredArray) other).layer(i)
                    : InternalArray.of(layerShape, Arrays.copyOfRange(others, i * layerSize, (i + 1) * layerSize));
            combined.add(checked(layer, layer.combine(operand, op)));
        }
        return new LayeredArray(combined);
    }

    private static MfArray checked(MfArray before, MfArray after) {
        if (!Arrays.equals(before.shape(), after.shape())) {
            throw new ArrayShapeException(
                    "Layer operation changed shape " + Arrays.toString(before.shape()) + " to "
                            + Arrays.toString(after.shape()));
        }
        return after;
    }

    @Override
    public String toString() {
        return "LayeredArray" + Arrays.toString(shape()) + " " + layers;
    }
}
