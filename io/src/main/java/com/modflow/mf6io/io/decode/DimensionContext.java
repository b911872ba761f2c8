package com.modflow.mf6io.io.decode;

import com.modflow.mf6io.spec.Shape;
import com.modflow.mf6io.spec.SourceLocation;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable lookup of named dimensions ({@code nlay}, {@code nodes}, ...) used to resolve
 * symbolic shapes while decoding. A context is extended by deriving a child, so values resolved
 * while decoding one file never leak into the caller's context or into a sibling decode.
 */
public final class DimensionContext {
    public static final DimensionContext EMPTY = new DimensionContext(null, Map.of());

    private final DimensionContext parent;
    private final Map<String, Integer> values;

    private DimensionContext(DimensionContext parent, Map<String, Integer> values) {
        this.parent = parent;
        this.values = values;
    }

    public static DimensionContext of(Map<String, Integer> values) {
        return EMPTY.withAll(values);
    }

    public DimensionContext with(String name, int value) {
        return new DimensionContext(this, Map.of(name.toLowerCase(Locale.ROOT), value));
    }

    public DimensionContext withAll(Map<String, Integer> added) {
        if (added.isEmpty()) {
            return this;
        }
        Map<String, Integer> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : added.entrySet()) {
            copy.put(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue());
        }
        return new DimensionContext(this, Collections.unmodifiableMap(copy));
    }

    /** The innermost value bound to the name, ignoring case, or {@code null}. */
    public Integer lookup(String name) {
        String key = name.toLowerCase(Locale.ROOT);
        for (DimensionContext scope = this; scope != null; scope = scope.parent) {
            Integer value = scope.values.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public boolean contains(String name) {
        return lookup(name) != null;
    }

    /** All visible bindings, inner scopes overriding outer ones. */
    public Map<String, Integer> asMap() {
        Map<String, Integer> flat = parent == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parent.asMap());
        flat.putAll(values);
        return flat;
    }

    /**
     * Resolves the first alternative of a shape whose dimensions are all known. Returns
     * {@code null} when none is, including shapes with open-ended dimensions.
     *
     * @throws ArithmeticException if a product dimension does not fit in an {@code int}
     */
    public int[] resolveOrNull(Shape shape) {
        for (List<Shape.Dim> alternative : shape.alternatives()) {
            int[] extents = resolveAlternative(alternative);
            if (extents != null) {
                return extents;
            }
        }
        return null;
    }

    /**
     * Like {@link #resolveOrNull(Shape)} but fails naming the first unknown dimension.
     *
     * @throws UnresolvedDimensionException if no alternative can be resolved
     */
    public int[] resolve(Shape shape, SourceLocation location, String param)
            throws UnresolvedDimensionException, ShapeMismatchException {
        int[] extents = resolveIfKnown(shape, location, param);
        if (extents != null) {
            return extents;
        }
        String missing = shape.toString();
        if (!shape.isEmpty()) {
            for (Shape.Dim dim : shape.alternatives().get(0)) {
                if (dim.isOpenEnded()) {
                    missing = dim.toString();
                    break;
                }
                String unknown = firstUnknown(dim);
                if (unknown != null) {
                    missing = unknown;
                    break;
                }
            }
        }
        throw new UnresolvedDimensionException(
                "Cannot resolve dimension '" + missing + "' of shape " + shape + " for '" + param + "'",
                location,
                param);
    }

    /**
     * Like {@link #resolveOrNull(Shape)} but checks the extents it finds: none may be negative and
     * their product must fit in an {@code int}.
     *
     * @throws ShapeMismatchException if the resolved shape cannot describe an array
     */
    public int[] resolveIfKnown(Shape shape, SourceLocation location, String param) throws ShapeMismatchException {
        int[] extents;
        try {
            extents = resolveOrNull(shape);
            if (extents == null) {
                return null;
            }
            int size = 1;
            for (int extent : extents) {
                size = Math.multiplyExact(size, extent);
            }
        } catch (ArithmeticException ex) {
            throw new ShapeMismatchException(
                    "Shape " + shape + " of '" + param + "' is too large", location, param, ex);
        }
        for (int extent : extents) {
            if (extent < 0) {
                throw new ShapeMismatchException(
                        "Shape " + shape + " of '" + param + "' resolves to negative extents "
                                + Arrays.toString(extents),
                        location,
                        param);
            }
        }
        return extents;
    }

    private int[] resolveAlternative(List<Shape.Dim> alternative) {
        int[] extents = new int[alternative.size()];
        for (int i = 0; i < extents.length; i++) {
            Shape.Dim dim = alternative.get(i);
            if (dim.literal() != null) {
                extents[i] = dim.literal();
            } else if (dim.isSymbolic()) {
                int product = 1;
                for (String factor : dim.factors()) {
                    Integer value = lookup(factor);
                    if (value == null) {
                        return null;
                    }
                    product = Math.multiplyExact(product, value);
                }
                extents[i] = product;
            } else {
                return null;
            }
        }
        return extents;
    }

    private String firstUnknown(Shape.Dim dim) {
        for (String factor : dim.factors()) {
            if (lookup(factor) == null) {
                return factor;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "DimensionContext" + asMap();
    }
}
