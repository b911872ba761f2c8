package com.modflow.mf6io.io.array;

/** Element count or layer shapes do not fit the requested array shape. */
public final class ArrayShapeException extends IllegalArgumentException {
    public ArrayShapeException(String message) {
        super(message);
    }
}
