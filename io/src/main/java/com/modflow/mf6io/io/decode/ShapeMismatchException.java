package com.modflow.mf6io.io.decode;

import com.modflow.mf6io.spec.Mf6Exception;
import com.modflow.mf6io.spec.SourceLocation;

/** The number of values read does not match the resolved shape of an array, list or table. */
public final class ShapeMismatchException extends Mf6Exception {
    public ShapeMismatchException(String message, SourceLocation location, String offendingText) {
        super(message, location, offendingText);
    }

    public ShapeMismatchException(String message, SourceLocation location, String offendingText, Throwable cause) {
        super(message, location, offendingText, cause);
    }
}
