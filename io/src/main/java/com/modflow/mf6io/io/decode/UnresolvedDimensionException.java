package com.modflow.mf6io.io.decode;

import com.modflow.mf6io.spec.Mf6Exception;
import com.modflow.mf6io.spec.SourceLocation;

/** A symbolic dimension of a shape is not defined in the decode context. */
public final class UnresolvedDimensionException extends Mf6Exception {
    public UnresolvedDimensionException(String message, SourceLocation location, String offendingText) {
        super(message, location, offendingText);
    }
}
