package com.modflow.mf6io.io.decode;

import com.modflow.mf6io.spec.Mf6Exception;
import com.modflow.mf6io.spec.SourceLocation;

/** The input names a block or parameter its specification does not declare. */
public final class UnknownParameterException extends Mf6Exception {
    public UnknownParameterException(String message, SourceLocation location, String offendingText) {
        super(message, location, offendingText);
    }
}
