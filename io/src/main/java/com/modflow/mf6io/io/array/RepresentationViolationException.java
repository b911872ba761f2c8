package com.modflow.mf6io.io.array;

/** An operation would break the representation an array value promises, e.g. a non-constant constant array. */
public final class RepresentationViolationException extends RuntimeException {
    public RepresentationViolationException(String message) {
        super(message);
    }
}
