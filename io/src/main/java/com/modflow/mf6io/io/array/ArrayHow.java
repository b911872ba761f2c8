package com.modflow.mf6io.io.array;

/** How an array is written in an input file. */
public enum ArrayHow {
    CONSTANT,
    INTERNAL,
    EXTERNAL
}
