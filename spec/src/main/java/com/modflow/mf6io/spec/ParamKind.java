package com.modflow.mf6io.spec;

/** What an input parameter holds, derived from the {@code type} and {@code reader} attributes. */
public enum ParamKind {
    KEYWORD,
    INTEGER,
    DOUBLE,
    STRING,
    FILENAME,
    RECORD,
    KEYSTRING,
    ARRAY,
    TABLE;

    public boolean isComposite() {
        return this == RECORD || this == KEYSTRING || this == TABLE;
    }

    /** Kinds that appear as {@code NAME VALUE} on a single line. */
    public boolean isScalar() {
        return this == INTEGER || this == DOUBLE || this == STRING;
    }
}
