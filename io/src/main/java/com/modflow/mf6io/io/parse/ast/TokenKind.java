package com.modflow.mf6io.io.parse.ast;

/** Lexical class of a token on an input line. */
public enum TokenKind {
    WORD,
    INTEGER,
    FLOAT,
    QUOTED;

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }
}
