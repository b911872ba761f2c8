package com.modflow.mf6io.io.decode;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable settings of a {@link Mf6Decoder}. Each {@code with...} method returns a modified copy.
 */
public final class DecodeOptions {
    private static final DecodeOptions DEFAULTS = new DecodeOptions(Path.of(""), false, new RowTableReader());

    private final Path baseDirectory;
    private final boolean failOnUnknownParameter;
    private final TableReader tableReader;

    private DecodeOptions(Path baseDirectory, boolean failOnUnknownParameter, TableReader tableReader) {
        this.baseDirectory = baseDirectory;
        this.failOnUnknownParameter = failOnUnknownParameter;
        this.tableReader = tableReader;
    }

    /** Working-directory relative paths, unknown parameters skipped, tables read row by row. */
    public static DecodeOptions defaults() {
        return DEFAULTS;
    }

    /** Directory that {@code OPEN/CLOSE} file names are resolved against. */
    public DecodeOptions withBaseDirectory(Path value) {
        return new DecodeOptions(Objects.requireNonNull(value, "baseDirectory"), failOnUnknownParameter, tableReader);
    }

    /** Raise {@link UnknownParameterException} instead of skipping undeclared blocks and parameters. */
    public DecodeOptions withFailOnUnknownParameter(boolean value) {
        return new DecodeOptions(baseDirectory, value, tableReader);
    }

    public DecodeOptions withTableReader(TableReader value) {
        return new DecodeOptions(baseDirectory, failOnUnknownParameter, Objects.requireNonNull(value, "tableReader"));
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }

    public boolean isFailOnUnknownParameter() {
        return failOnUnknownParameter;
    }

    public TableReader getTableReader() {
        return tableReader;
    }

    @Override
    public String toString() {
        return "DecodeOptions{baseDirectory=" + baseDirectory
                + ", failOnUnknownParameter=" + failOnUnknownParameter
                + ", tableReader=" + tableReader.getClass().getSimpleName() + '}';
    }
}
