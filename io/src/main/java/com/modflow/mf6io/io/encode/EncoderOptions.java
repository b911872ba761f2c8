package com.modflow.mf6io.io.encode;

/**
 * Layout of encoded text. Parameter lines are indented one unit, array control lines two and
 * array data three.
 */
public final class EncoderOptions {
    private static final EncoderOptions DEFAULTS = new EncoderOptions("  ", " ");

    private final String indent;
    private final String separator;

    private EncoderOptions(String indent, String separator) {
        this.indent = indent;
        this.separator = separator;
    }

    public static EncoderOptions defaults() {
        return DEFAULTS;
    }

    /** @throws IllegalArgumentException unless the unit is made of blanks and tabs only */
    public EncoderOptions withIndent(String value) {
        if (value == null || !value.matches("[ \t]*")) {
            throw new IllegalArgumentException("Indent must consist of blanks and tabs: '" + value + "'");
        }
        return new EncoderOptions(value, separator);
    }

    /** @throws IllegalArgumentException unless the separator is blanks, tabs and at most one comma */
    public EncoderOptions withSeparator(String value) {
        if (value == null || value.isEmpty() || !value.matches("[ \t]*,?[ \t]*")) {
            throw new IllegalArgumentException("Separator must be blanks or a comma: '" + value + "'");
        }
        return new EncoderOptions(indent, value);
    }

    public String getIndent() {
        return indent;
    }

    public String getSeparator() {
        return separator;
    }

    @Override
    public String toString() {
        return "EncoderOptions{indent='" + indent + "', separator='" + separator + "'}";
    }
}
