package com.modflow.mf6io.io.parse;

import java.util.regex.Pattern;

/**
 * Locale-neutral number parsing for input tokens. Accepts Fortran double precision exponents
 * ({@code 1.0d-3}) and rejects the special values and suffixes {@link Double#parseDouble} would let
 * through ({@code NaN}, {@code Infinity}, {@code 1f}, hex literals).
 */
public final class NumberParser {
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern REAL =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eEdD][+-]?\\d+)?");

    private NumberParser() {}

    public static boolean isInteger(String text) {
        return text != null && INTEGER.matcher(text.trim()).matches();
    }

    public static boolean isNumber(String text) {
        return text != null && REAL.matcher(text.trim()).matches();
    }

    /** @throws NumberFormatException if the text is not an integer or does not fit in an int */
    public static int parseInt(String text) {
        if (!isInteger(text)) {
            throw new NumberFormatException("Not an integer: " + text);
        }
        String trimmed = text.trim();
        return Integer.parseInt(trimmed.startsWith("+") ? trimmed.substring(1) : trimmed);
    }

    /** @throws NumberFormatException if the text is not a plain decimal or exponent number */
    public static double parseDouble(String text) {
        if (!isNumber(text)) {
            throw new NumberFormatException("Not a number: " + text);
        }
        return Double.parseDouble(text.trim().replace('d', 'e').replace('D', 'e'));
    }
}
