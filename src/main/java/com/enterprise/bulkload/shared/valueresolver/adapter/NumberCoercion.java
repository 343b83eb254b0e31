package com.enterprise.bulkload.shared.valueresolver.adapter;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Lenient number parsing shared by typed literals and the NUMBER transform.
 */
public final class NumberCoercion {

    private NumberCoercion() {}

    // ASCII whitespace, Unicode space separators (NBSP included), BOM, line/paragraph separators
    private static final Pattern EDGE_WHITESPACE =
            Pattern.compile("^[\\s\\p{Zs}\\uFEFF\\u2028\\u2029]+|[\\s\\p{Zs}\\uFEFF\\u2028\\u2029]+$");

    /**
     * Removes leading and trailing whitespace, including the non-breaking space
     * and byte order mark that {@link String#strip()} keeps.
     */
    public static String trim(String text) {
        return EDGE_WHITESPACE.matcher(text).replaceAll("");
    }

    /**
     * Numbers pass through, booleans become 1/0, text is trimmed and parsed.
     * Integral values that fit come back as {@link Long}, the rest as {@link Double}.
     *
     * @return the number, or {@code null} for null, blank or non-numeric input
     */
    public static Number coerce(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n;
        }
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        return parse(value.toString());
    }

    public static Number parse(String text) {
        if (text == null) {
            return null;
        }
        String s = trim(text);
        if (s.isEmpty()) {
            return null;
        }
        BigDecimal bd;
        try {
            bd = new BigDecimal(s);
        } catch (NumberFormatException e) {
            return null;
        }
        if (bd.signum() == 0) {
            return 0L;
        }
        BigDecimal stripped = bd.stripTrailingZeros();
        if (stripped.scale() <= 0 && stripped.precision() - stripped.scale() <= 18) {
            return stripped.longValueExact();
        }
        return bd.doubleValue();
    }
}
