package com.enterprise.bulkload.load.application;

import com.enterprise.bulkload.load.domain.TransformKind;
import com.enterprise.bulkload.shared.valueresolver.adapter.NumberCoercion;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Column value normalizations. Every transform is total: null in gives a
 * defined result, and no input makes one throw; unexpected values degrade to null.
 */
public final class ValueTransforms {

    private ValueTransforms() {}

    private static final Pattern NOT_AVAILABLE = Pattern.compile("(?i)N/?A");

    public static Object apply(Object value, TransformKind kind) {
        try {
            return switch (kind) {
                case NONE -> value;
                case TRIM -> value == null ? null : NumberCoercion.trim(value.toString());
                case UPPER -> value == null ? null : value.toString().toUpperCase(Locale.ROOT);
                case LOWER -> value == null ? null : value.toString().toLowerCase(Locale.ROOT);
                case NULL_IF_BLANK -> nullIfBlank(value);
                case BOOLEAN_01 -> booleanTo01(value);
                case NUMBER -> NumberCoercion.coerce(value);
                case STRING -> value == null ? null : value.toString();
            };
        } catch (RuntimeException e) {
            return null;
        }
    }

    private static Object nullIfBlank(Object value) {
        if (value == null) {
            return null;
        }
        String s = NumberCoercion.trim(value.toString());
        if (s.isEmpty() || NOT_AVAILABLE.matcher(s).matches()) {
            return null;
        }
        return value;
    }

    private static int booleanTo01(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        if (value instanceof Number n) {
            return isOne(n) ? 1 : 0;
        }
        return value != null && "true".equalsIgnoreCase(value.toString()) ? 1 : 0;
    }

    private static boolean isOne(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd.compareTo(BigDecimal.ONE) == 0;
        }
        return n.doubleValue() == 1.0d;
    }
}
