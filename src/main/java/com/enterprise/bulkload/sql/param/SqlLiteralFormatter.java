package com.enterprise.bulkload.sql.param;

import java.math.BigDecimal;
import java.util.HexFormat;

/**
 * Converts Java values to SQLite literals. Used only to render statements for
 * diagnostics; execution always binds parameters.
 */
public final class SqlLiteralFormatter {

    private SqlLiteralFormatter() {}

    public static String format(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof String s) {
            return "'" + s.replace("'", "''") + "'";
        }
        if (value instanceof BigDecimal bd) {
            return bd.toPlainString();
        }
        if (value instanceof Number n) {
            return n.toString();
        }
        if (value instanceof Boolean b) {
            return b ? "1" : "0";
        }
        if (value instanceof byte[] bytes) {
            return "X'" + HexFormat.of().withUpperCase().formatHex(bytes) + "'";
        }
        return format(value.toString());
    }
}
