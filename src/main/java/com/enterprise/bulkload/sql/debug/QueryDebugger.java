package com.enterprise.bulkload.sql.debug;

import com.enterprise.bulkload.sql.builder.InsertStatement;
import com.enterprise.bulkload.sql.param.SqlLiteralFormatter;

/**
 * Debug utility: renders a positional statement with one row's values inlined.
 */
public final class QueryDebugger {

    private QueryDebugger() {}

    /**
     * Replaces each {@code ?} outside quoted text with the matching literal.
     * Surplus placeholders are left untouched.
     */
    public static String inline(String sql, Object[] values) {
        StringBuilder sb = new StringBuilder(sql.length() + 16 * values.length);
        int next = 0;
        char quote = 0;
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                sb.append(c);
            } else if (c == '\'' || c == '"') {
                quote = c;
                sb.append(c);
            } else if (c == '?' && next < values.length) {
                sb.append(SqlLiteralFormatter.format(values[next++]));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String format(InsertStatement statement, Object[] values) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Bulk Statement Debug ===\n");
        sb.append("SQL (positional):\n  ").append(statement.sql()).append("\n");
        sb.append("SQL (values inlined):\n  ").append(inline(statement.sql(), values)).append("\n");
        sb.append("Parameters (").append(values.length).append("):\n");
        for (int i = 0; i < values.length; i++) {
            Object val = values[i];
            String name = i < statement.columns().size() ? statement.columns().get(i) : "?" + (i + 1);
            String typeName = val != null ? val.getClass().getSimpleName() : "null";
            sb.append("  ").append(name).append(" = ").append(val)
              .append(" (").append(typeName).append(")\n");
        }
        sb.append("============================");
        return sb.toString();
    }
}
