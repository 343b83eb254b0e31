package com.enterprise.bulkload.sql.param;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

class SqlLiteralFormatterTest {

    @Test
    void string() {
        assertThat(SqlLiteralFormatter.format("hello")).isEqualTo("'hello'");
    }

    @Test
    void stringWithQuotes() {
        assertThat(SqlLiteralFormatter.format("it's")).isEqualTo("'it''s'");
    }

    @Test
    void longValue() {
        assertThat(SqlLiteralFormatter.format(42L)).isEqualTo("42");
    }

    @Test
    void bigDecimalScientific() {
        // 1E+3 should render as 1000, not scientific notation
        assertThat(SqlLiteralFormatter.format(new BigDecimal("1E+3"))).isEqualTo("1000");
    }

    @Test
    void booleansAreIntegers() {
        assertThat(SqlLiteralFormatter.format(true)).isEqualTo("1");
        assertThat(SqlLiteralFormatter.format(false)).isEqualTo("0");
    }

    @Test
    void nullIsSqlNull() {
        assertThat(SqlLiteralFormatter.format(null)).isEqualTo("NULL");
    }

    @Test
    void blobAsHex() {
        assertThat(SqlLiteralFormatter.format(new byte[] {0x0A, (byte) 0xFF})).isEqualTo("X'0AFF'");
    }

    @Test
    void otherTypesAsText() {
        // SQLite has no date type; dates are stored as ISO text
        assertThat(SqlLiteralFormatter.format(LocalDate.of(2024, 3, 15))).isEqualTo("'2024-03-15'");
    }
}
