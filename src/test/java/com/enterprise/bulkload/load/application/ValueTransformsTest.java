package com.enterprise.bulkload.load.application;

import com.enterprise.bulkload.load.domain.TransformKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.enterprise.bulkload.load.application.ValueTransforms.apply;
import static org.assertj.core.api.Assertions.*;

class ValueTransformsTest {

    private static final List<Object> ODD_INPUTS = Arrays.asList(
            null, "", "   ", "N/A", "abc", 0, -1, 1.5d, Double.NaN, true, false,
            new BigDecimal("1E+400"), Map.of("k", "v"), List.of(1, 2), new Object(), new byte[] {1});

    @ParameterizedTest
    @EnumSource(TransformKind.class)
    void everyTransformIsTotal(TransformKind kind) {
        for (Object input : ODD_INPUTS) {
            assertThatCode(() -> apply(input, kind)).doesNotThrowAnyException();
        }
    }

    @ParameterizedTest
    @EnumSource(value = TransformKind.class, names = {"TRIM", "UPPER", "LOWER", "NULL_IF_BLANK", "NUMBER", "STRING"})
    void nullStaysNull(TransformKind kind) {
        assertThat(apply(null, kind)).isNull();
    }

    @Test
    void stringCaseAndTrim() {
        assertThat(apply("  Mixed Case ", TransformKind.TRIM)).isEqualTo("Mixed Case");
        assertThat(apply("istanbul", TransformKind.UPPER)).isEqualTo("ISTANBUL");
        assertThat(apply("A@B.COM", TransformKind.LOWER)).isEqualTo("a@b.com");
        assertThat(apply(12, TransformKind.UPPER)).isEqualTo("12");
    }

    @Test
    void nullIfBlank() {
        assertThat(apply("", TransformKind.NULL_IF_BLANK)).isNull();
        assertThat(apply("  ", TransformKind.NULL_IF_BLANK)).isNull();
        assertThat(apply("na", TransformKind.NULL_IF_BLANK)).isNull();
        assertThat(apply(" N/A ", TransformKind.NULL_IF_BLANK)).isNull();
        assertThat(apply("NAN", TransformKind.NULL_IF_BLANK)).isEqualTo("NAN");
        assertThat(apply(0, TransformKind.NULL_IF_BLANK)).isEqualTo(0);
    }

    @Test
    void nonBreakingSpaceAndByteOrderMarkCountAsWhitespace() {
        assertThat(apply("\u00A0\u00A0", TransformKind.NULL_IF_BLANK)).isNull();
        assertThat(apply("\uFEFF N/A\u00A0", TransformKind.NULL_IF_BLANK)).isNull();
        assertThat(apply("\u00A0Ada\uFEFF", TransformKind.TRIM)).isEqualTo("Ada");
        assertThat(apply("\u00A012\u00A0", TransformKind.NUMBER)).isEqualTo(12L);
        assertThat(apply("a\u00A0b", TransformKind.TRIM)).isEqualTo("a\u00A0b");
    }

    @Test
    void booleanToOneOrZero() {
        assertThat(apply(true, TransformKind.BOOLEAN_01)).isEqualTo(1);
        assertThat(apply(1, TransformKind.BOOLEAN_01)).isEqualTo(1);
        assertThat(apply(1.0d, TransformKind.BOOLEAN_01)).isEqualTo(1);
        assertThat(apply("TRUE", TransformKind.BOOLEAN_01)).isEqualTo(1);
        assertThat(apply("yes", TransformKind.BOOLEAN_01)).isEqualTo(0);
        assertThat(apply(2, TransformKind.BOOLEAN_01)).isEqualTo(0);
        assertThat(apply(null, TransformKind.BOOLEAN_01)).isEqualTo(0);
    }

    @Test
    void number() {
        assertThat(apply("42", TransformKind.NUMBER)).isEqualTo(42L);
        assertThat(apply(" 3.25 ", TransformKind.NUMBER)).isEqualTo(3.25d);
        assertThat(apply("", TransformKind.NUMBER)).isNull();
        assertThat(apply("x1", TransformKind.NUMBER)).isNull();
        assertThat(apply(true, TransformKind.NUMBER)).isEqualTo(1L);
        assertThat(apply(7, TransformKind.NUMBER)).isEqualTo(7);
    }

    @Test
    void stringAndNone() {
        assertThat(apply(5L, TransformKind.STRING)).isEqualTo("5");
        Object same = new Object();
        assertThat(apply(same, TransformKind.NONE)).isSameAs(same);
    }
}
