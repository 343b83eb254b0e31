package com.enterprise.bulkload.sql.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class EngineVersionTest {

    @Test
    void parsesFullVersion() {
        assertThat(EngineVersion.parse("3.45.3")).isEqualTo(new EngineVersion(3, 45, 3));
    }

    @Test
    void missingPartsAreZero() {
        assertThat(EngineVersion.parse("3.35")).isEqualTo(new EngineVersion(3, 35, 0));
        assertThat(EngineVersion.parse("3")).isEqualTo(new EngineVersion(3, 0, 0));
    }

    @Test
    void garbageIsZero() {
        assertThat(EngineVersion.parse(null)).isEqualTo(EngineVersion.ZERO);
        assertThat(EngineVersion.parse("abc")).isEqualTo(EngineVersion.ZERO);
        assertThat(EngineVersion.parse("3.x.1")).isEqualTo(new EngineVersion(3, 0, 1));
    }

    @Test
    void leadingDigitsOfEachPartCount() {
        assertThat(EngineVersion.parse("3.39.4-beta")).isEqualTo(new EngineVersion(3, 39, 4));
    }

    @Test
    void comparesLexicographicallyByPart() {
        EngineVersion min = Dialects.SQLITE_RETURNING_SINCE;
        assertThat(EngineVersion.parse("3.35.0").isAtLeast(min)).isTrue();
        assertThat(EngineVersion.parse("3.34.9").isAtLeast(min)).isFalse();
        assertThat(EngineVersion.parse("3.100.0").isAtLeast(min)).isTrue();
        assertThat(EngineVersion.parse("4.0.0").isAtLeast(min)).isTrue();
        assertThat(EngineVersion.parse("2.99.99").isAtLeast(min)).isFalse();
    }

    @Test
    void toStringIsDotted() {
        assertThat(new EngineVersion(3, 35, 0)).hasToString("3.35.0");
    }
}
