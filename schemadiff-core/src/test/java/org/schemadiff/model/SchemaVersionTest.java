package org.schemadiff.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.schemadiff.exception.SchemaParseException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaVersionTest {

    @Test
    void parse_fullVersion() throws SchemaParseException {
        SchemaVersion version = SchemaVersion.parse("1.4.2-rc.1+build.7");

        assertEquals(1, version.major());
        assertEquals(4, version.minor());
        assertEquals(2, version.patch());
        assertEquals("rc.1", version.preRelease());
        assertEquals("build.7", version.build());
        assertTrue(version.isPreRelease());
        assertEquals("1.4.2-rc.1+build.7", version.toString());
    }

    @Test
    void parse_acceptsLeadingV() throws SchemaParseException {
        assertThat(SchemaVersion.parse("v2.0.0")).isEqualTo(SchemaVersion.of(2, 0, 0));
    }

    @ParameterizedTest
    @ValueSource(strings = {"1", "1.2", "1.2.3.4", "01.2.3", "a.b.c", "1.2.3-", ""})
    @DisplayName("semver가 아닌 문자열은 거부한다")
    void parse_rejectsInvalid(String text) {
        assertThatThrownBy(() -> SchemaVersion.parse(text))
                .isInstanceOf(SchemaParseException.class)
                .hasMessageContaining("Invalid semantic version");
    }

    @ParameterizedTest
    @CsvSource({
            "1.0.0, 2.0.0",
            "1.9.0, 1.10.0",
            "1.0.0-alpha, 1.0.0",
            "1.0.0-alpha, 1.0.0-alpha.1",
            "1.0.0-alpha.1, 1.0.0-alpha.beta",
            "1.0.0-beta.2, 1.0.0-beta.11",
            "1.0.0-rc.1, 1.0.0"
    })
    void compareTo_followsSemverPrecedence(String lower, String higher) throws SchemaParseException {
        assertThat(SchemaVersion.parse(lower)).isLessThan(SchemaVersion.parse(higher));
    }

    @Test
    @DisplayName("build metadata는 순서와 동등성에 영향을 주지 않는다")
    void buildMetadata_ignoredByOrdering() throws SchemaParseException {
        SchemaVersion a = SchemaVersion.parse("1.0.0+a");
        SchemaVersion b = SchemaVersion.parse("1.0.0+b");

        assertThat(a).isEqualTo(b);
        assertThat(a.compareTo(b)).isZero();
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
    }

    @Test
    void sort_ordersMixedVersions() throws SchemaParseException {
        List<SchemaVersion> versions = new ArrayList<>(List.of(
                SchemaVersion.parse("1.0.0"),
                SchemaVersion.parse("0.9.0"),
                SchemaVersion.parse("1.0.0-rc.1")));
        Collections.sort(versions);

        assertThat(versions).extracting(SchemaVersion::toString)
                .containsExactly("0.9.0", "1.0.0-rc.1", "1.0.0");
    }

    @Test
    void negativeComponents_rejected() {
        assertThatThrownBy(() -> new SchemaVersion(-1, 0, 0, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
