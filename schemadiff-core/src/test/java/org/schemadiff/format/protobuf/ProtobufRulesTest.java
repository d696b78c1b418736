package org.schemadiff.format.protobuf;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.schemadiff.SchemaAnalyzer;
import org.schemadiff.exception.SchemaDiffException;
import org.schemadiff.model.Change;
import org.schemadiff.model.CompatibilityReport;
import org.schemadiff.model.ObjectNode;
import org.schemadiff.model.Schema;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.SchemaNode;
import org.schemadiff.model.Severity;
import org.schemadiff.rules.TypeConversion;

import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ProtobufRulesTest {

    private final SchemaAnalyzer analyzer = new SchemaAnalyzer();

    private Map<String, Change> analyze(String before, String after) throws SchemaDiffException {
        CompatibilityReport report = analyzer.analyzeCompatibility(
                Schema.of(SchemaFormat.PROTOBUF, before, "1.0.0"),
                Schema.of(SchemaFormat.PROTOBUF, after, "1.1.0"));
        return report.getChanges().stream()
                .collect(Collectors.toMap(c -> c.getKind() + " " + c.getLocation(), c -> c));
    }

    @ParameterizedTest
    @CsvSource({
            "int32, int64, WIDENING",
            "uint32, uint64, WIDENING",
            "bool, uint32, WIDENING",
            "string, bytes, WIDENING",
            "int64, int32, NARROWING",
            "bytes, string, NARROWING",
            "int32, uint32, NARROWING",
            "fixed64, sfixed64, NARROWING",
            "int32, sint32, INCOMPATIBLE",
            "string, int32, INCOMPATIBLE",
            "float, double, INCOMPATIBLE"
    })
    void lattice(String oldType, String newType, TypeConversion expected) {
        assertEquals(expected, ProtobufRules.lattice().classify(oldType, newType));
    }

    @Test
    @DisplayName("번호를 재사용하면서 타입을 바꾸면 Breaking")
    void numberReusedWithNewType_isBreaking() throws SchemaDiffException {
        Map<String, Change> changes = analyze(
                "syntax = \"proto3\"; message M { int32 count = 1; }",
                "syntax = \"proto3\"; message M { int64 total = 1; }");

        assertEquals(Severity.WARNING, changes.get("RENAMED /M/count").getSeverity());
        Change typeChange = changes.get("TYPE_CHANGED /M/count");
        assertEquals(Severity.BREAKING, typeChange.getSeverity());
        assertThat(typeChange.getDescription()).isNotBlank();
    }

    @Test
    void addedOnReservedNumber_isBreaking() throws SchemaDiffException {
        Map<String, Change> changes = analyze(
                "syntax = \"proto3\"; message M { reserved 2 to 4; int32 a = 1; }",
                "syntax = \"proto3\"; message M { reserved 2 to 4; int32 a = 1; string b = 3; }");

        assertEquals(Severity.BREAKING, changes.get("ADDED /M/b").getSeverity());
    }

    @Test
    void removedWithReservedName_isWarning() throws SchemaDiffException {
        Map<String, Change> changes = analyze(
                "syntax = \"proto3\"; message M { int32 a = 1; int32 b = 2; }",
                "syntax = \"proto3\"; message M { reserved \"b\"; int32 a = 1; }");

        assertEquals(Severity.WARNING, changes.get("REMOVED /M/b").getSeverity());
    }

    @Test
    void removedDeprecatedField_isWarning() throws SchemaDiffException {
        Map<String, Change> changes = analyze(
                "syntax = \"proto3\"; message M { int32 a = 1; int32 b = 2 [deprecated = true]; }",
                "syntax = \"proto3\"; message M { int32 a = 1; }");

        assertEquals(Severity.WARNING, changes.get("REMOVED /M/b").getSeverity());
    }

    @Test
    void requiredBecomingOptional_isBreaking() throws SchemaDiffException {
        Map<String, Change> changes = analyze(
                "syntax = \"proto2\"; message M { required string id = 1; }",
                "syntax = \"proto2\"; message M { optional string id = 1; }");

        assertEquals(Severity.BREAKING, changes.get("REQUIREDNESS_CHANGED /M/id").getSeverity());
    }

    @Test
    void renumberedField_isRemovedAndAdded() throws SchemaDiffException {
        Map<String, Change> changes = analyze(
                "syntax = \"proto3\"; message M { string id = 1; }",
                "syntax = \"proto3\"; message M { string id = 2; }");

        assertThat(changes.keySet()).containsExactlyInAnyOrder("REMOVED /M/id", "ADDED /M/id");
        assertEquals(Severity.BREAKING, changes.get("REMOVED /M/id").getSeverity());
    }

    @Test
    void isReservedNumber_readsRanges() throws SchemaDiffException {
        SchemaNode message = ((ObjectNode) new ProtobufAdapter().normalize(Schema.of(SchemaFormat.PROTOBUF,
                "syntax = \"proto3\"; message M { reserved 5, 10 to 12; }", "1.0.0"))).getFields().get("M");

        assertThat(ProtobufRules.isReservedNumber(message, 5)).isTrue();
        assertThat(ProtobufRules.isReservedNumber(message, 11)).isTrue();
        assertThat(ProtobufRules.isReservedNumber(message, 13)).isFalse();
        assertThat(ProtobufRules.isReservedName(message, "x")).isFalse();
    }
}
