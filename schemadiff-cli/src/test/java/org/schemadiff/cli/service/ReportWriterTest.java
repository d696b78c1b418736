package org.schemadiff.cli.service;

import org.junit.jupiter.api.Test;
import org.schemadiff.migration.MigrationOperation;
import org.schemadiff.migration.MigrationPhase;
import org.schemadiff.migration.MigrationPlan;
import org.schemadiff.migration.MigrationStep;
import org.schemadiff.model.Change;
import org.schemadiff.model.ChangeKind;
import org.schemadiff.model.CompatibilityIssue;
import org.schemadiff.model.CompatibilityReport;
import org.schemadiff.model.SchemaPath;
import org.schemadiff.model.Severity;
import org.schemadiff.validate.ValidationError;
import org.schemadiff.validate.ValidationResult;

import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;

class ReportWriterTest {

    private final ReportWriter writer = new ReportWriter();

    @Test
    void toText_reportWithoutChanges() {
        TreeMap<String, String> metadata = new TreeMap<>();
        metadata.put("threshold", "70");
        metadata.put("oldVersion", "1.0.0");
        metadata.put("newVersion", "1.0.1");
        metadata.put("format", "protobuf");
        CompatibilityReport report = CompatibilityReport.builder()
                .compatibilityScore(100)
                .compatible(true)
                .metadata(metadata)
                .build();

        assertThat(writer.toText(report)).isEqualTo("""
                Compatible (score 100, threshold 70)
                   1.0.0 -> 1.0.1 [protobuf]
                No changes detected.""");
    }

    @Test
    void toText_reportListsChangesAndIssues() {
        Change removed = Change.builder()
                .location(SchemaPath.of("user", "email"))
                .kind(ChangeKind.REMOVED)
                .description("Removed member 'email'")
                .build()
                .withSeverity(Severity.BREAKING);
        CompatibilityReport report = CompatibilityReport.builder()
                .change(removed)
                .issue(CompatibilityIssue.builder()
                        .location(removed.getLocation())
                        .severity(Severity.BREAKING)
                        .description("Removed member 'email': consumers lose the field")
                        .hint("Deprecate it first")
                        .build())
                .compatibilityScore(85)
                .compatible(false)
                .build();

        String text = writer.toText(report);

        assertThat(text).startsWith("Incompatible (score 85, threshold ?)");
        assertThat(text).contains("BREAKING REMOVED").contains("/user/email  Removed member 'email'");
        assertThat(text).contains("  - [BREAKING] Removed member 'email': consumers lose the field\n      hint: Deprecate it first");
    }

    @Test
    void toText_planNumbersSteps() {
        MigrationPlan plan = MigrationPlan.builder()
                .step(MigrationStep.builder()
                        .order(1)
                        .phase(MigrationPhase.DROP)
                        .operation(MigrationOperation.DROP)
                        .location(SchemaPath.of("t", "c"))
                        .severity(Severity.WARNING)
                        .instruction("ALTER TABLE t DROP COLUMN c;")
                        .build())
                .build();

        assertThat(writer.toText(plan)).isEqualTo("  1. [DROP] ALTER TABLE t DROP COLUMN c;");
    }

    @Test
    void toText_validationResult() {
        ValidationResult result = ValidationResult.builder()
                .valid(false)
                .error(ValidationError.builder()
                        .code(ValidationError.Code.DUPLICATE_CHANGE)
                        .message("Duplicate REMOVED change at /a")
                        .build())
                .build();

        assertThat(writer.toText(result)).isEqualTo("""
                Change set is invalid (0 change(s))
                  - DUPLICATE_CHANGE: Duplicate REMOVED change at /a""");
    }

    @Test
    void toJson_omitsNullsAndComputedProperties() {
        Change change = Change.builder()
                .location(SchemaPath.of("a"))
                .kind(ChangeKind.ADDED)
                .description("Added member 'a'")
                .build();

        String json = writer.toJson(change);

        assertThat(json).contains("\"location\" : \"/a\"").contains("\"kind\" : \"ADDED\"");
        assertThat(json).doesNotContain("severity").doesNotContain("targetLocation").doesNotContain("classified");
    }
}
