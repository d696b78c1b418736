package org.schemadiff.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class AnalyzeCommandTest extends CliTestSupport {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        captureOutput();
    }

    @AfterEach
    void tearDown() {
        restoreOutput();
    }

    @Test
    @DisplayName("호환되는 변경은 exit code 0")
    void compatibleChange_exitsZero() throws Exception {
        Path oldFile = write(tempDir, "user-v1.json", USER_V1);
        Path newFile = write(tempDir, "user-v2.json", USER_V2_ADDITIVE);

        int exitCode = new CommandLine(new AnalyzeCommand()).execute(
                "--old", oldFile.toString(), "--new", newFile.toString(),
                "--old-version", "1.0.0", "--new-version", "1.1.0");

        assertThat(exitCode).isEqualTo(SchemaDiffCli.EXIT_OK);
        assertThat(out())
                .contains("Compatible (score 100, threshold 70)")
                .contains("1.0.0 -> 1.1.0 [json-schema]")
                .contains("ADDED")
                .contains("/email");
    }

    @Test
    @DisplayName("Breaking 변경은 exit code 2와 issue 목록을 출력한다")
    void breakingChange_exitsIncompatible() throws Exception {
        Path oldFile = write(tempDir, "user-v1.json", USER_V1);
        Path newFile = write(tempDir, "user-v2.json", USER_V2_BREAKING);

        int exitCode = new CommandLine(new AnalyzeCommand()).execute(
                "--old", oldFile.toString(), "--new", newFile.toString());

        assertThat(exitCode).isEqualTo(SchemaDiffCli.EXIT_INCOMPATIBLE);
        assertThat(out())
                .contains("Incompatible (score 85, threshold 70)")
                .contains("Issues:")
                .contains("hint: ");
    }

    @Test
    void jsonOutput_isAReadableReport() throws Exception {
        Path oldFile = write(tempDir, "user-v1.json", USER_V1);
        Path newFile = write(tempDir, "user-v2.json", USER_V2_BREAKING);

        int exitCode = new CommandLine(new AnalyzeCommand()).execute(
                "--old", oldFile.toString(), "--new", newFile.toString(), "--json");

        assertThat(exitCode).isEqualTo(SchemaDiffCli.EXIT_INCOMPATIBLE);
        JsonNode report = new ObjectMapper().readTree(out());
        assertThat(report.get("compatibilityScore").asInt()).isEqualTo(85);
        assertThat(report.get("compatible").asBoolean()).isFalse();
        assertThat(report.get("changes").get(0).get("location").asText()).isEqualTo("/name");
        assertThat(report.get("changes").get(0).get("severity").asText()).isEqualTo("BREAKING");
        assertThat(report.get("metadata").get("format").asText()).isEqualTo("json-schema");
    }

    @Test
    void explicitFormat_overridesExtension() throws Exception {
        Path oldFile = write(tempDir, "old.txt", "CREATE TABLE t (id INT);");
        Path newFile = write(tempDir, "new.txt", "CREATE TABLE t (id BIGINT);");

        int exitCode = new CommandLine(new AnalyzeCommand()).execute(
                "--old", oldFile.toString(), "--new", newFile.toString(), "--format", "sql");

        assertThat(exitCode).isEqualTo(SchemaDiffCli.EXIT_OK);
        assertThat(out()).contains("[sql]").contains("TYPE_CHANGED");
    }

    @Test
    void undetectableFormat_failsWithHint() throws Exception {
        Path oldFile = write(tempDir, "old.txt", USER_V1);
        Path newFile = write(tempDir, "new.txt", USER_V1);

        int exitCode = new CommandLine(new AnalyzeCommand()).execute(
                "--old", oldFile.toString(), "--new", newFile.toString());

        assertThat(exitCode).isEqualTo(SchemaDiffCli.EXIT_ERROR);
        assertThat(err()).contains("Analysis failed: Cannot detect the schema format").contains("--format");
    }

    @Test
    void missingFile_fails() throws Exception {
        Path oldFile = write(tempDir, "user-v1.json", USER_V1);

        int exitCode = new CommandLine(new AnalyzeCommand()).execute(
                "--old", oldFile.toString(), "--new", tempDir.resolve("missing.json").toString());

        assertThat(exitCode).isEqualTo(SchemaDiffCli.EXIT_ERROR);
        assertThat(err()).contains("Analysis failed: File not found");
    }

    @Test
    void invalidVersion_fails() throws Exception {
        Path oldFile = write(tempDir, "user-v1.json", USER_V1);

        int exitCode = new CommandLine(new AnalyzeCommand()).execute(
                "--old", oldFile.toString(), "--new", oldFile.toString(), "--new-version", "one");

        assertThat(exitCode).isEqualTo(SchemaDiffCli.EXIT_ERROR);
        assertThat(err()).startsWith("Analysis failed: ");
    }
}
