package org.schemadiff.cli.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.schemadiff.exception.EncodingException;
import org.schemadiff.exception.InvalidFormatException;
import org.schemadiff.exception.SchemaDiffException;
import org.schemadiff.exception.SchemaIoException;
import org.schemadiff.model.Change;
import org.schemadiff.model.ChangeKind;
import org.schemadiff.model.Schema;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.Severity;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaIoServiceTest {

    @TempDir
    Path tempDir;

    private SchemaIoService service;

    @BeforeEach
    void setUp() {
        service = new SchemaIoService();
    }

    @ParameterizedTest
    @CsvSource({
            "order.proto, PROTOBUF",
            "order.pbtxt, PROTOBUF",
            "schema.SQL, SQL_DDL",
            "schema.ddl, SQL_DDL",
            "api.yaml, OPENAPI",
            "api.yml, OPENAPI"
    })
    void detectFormat_byExtension(String fileName, SchemaFormat expected) throws InvalidFormatException {
        assertThat(service.detectFormat(Path.of(fileName), "")).isEqualTo(expected);
    }

    @Test
    @DisplayName(".json 파일은 openapi/swagger 필드 유무로 구분한다")
    void detectFormat_jsonLooksAtContent() throws InvalidFormatException {
        assertThat(service.detectFormat(Path.of("api.json"), "{\"openapi\": \"3.0.0\"}")).isEqualTo(SchemaFormat.OPENAPI);
        assertThat(service.detectFormat(Path.of("api.json"), "{\"swagger\" : \"2.0\"}")).isEqualTo(SchemaFormat.OPENAPI);
        assertThat(service.detectFormat(Path.of("user.json"), "{\"type\": \"object\"}")).isEqualTo(SchemaFormat.JSON_SCHEMA);
    }

    @Test
    void detectFormat_unknownExtension() {
        assertThatThrownBy(() -> service.detectFormat(Path.of("schema.avsc"), "{}"))
                .isInstanceOf(InvalidFormatException.class)
                .hasMessageContaining("--format");
    }

    @Test
    void loadSchema_detectsFormatAndVersion() throws Exception {
        Path file = tempDir.resolve("user.json");
        Files.writeString(file, "{\"type\": \"object\"}");

        Schema schema = service.loadSchema(file, null, "v2.1.0");

        assertThat(schema.getFormat()).isEqualTo(SchemaFormat.JSON_SCHEMA);
        assertThat(schema.getVersion().toString()).isEqualTo("2.1.0");
    }

    @Test
    void readText_rejectsInvalidUtf8() throws IOException {
        Path file = tempDir.resolve("latin1.sql");
        Files.write(file, "CREATE TABLE café (id INT);".getBytes(StandardCharsets.ISO_8859_1));

        assertThatThrownBy(() -> service.readText(file))
                .isInstanceOf(EncodingException.class)
                .hasMessageContaining("is not valid UTF-8");
    }

    @Test
    void readText_missingFile() {
        assertThatThrownBy(() -> service.readText(tempDir.resolve("nope.sql")))
                .isInstanceOf(SchemaIoException.class)
                .hasMessageStartingWith("File not found: ");
    }

    @Test
    void readChanges_parsesExportedChanges() throws Exception {
        Path file = tempDir.resolve("changes.json");
        Files.writeString(file, """
                [{"location": "/a/b", "newLocation": "/a/c", "kind": "RENAMED", "severity": "BREAKING",
                  "breaking": true, "description": "Renamed member 'b' to 'c'",
                  "details": {"oldName": "b", "newName": "c"}}]
                """);

        List<Change> changes = service.readChanges(file);

        assertThat(changes).singleElement().satisfies(change -> {
            assertThat(change.getKind()).isEqualTo(ChangeKind.RENAMED);
            assertThat(change.getSeverity()).isEqualTo(Severity.BREAKING);
            assertThat(change.getTargetLocation().toString()).isEqualTo("/a/c");
            assertThat(change.detail(Change.NEW_NAME)).contains("c");
        });
    }

    @Test
    void writeText_createsParentDirectories() throws SchemaDiffException, IOException {
        Path file = tempDir.resolve("nested/dir/plan.txt");

        service.writeText(file, "1. step");

        assertThat(Files.readString(file)).isEqualTo("1. step");
    }
}
