package org.schemadiff.cli.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.schemadiff.exception.EncodingException;
import org.schemadiff.exception.InvalidFormatException;
import org.schemadiff.exception.SchemaDiffException;
import org.schemadiff.exception.SchemaIoException;
import org.schemadiff.exception.SchemaParseException;
import org.schemadiff.model.Change;
import org.schemadiff.model.Schema;
import org.schemadiff.model.SchemaFormat;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Service for reading schema and change files and writing command output.
 * Files are decoded strictly as UTF-8.
 */
@Slf4j
public class SchemaIoService {

    private static final Pattern OPENAPI_MARKER = Pattern.compile("\"(openapi|swagger)\"\\s*:");

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Reads a schema file and wraps it as a {@link Schema}.
     *
     * @param file    schema file
     * @param format  format to use, or null to detect it from the file
     * @param version semantic version of the schema
     */
    public Schema loadSchema(Path file, SchemaFormat format, String version) throws SchemaDiffException {
        String content = readText(file);
        SchemaFormat resolved = format != null ? format : detectFormat(file, content);
        log.debug("Loading {} as {} version {}", file, resolved.getId(), version);
        return Schema.of(resolved, content, version);
    }

    /**
     * Picks the format from the file extension. A {@code .json} file is OpenAPI when it
     * declares an {@code openapi} or {@code swagger} version, JSON Schema otherwise.
     */
    public SchemaFormat detectFormat(Path file, String content) throws InvalidFormatException {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        String extension = name.contains(".") ? name.substring(name.lastIndexOf('.') + 1) : "";
        return switch (extension) {
            case "proto", "pbtxt" -> SchemaFormat.PROTOBUF;
            case "sql", "ddl" -> SchemaFormat.SQL_DDL;
            case "yaml", "yml" -> SchemaFormat.OPENAPI;
            case "json" -> OPENAPI_MARKER.matcher(content).find() ? SchemaFormat.OPENAPI : SchemaFormat.JSON_SCHEMA;
            default -> throw new InvalidFormatException("Cannot detect the schema format of " + file
                    + "; pass --format explicitly");
        };
    }

    public List<Change> readChanges(Path file) throws SchemaDiffException {
        String content = readText(file);
        try {
            return objectMapper.readValue(content, new TypeReference<List<Change>>() {});
        } catch (JsonProcessingException e) {
            throw new SchemaParseException("Invalid change list in " + file + ": " + e.getOriginalMessage(), e);
        }
    }

    public String readText(Path file) throws SchemaDiffException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new SchemaIoException("File not found: " + file, e);
        } catch (IOException e) {
            throw new SchemaIoException("Failed to read " + file + ": " + e.getMessage(), e);
        }

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new EncodingException(file + " is not valid UTF-8", e);
        }
    }

    public void writeText(Path file, String content) throws SchemaIoException {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SchemaIoException("Failed to write " + file + ": " + e.getMessage(), e);
        }
    }
}
