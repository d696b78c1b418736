package org.schemadiff.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import org.schemadiff.exception.InvalidFormatException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Schema formats understood by the analyzer.
 */
@Getter
public enum SchemaFormat {
    JSON_SCHEMA("json-schema", List.of("jsonschema", "json")),
    OPENAPI("openapi", List.of("swagger", "oas")),
    PROTOBUF("protobuf", List.of("proto", "proto3", "proto2")),
    SQL_DDL("sql", List.of("sql-ddl", "ddl"));

    @JsonValue
    private final String id;
    private final List<String> aliases;

    SchemaFormat(String id, List<String> aliases) {
        this.id = id;
        this.aliases = aliases;
    }

    public static SchemaFormat fromName(String name) throws InvalidFormatException {
        if (name == null || name.isBlank()) {
            throw new InvalidFormatException("Schema format must not be blank");
        }
        String key = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(f -> f.id.equals(key) || f.aliases.contains(key))
                .findFirst()
                .orElseThrow(() -> new InvalidFormatException("Unsupported schema format: " + name));
    }
}
