package org.schemadiff.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.schemadiff.exception.FormatSpecificException;
import org.schemadiff.exception.InvalidFormatException;
import org.schemadiff.exception.SchemaDiffException;
import org.schemadiff.exception.SchemaParseException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaTest {

    @Test
    void of_validJsonSchema() throws SchemaDiffException {
        Schema schema = Schema.of(SchemaFormat.JSON_SCHEMA, "{\"type\":\"object\"}", "1.0.0");

        assertThat(schema.getFormat()).isEqualTo(SchemaFormat.JSON_SCHEMA);
        assertThat(schema.getVersion()).isEqualTo(SchemaVersion.of(1, 0, 0));
        assertThat(schema.toString()).contains("json-schema@1.0.0");
    }

    @Test
    @DisplayName("빈 내용은 거부한다")
    void of_blankContent_rejected() {
        assertThatThrownBy(() -> Schema.of(SchemaFormat.SQL_DDL, "   ", "1.0.0"))
                .isInstanceOf(SchemaParseException.class)
                .hasMessageContaining("must not be empty");
    }

    @Test
    @DisplayName("형식에 맞지 않는 문법은 생성 시점에 거부한다")
    void of_invalidSyntax_rejected() {
        assertThatThrownBy(() -> Schema.of(SchemaFormat.JSON_SCHEMA, "{\"type\": ", "1.0.0"))
                .isInstanceOf(FormatSpecificException.class)
                .hasMessageStartingWith("[json-schema]");
    }

    @Test
    void of_invalidVersion_rejected() {
        assertThatThrownBy(() -> Schema.of(SchemaFormat.JSON_SCHEMA, "{}", "latest"))
                .isInstanceOf(SchemaParseException.class);
    }

    @Test
    void formatFromName_acceptsAliases() throws InvalidFormatException {
        assertThat(SchemaFormat.fromName("proto3")).isEqualTo(SchemaFormat.PROTOBUF);
        assertThat(SchemaFormat.fromName("Swagger")).isEqualTo(SchemaFormat.OPENAPI);
        assertThat(SchemaFormat.fromName("sql_ddl")).isEqualTo(SchemaFormat.SQL_DDL);
        assertThat(SchemaFormat.fromName("json-schema")).isEqualTo(SchemaFormat.JSON_SCHEMA);
    }

    @Test
    void formatFromName_unknown_rejected() {
        assertThatThrownBy(() -> SchemaFormat.fromName("avro"))
                .isInstanceOf(InvalidFormatException.class)
                .hasMessageContaining("avro");
    }
}
