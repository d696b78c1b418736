package org.schemadiff.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.schemadiff.exception.SchemaDiffException;
import org.schemadiff.exception.SchemaParseException;
import org.schemadiff.format.FormatRegistry;

import java.util.Objects;

/**
 * Raw schema text tagged with its format and version. Instances are only created
 * through the factories, which reject blank text and text that is not a
 * syntactically valid document of the declared format.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Schema {

    SchemaFormat format;
    String content;
    SchemaVersion version;

    public static Schema of(SchemaFormat format, String content, String version) throws SchemaDiffException {
        return of(FormatRegistry.defaults(), format, content, SchemaVersion.parse(version));
    }

    public static Schema of(SchemaFormat format, String content, SchemaVersion version) throws SchemaDiffException {
        return of(FormatRegistry.defaults(), format, content, version);
    }

    public static Schema of(FormatRegistry registry, SchemaFormat format, String content, SchemaVersion version)
            throws SchemaDiffException {
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(version, "version must not be null");
        if (content == null || content.isBlank()) {
            throw new SchemaParseException("Schema content must not be empty");
        }
        registry.adapter(format).checkSyntax(content);
        return new Schema(format, content, version);
    }

    @Override
    public String toString() {
        return "Schema{" + format.getId() + "@" + version + ", " + content.length() + " chars}";
    }
}
