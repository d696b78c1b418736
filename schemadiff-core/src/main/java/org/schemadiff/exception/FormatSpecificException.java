package org.schemadiff.exception;

import lombok.Getter;
import org.schemadiff.model.SchemaFormat;

/**
 * Wraps a failure reported by a format's own library (Jackson, JSqlParser, protobuf).
 */
@Getter
public class FormatSpecificException extends SchemaParseException {

    private final SchemaFormat format;

    public FormatSpecificException(SchemaFormat format, String message, Throwable cause) {
        super("[" + format.getId() + "] " + message, cause);
        this.format = format;
    }
}
