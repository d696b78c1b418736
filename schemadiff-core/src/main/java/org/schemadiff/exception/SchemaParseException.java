package org.schemadiff.exception;

/**
 * Schema text is not a well-formed document of its declared format.
 */
public class SchemaParseException extends SchemaDiffException {

    public SchemaParseException(String message) {
        super(message);
    }

    public SchemaParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
