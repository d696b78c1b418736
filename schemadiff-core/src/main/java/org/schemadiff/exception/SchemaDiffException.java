package org.schemadiff.exception;

/**
 * Base type for every checked failure raised while parsing, comparing or
 * rendering schemas.
 */
public class SchemaDiffException extends Exception {

    public SchemaDiffException(String message) {
        super(message);
    }

    public SchemaDiffException(String message, Throwable cause) {
        super(message, cause);
    }
}
