package org.schemadiff.exception;

/**
 * Schema bytes are not valid text in the expected charset.
 */
public class EncodingException extends SchemaDiffException {

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
