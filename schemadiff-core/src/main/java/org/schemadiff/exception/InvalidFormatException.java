package org.schemadiff.exception;

public class InvalidFormatException extends SchemaDiffException {

    public InvalidFormatException(String message) {
        super(message);
    }
}
