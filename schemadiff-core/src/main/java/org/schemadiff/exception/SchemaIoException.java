package org.schemadiff.exception;

import java.io.IOException;

public class SchemaIoException extends SchemaDiffException {

    public SchemaIoException(String message, IOException cause) {
        super(message, cause);
    }
}
