package org.schemadiff.exception;

/**
 * Two schemas cannot be compared (different formats, incompatible roots, runaway nesting).
 */
public class ComparisonException extends SchemaDiffException {

    public ComparisonException(String message) {
        super(message);
    }
}
