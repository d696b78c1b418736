package org.schemadiff.model;

/**
 * Format-neutral classification of scalar values.
 */
public enum PrimitiveKind {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    BYTES,
    NULL,
    ANY
}
