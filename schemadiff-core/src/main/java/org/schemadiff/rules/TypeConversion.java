package org.schemadiff.rules;

public enum TypeConversion {
    /** every old value is representable in the new type */
    WIDENING,
    /** some old values are lost or truncated */
    NARROWING,
    /** the types are unrelated */
    INCOMPATIBLE
}
