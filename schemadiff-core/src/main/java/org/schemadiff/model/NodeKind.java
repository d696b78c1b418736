package org.schemadiff.model;

public enum NodeKind {
    SCALAR,
    OBJECT,
    ARRAY,
    UNION,
    REFERENCE
}
