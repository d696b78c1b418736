package org.schemadiff.model;

public enum ChangeKind {
    ADDED,
    REMOVED,
    TYPE_CHANGED,
    CONSTRAINT_TIGHTENED,
    CONSTRAINT_LOOSENED,
    REQUIREDNESS_CHANGED,
    RENAMED,
    OTHER
}
