package org.schemadiff.model;

/**
 * Ordered from most to least severe.
 */
public enum Severity {
    BREAKING,
    WARNING,
    INFO;

    public boolean isMoreSevereThan(Severity other) {
        return this.ordinal() < other.ordinal();
    }
}
