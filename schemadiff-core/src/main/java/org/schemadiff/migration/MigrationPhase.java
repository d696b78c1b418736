package org.schemadiff.migration;

/**
 * Execution order of migration steps. Destructive steps run before additive ones so
 * a removal never collides with an addition of the same name, and new requirements
 * are enforced only after the members they concern exist.
 */
public enum MigrationPhase {
    DROP,
    RENAME,
    ALTER,
    ADD,
    ENFORCE
}
