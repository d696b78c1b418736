package org.schemadiff.migration;

import lombok.Getter;
import org.schemadiff.model.Change;

@Getter
public enum MigrationOperation {
    DROP(MigrationPhase.DROP),
    RENAME(MigrationPhase.RENAME),
    ALTER_TYPE(MigrationPhase.ALTER),
    TIGHTEN(MigrationPhase.ALTER),
    LOOSEN(MigrationPhase.ALTER),
    MAKE_OPTIONAL(MigrationPhase.ALTER),
    UPDATE(MigrationPhase.ALTER),
    ADD(MigrationPhase.ADD),
    MAKE_REQUIRED(MigrationPhase.ENFORCE);

    private final MigrationPhase phase;

    MigrationOperation(MigrationPhase phase) {
        this.phase = phase;
    }

    public static MigrationOperation of(Change change) {
        return switch (change.getKind()) {
            case ADDED -> ADD;
            case REMOVED -> DROP;
            case RENAMED -> RENAME;
            case TYPE_CHANGED -> ALTER_TYPE;
            case CONSTRAINT_TIGHTENED -> TIGHTEN;
            case CONSTRAINT_LOOSENED -> LOOSEN;
            case REQUIREDNESS_CHANGED -> change.detail(Change.REQUIRED_AFTER).map(Boolean::parseBoolean).orElse(true)
                    ? MAKE_REQUIRED : MAKE_OPTIONAL;
            case OTHER -> UPDATE;
        };
    }
}
