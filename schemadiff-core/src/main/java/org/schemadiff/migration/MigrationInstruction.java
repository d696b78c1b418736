package org.schemadiff.migration;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.schemadiff.model.Change;
import org.schemadiff.model.SchemaNode;
import org.schemadiff.model.SchemaPath;

/**
 * Format-neutral description of one migration step, handed to a format adapter for
 * rendering.
 * <p>
 * {@code location} names the member in the old schema, {@code targetLocation} in the
 * new one. Steps in the {@link MigrationPhase#DROP} phase run before renames and
 * address members by their old names; every later phase uses the new names.
 */
@Value
@Builder
public class MigrationInstruction {

    @NonNull
    MigrationOperation operation;

    @NonNull
    SchemaPath location;

    @NonNull
    SchemaPath targetLocation;

    SchemaNode oldNode;

    SchemaNode newNode;

    @NonNull
    Change change;

    public static MigrationInstruction of(Change change) {
        return MigrationInstruction.builder()
                .operation(MigrationOperation.of(change))
                .location(change.getLocation())
                .targetLocation(change.getTargetLocation())
                .oldNode(change.getOldNode())
                .newNode(change.getNewNode())
                .change(change)
                .build();
    }

    public MigrationPhase getPhase() {
        return operation.getPhase();
    }

    /**
     * Path to use when rendering: old names before renames, new names afterwards.
     */
    public SchemaPath getEffectiveLocation() {
        return getPhase() == MigrationPhase.DROP ? location : targetLocation;
    }
}
