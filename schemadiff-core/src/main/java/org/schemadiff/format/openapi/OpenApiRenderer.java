package org.schemadiff.format.openapi;

import org.schemadiff.migration.MigrationInstruction;
import org.schemadiff.model.Change;
import org.schemadiff.model.SchemaNode;

/**
 * Renders steps as short editing instructions against the API description.
 */
final class OpenApiRenderer {

    private OpenApiRenderer() {
    }

    static String render(MigrationInstruction instruction) {
        Change change = instruction.getChange();
        String where = ApiLocation.describe(instruction.getEffectiveLocation());
        return switch (instruction.getOperation()) {
            case ADD -> "Add " + where + " (" + describe(instruction.getNewNode())
                    + (change.flag(Change.REQUIRED) ? ", required" : "") + ")";
            case DROP -> "Remove " + where;
            case RENAME -> "Rename " + ApiLocation.describe(instruction.getTargetLocation().parent()
                    .child(instruction.getLocation().leaf())) + " to '" + instruction.getTargetLocation().leaf() + "'";
            case ALTER_TYPE -> "Change type of " + where + " from " + change.detail(Change.OLD_TYPE).orElse("?")
                    + " to " + change.detail(Change.NEW_TYPE).orElse("?");
            case TIGHTEN, LOOSEN, UPDATE -> "Update " + where + ": " + change.getDescription();
            case MAKE_REQUIRED -> "Mark " + where + " as required";
            case MAKE_OPTIONAL -> "Mark " + where + " as optional";
        };
    }

    private static String describe(SchemaNode node) {
        return node == null ? "unknown" : node.describe();
    }
}
