package org.schemadiff.format.protobuf;

import org.schemadiff.migration.MigrationInstruction;
import org.schemadiff.model.ArrayNode;
import org.schemadiff.model.Change;
import org.schemadiff.model.ObjectNode;
import org.schemadiff.model.ReferenceNode;
import org.schemadiff.model.ScalarNode;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.SchemaNode;
import org.schemadiff.model.SchemaPath;

/**
 * Renders steps as edits to the {@code .proto} source.
 */
final class ProtoRenderer {

    private ProtoRenderer() {
    }

    static String render(MigrationInstruction instruction) {
        SchemaPath path = instruction.getEffectiveLocation();
        Change change = instruction.getChange();
        if (path.depth() <= 1) {
            return renderTopLevel(instruction, path);
        }

        String scope = "In " + kindOf(instruction) + " " + path.segments().get(0) + ": ";
        String field = "field `" + path.segments().get(1) + "`" + nestedSuffix(path);
        return scope + switch (instruction.getOperation()) {
            case ADD -> "add field `" + declaration(path.leaf(), instruction.getNewNode(), change.flag(Change.REQUIRED)) + "`";
            case DROP -> "remove " + field + reservation(instruction);
            case RENAME -> "rename field `" + instruction.getLocation().leaf() + "` to `"
                    + instruction.getTargetLocation().leaf() + "`" + numberSuffix(instruction.getOldNode());
            case ALTER_TYPE -> "change type of " + field + " from " + change.detail(Change.OLD_TYPE).orElse("?")
                    + " to " + change.detail(Change.NEW_TYPE).orElse("?");
            case MAKE_REQUIRED -> "mark " + field + " as required";
            case MAKE_OPTIONAL -> "mark " + field + " as optional";
            case TIGHTEN, LOOSEN, UPDATE -> "update " + field + ": " + change.getDescription();
        };
    }

    private static String renderTopLevel(MigrationInstruction instruction, SchemaPath path) {
        String name = path.isRoot() ? "file" : kindOf(instruction) + " " + path.leaf();
        return switch (instruction.getOperation()) {
            case ADD -> "Add " + name;
            case DROP -> "Remove " + name;
            case RENAME -> "Rename " + kindOf(instruction) + " " + instruction.getLocation().leaf()
                    + " to " + instruction.getTargetLocation().leaf();
            case ALTER_TYPE -> "Replace " + name + " (" + instruction.getChange().getDescription() + ")";
            case TIGHTEN, LOOSEN, UPDATE, MAKE_REQUIRED, MAKE_OPTIONAL ->
                    "Update " + name + ": " + instruction.getChange().getDescription();
        };
    }

    private static String kindOf(MigrationInstruction instruction) {
        if (instruction.getEffectiveLocation().depth() > 1) {
            return ProtoNormalizer.KIND_MESSAGE;
        }
        SchemaNode node = instruction.getNewNode() != null ? instruction.getNewNode() : instruction.getOldNode();
        if (node == null) {
            return ProtoNormalizer.KIND_MESSAGE;
        }
        return node.getMetadata().attribute(SchemaFormat.PROTOBUF, ProtoNormalizer.KIND).orElse(ProtoNormalizer.KIND_MESSAGE);
    }

    private static String nestedSuffix(SchemaPath path) {
        return path.depth() > 2 ? " (at " + path + ")" : "";
    }

    private static String reservation(MigrationInstruction instruction) {
        SchemaNode oldNode = instruction.getOldNode();
        if (instruction.getLocation().depth() != 2 || oldNode == null || !oldNode.getMetadata().hasIdentity()) {
            return "";
        }
        return " and add `reserved " + oldNode.getMetadata().getIdentity() + "; reserved \""
                + instruction.getLocation().leaf() + "\";`";
    }

    private static String numberSuffix(SchemaNode node) {
        return node != null && node.getMetadata().hasIdentity()
                ? " (number " + node.getMetadata().getIdentity() + " unchanged)"
                : "";
    }

    static String declaration(String name, SchemaNode node, boolean required) {
        if (node == null) {
            return name;
        }
        String label = node.getMetadata().attribute(SchemaFormat.PROTOBUF, ProtoNormalizer.LABEL)
                .filter(l -> !"repeated".equals(l))
                .orElse(required ? "required" : null);
        String number = node.getMetadata().hasIdentity() ? " = " + node.getMetadata().getIdentity() : "";
        return (label != null ? label + " " : "") + typeOf(node) + " " + name + number + ";";
    }

    private static String typeOf(SchemaNode node) {
        if (node instanceof ArrayNode array) {
            if (node.getMetadata().flag(SchemaFormat.PROTOBUF, ProtoNormalizer.MAP)
                    && array.getElement() instanceof ObjectNode entry) {
                return "map<" + typeOf(entry.getFields().get("key")) + ", " + typeOf(entry.getFields().get("value")) + ">";
            }
            return "repeated " + typeOf(array.getElement());
        }
        if (node instanceof ReferenceNode reference) {
            return reference.getTarget();
        }
        if (node instanceof ScalarNode scalar) {
            return scalar.getTypeName();
        }
        return node.describe();
    }
}
