package org.schemadiff.diff;

import org.schemadiff.exception.ComparisonException;
import org.schemadiff.model.Change;
import org.schemadiff.model.ChangeKind;
import org.schemadiff.model.ObjectNode;
import org.schemadiff.model.SchemaNode;
import org.schemadiff.model.SchemaPath;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

public class ObjectDiffer implements NodeDiffer {

    @Override
    public void diff(NodePair pair, DiffContext context) throws ComparisonException {
        ObjectNode oldObject = pair.oldAs(ObjectNode.class);
        ObjectNode newObject = pair.newAs(ObjectNode.class);
        Map<String, SchemaNode> oldFields = oldObject.getFields();
        Map<String, SchemaNode> newFields = newObject.getFields();

        Map<String, String> matches = MemberMatcher.match(oldFields, newFields);
        Set<String> matchedNew = new HashSet<>(matches.values());

        for (Map.Entry<String, SchemaNode> entry : oldFields.entrySet()) {
            String oldName = entry.getKey();
            SchemaNode oldChild = entry.getValue();
            SchemaPath oldPath = pair.oldPath().child(oldName);
            String newName = matches.get(oldName);

            if (newName == null) {
                boolean required = oldObject.isRequired(oldName);
                context.emit(Change.builder()
                        .location(oldPath)
                        .kind(ChangeKind.REMOVED)
                        .description("Removed " + (required ? "required " : "") + "member '" + oldName
                                + "' (" + oldChild.describe() + ")")
                        .detail(Change.REQUIRED, String.valueOf(required))
                        .oldNode(oldChild)
                        .build());
                continue;
            }

            SchemaNode newChild = newFields.get(newName);
            SchemaPath newPath = pair.newPath().child(newName);

            if (!oldName.equals(newName)) {
                Change.ChangeBuilder renamed = Change.builder()
                        .location(oldPath)
                        .newLocation(newPath)
                        .kind(ChangeKind.RENAMED)
                        .description("Renamed '" + oldName + "' to '" + newName + "'")
                        .detail(Change.OLD_NAME, oldName)
                        .detail(Change.NEW_NAME, newName)
                        .oldNode(oldChild)
                        .newNode(newChild);
                if (oldChild.getMetadata().hasIdentity()) {
                    renamed.detail(Change.IDENTITY, oldChild.getMetadata().getIdentity());
                }
                context.emit(renamed.build());
            }

            boolean requiredBefore = oldObject.isRequired(oldName);
            boolean requiredAfter = newObject.isRequired(newName);
            if (requiredBefore != requiredAfter) {
                context.emit(Change.builder()
                        .location(oldPath)
                        .newLocation(newPath)
                        .kind(ChangeKind.REQUIREDNESS_CHANGED)
                        .description("'" + newName + "' changed from " + label(requiredBefore) + " to " + label(requiredAfter))
                        .detail(Change.REQUIRED_BEFORE, String.valueOf(requiredBefore))
                        .detail(Change.REQUIRED_AFTER, String.valueOf(requiredAfter))
                        .oldNode(oldChild)
                        .newNode(newChild)
                        .build());
            }

            context.compare(NodePair.of(oldChild, newChild, oldPath, newPath));
        }

        for (Map.Entry<String, SchemaNode> entry : newFields.entrySet()) {
            String newName = entry.getKey();
            if (matchedNew.contains(newName)) continue;
            SchemaNode newChild = entry.getValue();
            boolean required = newObject.isRequired(newName);
            SchemaPath newPath = pair.newPath().child(newName);
            context.emit(Change.builder()
                    .location(newPath)
                    .newLocation(newPath)
                    .kind(ChangeKind.ADDED)
                    .description("Added " + (required ? "required " : "optional ") + "member '" + newName
                            + "' (" + newChild.describe() + ")")
                    .detail(Change.REQUIRED, String.valueOf(required))
                    .newNode(newChild)
                    .build());
        }
    }

    private static String label(boolean required) {
        return required ? "required" : "optional";
    }
}
