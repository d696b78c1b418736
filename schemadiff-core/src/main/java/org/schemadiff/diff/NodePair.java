package org.schemadiff.diff;

import org.schemadiff.model.SchemaNode;
import org.schemadiff.model.SchemaPath;

import java.util.ArrayList;
import java.util.List;

/**
 * Old/new nodes being compared, their paths, and the annotation-level notes collected
 * while comparing them. Notes end up in a single {@code OTHER} change for the pair.
 */
public record NodePair(SchemaNode oldNode, SchemaNode newNode, SchemaPath oldPath, SchemaPath newPath,
                       List<String> notes) {

    public static NodePair of(SchemaNode oldNode, SchemaNode newNode, SchemaPath oldPath, SchemaPath newPath) {
        return new NodePair(oldNode, newNode, oldPath, newPath, new ArrayList<>());
    }

    public <T extends SchemaNode> T oldAs(Class<T> type) {
        return type.cast(oldNode);
    }

    public <T extends SchemaNode> T newAs(Class<T> type) {
        return type.cast(newNode);
    }

    public void note(String note) {
        notes.add(note);
    }
}
