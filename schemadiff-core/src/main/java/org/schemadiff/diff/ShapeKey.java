package org.schemadiff.diff;

import org.schemadiff.model.ArrayNode;
import org.schemadiff.model.NodeKind;
import org.schemadiff.model.ReferenceNode;
import org.schemadiff.model.ScalarNode;
import org.schemadiff.model.SchemaNode;

/**
 * Coarse structural signature used to pair union alternatives that are not equal.
 */
record ShapeKey(NodeKind kind, String discriminator) {

    static ShapeKey of(SchemaNode node) {
        String discriminator = switch (node.getKind()) {
            case SCALAR -> ((ScalarNode) node).getPrimitive().name();
            case REFERENCE -> ((ReferenceNode) node).getTarget();
            case ARRAY -> ((ArrayNode) node).getElement().getKind().name();
            case OBJECT, UNION -> "";
        };
        return new ShapeKey(node.getKind(), discriminator);
    }
}
