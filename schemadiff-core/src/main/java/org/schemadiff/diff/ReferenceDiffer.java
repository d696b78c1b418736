package org.schemadiff.diff;

import org.schemadiff.model.Change;
import org.schemadiff.model.ChangeKind;
import org.schemadiff.model.ReferenceNode;

public class ReferenceDiffer implements NodeDiffer {

    @Override
    public void diff(NodePair pair, DiffContext context) {
        ReferenceNode oldRef = pair.oldAs(ReferenceNode.class);
        ReferenceNode newRef = pair.newAs(ReferenceNode.class);
        if (oldRef.getTarget().equals(newRef.getTarget())) {
            return;
        }
        context.emit(Change.builder()
                .location(pair.oldPath())
                .newLocation(pair.newPath())
                .kind(ChangeKind.TYPE_CHANGED)
                .description("Reference changed from " + oldRef.getTarget() + " to " + newRef.getTarget())
                .detail(Change.OLD_TYPE, oldRef.describe())
                .detail(Change.NEW_TYPE, newRef.describe())
                .oldNode(oldRef)
                .newNode(newRef)
                .build());
    }
}
