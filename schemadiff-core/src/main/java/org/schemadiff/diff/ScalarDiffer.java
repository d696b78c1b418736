package org.schemadiff.diff;

import org.schemadiff.model.Change;
import org.schemadiff.model.ChangeKind;
import org.schemadiff.model.Constraint;
import org.schemadiff.model.ScalarNode;

public class ScalarDiffer implements NodeDiffer {

    private static final String OLD_PRIMITIVE = "oldPrimitive";
    private static final String NEW_PRIMITIVE = "newPrimitive";

    @Override
    public void diff(NodePair pair, DiffContext context) {
        ScalarNode oldScalar = pair.oldAs(ScalarNode.class);
        ScalarNode newScalar = pair.newAs(ScalarNode.class);

        boolean primitiveChanged = oldScalar.getPrimitive() != newScalar.getPrimitive();
        if (primitiveChanged || !oldScalar.getTypeName().equals(newScalar.getTypeName())) {
            context.emit(Change.builder()
                    .location(pair.oldPath())
                    .newLocation(pair.newPath())
                    .kind(ChangeKind.TYPE_CHANGED)
                    .description("Type changed from " + oldScalar.getTypeName() + " to " + newScalar.getTypeName())
                    .detail(Change.OLD_TYPE, oldScalar.getTypeName())
                    .detail(Change.NEW_TYPE, newScalar.getTypeName())
                    .detail(OLD_PRIMITIVE, oldScalar.getPrimitive().name())
                    .detail(NEW_PRIMITIVE, newScalar.getPrimitive().name())
                    .oldNode(oldScalar)
                    .newNode(newScalar)
                    .build());
        }

        // 타입 계열이 바뀌면 bound 비교는 의미가 없다
        if (primitiveChanged) {
            return;
        }

        ConstraintChanges constraints = new ConstraintChanges();
        for (Constraint constraint : Constraint.values()) {
            Object before = oldScalar.getConstraints().get(constraint);
            Object after = newScalar.getConstraints().get(constraint);
            constraints.record(constraint.getKey(), before, after,
                    BoundComparison.compare(constraint.getDirection(), before, after), pair);
        }
        constraints.emit(pair, context);
    }
}
