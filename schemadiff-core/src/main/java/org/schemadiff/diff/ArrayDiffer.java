package org.schemadiff.diff;

import org.schemadiff.exception.ComparisonException;
import org.schemadiff.model.ArrayNode;
import org.schemadiff.model.Constraint;

public class ArrayDiffer implements NodeDiffer {

    @Override
    public void diff(NodePair pair, DiffContext context) throws ComparisonException {
        ArrayNode oldArray = pair.oldAs(ArrayNode.class);
        ArrayNode newArray = pair.newAs(ArrayNode.class);

        ConstraintChanges constraints = new ConstraintChanges();
        constraints.record("minItems", oldArray.getMinItems(), newArray.getMinItems(),
                BoundComparison.compare(Constraint.Direction.LOWER_BOUND, oldArray.getMinItems(), newArray.getMinItems()), pair);
        constraints.record("maxItems", oldArray.getMaxItems(), newArray.getMaxItems(),
                BoundComparison.compare(Constraint.Direction.UPPER_BOUND, oldArray.getMaxItems(), newArray.getMaxItems()), pair);
        constraints.emit(pair, context);

        context.compare(NodePair.of(oldArray.getElement(), newArray.getElement(),
                pair.oldPath().element(), pair.newPath().element()));
    }
}
