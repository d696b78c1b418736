package org.schemadiff.diff;

import org.schemadiff.exception.ComparisonException;

/**
 * Compares two nodes of the same {@link org.schemadiff.model.NodeKind}.
 */
@FunctionalInterface
public interface NodeDiffer {
    void diff(NodePair pair, DiffContext context) throws ComparisonException;
}
