package org.schemadiff.diff;

import org.schemadiff.exception.ComparisonException;
import org.schemadiff.model.Change;
import org.schemadiff.model.ChangeKind;
import org.schemadiff.model.SchemaPath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * State of a single diff run: collected changes, the depth limit and the recursion
 * entry point handed to every {@link NodeDiffer}.
 */
public class DiffContext {

    private final SchemaDiffer differ;
    private final int maxDepth;
    private final List<Change> changes = new ArrayList<>();
    private final Set<String> seen = new HashSet<>();

    DiffContext(SchemaDiffer differ, int maxDepth) {
        this.differ = differ;
        this.maxDepth = maxDepth;
    }

    public void compare(NodePair pair) throws ComparisonException {
        if (pair.oldPath().depth() > maxDepth || pair.newPath().depth() > maxDepth) {
            throw new ComparisonException("Schema nesting exceeds the maximum depth of " + maxDepth
                    + " at " + pair.oldPath());
        }
        differ.compareNodes(pair, this);
    }

    public void emit(Change change) {
        String key = change.getLocation() + "#" + change.getKind();
        if (!seen.add(key)) {
            throw new IllegalStateException("Duplicate change " + change.getKind() + " at " + change.getLocation());
        }
        changes.add(change);
    }

    public boolean hasChange(SchemaPath location, ChangeKind kind) {
        return seen.contains(location + "#" + kind);
    }

    public List<Change> changes() {
        return Collections.unmodifiableList(changes);
    }
}
