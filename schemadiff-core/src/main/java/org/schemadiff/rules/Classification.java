package org.schemadiff.rules;

import org.schemadiff.model.Change;
import org.schemadiff.model.CompatibilityIssue;

import java.util.List;

/**
 * Classified changes in diff order and the issues raised for the Breaking and Warning ones.
 */
public record Classification(List<Change> changes, List<CompatibilityIssue> issues) {

    public Classification {
        changes = List.copyOf(changes);
        issues = List.copyOf(issues);
    }
}
