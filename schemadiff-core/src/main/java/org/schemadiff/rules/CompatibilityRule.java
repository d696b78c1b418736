package org.schemadiff.rules;

import org.schemadiff.model.Change;

import java.util.Optional;

/**
 * A single classification rule. Returning empty hands the change to the next rule.
 */
@FunctionalInterface
public interface CompatibilityRule {
    Optional<Verdict> evaluate(Change change, RuleContext context);
}
