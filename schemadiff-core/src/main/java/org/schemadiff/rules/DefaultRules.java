package org.schemadiff.rules;

import org.schemadiff.diff.UnionDiffer;
import org.schemadiff.model.Change;
import org.schemadiff.model.ChangeKind;
import org.schemadiff.model.NodeMetadata;
import org.schemadiff.model.SchemaNode;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Format-neutral classification shared by every rule table.
 */
final class DefaultRules {

    private DefaultRules() {
    }

    static Map<ChangeKind, CompatibilityRule> create(TypeLattice lattice, boolean deprecationAware) {
        Map<ChangeKind, CompatibilityRule> rules = new EnumMap<>(ChangeKind.class);
        rules.put(ChangeKind.ADDED, DefaultRules::added);
        rules.put(ChangeKind.REMOVED, (change, ctx) -> removed(change, ctx, deprecationAware));
        rules.put(ChangeKind.TYPE_CHANGED, (change, ctx) -> typeChanged(change, lattice));
        rules.put(ChangeKind.CONSTRAINT_TIGHTENED, DefaultRules::tightened);
        rules.put(ChangeKind.CONSTRAINT_LOOSENED, (change, ctx) ->
                Optional.of(Verdict.info("Constraint loosened; every previously valid value is still valid")));
        rules.put(ChangeKind.REQUIREDNESS_CHANGED, DefaultRules::requiredness);
        rules.put(ChangeKind.RENAMED, (change, ctx) -> Optional.of(Verdict.breaking(
                "Member renamed; consumers addressing it by name no longer find it",
                "Keep the old name as a deprecated alias until consumers have moved")));
        rules.put(ChangeKind.OTHER, (change, ctx) -> Optional.of(Verdict.info("Annotation or metadata change")));
        return rules;
    }

    private static Optional<Verdict> added(Change change, RuleContext ctx) {
        if (isAlternative(change)) {
            return Optional.of(Verdict.info("Union alternative added; the set of accepted values grows"));
        }
        if (change.flag(Change.REQUIRED)) {
            return Optional.of(Verdict.breaking(
                    "Required member added; existing producers do not supply it",
                    "Add the member as optional or give it a default value"));
        }
        return Optional.of(Verdict.info("Optional member added"));
    }

    private static Optional<Verdict> removed(Change change, RuleContext ctx, boolean deprecationAware) {
        if (isAlternative(change)) {
            return Optional.of(Verdict.breaking(
                    "Union alternative removed; values of that shape are now rejected",
                    "Keep the alternative until no producer emits it"));
        }
        if (deprecationAware && wasDeprecated(change, ctx)) {
            return Optional.of(Verdict.warning(
                    "Deprecated member removed",
                    "Confirm that no consumer still reads the member"));
        }
        return Optional.of(Verdict.breaking(
                "Member removed; consumers reading it break",
                "Deprecate the member first and remove it in a later major version"));
    }

    private static Optional<Verdict> typeChanged(Change change, TypeLattice lattice) {
        String oldType = change.detail(Change.OLD_TYPE).orElse(null);
        String newType = change.detail(Change.NEW_TYPE).orElse(null);
        return Optional.of(switch (lattice.classify(oldType, newType)) {
            case WIDENING -> Verdict.warning(
                    "Type widened from " + oldType + " to " + newType,
                    "Make sure consumers accept the wider range of values");
            case NARROWING -> Verdict.breaking(
                    "Type narrowed from " + oldType + " to " + newType,
                    "Introduce a new member with the narrower type instead");
            case INCOMPATIBLE -> Verdict.breaking(
                    "Type changed from " + oldType + " to " + newType,
                    "Introduce a new member with the new type instead");
        });
    }

    private static Optional<Verdict> tightened(Change change, RuleContext ctx) {
        if (ctx.isUnderAddedMember(change.getTargetLocation())) {
            return Optional.of(Verdict.info("Constraint on a newly added member"));
        }
        return Optional.of(Verdict.breaking(
                "Constraint tightened; some previously valid values are rejected",
                "Relax the constraint or migrate existing data first"));
    }

    private static Optional<Verdict> requiredness(Change change, RuleContext ctx) {
        // 방향을 알 수 없으면 보수적으로 optional -> required로 본다
        boolean nowRequired = change.detail(Change.REQUIRED_AFTER).map(Boolean::parseBoolean).orElse(true);
        if (nowRequired) {
            return Optional.of(Verdict.breaking(
                    "Member became required; existing producers may omit it",
                    "Keep the member optional or supply a default"));
        }
        return Optional.of(Verdict.warning(
                "Member became optional; consumers may now receive it absent",
                "Make sure consumers handle the missing value"));
    }

    static boolean isAlternative(Change change) {
        return change.flag(UnionDiffer.ALTERNATIVE);
    }

    static boolean wasDeprecated(Change change, RuleContext ctx) {
        if (change.flag(Change.DEPRECATED)) {
            return true;
        }
        SchemaNode oldNode = change.getOldNode();
        if (oldNode == null || ctx.getFormat() == null) {
            return false;
        }
        return oldNode.getMetadata().flag(ctx.getFormat(), NodeMetadata.DEPRECATED);
    }
}
