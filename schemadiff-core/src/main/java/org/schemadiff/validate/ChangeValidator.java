package org.schemadiff.validate;

import lombok.extern.slf4j.Slf4j;
import org.schemadiff.exception.InvalidFormatException;
import org.schemadiff.model.Change;
import org.schemadiff.model.ChangeKind;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.SchemaPath;
import org.schemadiff.model.Severity;
import org.schemadiff.rules.CompatibilityRuleSet;
import org.schemadiff.rules.RuleContext;
import org.schemadiff.rules.RuleTable;
import org.schemadiff.rules.Verdict;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Checks an externally supplied change set for internal consistency.
 * <p>
 * Only the changes are available, not the schemas they came from, so the rule set
 * sees a detached context and decides from change details alone.
 */
@Slf4j
public class ChangeValidator {

    public static final String TOTAL = "total";

    private final CompatibilityRuleSet ruleSet;

    public ChangeValidator(CompatibilityRuleSet ruleSet) {
        this.ruleSet = Objects.requireNonNull(ruleSet, "ruleSet must not be null");
    }

    public ValidationResult validate(SchemaFormat format, List<Change> changes) throws InvalidFormatException {
        return validate(format, ruleSet.tableFor(format), changes);
    }

    /**
     * Validates against the format-neutral default rules.
     */
    public ValidationResult validate(List<Change> changes) {
        return validate(null, RuleTable.generic(), changes);
    }

    private ValidationResult validate(SchemaFormat format, RuleTable table, List<Change> changes) {
        RuleContext context = RuleContext.detached(format, changes);
        ValidationResult.ValidationResultBuilder result = ValidationResult.builder();
        Set<String> seen = new HashSet<>();
        Map<ChangeKind, Integer> counts = new EnumMap<>(ChangeKind.class);
        int errors = 0;

        for (Change change : changes) {
            counts.merge(change.getKind(), 1, Integer::sum);
            SchemaPath location = change.getLocation();

            if (!seen.add(location + "\u0000" + change.getKind())) {
                result.error(error(ValidationError.Code.DUPLICATE_CHANGE,
                        "Duplicate " + change.getKind() + " change at " + location, change));
                errors++;
            }

            if (!change.isClassified()) {
                result.error(error(ValidationError.Code.UNCLASSIFIED,
                        "Change at " + location + " has no severity", change));
                errors++;
                continue;
            }

            if (change.isBreaking() != (change.getSeverity() == Severity.BREAKING)) {
                result.error(error(ValidationError.Code.INCONSISTENT_BREAKING_FLAG,
                        "Change at " + location + " is " + change.getSeverity() + " but breaking=" + change.isBreaking(), change));
                errors++;
            }

            Verdict verdict = table.classify(change, context);
            if (verdict.severity() == Severity.BREAKING && change.getSeverity() != Severity.BREAKING) {
                result.error(error(ValidationError.Code.SEVERITY_UNDERSTATED,
                        "Change at " + location + " is marked " + change.getSeverity()
                                + " but is breaking: " + verdict.reason(), change));
                errors++;
            }
        }

        TreeMap<String, String> summary = new TreeMap<>();
        counts.forEach((kind, count) -> summary.put(kind.name(), String.valueOf(count)));
        summary.put(TOTAL, String.valueOf(changes.size()));
        log.debug("Validated {} change(s): {} error(s)", changes.size(), errors);
        return result.valid(errors == 0).context(summary).build();
    }

    private static ValidationError error(ValidationError.Code code, String message, Change change) {
        return ValidationError.builder()
                .code(code)
                .message(message)
                .location(change.getLocation())
                .kind(change.getKind())
                .build();
    }
}
