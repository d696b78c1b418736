package org.schemadiff.rules;

import lombok.extern.slf4j.Slf4j;
import org.schemadiff.exception.InvalidFormatException;
import org.schemadiff.format.FormatAdapter;
import org.schemadiff.format.FormatRegistry;
import org.schemadiff.model.Change;
import org.schemadiff.model.CompatibilityIssue;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.SchemaNode;
import org.schemadiff.model.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns a severity to every change using the rule table of the schema's format.
 */
@Slf4j
public class CompatibilityRuleSet {

    private final Map<SchemaFormat, RuleTable> tables;

    public CompatibilityRuleSet(Map<SchemaFormat, RuleTable> tables) {
        Map<SchemaFormat, RuleTable> copy = new EnumMap<>(SchemaFormat.class);
        copy.putAll(tables);
        this.tables = Collections.unmodifiableMap(copy);
    }

    public static CompatibilityRuleSet from(FormatRegistry registry) {
        Map<SchemaFormat, RuleTable> tables = new EnumMap<>(SchemaFormat.class);
        for (FormatAdapter adapter : registry.adapters()) {
            tables.put(adapter.format(), adapter.ruleTable());
        }
        return new CompatibilityRuleSet(tables);
    }

    public RuleTable tableFor(SchemaFormat format) throws InvalidFormatException {
        RuleTable table = tables.get(format);
        if (table == null) {
            throw new InvalidFormatException("No compatibility rules registered for format: " + format);
        }
        return table;
    }

    public Classification classify(SchemaFormat format, List<Change> changes, SchemaNode oldRoot, SchemaNode newRoot)
            throws InvalidFormatException {
        RuleTable table = tableFor(format);
        RuleContext context = new RuleContext(format, oldRoot, newRoot, changes);

        List<Change> classified = new ArrayList<>(changes.size());
        List<CompatibilityIssue> issues = new ArrayList<>();
        for (Change change : changes) {
            Verdict verdict = table.classify(change, context);
            Change result = change.withSeverity(verdict.severity());
            classified.add(result);
            if (verdict.severity() != Severity.INFO) {
                issues.add(CompatibilityIssue.of(result, verdict.reason(), verdict.hint()));
            }
        }
        log.debug("Classified {} change(s) for {}: {} issue(s)", classified.size(), format, issues.size());
        return new Classification(classified, issues);
    }
}
