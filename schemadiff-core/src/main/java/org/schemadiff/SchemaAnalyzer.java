package org.schemadiff;

import lombok.extern.slf4j.Slf4j;
import org.schemadiff.config.AnalysisPolicy;
import org.schemadiff.diff.SchemaDiffer;
import org.schemadiff.exception.ComparisonException;
import org.schemadiff.exception.InvalidFormatException;
import org.schemadiff.exception.SchemaDiffException;
import org.schemadiff.format.FormatAdapter;
import org.schemadiff.format.FormatRegistry;
import org.schemadiff.migration.MigrationPlan;
import org.schemadiff.migration.MigrationPlanner;
import org.schemadiff.migration.RenderContext;
import org.schemadiff.model.Change;
import org.schemadiff.model.CompatibilityReport;
import org.schemadiff.model.Schema;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.SchemaNode;
import org.schemadiff.model.Severity;
import org.schemadiff.rules.Classification;
import org.schemadiff.rules.CompatibilityRuleSet;
import org.schemadiff.score.Score;
import org.schemadiff.score.ScoreAggregator;
import org.schemadiff.validate.ChangeValidator;
import org.schemadiff.validate.ValidationResult;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Entry point: compares two versions of a schema, scores the result and plans the
 * migration between them.
 * <p>
 * Instances are immutable and hold no per-call state, so one analyzer can serve
 * concurrent callers.
 */
@Slf4j
public class SchemaAnalyzer {

    public static final String FORMAT = "format";
    public static final String OLD_VERSION = "oldVersion";
    public static final String NEW_VERSION = "newVersion";
    public static final String THRESHOLD = "threshold";
    public static final String OLD_PREFIX = "old.";
    public static final String NEW_PREFIX = "new.";

    private final FormatRegistry registry;
    private final AnalysisPolicy policy;
    private final SchemaDiffer differ;
    private final CompatibilityRuleSet ruleSet;
    private final MigrationPlanner planner;
    private final ChangeValidator validator;

    public SchemaAnalyzer() {
        this(FormatRegistry.defaults(), AnalysisPolicy.defaults());
    }

    public SchemaAnalyzer(FormatRegistry registry, AnalysisPolicy policy) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.differ = new SchemaDiffer(policy.getMaxDepth());
        this.ruleSet = CompatibilityRuleSet.from(registry);
        this.planner = new MigrationPlanner(registry);
        this.validator = new ChangeValidator(ruleSet);
    }

    public CompatibilityReport analyzeCompatibility(Schema oldSchema, Schema newSchema) throws SchemaDiffException {
        Analysis analysis = analyze(oldSchema, newSchema);
        SchemaFormat format = analysis.format();

        TreeMap<String, String> metadata = new TreeMap<>();
        metadata.put(FORMAT, format.getId());
        metadata.put(OLD_VERSION, oldSchema.getVersion().toString());
        metadata.put(NEW_VERSION, newSchema.getVersion().toString());
        metadata.put(THRESHOLD, String.valueOf(policy.thresholdFor(format)));
        for (Severity severity : Severity.values()) {
            metadata.put(severity.name().toLowerCase(Locale.ROOT), String.valueOf(analysis.countOf(severity)));
        }
        analysis.oldRoot().getMetadata().attributes(format).forEach((k, v) -> metadata.put(OLD_PREFIX + k, v));
        analysis.newRoot().getMetadata().attributes(format).forEach((k, v) -> metadata.put(NEW_PREFIX + k, v));

        return CompatibilityReport.builder()
                .changes(analysis.classification().changes())
                .issues(analysis.classification().issues())
                .compatibilityScore(analysis.score().value())
                .compatible(analysis.score().compatible())
                .metadata(metadata)
                .build();
    }

    public MigrationPlan generateMigrationPath(Schema oldSchema, Schema newSchema) throws SchemaDiffException {
        Analysis analysis = analyze(oldSchema, newSchema);
        RenderContext context = RenderContext.builder()
                .format(analysis.format())
                .sourceVersion(oldSchema.getVersion())
                .targetVersion(newSchema.getVersion())
                .oldRoot(analysis.oldRoot())
                .newRoot(analysis.newRoot())
                .oldContent(oldSchema.getContent())
                .newContent(newSchema.getContent())
                .build();
        return planner.plan(analysis.classification().changes(), context, analysis.score());
    }

    /**
     * Checks a change set against the default rules, for changes of unknown origin.
     */
    public ValidationResult validateChanges(List<Change> changes) {
        return validator.validate(Objects.requireNonNull(changes, "changes must not be null"));
    }

    public ValidationResult validateChanges(SchemaFormat format, List<Change> changes) throws InvalidFormatException {
        return validator.validate(format, Objects.requireNonNull(changes, "changes must not be null"));
    }

    private Analysis analyze(Schema oldSchema, Schema newSchema) throws SchemaDiffException {
        Objects.requireNonNull(oldSchema, "oldSchema must not be null");
        Objects.requireNonNull(newSchema, "newSchema must not be null");
        if (oldSchema.getFormat() != newSchema.getFormat()) {
            throw new ComparisonException("Cannot compare a " + oldSchema.getFormat().getId()
                    + " schema with a " + newSchema.getFormat().getId() + " schema");
        }

        SchemaFormat format = oldSchema.getFormat();
        FormatAdapter adapter = registry.adapter(format);
        SchemaNode oldRoot = adapter.normalize(oldSchema);
        SchemaNode newRoot = adapter.normalize(newSchema);
        log.debug("Normalized {} schemas {} -> {}", format.getId(), oldSchema.getVersion(), newSchema.getVersion());

        List<Change> changes = differ.diff(oldRoot, newRoot);
        Classification classification = ruleSet.classify(format, changes, oldRoot, newRoot);
        Score score = new ScoreAggregator(policy.scoringFor(format)).aggregate(classification.changes());
        log.debug("Analysis of {} {} -> {}: {} change(s), score {}", format.getId(), oldSchema.getVersion(),
                newSchema.getVersion(), changes.size(), score.value());
        return new Analysis(format, oldRoot, newRoot, classification, score);
    }

    private record Analysis(SchemaFormat format, SchemaNode oldRoot, SchemaNode newRoot,
                            Classification classification, Score score) {

        long countOf(Severity severity) {
            return classification.changes().stream().filter(c -> c.getSeverity() == severity).count();
        }
    }
}
