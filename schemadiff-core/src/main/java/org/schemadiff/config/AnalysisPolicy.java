package org.schemadiff.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.schemadiff.exception.InvalidFormatException;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.options.SchemaDiffOptions;
import org.schemadiff.score.ScoringPolicy;

import java.util.Map;

/**
 * Everything an analysis run can be tuned with. Passed explicitly to the analyzer;
 * nothing here is global.
 */
@Slf4j
@Value
@Builder(toBuilder = true)
public class AnalysisPolicy {

    @Builder.Default
    ScoringPolicy scoring = ScoringPolicy.defaults();

    @Builder.Default
    int maxDepth = SchemaDiffOptions.Diff.MAX_DEPTH_DEFAULT;

    /**
     * Threshold overrides per format. Formats not listed use {@code scoring.threshold}.
     */
    @Singular
    Map<SchemaFormat, Integer> formatThresholds;

    public static AnalysisPolicy defaults() {
        return builder().build();
    }

    public int thresholdFor(SchemaFormat format) {
        return formatThresholds.getOrDefault(format, scoring.getThreshold());
    }

    public ScoringPolicy scoringFor(SchemaFormat format) {
        return scoring.withThreshold(thresholdFor(format));
    }

    /**
     * Builds a policy from the flat key/value map produced by {@link ConfigurationLoader}.
     * Unparseable or out-of-range values fall back to their defaults.
     */
    public static AnalysisPolicy fromOptions(Map<String, String> options) {
        ScoringPolicy scoring = ScoringPolicy.builder()
                .threshold(intOption(options, SchemaDiffOptions.Score.THRESHOLD_KEY,
                        SchemaDiffOptions.Score.THRESHOLD_DEFAULT, 0, 100))
                .breakingPenalty(doubleOption(options, SchemaDiffOptions.Score.BREAKING_PENALTY_KEY,
                        SchemaDiffOptions.Score.BREAKING_PENALTY_DEFAULT, 0, 100))
                .warningPenalty(doubleOption(options, SchemaDiffOptions.Score.WARNING_PENALTY_KEY,
                        SchemaDiffOptions.Score.WARNING_PENALTY_DEFAULT, 0, 100))
                .infoPenalty(doubleOption(options, SchemaDiffOptions.Score.INFO_PENALTY_KEY,
                        SchemaDiffOptions.Score.INFO_PENALTY_DEFAULT, 0, 100))
                .repeatDecay(doubleOption(options, SchemaDiffOptions.Score.REPEAT_DECAY_KEY,
                        SchemaDiffOptions.Score.REPEAT_DECAY_DEFAULT, Double.MIN_VALUE, 1))
                .build();

        AnalysisPolicyBuilder builder = builder()
                .scoring(scoring)
                .maxDepth(intOption(options, SchemaDiffOptions.Diff.MAX_DEPTH_KEY,
                        SchemaDiffOptions.Diff.MAX_DEPTH_DEFAULT, 1, Integer.MAX_VALUE));

        options.forEach((key, value) -> {
            if (!key.startsWith(SchemaDiffOptions.Threshold.PREFIX)) return;
            String formatName = key.substring(SchemaDiffOptions.Threshold.PREFIX.length());
            try {
                SchemaFormat format = SchemaFormat.fromName(formatName);
                builder.formatThreshold(format, intOption(options, key, scoring.getThreshold(), 0, 100));
            } catch (InvalidFormatException e) {
                log.warn("Ignoring threshold for unknown format '{}'", formatName);
            }
        });

        return builder.build();
    }

    private static int intOption(Map<String, String> options, String key, int fallback, int min, int max) {
        String raw = options.get(key);
        if (raw == null) return fallback;
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < min || value > max) {
                log.warn("Value {} for {} is out of range [{}, {}]. Using default: {}", value, key, min, max, fallback);
                return fallback;
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("Invalid {} in configuration: {}. Using default: {}", key, raw, fallback);
            return fallback;
        }
    }

    private static double doubleOption(Map<String, String> options, String key, double fallback, double min, double max) {
        String raw = options.get(key);
        if (raw == null) return fallback;
        try {
            double value = Double.parseDouble(raw.trim());
            if (Double.isNaN(value) || value < min || value > max) {
                log.warn("Value {} for {} is out of range [{}, {}]. Using default: {}", value, key, min, max, fallback);
                return fallback;
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("Invalid {} in configuration: {}. Using default: {}", key, raw, fallback);
            return fallback;
        }
    }
}
