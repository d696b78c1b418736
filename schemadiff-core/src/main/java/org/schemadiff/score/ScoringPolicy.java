package org.schemadiff.score;

import lombok.Builder;
import lombok.Value;
import org.schemadiff.options.SchemaDiffOptions;

/**
 * Penalties and threshold used to turn classified changes into a score.
 */
@Value
@Builder(toBuilder = true)
public class ScoringPolicy {

    @Builder.Default
    double breakingPenalty = SchemaDiffOptions.Score.BREAKING_PENALTY_DEFAULT;

    @Builder.Default
    double warningPenalty = SchemaDiffOptions.Score.WARNING_PENALTY_DEFAULT;

    @Builder.Default
    double infoPenalty = SchemaDiffOptions.Score.INFO_PENALTY_DEFAULT;

    /**
     * Factor applied per repeat of a Breaking change of the same kind; must be in (0, 1].
     */
    @Builder.Default
    double repeatDecay = SchemaDiffOptions.Score.REPEAT_DECAY_DEFAULT;

    @Builder.Default
    int threshold = SchemaDiffOptions.Score.THRESHOLD_DEFAULT;

    public static ScoringPolicy defaults() {
        return builder().build();
    }

    public ScoringPolicy withThreshold(int threshold) {
        return toBuilder().threshold(threshold).build();
    }
}
