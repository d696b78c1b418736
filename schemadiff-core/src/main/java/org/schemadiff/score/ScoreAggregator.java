package org.schemadiff.score;

import org.schemadiff.model.Change;
import org.schemadiff.model.ChangeKind;
import org.schemadiff.model.Severity;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Folds classified changes into a 0..100 compatibility score.
 * <p>
 * Every Breaking change costs {@code breakingPenalty}, discounted by {@code repeatDecay}
 * for each earlier Breaking change of the same kind, so fifty removed fields do not
 * weigh fifty times one. A change set with any Breaking change is never compatible,
 * whatever its score.
 */
public class ScoreAggregator {

    public static final int MAX_SCORE = 100;

    private final ScoringPolicy policy;

    public ScoreAggregator(ScoringPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    public Score aggregate(List<Change> changes) {
        Map<ChangeKind, Integer> breakingSeen = new EnumMap<>(ChangeKind.class);
        double penalty = 0;
        int breaking = 0;
        int warnings = 0;
        int infos = 0;

        for (Change change : changes) {
            Severity severity = change.getSeverity();
            if (severity == null) {
                throw new IllegalStateException("Change at " + change.getLocation() + " has not been classified");
            }
            switch (severity) {
                case BREAKING -> {
                    int repeat = breakingSeen.merge(change.getKind(), 1, Integer::sum) - 1;
                    penalty += policy.getBreakingPenalty() * Math.pow(policy.getRepeatDecay(), repeat);
                    breaking++;
                }
                case WARNING -> {
                    penalty += policy.getWarningPenalty();
                    warnings++;
                }
                case INFO -> {
                    penalty += policy.getInfoPenalty();
                    infos++;
                }
            }
        }

        int value = clamp(MAX_SCORE - (int) Math.round(penalty));
        boolean compatible = breaking == 0 && value >= policy.getThreshold();
        return new Score(value, compatible, breaking, warnings, infos);
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(MAX_SCORE, value));
    }
}
