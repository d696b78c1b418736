package org.schemadiff.options;

/**
 * Configuration keys and defaults shared by the library and the CLI, so both read
 * {@code schemadiff.yaml} the same way.
 */
public final class SchemaDiffOptions {

    private SchemaDiffOptions() {
    }

    /**
     * Profile-related settings.
     */
    public static final class Profile {
        private Profile() {}

        /**
         * Default profile name.
         */
        public static final String DEFAULT = "dev";

        /**
         * Profile environment variable name.
         */
        public static final String ENV_VAR = "SCHEMADIFF_PROFILE";

        /**
         * Configuration file name.
         */
        public static final String CONFIG_FILE = "schemadiff.yaml";
    }

    /**
     * Score aggregation settings.
     */
    public static final class Score {
        private Score() {}

        public static final String THRESHOLD_KEY = "schemadiff.score.threshold";
        public static final int THRESHOLD_DEFAULT = 70;

        public static final String BREAKING_PENALTY_KEY = "schemadiff.score.breakingPenalty";
        public static final double BREAKING_PENALTY_DEFAULT = 15.0;

        public static final String WARNING_PENALTY_KEY = "schemadiff.score.warningPenalty";
        public static final double WARNING_PENALTY_DEFAULT = 3.0;

        public static final String INFO_PENALTY_KEY = "schemadiff.score.infoPenalty";
        public static final double INFO_PENALTY_DEFAULT = 0.0;

        /**
         * Multiplier applied to each repeated Breaking change of the same kind.
         * 1.0 disables diminishing penalties.
         */
        public static final String REPEAT_DECAY_KEY = "schemadiff.score.repeatDecay";
        public static final double REPEAT_DECAY_DEFAULT = 0.5;
    }

    /**
     * Diff engine settings.
     */
    public static final class Diff {
        private Diff() {}

        public static final String MAX_DEPTH_KEY = "schemadiff.diff.maxDepth";
        public static final int MAX_DEPTH_DEFAULT = 64;
    }

    /**
     * Per-format threshold overrides, e.g. {@code schemadiff.threshold.protobuf}.
     */
    public static final class Threshold {
        private Threshold() {}

        public static final String PREFIX = "schemadiff.threshold.";

        public static String keyFor(String formatId) {
            return PREFIX + formatId;
        }
    }
}
