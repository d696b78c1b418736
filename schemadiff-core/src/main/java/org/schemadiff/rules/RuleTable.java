package org.schemadiff.rules;

import lombok.Getter;
import org.schemadiff.model.Change;
import org.schemadiff.model.ChangeKind;
import org.schemadiff.model.SchemaFormat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Classification table of one format: a default rule per change kind, plus ordered
 * overrides that get the first say. The first override that returns a verdict wins.
 */
public final class RuleTable {

    @Getter
    private final SchemaFormat format;
    @Getter
    private final TypeLattice typeLattice;
    private final Map<ChangeKind, CompatibilityRule> defaults;
    private final Map<ChangeKind, List<CompatibilityRule>> overrides;

    private RuleTable(Builder builder) {
        this.format = builder.format;
        this.typeLattice = builder.typeLattice;
        this.defaults = DefaultRules.create(builder.typeLattice, builder.deprecationAware);
        Map<ChangeKind, List<CompatibilityRule>> copy = new EnumMap<>(ChangeKind.class);
        builder.overrides.forEach((kind, rules) -> copy.put(kind, List.copyOf(rules)));
        this.overrides = Collections.unmodifiableMap(copy);
    }

    public static Builder builder(SchemaFormat format) {
        return new Builder(format);
    }

    /**
     * Table with no format overrides, used when a change set is validated without a format.
     */
    public static RuleTable generic() {
        return new Builder(null).build();
    }

    public Verdict classify(Change change, RuleContext context) {
        for (CompatibilityRule rule : overrides.getOrDefault(change.getKind(), List.of())) {
            Optional<Verdict> verdict = rule.evaluate(change, context);
            if (verdict.isPresent()) {
                return verdict.get();
            }
        }
        return defaults.get(change.getKind()).evaluate(change, context)
                .orElseThrow(() -> new IllegalStateException("Default rule for " + change.getKind() + " returned no verdict"));
    }

    public static final class Builder {
        private final SchemaFormat format;
        private TypeLattice typeLattice = TypeLattice.generic();
        private boolean deprecationAware;
        private final Map<ChangeKind, List<CompatibilityRule>> overrides = new EnumMap<>(ChangeKind.class);

        private Builder(SchemaFormat format) {
            this.format = format;
        }

        public Builder typeLattice(TypeLattice typeLattice) {
            this.typeLattice = Objects.requireNonNull(typeLattice, "typeLattice must not be null");
            return this;
        }

        /**
         * Lets removals of deprecated members downgrade to Warning.
         */
        public Builder deprecationAware(boolean deprecationAware) {
            this.deprecationAware = deprecationAware;
            return this;
        }

        public Builder override(ChangeKind kind, CompatibilityRule rule) {
            overrides.computeIfAbsent(kind, k -> new ArrayList<>()).add(Objects.requireNonNull(rule, "rule must not be null"));
            return this;
        }

        public RuleTable build() {
            return new RuleTable(this);
        }
    }
}
