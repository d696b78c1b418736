package org.schemadiff.migration;

import lombok.extern.slf4j.Slf4j;
import org.schemadiff.exception.InvalidFormatException;
import org.schemadiff.format.FormatAdapter;
import org.schemadiff.format.FormatRegistry;
import org.schemadiff.model.Change;
import org.schemadiff.score.Score;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Turns classified changes into an ordered, rendered migration plan.
 * <p>
 * Steps are sorted by {@link MigrationPhase}; within a phase the diff order is kept,
 * which puts parents before children and old declaration order before new.
 */
@Slf4j
public class MigrationPlanner {

    public static final String FORMAT = "format";
    public static final String SOURCE_VERSION = "sourceVersion";
    public static final String TARGET_VERSION = "targetVersion";
    public static final String STEP_COUNT = "stepCount";
    public static final String BREAKING_CHANGES = "breakingChanges";
    public static final String BREAKING = "breaking";
    public static final String COMPATIBILITY_SCORE = "compatibilityScore";

    private final FormatRegistry registry;

    public MigrationPlanner(FormatRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public MigrationPlan plan(List<Change> changes, RenderContext context, Score score) throws InvalidFormatException {
        FormatAdapter adapter = registry.adapter(context.getFormat());

        List<MigrationInstruction> instructions = new ArrayList<>();
        for (Change change : changes) {
            if (!change.isClassified()) {
                throw new IllegalStateException("Change at " + change.getLocation() + " has not been classified");
            }
            instructions.add(MigrationInstruction.of(change));
        }
        // List.sort는 stable이므로 phase 내부에서는 diff 순서가 유지된다
        instructions.sort(Comparator.comparing(MigrationInstruction::getPhase));
        RenderContext planContext = context.toBuilder().instructions(List.copyOf(instructions)).build();

        MigrationPlan.MigrationPlanBuilder plan = MigrationPlan.builder();
        int order = 1;
        for (MigrationInstruction instruction : instructions) {
            plan.step(MigrationStep.builder()
                    .order(order++)
                    .phase(instruction.getPhase())
                    .operation(instruction.getOperation())
                    .location(instruction.getEffectiveLocation())
                    .severity(instruction.getChange().getSeverity())
                    .instruction(render(adapter, instruction, planContext))
                    .build());
        }

        long breaking = changes.stream().filter(Change::isBreaking).count();
        TreeMap<String, String> metadata = new TreeMap<>();
        metadata.put(FORMAT, context.getFormat().getId());
        metadata.put(SOURCE_VERSION, String.valueOf(context.getSourceVersion()));
        metadata.put(TARGET_VERSION, String.valueOf(context.getTargetVersion()));
        metadata.put(STEP_COUNT, String.valueOf(instructions.size()));
        metadata.put(BREAKING_CHANGES, String.valueOf(breaking));
        metadata.put(BREAKING, String.valueOf(breaking > 0));
        if (score != null) {
            metadata.put(COMPATIBILITY_SCORE, String.valueOf(score.value()));
        }
        plan.metadata(metadata);

        log.debug("Planned {} migration step(s) for {}", instructions.size(), context.getFormat());
        return plan.build();
    }

    private static String render(FormatAdapter adapter, MigrationInstruction instruction, RenderContext context) {
        String rendered = adapter.render(instruction, context);
        if (rendered == null || rendered.isBlank()) {
            return instruction.getOperation() + " " + instruction.getEffectiveLocation()
                    + ": " + instruction.getChange().getDescription();
        }
        return rendered;
    }
}
