package org.schemadiff.migration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.schemadiff.exception.InvalidFormatException;
import org.schemadiff.format.FormatAdapter;
import org.schemadiff.format.FormatRegistry;
import org.schemadiff.model.Change;
import org.schemadiff.model.ChangeKind;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.SchemaPath;
import org.schemadiff.model.SchemaVersion;
import org.schemadiff.model.Severity;
import org.schemadiff.score.Score;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MigrationPlannerTest {

    @Mock
    private FormatAdapter adapter;

    private MigrationPlanner planner;
    private RenderContext context;

    @BeforeEach
    void setUp() {
        when(adapter.format()).thenReturn(SchemaFormat.SQL_DDL);
        planner = new MigrationPlanner(new FormatRegistry(List.of(adapter)));
        context = RenderContext.builder()
                .format(SchemaFormat.SQL_DDL)
                .sourceVersion(SchemaVersion.of(1, 0, 0))
                .targetVersion(SchemaVersion.of(2, 0, 0))
                .build();
    }

    private static Change change(ChangeKind kind, String location, String newLocation, Severity severity, String... details) {
        Change.ChangeBuilder builder = Change.builder()
                .location(SchemaPath.parse(location))
                .newLocation(newLocation == null ? null : SchemaPath.parse(newLocation))
                .kind(kind)
                .description(kind + " " + location);
        for (int i = 0; i + 1 < details.length; i += 2) {
            builder.detail(details[i], details[i + 1]);
        }
        return builder.build().withSeverity(severity);
    }

    @Test
    @DisplayName("단계는 DROP, RENAME, ALTER, ADD, ENFORCE 순서로 정렬된다")
    void plan_ordersByPhase() throws InvalidFormatException {
        when(adapter.render(any(), any())).thenAnswer(inv -> {
            MigrationInstruction instruction = inv.getArgument(0);
            return instruction.getOperation() + " " + instruction.getEffectiveLocation();
        });
        List<Change> changes = List.of(
                change(ChangeKind.ADDED, "/users/email", "/users/email", Severity.INFO, Change.REQUIRED, "false"),
                change(ChangeKind.REQUIREDNESS_CHANGED, "/users/name", "/users/full_name", Severity.BREAKING,
                        Change.REQUIRED_BEFORE, "false", Change.REQUIRED_AFTER, "true"),
                change(ChangeKind.RENAMED, "/users/name", "/users/full_name", Severity.BREAKING),
                change(ChangeKind.TYPE_CHANGED, "/users/age", "/users/age", Severity.WARNING),
                change(ChangeKind.REMOVED, "/users/legacy", null, Severity.BREAKING));

        MigrationPlan plan = planner.plan(changes, context, null);

        assertThat(plan.getSteps()).extracting(MigrationStep::getPhase).containsExactly(
                MigrationPhase.DROP, MigrationPhase.RENAME, MigrationPhase.ALTER, MigrationPhase.ADD, MigrationPhase.ENFORCE);
        assertThat(plan.getSteps()).extracting(MigrationStep::getOrder).containsExactly(1, 2, 3, 4, 5);
        assertThat(plan.getInstructions()).containsExactly(
                "DROP /users/legacy",
                "RENAME /users/full_name",
                "ALTER_TYPE /users/age",
                "ADD /users/email",
                "MAKE_REQUIRED /users/full_name");

        InOrder order = inOrder(adapter);
        order.verify(adapter).render(argThat(i -> i.getOperation() == MigrationOperation.DROP), any());
        order.verify(adapter).render(argThat(i -> i.getOperation() == MigrationOperation.RENAME), any());
        order.verify(adapter).render(argThat(i -> i.getOperation() == MigrationOperation.ALTER_TYPE), any());
        order.verify(adapter).render(argThat(i -> i.getOperation() == MigrationOperation.ADD), any());
        order.verify(adapter).render(argThat(i -> i.getOperation() == MigrationOperation.MAKE_REQUIRED), any());
    }

    @Test
    @DisplayName("같은 단계 안에서는 diff 순서를 유지한다")
    void plan_isStableWithinPhase() throws InvalidFormatException {
        when(adapter.render(any(), any())).thenAnswer(inv ->
                ((MigrationInstruction) inv.getArgument(0)).getEffectiveLocation().toString());
        List<Change> changes = List.of(
                change(ChangeKind.REMOVED, "/b", null, Severity.BREAKING),
                change(ChangeKind.REMOVED, "/a", null, Severity.BREAKING),
                change(ChangeKind.REMOVED, "/c", null, Severity.BREAKING));

        assertThat(planner.plan(changes, context, null).getInstructions()).containsExactly("/b", "/a", "/c");
    }

    @Test
    void plan_metadata() throws InvalidFormatException {
        when(adapter.render(any(), any())).thenReturn("DROP TABLE t;");
        List<Change> changes = List.of(change(ChangeKind.REMOVED, "/t", null, Severity.BREAKING));

        MigrationPlan plan = planner.plan(changes, context, new Score(85, false, 1, 0, 0));

        assertThat(plan.getMetadata())
                .containsEntry(MigrationPlanner.FORMAT, "sql")
                .containsEntry(MigrationPlanner.SOURCE_VERSION, "1.0.0")
                .containsEntry(MigrationPlanner.TARGET_VERSION, "2.0.0")
                .containsEntry(MigrationPlanner.STEP_COUNT, "1")
                .containsEntry(MigrationPlanner.BREAKING_CHANGES, "1")
                .containsEntry(MigrationPlanner.BREAKING, "true")
                .containsEntry(MigrationPlanner.COMPATIBILITY_SCORE, "85");
        assertThat(plan.getSteps().get(0).getSeverity()).isEqualTo(Severity.BREAKING);
    }

    @Test
    void blankRendering_fallsBackToGenericText() throws InvalidFormatException {
        when(adapter.render(any(), any())).thenReturn("  ");
        List<Change> changes = List.of(change(ChangeKind.OTHER, "/t/c", "/t/c", Severity.WARNING));

        MigrationPlan plan = planner.plan(changes, context, null);

        assertThat(plan.getInstructions()).containsExactly("UPDATE /t/c: OTHER /t/c");
    }

    @Test
    void renameInstruction_carriesBothPaths() throws InvalidFormatException {
        ArgumentCaptor<MigrationInstruction> captor = ArgumentCaptor.forClass(MigrationInstruction.class);
        when(adapter.render(captor.capture(), any())).thenReturn("rename");

        planner.plan(List.of(change(ChangeKind.RENAMED, "/t/a", "/t/b", Severity.BREAKING)), context, null);

        MigrationInstruction instruction = captor.getValue();
        assertThat(instruction.getLocation()).isEqualTo(SchemaPath.parse("/t/a"));
        assertThat(instruction.getTargetLocation()).isEqualTo(SchemaPath.parse("/t/b"));
        assertThat(instruction.getEffectiveLocation()).isEqualTo(SchemaPath.parse("/t/b"));
        verify(adapter).render(any(), any());
    }

    @Test
    void renderContext_carriesThePlanInPhaseOrder() throws InvalidFormatException {
        ArgumentCaptor<RenderContext> captor = ArgumentCaptor.forClass(RenderContext.class);
        when(adapter.render(any(), captor.capture())).thenReturn("step");
        List<Change> changes = List.of(
                change(ChangeKind.ADDED, "/t/b", "/t/b", Severity.INFO, Change.REQUIRED, "false"),
                change(ChangeKind.REMOVED, "/t/a", null, Severity.BREAKING));

        planner.plan(changes, context, null);

        assertThat(captor.getAllValues()).hasSize(2).allSatisfy(rendered -> {
            assertThat(rendered.getFormat()).isEqualTo(context.getFormat());
            assertThat(rendered.getInstructions()).extracting(MigrationInstruction::getOperation)
                    .containsExactly(MigrationOperation.DROP, MigrationOperation.ADD);
        });
    }

    @Test
    void unclassifiedChange_rejected() {
        Change raw = Change.builder().location(SchemaPath.of("t")).kind(ChangeKind.REMOVED).description("x").build();

        assertThatThrownBy(() -> planner.plan(List.of(raw), context, null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void emptyChangeSet_isEmptyPlan() throws InvalidFormatException {
        MigrationPlan plan = planner.plan(List.of(), context, null);

        assertThat(plan.isEmpty()).isTrue();
        assertThat(plan.getMetadata()).containsEntry(MigrationPlanner.BREAKING, "false");
    }
}
