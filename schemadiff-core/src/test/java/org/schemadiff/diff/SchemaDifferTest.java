package org.schemadiff.diff;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.schemadiff.exception.ComparisonException;
import org.schemadiff.model.ArrayNode;
import org.schemadiff.model.Change;
import org.schemadiff.model.ChangeKind;
import org.schemadiff.model.Constraint;
import org.schemadiff.model.NodeKind;
import org.schemadiff.model.NodeMetadata;
import org.schemadiff.model.ObjectNode;
import org.schemadiff.model.PrimitiveKind;
import org.schemadiff.model.ReferenceNode;
import org.schemadiff.model.ScalarNode;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.SchemaNode;
import org.schemadiff.model.SchemaPath;
import org.schemadiff.model.UnionNode;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class SchemaDifferTest {

    private final SchemaDiffer differ = new SchemaDiffer();

    private static ScalarNode string() {
        return ScalarNode.of(PrimitiveKind.STRING, "string");
    }

    private static ScalarNode integer() {
        return ScalarNode.of(PrimitiveKind.INTEGER, "integer");
    }

    @Test
    @DisplayName("같은 트리를 비교하면 변경이 없다")
    void diff_identicalTrees_isEmpty() throws ComparisonException {
        ObjectNode tree = ObjectNode.builder()
                .field("id", integer())
                .field("tags", ArrayNode.of(string()))
                .requiredField("id")
                .build();

        assertThat(differ.diff(tree, tree)).isEmpty();
    }

    @Test
    @DisplayName("같은 입력이면 항상 같은 순서의 결과를 낸다")
    void diff_isDeterministic() throws ComparisonException {
        ObjectNode before = ObjectNode.builder()
                .field("a", string())
                .field("b", integer())
                .field("c", string())
                .build();
        ObjectNode after = ObjectNode.builder()
                .field("z", string())
                .field("b", string())
                .field("y", integer())
                .build();

        List<Change> first = differ.diff(before, after);
        List<Change> second = differ.diff(before, after);

        assertThat(first).isEqualTo(second);
        assertThat(first).extracting(c -> c.getKind() + " " + c.getLocation())
                .containsExactly(
                        "REMOVED /a",
                        "TYPE_CHANGED /b",
                        "REMOVED /c",
                        "ADDED /z",
                        "ADDED /y");
    }

    @Test
    void diff_changesHaveNoSeverity() throws ComparisonException {
        List<Change> changes = differ.diff(
                ObjectNode.builder().field("a", string()).build(),
                ObjectNode.builder().build());

        assertThat(changes).allSatisfy(c -> {
            assertThat(c.isClassified()).isFalse();
            assertThat(c.isBreaking()).isFalse();
        });
    }

    @Nested
    class KindMismatch {

        @Test
        @DisplayName("root 종류가 다르면 비교할 수 없다")
        void rootMismatch_throws() {
            assertThatThrownBy(() -> differ.diff(ObjectNode.builder().build(), ArrayNode.of(string())))
                    .isInstanceOf(ComparisonException.class)
                    .hasMessageContaining("OBJECT")
                    .hasMessageContaining("ARRAY");
        }

        @Test
        void nestedMismatch_reportsTypeChanged() throws ComparisonException {
            ObjectNode before = ObjectNode.builder().field("v", ObjectNode.builder().build()).build();
            ObjectNode after = ObjectNode.builder().field("v", ArrayNode.of(string())).build();

            List<Change> changes = differ.diff(before, after);

            assertThat(changes).hasSize(1);
            Change change = changes.get(0);
            assertThat(change.getKind()).isEqualTo(ChangeKind.TYPE_CHANGED);
            assertThat(change.getLocation()).isEqualTo(SchemaPath.of("v"));
            assertThat(change.detail(Change.OLD_TYPE)).contains("object");
            assertThat(change.detail(Change.NEW_TYPE)).contains("array<string>");
        }

        @Test
        @DisplayName("한쪽만 union이면 단일 대안 union으로 승격해 비교한다")
        void unionOnOneSide_isPromoted() throws ComparisonException {
            ObjectNode before = ObjectNode.builder().field("v", string()).build();
            ObjectNode after = ObjectNode.builder()
                    .field("v", UnionNode.of(List.of(string(), ScalarNode.of(PrimitiveKind.NULL, "null"))))
                    .build();

            List<Change> changes = differ.diff(before, after);

            assertThat(changes).singleElement().satisfies(c -> {
                assertThat(c.getKind()).isEqualTo(ChangeKind.ADDED);
                assertThat(c.getLocation().toString()).isEqualTo("/v/|1");
                assertThat(c.flag(UnionDiffer.ALTERNATIVE)).isTrue();
            });
        }

        @Test
        @DisplayName("nullable이 되면서 deprecated가 붙으면 대안 추가와 OTHER를 함께 보고한다")
        void unionOnOneSide_keepsMetadataChange() throws ComparisonException {
            NodeMetadata deprecated = NodeMetadata.empty().with(SchemaFormat.JSON_SCHEMA, NodeMetadata.DEPRECATED, "true");
            ObjectNode before = ObjectNode.builder().field("v", string()).build();
            ObjectNode after = ObjectNode.builder()
                    .field("v", UnionNode.of(List.of(string(), ScalarNode.of(PrimitiveKind.NULL, "null")))
                            .withMetadata(deprecated))
                    .build();

            List<Change> changes = differ.diff(before, after);

            assertThat(changes).extracting(Change::getKind)
                    .containsExactlyInAnyOrder(ChangeKind.ADDED, ChangeKind.OTHER);
            assertThat(changes).filteredOn(c -> c.getKind() == ChangeKind.OTHER).singleElement().satisfies(c -> {
                assertThat(c.getLocation()).isEqualTo(SchemaPath.of("v"));
                assertThat(c.getDescription()).contains("deprecated (none) -> true");
            });
        }

        @Test
        void unionOnOneSide_unchangedMetadataIsNotReported() throws ComparisonException {
            NodeMetadata deprecated = NodeMetadata.empty().with(SchemaFormat.JSON_SCHEMA, NodeMetadata.DEPRECATED, "true");
            ObjectNode before = ObjectNode.builder().field("v", string().withMetadata(deprecated)).build();
            ObjectNode after = ObjectNode.builder()
                    .field("v", UnionNode.of(List.of(string(), ScalarNode.of(PrimitiveKind.NULL, "null")))
                            .withMetadata(deprecated))
                    .build();

            assertThat(differ.diff(before, after)).extracting(Change::getKind).containsExactly(ChangeKind.ADDED);
        }

        @Test
        void unionRootAgainstScalarRoot_isAllowed() throws ComparisonException {
            List<Change> changes = differ.diff(string(), UnionNode.of(List.of(integer())));

            assertThat(changes).isNotEmpty();
        }
    }

    @Nested
    class Depth {

        private SchemaNode nest(int levels, SchemaNode leaf) {
            SchemaNode node = leaf;
            for (int i = 0; i < levels; i++) {
                node = ObjectNode.builder().field("n", node).build();
            }
            return node;
        }

        @Test
        @DisplayName("최대 깊이를 넘으면 ComparisonException")
        void deeperThanMax_throws() {
            SchemaDiffer shallow = new SchemaDiffer(2);

            assertThatThrownBy(() -> shallow.diff(nest(3, string()), nest(3, integer())))
                    .isInstanceOf(ComparisonException.class)
                    .hasMessageContaining("maximum depth of 2");
        }

        @Test
        @DisplayName("변경이 없는 동일한 트리라도 최대 깊이를 넘으면 거부한다")
        void identicalTreesDeeperThanMax_throw() {
            SchemaDiffer shallow = new SchemaDiffer(2);
            SchemaNode deep = nest(3, string());

            assertThatThrownBy(() -> shallow.diff(deep, nest(3, string())))
                    .isInstanceOf(ComparisonException.class)
                    .hasMessageContaining("maximum depth of 2")
                    .hasMessageContaining("/n/n/n");
        }

        @Test
        void onlyNewSideTooDeep_throws() {
            SchemaDiffer shallow = new SchemaDiffer(2);

            assertThatThrownBy(() -> shallow.diff(nest(1, string()), nest(3, string())))
                    .isInstanceOf(ComparisonException.class);
        }

        @Test
        void veryDeepTree_failsWithoutStackOverflow() {
            SchemaNode deep = nest(20_000, string());

            assertThatThrownBy(() -> differ.diff(deep, deep))
                    .isInstanceOf(ComparisonException.class)
                    .hasMessageContaining("maximum depth of 64");
        }

        @Test
        void withinMax_succeeds() throws ComparisonException {
            SchemaDiffer shallow = new SchemaDiffer(3);

            assertThat(shallow.diff(nest(3, string()), nest(3, integer())))
                    .extracting(Change::getLocation)
                    .containsExactly(SchemaPath.of("n", "n", "n"));
        }

        @Test
        void nonPositiveMaxDepth_rejected() {
            assertThatThrownBy(() -> new SchemaDiffer(0)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Metadata {

        @Test
        @DisplayName("메타데이터 변화는 하나의 OTHER 변경으로 합쳐진다")
        void attributeChanges_mergeIntoOneOther() throws ComparisonException {
            NodeMetadata before = NodeMetadata.empty().with(SchemaFormat.OPENAPI, NodeMetadata.DEPRECATED, "true");
            ScalarNode old = ScalarNode.builder().primitive(PrimitiveKind.STRING).typeName("string")
                    .constraint(Constraint.DEFAULT_VALUE, "a")
                    .metadata(before)
                    .build();
            ScalarNode updated = ScalarNode.builder().primitive(PrimitiveKind.STRING).typeName("string")
                    .constraint(Constraint.DEFAULT_VALUE, "b")
                    .build();

            List<Change> changes = differ.diff(
                    ObjectNode.builder().field("s", old).build(),
                    ObjectNode.builder().field("s", updated).build());

            assertThat(changes).singleElement().satisfies(c -> {
                assertThat(c.getKind()).isEqualTo(ChangeKind.OTHER);
                assertThat(c.getDescription())
                        .startsWith("Changed ")
                        .contains("default a -> b")
                        .contains("deprecated true -> (none)");
            });
        }
    }

    @Test
    void reference_targetChange_isTypeChanged() throws ComparisonException {
        List<Change> changes = differ.diff(
                ObjectNode.builder().field("r", ReferenceNode.of("#/$defs/A")).build(),
                ObjectNode.builder().field("r", ReferenceNode.of("#/$defs/B")).build());

        assertThat(changes).singleElement().satisfies(c -> {
            assertThat(c.getKind()).isEqualTo(ChangeKind.TYPE_CHANGED);
            assertThat(c.detail(Change.OLD_TYPE)).contains("ref #/$defs/A");
        });
    }

    @Test
    @DisplayName("등록된 differ에 비교를 위임한다")
    void customDiffer_isUsedForItsKind() throws ComparisonException {
        NodeDiffer scalar = mock(NodeDiffer.class);
        Map<NodeKind, NodeDiffer> differs = new EnumMap<>(NodeKind.class);
        differs.put(NodeKind.SCALAR, scalar);
        differs.put(NodeKind.OBJECT, new ObjectDiffer());
        differs.put(NodeKind.ARRAY, new ArrayDiffer());
        differs.put(NodeKind.UNION, new UnionDiffer());
        differs.put(NodeKind.REFERENCE, new ReferenceDiffer());
        SchemaDiffer custom = new SchemaDiffer(8, differs);

        custom.diff(ObjectNode.builder().field("a", string()).build(),
                ObjectNode.builder().field("a", integer()).build());

        verify(scalar, times(1)).diff(any(NodePair.class), any(DiffContext.class));
    }

    @Test
    void missingDiffer_rejected() {
        Map<NodeKind, NodeDiffer> differs = new EnumMap<>(NodeKind.class);
        differs.put(NodeKind.SCALAR, new ScalarDiffer());

        assertThatThrownBy(() -> new SchemaDiffer(8, differs))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No differ registered");
    }

    @Test
    @DisplayName("같은 위치에 같은 종류의 변경을 두 번 낼 수 없다")
    void emit_duplicate_throws() {
        DiffContext context = new DiffContext(differ, 8);
        Change change = Change.builder()
                .location(SchemaPath.of("a"))
                .kind(ChangeKind.REMOVED)
                .description("Removed member 'a'")
                .build();
        context.emit(change);

        assertThatThrownBy(() -> context.emit(change)).isInstanceOf(IllegalStateException.class);
        assertThat(context.hasChange(SchemaPath.of("a"), ChangeKind.REMOVED)).isTrue();
    }
}
