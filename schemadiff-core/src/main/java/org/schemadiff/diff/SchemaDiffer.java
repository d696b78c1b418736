package org.schemadiff.diff;

import lombok.extern.slf4j.Slf4j;
import org.schemadiff.exception.ComparisonException;
import org.schemadiff.model.ArrayNode;
import org.schemadiff.model.Change;
import org.schemadiff.model.ChangeKind;
import org.schemadiff.model.NodeKind;
import org.schemadiff.model.NodeMetadata;
import org.schemadiff.model.ObjectNode;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.SchemaNode;
import org.schemadiff.model.SchemaPath;
import org.schemadiff.model.UnionNode;
import org.schemadiff.options.SchemaDiffOptions;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Walks two normalized schema trees in lock step and reports every structural delta.
 * <p>
 * Children are visited in the old tree's declared order, then new-only children in
 * the new tree's order, so the output is fully determined by the inputs.
 */
@Slf4j
public class SchemaDiffer {

    private final Map<NodeKind, NodeDiffer> differs;
    private final int maxDepth;

    public SchemaDiffer() {
        this(SchemaDiffOptions.Diff.MAX_DEPTH_DEFAULT);
    }

    public SchemaDiffer(int maxDepth) {
        this(maxDepth, createDefaultDiffers());
    }

    public SchemaDiffer(int maxDepth, Map<NodeKind, NodeDiffer> differs) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
        this.differs = new EnumMap<>(Objects.requireNonNull(differs, "differs must not be null"));
        for (NodeKind kind : NodeKind.values()) {
            if (!this.differs.containsKey(kind)) {
                throw new IllegalArgumentException("No differ registered for " + kind);
            }
        }
    }

    private static Map<NodeKind, NodeDiffer> createDefaultDiffers() {
        Map<NodeKind, NodeDiffer> map = new EnumMap<>(NodeKind.class);
        map.put(NodeKind.SCALAR, new ScalarDiffer());
        map.put(NodeKind.OBJECT, new ObjectDiffer());
        map.put(NodeKind.ARRAY, new ArrayDiffer());
        map.put(NodeKind.UNION, new UnionDiffer());
        map.put(NodeKind.REFERENCE, new ReferenceDiffer());
        return map;
    }

    public List<Change> diff(SchemaNode oldRoot, SchemaNode newRoot) throws ComparisonException {
        Objects.requireNonNull(oldRoot, "oldRoot must not be null");
        Objects.requireNonNull(newRoot, "newRoot must not be null");

        if (oldRoot.getKind() != newRoot.getKind()
                && oldRoot.getKind() != NodeKind.UNION && newRoot.getKind() != NodeKind.UNION) {
            throw new ComparisonException("Cannot compare a " + oldRoot.getKind() + " root with a "
                    + newRoot.getKind() + " root");
        }

        checkDepth(oldRoot);
        checkDepth(newRoot);

        DiffContext context = new DiffContext(this, maxDepth);
        context.compare(NodePair.of(oldRoot, newRoot, SchemaPath.root(), SchemaPath.root()));
        log.debug("Diff finished with {} change(s)", context.changes().size());
        return context.changes();
    }

    /**
     * Rejects a tree nested deeper than {@code maxDepth}, identical subtrees included.
     * Iterative, so the input depth never reaches the call stack.
     */
    private void checkDepth(SchemaNode root) throws ComparisonException {
        Deque<NodeAt> pending = new ArrayDeque<>();
        pending.push(new NodeAt(root, SchemaPath.root()));
        while (!pending.isEmpty()) {
            NodeAt current = pending.pop();
            if (current.path().depth() > maxDepth) {
                throw new ComparisonException("Schema nesting exceeds the maximum depth of " + maxDepth
                        + " at " + current.path());
            }
            SchemaNode node = current.node();
            if (node instanceof ObjectNode object) {
                object.getFields().forEach((name, child) -> pending.push(new NodeAt(child, current.path().child(name))));
            } else if (node instanceof ArrayNode array) {
                pending.push(new NodeAt(array.getElement(), current.path().element()));
            } else if (node instanceof UnionNode union) {
                List<SchemaNode> alternatives = union.getAlternatives();
                for (int i = 0; i < alternatives.size(); i++) {
                    pending.push(new NodeAt(alternatives.get(i), current.path().alternative(i)));
                }
            }
        }
    }

    private record NodeAt(SchemaNode node, SchemaPath path) {
    }

    void compareNodes(NodePair pair, DiffContext context) throws ComparisonException {
        SchemaNode oldNode = pair.oldNode();
        SchemaNode newNode = pair.newNode();
        if (oldNode.equals(newNode)) {
            return;
        }

        if (oldNode.getKind() != newNode.getKind()) {
            // 한쪽만 union이면 나머지를 단일 대안 union으로 보고 비교
            if (oldNode.getKind() == NodeKind.UNION || newNode.getKind() == NodeKind.UNION) {
                NodePair promoted = NodePair.of(asUnion(oldNode), asUnion(newNode), pair.oldPath(), pair.newPath());
                differs.get(NodeKind.UNION).diff(promoted, context);
                compareMetadata(promoted.oldNode().getMetadata(), promoted.newNode().getMetadata(), pair);
                emitNotes(pair, context);
                return;
            }
            context.emit(Change.builder()
                    .location(pair.oldPath())
                    .newLocation(pair.newPath())
                    .kind(ChangeKind.TYPE_CHANGED)
                    .description("Type changed from " + oldNode.describe() + " to " + newNode.describe())
                    .detail(Change.OLD_TYPE, oldNode.describe())
                    .detail(Change.NEW_TYPE, newNode.describe())
                    .oldNode(oldNode)
                    .newNode(newNode)
                    .build());
            return;
        }

        differs.get(oldNode.getKind()).diff(pair, context);
        compareMetadata(oldNode.getMetadata(), newNode.getMetadata(), pair);
        emitNotes(pair, context);
    }

    private static void emitNotes(NodePair pair, DiffContext context) {
        if (pair.notes().isEmpty()) {
            return;
        }
        context.emit(Change.builder()
                .location(pair.oldPath())
                .newLocation(pair.newPath())
                .kind(ChangeKind.OTHER)
                .description("Changed " + String.join("; ", pair.notes()))
                .oldNode(pair.oldNode())
                .newNode(pair.newNode())
                .build());
    }

    /**
     * Wraps a non-union node as a one-alternative union. The node's metadata moves to the
     * wrapper, where the normalizers put it for real unions.
     */
    private static SchemaNode asUnion(SchemaNode node) {
        if (node instanceof UnionNode) {
            return node;
        }
        return UnionNode.of(List.of(node.withMetadata(NodeMetadata.empty())))
                .withMetadata(node.getMetadata());
    }

    private static void compareMetadata(NodeMetadata oldMeta, NodeMetadata newMeta, NodePair pair) {
        if (oldMeta.equals(newMeta)) {
            return;
        }
        if (!Objects.equals(oldMeta.getIdentity(), newMeta.getIdentity())) {
            pair.note("identity " + display(oldMeta.getIdentity()) + " -> " + display(newMeta.getIdentity()));
        }
        for (SchemaFormat format : SchemaFormat.values()) {
            Map<String, String> oldAttrs = oldMeta.attributes(format);
            Map<String, String> newAttrs = newMeta.attributes(format);
            Set<String> keys = new TreeSet<>(oldAttrs.keySet());
            keys.addAll(newAttrs.keySet());
            for (String key : keys) {
                String before = oldAttrs.get(key);
                String after = newAttrs.get(key);
                if (!Objects.equals(before, after)) {
                    pair.note(key + " " + display(before) + " -> " + display(after));
                }
            }
        }
    }

    static String display(Object value) {
        return value == null ? "(none)" : String.valueOf(value);
    }
}
